package org.tabbit.compute;

import org.junit.jupiter.api.Test;
import org.tabbit.model.Ballot;
import org.tabbit.model.DrawConfig;
import org.tabbit.model.Pairing;
import org.tabbit.model.Round;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;
import org.tabbit.model.Speaker;
import org.tabbit.model.SpeakerScore;
import org.tabbit.model.SpeakerStanding;
import org.tabbit.model.Standing;
import org.tabbit.model.Team;
import org.tabbit.model.TeamResult;
import org.tabbit.model.TieBreak;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StandingsCalculatorTest {

    private static Team team(String id) {
        return new Team(id, id.toUpperCase(), null, null,
            List.of(new Speaker(id + "-1", "First " + id), new Speaker(id + "-2", "Second " + id)));
    }

    private static TeamResult result(String teamId, int placement, double first, double second) {
        return new TeamResult(teamId, placement, List.of(
            new SpeakerScore(teamId + "-1", 1, first),
            new SpeakerScore(teamId + "-2", 2, second)));
    }

    private static RoundRecord round(int sequence, RoundStatus status, List<Pairing> pairings, List<Ballot> ballots) {
        return new RoundRecord(new Round("round-" + sequence, sequence, "Round " + sequence, status),
            pairings, ballots);
    }

    private static final List<Team> TEAMS = List.of(team("a"), team("b"), team("c"), team("d"));

    private static RoundRecord completedFirstRound() {
        return round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "b")), Pairing.room(1, 2, List.of("c", "d"))),
            List.of(
                new Ballot("r1-1", List.of(result("a", 1, 75, 75), result("b", 2, 73, 72))),
                new Ballot("r1-2", List.of(result("c", 1, 70, 70), result("d", 2, 65, 65)))));
    }

    @Test
    void computeStandings_noRounds_allZeroOrderedById() {
        List<Standing> standings = StandingsCalculator.computeStandings(TEAMS, List.of(), DrawConfig.defaults());

        assertEquals(List.of("a", "b", "c", "d"), standings.stream().map(Standing::teamId).toList());
        assertEquals(List.of(1, 2, 3, 4), standings.stream().map(Standing::rank).toList());
        assertTrue(standings.stream().allMatch(s -> s.points() == 0 && s.speakerScore() == 0.0));
    }

    @Test
    void computeStandings_pointsThenSpeakerScore() {
        List<Standing> standings = StandingsCalculator.computeStandings(
            TEAMS, List.of(completedFirstRound()), DrawConfig.defaults());

        assertEquals(List.of("a", "c", "b", "d"), standings.stream().map(Standing::teamId).toList());
        assertEquals(1, standings.get(0).points());
        assertEquals(150.0, standings.get(0).speakerScore());
        assertEquals(0, standings.get(2).points());
        assertEquals(145.0, standings.get(2).speakerScore());
    }

    @Test
    void computeStandings_ignoresRoundsNotCompleted() {
        RoundRecord inProgress = round(2, RoundStatus.IN_PROGRESS,
            List.of(Pairing.room(2, 1, List.of("b", "d"))),
            List.of(new Ballot("r2-1", List.of(result("d", 1, 90, 90), result("b", 2, 60, 60)))));

        List<Standing> standings = StandingsCalculator.computeStandings(
            TEAMS, List.of(completedFirstRound(), inProgress), DrawConfig.defaults());

        assertEquals(List.of("a", "c", "b", "d"), standings.stream().map(Standing::teamId).toList());
    }

    @Test
    void computeStandings_byeScoresSidesMinusOne() {
        RoundRecord withBye = round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "b")), Pairing.bye(1, 2, "c")),
            List.of(new Ballot("r1-1", List.of(result("b", 1, 70, 70), result("a", 2, 71, 71)))));

        List<Standing> standings = StandingsCalculator.computeStandings(
            List.of(team("a"), team("b"), team("c")), List.of(withBye), DrawConfig.defaults());

        Standing c = standings.stream().filter(s -> s.teamId().equals("c")).findFirst().orElseThrow();
        assertEquals(1, c.points());
        assertEquals(0.0, c.speakerScore());
        assertEquals("b", standings.get(0).teamId());
    }

    @Test
    void computeStandings_fourSidedPlacementsScoreThreeToZero() {
        RoundRecord bp = round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "b", "c", "d"))),
            List.of(new Ballot("r1-1", List.of(
                result("a", 4, 70, 70), result("b", 3, 70, 70),
                result("c", 2, 70, 70), result("d", 1, 70, 70)))));

        List<Standing> standings = StandingsCalculator.computeStandings(TEAMS, List.of(bp), DrawConfig.of(4, 1));

        assertEquals(List.of("d", "c", "b", "a"), standings.stream().map(Standing::teamId).toList());
        assertEquals(List.of(3, 2, 1, 0), standings.stream().map(Standing::points).toList());
    }

    @Test
    void computeStandings_missingBallotInCompletedRound() {
        RoundRecord incomplete = round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "b")), Pairing.room(1, 2, List.of("c", "d"))),
            List.of(new Ballot("r1-1", List.of(result("a", 1, 75, 75), result("b", 2, 73, 72)))));

        assertThrows(DataIntegrityException.class,
            () -> StandingsCalculator.computeStandings(TEAMS, List.of(incomplete), DrawConfig.defaults()));
    }

    @Test
    void computeStandings_unknownTeamInPairing() {
        RoundRecord stray = round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "zz"))),
            List.of(new Ballot("r1-1", List.of(result("a", 1, 75, 75)))));

        DataIntegrityException e = assertThrows(DataIntegrityException.class,
            () -> StandingsCalculator.computeStandings(TEAMS, List.of(stray), DrawConfig.defaults()));
        assertTrue(e.getMessage().contains("zz"));
    }

    @Test
    void computeStandings_duplicateTeamInRound() {
        RoundRecord doubled = round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "b")), Pairing.room(1, 2, List.of("a", "c"))),
            List.of());

        assertThrows(DataIntegrityException.class,
            () -> StandingsCalculator.computeStandings(TEAMS, List.of(doubled), DrawConfig.defaults()));
    }

    @Test
    void computeStandings_seededTieBreakIsDeterministic() {
        DrawConfig seeded = DrawConfig.defaults().withTieBreak(TieBreak.SEEDED, 7L);

        List<Standing> first = StandingsCalculator.computeStandings(TEAMS, List.of(), seeded);
        List<Standing> second = StandingsCalculator.computeStandings(TEAMS, List.of(), seeded);

        assertEquals(first, second);
        assertEquals(4, first.size());
    }

    @Test
    void computeStandings_invalidConfig() {
        DrawConfig seededWithoutSeed = DrawConfig.defaults().withTieBreak(TieBreak.SEEDED, null);

        assertThrows(ConfigurationException.class,
            () -> StandingsCalculator.computeStandings(TEAMS, List.of(), seededWithoutSeed));
    }

    @Test
    void computeSpeakerStandings_totalsAndDebates() {
        List<SpeakerStanding> speakers = StandingsCalculator.computeSpeakerStandings(
            TEAMS, List.of(completedFirstRound()));

        assertEquals(8, speakers.size());
        assertEquals("a-1", speakers.get(0).speakerId());
        assertEquals("a-2", speakers.get(1).speakerId());
        assertEquals("b-1", speakers.get(2).speakerId());
        assertEquals(73.0, speakers.get(2).totalScore());
        assertEquals("b", speakers.get(2).teamId());
        assertEquals(1, speakers.get(0).debates());
    }

    @Test
    void computeSpeakerStandings_speakerOnWrongTeam() {
        RoundRecord swapped = round(1, RoundStatus.COMPLETED,
            List.of(Pairing.room(1, 1, List.of("a", "b"))),
            List.of(new Ballot("r1-1", List.of(
                new TeamResult("a", 1, List.of(new SpeakerScore("b-1", 1, 75))),
                result("b", 2, 70, 70)))));

        assertThrows(DataIntegrityException.class,
            () -> StandingsCalculator.computeSpeakerStandings(TEAMS, List.of(swapped)));
    }

    private static RoundRecord duplicatedBallot() {
        Ballot ballot = new Ballot("r1-1", List.of(result("a", 1, 75, 75), result("b", 2, 73, 72)));
        return round(1, RoundStatus.COMPLETED, List.of(Pairing.room(1, 1, List.of("a", "b"))),
            List.of(ballot, ballot));
    }

    private static RoundRecord teamListedTwice() {
        return round(1, RoundStatus.COMPLETED, List.of(Pairing.room(1, 1, List.of("a", "b"))),
            List.of(new Ballot("r1-1", List.of(result("a", 1, 75, 75), result("a", 2, 73, 72)))));
    }

    @Test
    void computeStandings_twoBallotsForOnePairing() {
        DataIntegrityException e = assertThrows(DataIntegrityException.class, () ->
            StandingsCalculator.computeStandings(List.of(team("a"), team("b")), List.of(duplicatedBallot()),
                DrawConfig.defaults()));
        assertTrue(e.getMessage().contains("r1-1"));
    }

    @Test
    void computeStandings_teamListedTwiceInBallot() {
        assertThrows(DataIntegrityException.class, () ->
            StandingsCalculator.computeStandings(List.of(team("a"), team("b")), List.of(teamListedTwice()),
                DrawConfig.defaults()));
    }

    @Test
    void computeSpeakerStandings_twoBallotsForOnePairing() {
        assertThrows(DataIntegrityException.class, () ->
            StandingsCalculator.computeSpeakerStandings(List.of(team("a"), team("b")), List.of(duplicatedBallot())));
    }

    @Test
    void computeSpeakerStandings_teamListedTwiceInBallot() {
        assertThrows(DataIntegrityException.class, () ->
            StandingsCalculator.computeSpeakerStandings(List.of(team("a"), team("b")), List.of(teamListedTwice())));
    }
}
