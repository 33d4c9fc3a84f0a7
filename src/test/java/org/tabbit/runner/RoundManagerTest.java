package org.tabbit.runner;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tabbit.compute.Constraint;
import org.tabbit.compute.DataIntegrityException;
import org.tabbit.compute.History;
import org.tabbit.compute.InfeasibleException;
import org.tabbit.model.Ballot;
import org.tabbit.model.Draw;
import org.tabbit.model.Pairing;
import org.tabbit.model.Round;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;
import org.tabbit.model.SpeakerScore;
import org.tabbit.model.SpeakerStanding;
import org.tabbit.model.Standing;
import org.tabbit.model.TeamResult;
import org.tabbit.model.Tournament;
import org.tabbit.store.JsonFileTournamentRepository;
import org.tabbit.store.ObjectMapperFactory;
import org.tabbit.store.SampleTournament;
import org.tabbit.store.TournamentNotFoundException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Lifecycle tests against the sample tournament: four teams, round 1 completed.
 */
class RoundManagerTest {

    private static final String ID = SampleTournament.ID;

    @TempDir
    Path tempDir;

    private JsonFileTournamentRepository repository;
    private RoundEventListener listener;
    private RoundManager manager;

    @BeforeEach
    void setUp() throws Exception {
        SampleTournament.copyTo(tempDir);
        repository = new JsonFileTournamentRepository(tempDir, ObjectMapperFactory.create());
        listener = mock(RoundEventListener.class);
        manager = new RoundManager(repository, new TournamentLocks(), listener);
    }

    private static TeamResult result(String teamId, int placement, double score) {
        return new TeamResult(teamId, placement, List.of(
            new SpeakerScore(teamId + "-1", 1, score),
            new SpeakerScore(teamId + "-2", 2, score)));
    }

    private static Ballot ballot(String pairingId, String winner, String loser) {
        return new Ballot(pairingId, List.of(result(winner, 1, 75), result(loser, 2, 72)));
    }

    private RoundRecord startSecondRound() {
        manager.createRound(ID, null);
        manager.drawRound(ID, 2);
        return manager.startRound(ID, 2);
    }

    @Test
    void createRound_appendsNextSequence() {
        RoundRecord created = manager.createRound(ID, null);

        assertEquals(2, created.sequence());
        assertEquals("Round 2", created.round().name());
        assertEquals(RoundStatus.PENDING, created.status());
        assertEquals(2, manager.listRounds(ID).size());
        verify(listener).onRoundChanged(new RoundEvent(ID, 2, RoundStatus.PENDING, 0, 0));
    }

    @Test
    void createRound_keepsGivenName() {
        assertEquals("Semi-final", manager.createRound(ID, "Semi-final").round().name());
    }

    @Test
    void createRound_unknownTournament() {
        assertThrows(TournamentNotFoundException.class, () -> manager.createRound("ghost", null));
    }

    @Test
    void drawRound_pairsByStandingsAndStaffsPanels() {
        manager.createRound(ID, null);

        RoundRecord drawn = manager.drawRound(ID, 2);

        assertEquals(RoundStatus.DRAWN, drawn.status());
        assertEquals(List.of("alpha", "delta"), drawn.pairings().get(0).teamIds());
        assertEquals(List.of("bravo", "charlie"), drawn.pairings().get(1).teamIds());
        assertEquals("kim", drawn.pairings().get(0).panel().chairId());
        assertEquals("max", drawn.pairings().get(1).panel().chairId());
        assertEquals(drawn, repository.getRound(ID, 2));
        verify(listener).onRoundChanged(argThat(e -> e.status() == RoundStatus.DRAWN && e.pairings() == 2));
    }

    @Test
    void drawRound_requiresEarlierRoundsCompleted() {
        manager.createRound(ID, null);
        manager.createRound(ID, null);

        RoundStateException e = assertThrows(RoundStateException.class, () -> manager.drawRound(ID, 3));
        assertTrue(e.getMessage().contains("round 2"));
    }

    @Test
    void drawRound_onlyFromPending() {
        manager.createRound(ID, null);
        manager.drawRound(ID, 2);

        assertThrows(RoundStateException.class, () -> manager.drawRound(ID, 2));
        assertThrows(RoundStateException.class, () -> manager.drawRound(ID, 1));
    }

    @Test
    void drawRound_concurrentDrawsCommitOnce() throws Exception {
        manager.createRound(ID, null);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger committed = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(executor.submit(() -> {
                    assertTrue(start.await(1, TimeUnit.SECONDS), "Both draws should be released together");
                    try {
                        manager.drawRound(ID, 2);
                        committed.incrementAndGet();
                    } catch (RoundStateException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<Object> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, committed.get());
        assertEquals(1, rejected.get());
        assertEquals(RoundStatus.DRAWN, repository.getRound(ID, 2).status());
        verify(listener, times(1)).onRoundChanged(argThat(e -> e.status() == RoundStatus.DRAWN));
    }

    @Test
    void drawRound_infeasibleLeavesRoundPending() {
        Tournament sample = repository.getTournament(ID);
        repository.saveTournament(new Tournament(sample.id(), sample.name(), sample.abbreviation(), sample.config(),
            sample.institutions(), sample.teams(), List.of(sample.adjudicator("judy").orElseThrow())));
        manager.createRound(ID, null);

        InfeasibleException e = assertThrows(InfeasibleException.class, () -> manager.drawRound(ID, 2));

        assertEquals(Constraint.PANEL_SIZE, e.constraint());
        assertEquals(RoundStatus.PENDING, repository.getRound(ID, 2).status());
        assertTrue(repository.getRound(ID, 2).pairings().isEmpty());
        verify(listener, never()).onRoundChanged(argThat(ev -> ev.status() == RoundStatus.DRAWN));
    }

    @Test
    void previewDraw_doesNotSave() {
        manager.createRound(ID, null);

        Draw preview = manager.previewDraw(ID, 2);

        assertEquals(2, preview.rooms().size());
        assertEquals(RoundStatus.PENDING, repository.getRound(ID, 2).status());
    }

    @Test
    void redraw_returnsDrawnRoundToPending() {
        manager.createRound(ID, null);
        manager.drawRound(ID, 2);

        RoundRecord reset = manager.redraw(ID, 2);

        assertEquals(RoundStatus.PENDING, reset.status());
        assertTrue(reset.pairings().isEmpty());
        assertEquals(RoundStatus.DRAWN, manager.drawRound(ID, 2).status());
    }

    @Test
    void redraw_rejectedOnceStarted() {
        startSecondRound();

        assertThrows(RoundStateException.class, () -> manager.redraw(ID, 2));
    }

    @Test
    void startRound_requiresDraw() {
        manager.createRound(ID, null);

        assertThrows(RoundStateException.class, () -> manager.startRound(ID, 2));
    }

    @Test
    void submitBallot_requiresRoundInProgress() {
        manager.createRound(ID, null);
        manager.drawRound(ID, 2);

        assertThrows(RoundStateException.class,
            () -> manager.submitBallot(ID, 2, ballot("r2-1", "alpha", "delta")));
    }

    @Test
    void submitBallot_laterBallotReplacesEarlier() {
        startSecondRound();

        manager.submitBallot(ID, 2, ballot("r2-1", "alpha", "delta"));
        RoundRecord updated = manager.submitBallot(ID, 2, ballot("r2-1", "delta", "alpha"));

        assertEquals(1, updated.ballots().size());
        assertEquals(1, updated.ballotFor("r2-1").orElseThrow().resultFor("delta").orElseThrow().placement());
    }

    @Test
    void submitBallot_rejectsUnknownPairing() {
        startSecondRound();

        assertThrows(DataIntegrityException.class,
            () -> manager.submitBallot(ID, 2, ballot("r2-9", "alpha", "delta")));
    }

    @Test
    void submitBallot_rejectsTeamNotInRoom() {
        startSecondRound();

        assertThrows(DataIntegrityException.class,
            () -> manager.submitBallot(ID, 2, ballot("r2-1", "alpha", "bravo")));
    }

    @Test
    void submitBallot_rejectsRepeatedPlacement() {
        startSecondRound();
        Ballot tied = new Ballot("r2-1", List.of(result("alpha", 1, 75), result("delta", 1, 75)));

        assertThrows(DataIntegrityException.class, () -> manager.submitBallot(ID, 2, tied));
    }

    @Test
    void submitBallot_rejectsSpeakerFromAnotherTeam() {
        startSecondRound();
        Ballot borrowed = new Ballot("r2-1", List.of(
            new TeamResult("alpha", 1, List.of(new SpeakerScore("bravo-1", 1, 80))),
            result("delta", 2, 72)));

        assertThrows(DataIntegrityException.class, () -> manager.submitBallot(ID, 2, borrowed));
    }

    @Test
    void completeRound_requiresEveryBallot() {
        startSecondRound();
        manager.submitBallot(ID, 2, ballot("r2-1", "alpha", "delta"));

        RoundStateException e = assertThrows(RoundStateException.class, () -> manager.completeRound(ID, 2));
        assertTrue(e.getMessage().contains("r2-2"));
    }

    @Test
    void completeRound_updatesStandings() {
        startSecondRound();
        manager.submitBallot(ID, 2, ballot("r2-1", "alpha", "delta"));
        manager.submitBallot(ID, 2, ballot("r2-2", "bravo", "charlie"));

        RoundRecord completed = manager.completeRound(ID, 2);
        List<Standing> standings = manager.standings(ID);

        assertEquals(RoundStatus.COMPLETED, completed.status());
        assertEquals("alpha", standings.get(0).teamId());
        assertEquals(2, standings.get(0).points());
        assertEquals("charlie", standings.get(3).teamId());
        assertEquals(0, standings.get(3).points());
        assertTrue(manager.history(ID).haveMet("alpha", "delta"));
    }

    @Test
    void standings_fromSampleFixture() {
        List<Standing> standings = manager.standings(ID);

        assertEquals(List.of("alpha", "delta", "bravo", "charlie"),
            standings.stream().map(Standing::teamId).toList());
    }

    @Test
    void speakerStandings_fromSampleFixture() {
        List<SpeakerStanding> speakers = manager.speakerStandings(ID);

        assertEquals(8, speakers.size());
        assertEquals("alpha-1", speakers.get(0).speakerId());
        assertEquals("charlie-2", speakers.get(7).speakerId());
    }

    @Test
    void history_fromSampleFixture() {
        History history = manager.history(ID);

        assertTrue(history.haveMet("alpha", "bravo"));
        assertTrue(history.hasJudged("lee", "delta"));
        assertFalse(history.hasJudged("kim", "alpha"));
    }

    @Test
    void checkBallot_rejectsByePairing() {
        RoundRecord round = RoundRecord.pending(new Round("x", 2, "Round 2", RoundStatus.IN_PROGRESS))
            .withDraw(RoundStatus.IN_PROGRESS, List.of(Pairing.bye(2, 1, "alpha")));

        assertThrows(DataIntegrityException.class, () -> RoundManager.checkBallot(repository.getTournament(ID),
            round, new Ballot("r2-1", List.of(result("alpha", 1, 70)))));
        verify(listener, never()).onRoundChanged(any());
    }
}
