package org.tabbit.compute;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.tabbit.model.Ballot;
import org.tabbit.model.DrawConfig;
import org.tabbit.model.Pairing;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;
import org.tabbit.model.SpeakerScore;
import org.tabbit.model.SpeakerStanding;
import org.tabbit.model.Standing;
import org.tabbit.model.Team;
import org.tabbit.model.TeamResult;
import org.tabbit.model.TieBreak;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the team and speaker tabs from completed rounds.
 *
 * <p>Teams are ordered by points, then cumulative speaker score, then the configured
 * {@link TieBreak}. The order is total: every team gets a distinct rank.
 */
public final class StandingsCalculator {

    private StandingsCalculator() {}

    /**
     * Ranks every team on the roster using the results of completed rounds.
     *
     * <p>A debate is worth {@code roomSize - placement} points, so a two-sided win scores 1.
     * A bye scores {@code sidesPerRoom - 1} points and no speaker score.
     *
     * @param teams  the roster; teams without results rank on zero points
     * @param rounds rounds in any status; only completed rounds count
     * @param config supplies sides per room and the tie-break
     * @return standings in rank order
     * @throws DataIntegrityException if a ballot or pairing references a team or pairing that does not exist,
     *                                a pairing has two ballots, or a ballot lists a team twice
     */
    public static List<Standing> computeStandings(Collection<Team> teams, List<RoundRecord> rounds, DrawConfig config) {
        ConfigurationException.requireValid(config);
        Map<String, Team> roster = Rosters.indexTeams(teams);

        Map<String, Integer> points = new HashMap<>();
        Map<String, Double> speaks = new HashMap<>();
        for (String teamId : roster.keySet()) {
            points.put(teamId, 0);
            speaks.put(teamId, 0.0);
        }

        for (RoundRecord record : completed(rounds)) {
            Rosters.checkTeams(record, roster);
            Rosters.checkBallots(record);
            for (Pairing pairing : record.pairings()) {
                if (pairing.bye()) {
                    points.merge(pairing.teamIds().get(0), config.sidesPerRoom() - 1, Integer::sum);
                } else if (record.ballotFor(pairing.id()).isEmpty()) {
                    throw new DataIntegrityException(String.format(
                        "Completed round %d has no ballot for pairing %s", record.sequence(), pairing.id()));
                }
            }
            for (Ballot ballot : record.ballots()) {
                Pairing pairing = pairingOf(record, ballot);
                for (TeamResult result : ballot.results()) {
                    checkResult(record, pairing, result, roster);
                    points.merge(result.teamId(), pairing.teamIds().size() - result.placement(), Integer::sum);
                    speaks.merge(result.teamId(), result.speakerTotal(), Double::sum);
                }
            }
        }

        List<String> order = new ArrayList<>(roster.keySet());
        order.sort(Comparator.<String>comparingInt(points::get).reversed()
            .thenComparing(Comparator.<String>comparingDouble(speaks::get).reversed())
            .thenComparing(tieBreakOrder(config)));

        List<Standing> standings = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            String teamId = order.get(i);
            standings.add(new Standing(teamId, i + 1, points.get(teamId), speaks.get(teamId)));
        }
        return standings;
    }

    /**
     * Ranks every registered speaker by total speaker score, then speaker id.
     *
     * @throws DataIntegrityException if a score is credited to a speaker who is not on that team,
     *                                a pairing has two ballots, or a ballot lists a team twice
     */
    public static List<SpeakerStanding> computeSpeakerStandings(Collection<Team> teams, List<RoundRecord> rounds) {
        Map<String, Team> roster = Rosters.indexTeams(teams);

        Map<String, String> teamOfSpeaker = new HashMap<>();
        Map<String, Double> totals = new HashMap<>();
        Map<String, Integer> debates = new HashMap<>();
        for (Team team : roster.values()) {
            team.speakers().forEach(s -> {
                teamOfSpeaker.put(s.id(), team.id());
                totals.put(s.id(), 0.0);
                debates.put(s.id(), 0);
            });
        }

        for (RoundRecord record : completed(rounds)) {
            Rosters.checkTeams(record, roster);
            Rosters.checkBallots(record);
            for (Ballot ballot : record.ballots()) {
                Pairing pairing = pairingOf(record, ballot);
                for (TeamResult result : ballot.results()) {
                    checkResult(record, pairing, result, roster);
                    Set<String> spoke = new HashSet<>();
                    for (SpeakerScore score : result.speakerScores()) {
                        if (!result.teamId().equals(teamOfSpeaker.get(score.speakerId()))) {
                            throw new DataIntegrityException(String.format(
                                "Ballot for %s credits speaker %s who is not on team %s",
                                pairing.id(), score.speakerId(), result.teamId()));
                        }
                        totals.merge(score.speakerId(), score.score(), Double::sum);
                        if (spoke.add(score.speakerId())) {
                            debates.merge(score.speakerId(), 1, Integer::sum);
                        }
                    }
                }
            }
        }

        List<String> order = new ArrayList<>(totals.keySet());
        order.sort(Comparator.<String>comparingDouble(totals::get).reversed()
            .thenComparing(Comparator.naturalOrder()));

        List<SpeakerStanding> standings = new ArrayList<>(order.size());
        for (int i = 0; i < order.size(); i++) {
            String speakerId = order.get(i);
            standings.add(new SpeakerStanding(speakerId, teamOfSpeaker.get(speakerId), i + 1,
                totals.get(speakerId), debates.get(speakerId)));
        }
        return standings;
    }

    static List<RoundRecord> completed(List<RoundRecord> rounds) {
        return rounds.stream()
            .filter(r -> r.status() == RoundStatus.COMPLETED)
            .sorted(Comparator.comparingInt(RoundRecord::sequence))
            .toList();
    }

    private static Pairing pairingOf(RoundRecord record, Ballot ballot) {
        return record.pairing(ballot.pairingId()).orElseThrow(() -> new DataIntegrityException(String.format(
            "Ballot in round %d references unknown pairing %s", record.sequence(), ballot.pairingId())));
    }

    private static void checkResult(RoundRecord record, Pairing pairing, TeamResult result, Map<String, Team> roster) {
        if (!roster.containsKey(result.teamId())) {
            throw new DataIntegrityException(String.format(
                "Ballot for %s references unknown team %s", pairing.id(), result.teamId()));
        }
        if (!pairing.teamIds().contains(result.teamId())) {
            throw new DataIntegrityException(String.format(
                "Ballot for %s in round %d has a result for team %s which is not in that pairing",
                pairing.id(), record.sequence(), result.teamId()));
        }
        if (result.placement() < 1 || result.placement() > pairing.teamIds().size()) {
            throw new DataIntegrityException(String.format(
                "Ballot for %s gives team %s placement %d outside 1..%d",
                pairing.id(), result.teamId(), result.placement(), pairing.teamIds().size()));
        }
    }

    private static Comparator<String> tieBreakOrder(DrawConfig config) {
        if (config.tieBreak() == TieBreak.SEEDED) {
            HashFunction hash = Hashing.murmur3_32_fixed(Long.hashCode(config.tieBreakSeed()));
            return Comparator.<String>comparingInt(id -> hash.hashString(id, StandardCharsets.UTF_8).asInt())
                .thenComparing(Comparator.naturalOrder());
        }
        return Comparator.naturalOrder();
    }
}
