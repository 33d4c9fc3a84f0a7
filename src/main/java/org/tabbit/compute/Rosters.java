package org.tabbit.compute;

import org.tabbit.model.Adjudicator;
import org.tabbit.model.Ballot;
import org.tabbit.model.Pairing;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.Team;
import org.tabbit.model.TeamResult;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Roster indexing and participation checks shared by the calculators.
 */
final class Rosters {

    private Rosters() {}

    static Map<String, Team> indexTeams(Collection<Team> teams) {
        Map<String, Team> index = new LinkedHashMap<>();
        for (Team team : teams) {
            if (index.put(team.id(), team) != null) {
                throw new DataIntegrityException("Duplicate team id in roster: " + team.id());
            }
        }
        return index;
    }

    static Map<String, Adjudicator> indexAdjudicators(Collection<Adjudicator> adjudicators) {
        Map<String, Adjudicator> index = new LinkedHashMap<>();
        for (Adjudicator adjudicator : adjudicators) {
            if (index.put(adjudicator.id(), adjudicator) != null) {
                throw new DataIntegrityException("Duplicate adjudicator id in pool: " + adjudicator.id());
            }
        }
        return index;
    }

    /**
     * Checks that every team in the round is on the roster and in at most one pairing.
     */
    static void checkTeams(RoundRecord record, Map<String, Team> roster) {
        Set<String> seen = new HashSet<>();
        for (Pairing pairing : record.pairings()) {
            for (String teamId : pairing.teamIds()) {
                if (!roster.containsKey(teamId)) {
                    throw new DataIntegrityException(String.format(
                        "Round %d pairing %s references unknown team %s", record.sequence(), pairing.id(), teamId));
                }
                if (!seen.add(teamId)) {
                    throw new DataIntegrityException(String.format(
                        "Team %s appears in more than one pairing of round %d", teamId, record.sequence()));
                }
            }
        }
    }

    /**
     * Checks that each pairing has at most one ballot and each ballot lists a team at most once.
     */
    static void checkBallots(RoundRecord record) {
        Set<String> pairings = new HashSet<>();
        for (Ballot ballot : record.ballots()) {
            if (!pairings.add(ballot.pairingId())) {
                throw new DataIntegrityException(String.format(
                    "Round %d has more than one ballot for pairing %s", record.sequence(), ballot.pairingId()));
            }
            Set<String> teams = new HashSet<>();
            for (TeamResult result : ballot.results()) {
                if (!teams.add(result.teamId())) {
                    throw new DataIntegrityException(String.format(
                        "Ballot for %s in round %d lists team %s more than once",
                        ballot.pairingId(), record.sequence(), result.teamId()));
                }
            }
        }
    }

    /**
     * Checks that every panel member is in the pool and sits on at most one panel.
     */
    static void checkPanels(RoundRecord record, Map<String, Adjudicator> pool) {
        Set<String> seen = new HashSet<>();
        for (Pairing pairing : record.pairings()) {
            if (pairing.panel() == null) {
                continue;
            }
            for (String adjudicatorId : pairing.panel().members()) {
                if (!pool.containsKey(adjudicatorId)) {
                    throw new DataIntegrityException(String.format(
                        "Round %d pairing %s references unknown adjudicator %s",
                        record.sequence(), pairing.id(), adjudicatorId));
                }
                if (!seen.add(adjudicatorId)) {
                    throw new DataIntegrityException(String.format(
                        "Adjudicator %s sits on more than one panel in round %d", adjudicatorId, record.sequence()));
                }
            }
        }
    }
}
