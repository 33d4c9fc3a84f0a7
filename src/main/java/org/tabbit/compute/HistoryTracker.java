package org.tabbit.compute;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import org.tabbit.model.Adjudicator;
import org.tabbit.model.Pairing;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.Team;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Derives prior meetings, byes and adjudicator conflicts from completed rounds.
 * Rounds that are pending, drawn or in progress never contribute.
 */
public final class HistoryTracker {

    private HistoryTracker() {}

    /**
     * @param teams        the team roster
     * @param adjudicators the adjudicator pool
     * @param rounds       rounds in any status
     * @throws DataIntegrityException if a pairing references an unknown team or adjudicator,
     *                                or a team or adjudicator appears twice in one round
     */
    public static History computeHistory(Collection<Team> teams, Collection<Adjudicator> adjudicators,
                                         List<RoundRecord> rounds) {
        Map<String, Team> roster = Rosters.indexTeams(teams);
        Map<String, Adjudicator> pool = Rosters.indexAdjudicators(adjudicators);

        ImmutableSet.Builder<TeamPair> metPairs = ImmutableSet.builder();
        ImmutableSetMultimap.Builder<String, String> metInstitutions = ImmutableSetMultimap.builder();
        ImmutableSetMultimap.Builder<String, String> judgedTeams = ImmutableSetMultimap.builder();
        ImmutableSetMultimap.Builder<String, String> judgedInstitutions = ImmutableSetMultimap.builder();
        ImmutableSet.Builder<String> byes = ImmutableSet.builder();

        for (RoundRecord record : StandingsCalculator.completed(rounds)) {
            Rosters.checkTeams(record, roster);
            Rosters.checkPanels(record, pool);
            for (Pairing pairing : record.pairings()) {
                if (pairing.bye()) {
                    byes.add(pairing.teamIds().get(0));
                    continue;
                }
                List<String> teamIds = pairing.teamIds();
                for (int i = 0; i < teamIds.size(); i++) {
                    for (int j = 0; j < teamIds.size(); j++) {
                        if (i == j) {
                            continue;
                        }
                        metPairs.add(TeamPair.of(teamIds.get(i), teamIds.get(j)));
                        String team = teamIds.get(i);
                        roster.get(teamIds.get(j)).institution()
                            .ifPresent(institution -> metInstitutions.put(team, institution));
                    }
                }
                if (pairing.panel() == null) {
                    continue;
                }
                for (String adjudicatorId : pairing.panel().members()) {
                    for (String teamId : teamIds) {
                        judgedTeams.put(adjudicatorId, teamId);
                        roster.get(teamId).institution()
                            .ifPresent(institution -> judgedInstitutions.put(adjudicatorId, institution));
                    }
                }
            }
        }

        return new History(metPairs.build(), metInstitutions.build(), judgedTeams.build(),
            judgedInstitutions.build(), byes.build());
    }
}
