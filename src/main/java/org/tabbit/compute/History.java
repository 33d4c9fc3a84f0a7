package org.tabbit.compute;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;

/**
 * Relations derived from completed rounds that later draws and allocations must respect.
 *
 * @param metPairs           teams that have shared a room
 * @param metInstitutions    team id to the institutions of opponents it has faced
 * @param judgedTeams        adjudicator id to the teams they have judged
 * @param judgedInstitutions adjudicator id to the institutions of teams they have judged
 * @param byes               teams that have received a bye
 */
public record History(
    @JsonProperty("metPairs") ImmutableSet<TeamPair> metPairs,
    @JsonProperty("metInstitutions") ImmutableSetMultimap<String, String> metInstitutions,
    @JsonProperty("judgedTeams") ImmutableSetMultimap<String, String> judgedTeams,
    @JsonProperty("judgedInstitutions") ImmutableSetMultimap<String, String> judgedInstitutions,
    @JsonProperty("byes") ImmutableSet<String> byes
) {

    public static History empty() {
        return new History(ImmutableSet.of(), ImmutableSetMultimap.of(), ImmutableSetMultimap.of(),
            ImmutableSetMultimap.of(), ImmutableSet.of());
    }

    public boolean haveMet(String teamA, String teamB) {
        return metPairs.contains(TeamPair.of(teamA, teamB));
    }

    public boolean hasJudged(String adjudicatorId, String teamId) {
        return judgedTeams.containsEntry(adjudicatorId, teamId);
    }

    public boolean hasJudgedInstitution(String adjudicatorId, String institutionId) {
        return judgedInstitutions.containsEntry(adjudicatorId, institutionId);
    }

    public boolean hadBye(String teamId) {
        return byes.contains(teamId);
    }
}
