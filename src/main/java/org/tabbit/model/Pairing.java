package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One room of a round's draw.
 *
 * @param id            identifier, {@code r<sequence>-<rank>}
 * @param roundSequence sequence of the round this room belongs to
 * @param rank          room importance; 1 is the top room and byes come after every room
 * @param teamIds       teams in side order
 * @param panel         assigned adjudicators, or null before allocation and for byes
 * @param bye           true when this entry is a bye for its single team
 */
public record Pairing(
    @JsonProperty("id") String id,
    @JsonProperty("roundSequence") int roundSequence,
    @JsonProperty("rank") int rank,
    @JsonProperty("teamIds") List<String> teamIds,
    @JsonProperty("panel") Panel panel,
    @JsonProperty("bye") boolean bye
) {

    public Pairing {
        teamIds = List.copyOf(teamIds);
    }

    public static String idFor(int roundSequence, int rank) {
        return "r" + roundSequence + "-" + rank;
    }

    public static Pairing room(int roundSequence, int rank, List<String> teamIds) {
        return new Pairing(idFor(roundSequence, rank), roundSequence, rank, teamIds, null, false);
    }

    public static Pairing bye(int roundSequence, int rank, String teamId) {
        return new Pairing(idFor(roundSequence, rank), roundSequence, rank, List.of(teamId), null, true);
    }

    public Pairing withPanel(Panel assigned) {
        return new Pairing(id, roundSequence, rank, teamIds, assigned, bye);
    }
}
