package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A round's room assignments in rank order, byes last.
 */
public record Draw(
    @JsonProperty("roundSequence") int roundSequence,
    @JsonProperty("pairings") List<Pairing> pairings
) {

    public Draw {
        pairings = List.copyOf(pairings);
    }

    /**
     * Debating rooms, excluding byes.
     */
    public List<Pairing> rooms() {
        return pairings.stream().filter(p -> !p.bye()).toList();
    }

    public List<Pairing> byes() {
        return pairings.stream().filter(Pairing::bye).toList();
    }
}
