package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Confirmed result of one pairing.
 */
public record Ballot(
    @JsonProperty("pairingId") String pairingId,
    @JsonProperty("results") List<TeamResult> results
) {

    public Ballot {
        results = List.copyOf(results);
    }

    public Optional<TeamResult> resultFor(String teamId) {
        return results.stream().filter(r -> r.teamId().equals(teamId)).findFirst();
    }
}
