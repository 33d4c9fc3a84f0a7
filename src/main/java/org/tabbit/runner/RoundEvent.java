package org.tabbit.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.tabbit.model.RoundRecord;
import org.tabbit.model.RoundStatus;

/**
 * Notification that a round changed status or content.
 */
public record RoundEvent(
    @JsonProperty("tournamentId") String tournamentId,
    @JsonProperty("sequence") int sequence,
    @JsonProperty("status") RoundStatus status,
    @JsonProperty("pairings") int pairings,
    @JsonProperty("ballots") int ballots
) {

    public static RoundEvent of(String tournamentId, RoundRecord record) {
        return new RoundEvent(tournamentId, record.sequence(), record.status(),
            record.pairings().size(), record.ballots().size());
    }
}
