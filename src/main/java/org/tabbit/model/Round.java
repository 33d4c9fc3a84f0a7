package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A round of the tournament.
 *
 * @param id           stable identifier
 * @param sequence     1-based position; sequences have no gaps
 * @param name         display name, e.g. "Round 1"
 * @param abbreviation short name for tab displays, e.g. "R1", or null
 * @param status       lifecycle status
 */
public record Round(
    @JsonProperty("id") String id,
    @JsonProperty("sequence") int sequence,
    @JsonProperty("name") String name,
    @JsonProperty("abbreviation") String abbreviation,
    @JsonProperty("status") RoundStatus status
) {

    public Round(String id, int sequence, String name, RoundStatus status) {
        this(id, sequence, name, null, status);
    }

    public Round withStatus(RoundStatus next) {
        return new Round(id, sequence, name, abbreviation, next);
    }

    public Round withDetails(String newName, String newAbbreviation) {
        return new Round(id, sequence, newName, newAbbreviation, status);
    }
}
