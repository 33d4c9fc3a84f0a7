package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A motion set for a round.
 *
 * @param id        stable identifier, unique within the round
 * @param text      the motion as read out to debaters
 * @param infoslide background shown before the motion, or null
 */
public record Motion(
    @JsonProperty("id") String id,
    @JsonProperty("text") String text,
    @JsonProperty("infoslide") String infoslide
) {

    public Motion withContent(String newText, String newInfoslide) {
        return new Motion(id, newText, newInfoslide);
    }
}
