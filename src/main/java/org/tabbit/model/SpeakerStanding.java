package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A speaker's position in the speaker tab.
 */
public record SpeakerStanding(
    @JsonProperty("speakerId") String speakerId,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("rank") int rank,
    @JsonProperty("totalScore") double totalScore,
    @JsonProperty("debates") int debates
) {}
