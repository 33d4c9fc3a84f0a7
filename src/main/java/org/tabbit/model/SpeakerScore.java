package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Points awarded to one speaker on a ballot.
 */
public record SpeakerScore(
    @JsonProperty("speakerId") String speakerId,
    @JsonProperty("position") int position,
    @JsonProperty("score") double score
) {}
