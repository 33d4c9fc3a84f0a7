package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A team's position in the team tab.
 *
 * @param teamId       the team
 * @param rank         1-based, unique within one standings list
 * @param points       team points; equal to wins in two-sided formats
 * @param speakerScore cumulative speaker score
 */
public record Standing(
    @JsonProperty("teamId") String teamId,
    @JsonProperty("rank") int rank,
    @JsonProperty("points") int points,
    @JsonProperty("speakerScore") double speakerScore
) {}
