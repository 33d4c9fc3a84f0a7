package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A tournament-wide label, such as "novice" or "ESL", attached to speakers and adjudicators.
 */
public record Tag(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name
) {}
