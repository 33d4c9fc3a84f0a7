package org.tabbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A university, school or club that teams and adjudicators are affiliated with.
 */
public record Institution(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name
) {}
