package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * DTO for appending a round; a missing name becomes "Round n" and a missing abbreviation "Rn".
 */
public record CreateRoundRequest(
    @JsonProperty("name") @Size(max = 50) String name,
    @JsonProperty("abbreviation") @Size(max = 10) String abbreviation
) {}
