package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

public record UpdateRoundRequest(
    @JsonProperty("name") @Size(min = 1, max = 50) String name,
    @JsonProperty("abbreviation") @Size(min = 1, max = 10) String abbreviation
) {}
