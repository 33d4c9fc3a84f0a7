package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record AdjudicatorRequest(
    @JsonProperty("name") @NotBlank String name,
    @JsonProperty("institutionId") String institutionId,
    @JsonProperty("experience") @Min(0) int experience,
    @JsonProperty("independent") boolean independent
) {}
