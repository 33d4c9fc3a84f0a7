package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * DTO for editing an adjudicator; omitted fields are left unchanged.
 */
public record UpdateAdjudicatorRequest(
    @JsonProperty("name") @Size(min = 1, max = 100) String name,
    @JsonProperty("institutionId") String institutionId,
    @JsonProperty("experience") @Min(0) Integer experience,
    @JsonProperty("independent") Boolean independent
) {}
