package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * DTO for editing a team; omitted fields are left unchanged. Speakers are edited separately.
 */
public record UpdateTeamRequest(
    @JsonProperty("name") @Size(min = 1, max = 100) String name,
    @JsonProperty("abbreviation") @Size(max = 20) String abbreviation,
    @JsonProperty("institutionId") String institutionId
) {}
