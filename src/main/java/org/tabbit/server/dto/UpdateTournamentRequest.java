package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * DTO for renaming a tournament; omitted fields are left unchanged.
 */
public record UpdateTournamentRequest(
    @JsonProperty("name") @Size(min = 1, max = 100) String name,
    @JsonProperty("abbreviation") @Size(max = 20) String abbreviation
) {}
