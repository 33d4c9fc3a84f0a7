package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * DTO for registering a team. Speakers are listed in speaking order.
 */
public record TeamRequest(
    @JsonProperty("name") @NotBlank String name,
    @JsonProperty("abbreviation") String abbreviation,
    @JsonProperty("institutionId") String institutionId,
    @JsonProperty("speakers") List<@NotBlank String> speakers
) {

    public TeamRequest {
        speakers = speakers == null ? List.of() : speakers;
    }
}
