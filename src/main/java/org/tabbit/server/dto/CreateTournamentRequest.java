package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.tabbit.model.DrawConfig;

/**
 * DTO for creating a tournament.
 */
public record CreateTournamentRequest(
    @JsonProperty("name") @NotBlank @Size(max = 100) String name,
    @JsonProperty("abbreviation") @Size(max = 20) String abbreviation,
    @JsonProperty("config") DrawConfigRequest config
) {

    public DrawConfig drawConfig() {
        return config == null ? DrawConfig.defaults() : config.toConfig();
    }
}
