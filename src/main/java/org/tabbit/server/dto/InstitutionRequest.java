package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record InstitutionRequest(
    @JsonProperty("name") @NotBlank String name
) {}
