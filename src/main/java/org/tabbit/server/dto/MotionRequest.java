package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for adding a motion to a round.
 */
public record MotionRequest(
    @JsonProperty("text") @NotBlank @Size(max = 1000) String text,
    @JsonProperty("infoslide") @Size(max = 5000) String infoslide
) {}
