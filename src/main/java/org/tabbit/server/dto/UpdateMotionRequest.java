package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * DTO for editing a motion; omitted fields are left unchanged.
 */
public record UpdateMotionRequest(
    @JsonProperty("text") @Size(min = 1, max = 1000) String text,
    @JsonProperty("infoslide") @Size(max = 5000) String infoslide
) {}
