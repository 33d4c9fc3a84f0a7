package org.tabbit.server.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * DTO listing the speakers or adjudicators to attach a tag to.
 */
public record TagMembersRequest(
    @JsonProperty("ids") @NotEmpty List<@NotBlank String> ids
) {}
