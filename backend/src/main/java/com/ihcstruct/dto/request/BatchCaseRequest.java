package com.ihcstruct.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for structuring several independent cases in one call.
 */
public record BatchCaseRequest(
    @NotEmpty(message = "At least one case is required")
    List<@Valid IhcCaseRequest> cases
) {}
