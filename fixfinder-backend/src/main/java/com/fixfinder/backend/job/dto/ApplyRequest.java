package com.fixfinder.backend.job.dto;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record ApplyRequest(
        @Size(max = 2000) String proposal,
        @PositiveOrZero Integer proposedPrice,
        String estimatedDuration
) {
}
