package com.fixfinder.backend.job.dto;

import com.fixfinder.backend.job.Urgency;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateJobRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 2000) String description,
        String category,
        @Valid LocationInput location,
        @NotNull @Valid BudgetInput budget,
        LocalDate preferredDate,
        String preferredTime,
        Urgency urgency
) {
    public record LocationInput(String address, String city, String state, Double lat, Double lng) {
    }

    public record BudgetInput(@NotNull @PositiveOrZero Integer min, @NotNull @PositiveOrZero Integer max) {
    }
}
