package com.fixfinder.backend.job.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fixfinder.backend.job.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobDto(
        Long id,
        Long clientId,
        String clientName,
        Long professionalId,
        String professionalName,
        String title,
        String description,
        String category,
        JobLocation location,
        Budget budget,
        LocalDate preferredDate,
        String preferredTime,
        Urgency urgency,
        JobStatus status,
        LifecycleState lifecycleState,
        Long conversationId,
        List<ApplicationDto> applications,
        Double distanceKm,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        Instant cancelledAt,
        String cancellationReason
) {
    public static JobDto from(Job job) {
        return from(job, null);
    }

    public static JobDto from(Job job, Double distanceKm) {
        return new JobDto(
                job.getId(),
                job.getClient().getId(),
                job.getClient().getName(),
                job.getProfessional() != null ? job.getProfessional().getId() : null,
                job.getProfessional() != null ? job.getProfessional().getName() : null,
                job.getTitle(),
                job.getDescription(),
                job.getCategory(),
                job.getLocation(),
                job.getBudget(),
                job.getPreferredDate(),
                job.getPreferredTime(),
                job.getUrgency(),
                job.getStatus(),
                job.getLifecycleState(),
                job.getConversationId(),
                job.getApplications().stream().map(ApplicationDto::from).toList(),
                distanceKm,
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt(),
                job.getCancelledAt(),
                job.getCancellationReason()
        );
    }
}
