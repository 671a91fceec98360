package com.fixfinder.backend.job.dto;

import com.fixfinder.backend.job.ApplicationStatus;
import com.fixfinder.backend.job.JobApplication;

import java.time.Instant;

public record ApplicationDto(
        String id,
        Long professionalId,
        String proposal,
        Integer proposedPrice,
        String estimatedDuration,
        ApplicationStatus status,
        Instant appliedAt
) {
    public static ApplicationDto from(JobApplication a) {
        return new ApplicationDto(
                a.getId(),
                a.getProfessionalId(),
                a.getProposal(),
                a.getProposedPrice(),
                a.getEstimatedDuration(),
                a.getStatus(),
                a.getAppliedAt()
        );
    }
}
