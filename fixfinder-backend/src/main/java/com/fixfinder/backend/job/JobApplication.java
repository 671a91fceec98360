package com.fixfinder.backend.job;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A professional's bid on a job. Owned by {@link Job}; the list is replaced wholesale on every
 * status change, so instances are copied with {@link #withStatus} rather than mutated.
 */
@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobApplication {

    @Column(name = "application_id", nullable = false, length = 36)
    private String id;

    @Column(name = "professional_id", nullable = false)
    private Long professionalId;

    @Column(length = 2000)
    private String proposal;

    private Integer proposedPrice;

    private String estimatedDuration;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApplicationStatus status;

    private Instant appliedAt;

    public JobApplication withStatus(ApplicationStatus next) {
        return toBuilder().status(next).build();
    }
}
