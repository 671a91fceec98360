package com.fixfinder.backend.job;

import com.fixfinder.backend.professional.Professional;
import com.fixfinder.backend.shared.error.ConflictException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.User;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Getter
@Setter
@Table(name = "jobs", indexes = @Index(name = "idx_jobs_client", columnList = "client_id"))
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "client_id", nullable = false)
    private User client;

    @ManyToOne
    @JoinColumn(name = "professional_id")
    private Professional professional;

    @Column(nullable = false)
    private String title;

    @Column(length = 2000)
    private String description;

    private String category;

    @Embedded
    private JobLocation location = new JobLocation();

    @Embedded
    private Budget budget = new Budget();

    private LocalDate preferredDate;
    private String preferredTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Urgency urgency = Urgency.REGULAR;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LifecycleState lifecycleState = LifecycleState.POSTED;

    @Setter(AccessLevel.NONE)
    private Long conversationId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_applications", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Setter(AccessLevel.NONE)
    private List<JobApplication> applications = new ArrayList<>();

    @Column(nullable = false)
    private boolean active = true;

    private Instant createdAt = Instant.now();
    private Instant updatedAt = Instant.now();
    private Instant completedAt;
    private Instant cancelledAt;

    @Column(length = 500)
    private String cancellationReason;

    /** Binds the job to its conversation. Once set the link never changes. */
    public void linkConversation(Long id) {
        if (conversationId != null && !conversationId.equals(id)) {
            throw new ConflictException("Job is already linked to conversation " + conversationId);
        }
        this.conversationId = id;
    }

    public void transitionTo(LifecycleState target) {
        if (!lifecycleState.canTransitionTo(target)) {
            throw new ValidationException("Job cannot move from " + lifecycleState + " to " + target);
        }
        this.lifecycleState = target;
    }

    public boolean isClient(Long userId) {
        return client != null && client.getId() != null && client.getId().equals(userId);
    }

    public boolean isAssignedProfessional(Long userId) {
        return professional != null && professional.isOwnedBy(userId);
    }

    public boolean hasApplicationFrom(Long professionalId) {
        return applications.stream().anyMatch(a -> a.getProfessionalId().equals(professionalId));
    }

    public Optional<JobApplication> findApplication(String applicationId) {
        return applications.stream().filter(a -> a.getId().equals(applicationId)).findFirst();
    }

    /** Swaps in a new application list in one step; the old list is never edited in place. */
    public void replaceApplications(List<JobApplication> next) {
        List<JobApplication> copy = List.copyOf(next);
        applications.clear();
        applications.addAll(copy);
    }
}
