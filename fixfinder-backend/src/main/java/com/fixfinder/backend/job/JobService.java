package com.fixfinder.backend.job;

import com.fixfinder.backend.conversation.Conversation;
import com.fixfinder.backend.conversation.ConversationService;
import com.fixfinder.backend.conversation.Participant;
import com.fixfinder.backend.conversation.ParticipantRole;
import com.fixfinder.backend.job.dto.*;
import com.fixfinder.backend.notification.NotificationData;
import com.fixfinder.backend.notification.NotificationService;
import com.fixfinder.backend.notification.NotificationType;
import com.fixfinder.backend.notification.Priority;
import com.fixfinder.backend.professional.Professional;
import com.fixfinder.backend.professional.ProfessionalRepository;
import com.fixfinder.backend.realtime.Channel;
import com.fixfinder.backend.realtime.ConversationChannel;
import com.fixfinder.backend.realtime.RealtimeEvent;
import com.fixfinder.backend.realtime.RealtimePublisher;
import com.fixfinder.backend.realtime.UserChannel;
import com.fixfinder.backend.shared.PageRequests;
import com.fixfinder.backend.shared.PaginatedResponse;
import com.fixfinder.backend.shared.error.AuthorizationException;
import com.fixfinder.backend.shared.error.ConflictException;
import com.fixfinder.backend.shared.error.NotFoundException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.Role;
import com.fixfinder.backend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * The job lifecycle engine. Every state change validates against {@link LifecycleState}, persists the
 * job with one save, then notifies the counterparty and pushes {@code job:update}. The last two steps
 * are best-effort.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobService {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private final JobRepository jobRepository;
    private final ProfessionalRepository professionalRepository;
    private final ConversationService conversationService;
    private final NotificationService notificationService;
    private final RealtimePublisher publisher;

    // ---------------------------------------------------------------------
    // Creation
    // ---------------------------------------------------------------------

    public JobDto create(User client, CreateJobRequest request) {
        if (client.getRole() != Role.CLIENT) {
            throw new AuthorizationException("Only clients can post jobs");
        }
        Job job = buildJob(client, request);
        Job saved = persist(job);
        log.info("Job {} posted by client {}", saved.getId(), client.getId());
        return JobDto.from(saved);
    }

    public JobDto createJobRequestInChat(User client, Long conversationId, CreateJobRequest request) {
        Conversation conversation = conversationService.requireConversation(conversationId);
        Participant requester = conversation.requireParticipant(client.getId());
        if (requester.getRole() != ParticipantRole.CLIENT) {
            throw new AuthorizationException("Only the client in a conversation can request a job");
        }
        Participant counterpart = conversation.counterpartOf(client.getId());
        Professional professional = professionalRepository.findByUser_Id(counterpart.getUserId())
                .orElseThrow(() -> new ValidationException("The other participant has no professional profile"));

        Job job = buildJob(client, request);
        job.setProfessional(professional);
        job.transitionTo(LifecycleState.JOB_REQUESTED);
        job.linkConversation(conversationId);
        Job saved = persist(job);
        conversationService.attachJob(conversationId, saved.getId());
        log.info("Job {} requested in conversation {}", saved.getId(), conversationId);

        notifyUser(professional.getUser().getId(), NotificationType.JOB_REQUESTED, Priority.HIGH,
                "New job request",
                client.getName() + " requested \"" + saved.getTitle() + "\"",
                saved);
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    // ---------------------------------------------------------------------
    // Applications
    // ---------------------------------------------------------------------

    public JobDto apply(User actor, Long jobId, ApplyRequest request) {
        Professional professional = professionalRepository.findByUser_Id(actor.getId())
                .orElseThrow(() -> new AuthorizationException("A professional profile is required to apply"));
        Job job = requireJob(jobId);

        if (job.isClient(actor.getId())) {
            throw new ValidationException("You cannot apply to your own job");
        }
        if (!job.isActive() || job.getStatus() != JobStatus.PENDING || !job.getLifecycleState().isOpenForApplications()) {
            throw new ValidationException("Job is not open for applications");
        }
        if (job.hasApplicationFrom(professional.getId())) {
            throw new ConflictException("You have already applied to this job");
        }

        List<JobApplication> next = new ArrayList<>(job.getApplications());
        next.add(JobApplication.builder()
                .id(UUID.randomUUID().toString())
                .professionalId(professional.getId())
                .proposal(request != null ? request.proposal() : null)
                .proposedPrice(request != null ? request.proposedPrice() : null)
                .estimatedDuration(request != null ? request.estimatedDuration() : null)
                .status(ApplicationStatus.PENDING)
                .appliedAt(Instant.now())
                .build());
        job.replaceApplications(next);
        if (job.getLifecycleState() == LifecycleState.POSTED) {
            job.transitionTo(LifecycleState.OFFER_PENDING);
        }

        Job saved = persist(job);
        log.info("Professional {} applied to job {}", professional.getId(), jobId);

        notifyUser(saved.getClient().getId(), NotificationType.JOB_APPLICATION, Priority.MEDIUM,
                "New application",
                professional.getName() + " applied to \"" + saved.getTitle() + "\"",
                saved);
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    public JobDto acceptApplication(User actor, Long jobId, String applicationId) {
        Job job = requireJob(jobId);
        if (!job.isClient(actor.getId())) {
            throw new AuthorizationException("Only the job's client can accept applications");
        }
        JobApplication chosen = job.findApplication(applicationId)
                .orElseThrow(() -> new NotFoundException("Application not found"));
        if (chosen.getStatus() != ApplicationStatus.PENDING) {
            throw new ValidationException("Application is no longer pending");
        }
        if (!job.getLifecycleState().canTransitionTo(LifecycleState.CHAT_OPEN)) {
            throw new ValidationException("Job cannot move from " + job.getLifecycleState() + " to " + LifecycleState.CHAT_OPEN);
        }
        Professional professional = professionalRepository.findById(chosen.getProfessionalId())
                .orElseThrow(() -> new NotFoundException("Applicant profile not found"));

        Conversation conversation = conversationService.findOrCreate(
                actor.getId(), ParticipantRole.CLIENT,
                professional.getUser().getId(), ParticipantRole.PROFESSIONAL,
                job.getId()
        );

        List<JobApplication> next = job.getApplications().stream()
                .map(a -> a.getId().equals(applicationId)
                        ? a.withStatus(ApplicationStatus.ACCEPTED)
                        : a.withStatus(ApplicationStatus.REJECTED))
                .toList();
        job.replaceApplications(next);
        job.setProfessional(professional);
        job.transitionTo(LifecycleState.CHAT_OPEN);
        job.linkConversation(conversation.getId());

        Job saved = persist(job);
        log.info("Job {} accepted application {} from professional {}", jobId, applicationId, professional.getId());

        notifyUser(professional.getUser().getId(), NotificationType.JOB_ACCEPTED, Priority.HIGH,
                "Application accepted",
                "Your application for \"" + saved.getTitle() + "\" was accepted",
                saved);
        notifyRejected(saved, applicationId);
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    // ---------------------------------------------------------------------
    // Progress
    // ---------------------------------------------------------------------

    public JobDto acceptJobRequest(User actor, Long jobId) {
        Job job = requireJob(jobId);
        if (!job.isAssignedProfessional(actor.getId())) {
            throw new AuthorizationException("Only the assigned professional can accept this job");
        }
        LifecycleState from = job.getLifecycleState();
        if (from != LifecycleState.JOB_REQUESTED && from != LifecycleState.CHAT_OPEN) {
            throw new ValidationException("Job cannot be accepted while " + from);
        }
        job.transitionTo(LifecycleState.IN_PROGRESS);
        job.setStatus(JobStatus.IN_PROGRESS);

        Job saved = persist(job);
        log.info("Job {} moved {} -> IN_PROGRESS", jobId, from);

        notifyUser(saved.getClient().getId(), NotificationType.JOB_IN_PROGRESS, Priority.HIGH,
                "Job accepted",
                saved.getProfessional().getName() + " started \"" + saved.getTitle() + "\"",
                saved);
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    public JobDto proMarkCompleted(User actor, Long jobId) {
        Job job = requireJob(jobId);
        if (!job.isAssignedProfessional(actor.getId())) {
            throw new AuthorizationException("Only the assigned professional can mark this job completed");
        }
        if (job.getLifecycleState() != LifecycleState.IN_PROGRESS) {
            throw new ValidationException("Only a job in progress can be marked completed");
        }
        job.transitionTo(LifecycleState.COMPLETED_BY_PRO);

        Job saved = persist(job);
        log.info("Job {} marked completed by professional", jobId);

        notifyUser(saved.getClient().getId(), NotificationType.JOB_COMPLETED_BY_PRO, Priority.HIGH,
                "Job marked completed",
                saved.getProfessional().getName() + " marked \"" + saved.getTitle() + "\" as completed. Please confirm.",
                saved);
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    public JobDto confirmCompletion(User actor, Long jobId) {
        Job job = requireJob(jobId);
        if (!job.isClient(actor.getId())) {
            throw new AuthorizationException("Only the job's client can confirm completion");
        }
        if (job.getLifecycleState() != LifecycleState.COMPLETED_BY_PRO) {
            throw new ValidationException("The professional has not marked this job completed yet");
        }
        job.transitionTo(LifecycleState.CLOSED);
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(Instant.now());

        Job saved = persist(job);
        professionalRepository.incrementCompletedJobs(saved.getProfessional().getId());
        log.info("Job {} closed by client {}", jobId, actor.getId());

        notifyUser(saved.getProfessional().getUser().getId(), NotificationType.JOB_CLOSED, Priority.MEDIUM,
                "Job closed",
                actor.getName() + " confirmed \"" + saved.getTitle() + "\" as completed",
                saved);
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    /** Single completion endpoint: routes the caller onto the matching half of the two-step close. */
    public JobDto complete(User actor, Long jobId) {
        Job job = requireJob(jobId);
        if (job.isAssignedProfessional(actor.getId())) {
            return proMarkCompleted(actor, jobId);
        }
        if (job.isClient(actor.getId())) {
            return confirmCompletion(actor, jobId);
        }
        throw new AuthorizationException("Not a party to this job");
    }

    // ---------------------------------------------------------------------
    // Cancel / delete
    // ---------------------------------------------------------------------

    public JobDto cancel(User actor, Long jobId, String reason) {
        Job job = requireJob(jobId);
        boolean byClient = job.isClient(actor.getId());
        if (!byClient && !job.isAssignedProfessional(actor.getId())) {
            throw new AuthorizationException("Only the client or the assigned professional can cancel");
        }
        if (job.getLifecycleState().isTerminal()) {
            throw new ValidationException("Job is already " + job.getLifecycleState());
        }
        job.transitionTo(LifecycleState.CANCELLED);
        job.setStatus(JobStatus.CANCELLED);
        job.setCancelledAt(Instant.now());
        job.setCancellationReason(reason);

        Job saved = persist(job);
        log.info("Job {} cancelled by user {}", jobId, actor.getId());

        Long counterparty = byClient
                ? (saved.getProfessional() != null ? saved.getProfessional().getUser().getId() : null)
                : saved.getClient().getId();
        if (counterparty != null) {
            notifyUser(counterparty, NotificationType.JOB_CANCELLED, Priority.HIGH,
                    "Job cancelled",
                    "\"" + saved.getTitle() + "\" was cancelled" + (reason != null && !reason.isBlank() ? ": " + reason : ""),
                    saved);
        }
        publishUpdate(saved);
        return JobDto.from(saved);
    }

    public void delete(User actor, Long jobId) {
        Job job = requireJob(jobId);
        if (!job.isClient(actor.getId()) && !job.isAssignedProfessional(actor.getId())) {
            throw new AuthorizationException("Only the client or the assigned professional can delete");
        }
        if (job.getStatus() != JobStatus.CANCELLED) {
            throw new ValidationException("Only cancelled jobs can be deleted");
        }

        Long conversationId = job.getConversationId();
        if (conversationId != null) {
            conversationService.detachJob(conversationId, jobId);
        }
        jobRepository.delete(job);
        log.info("Job {} deleted by user {}", jobId, actor.getId());

        JobUpdatePayload payload = new JobUpdatePayload(conversationId, null);
        for (Channel channel : audience(job)) {
            publisher.publish(channel, new RealtimeEvent(RealtimeEvent.JOB_UPDATE, payload));
        }
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    public JobDto getJob(User actor, Long jobId) {
        Job job = requireJob(jobId);
        if (job.isClient(actor.getId()) || job.isAssignedProfessional(actor.getId())) {
            return JobDto.from(job);
        }
        boolean applicant = professionalRepository.findByUser_Id(actor.getId())
                .map(p -> job.hasApplicationFrom(p.getId()))
                .orElse(false);
        if (!applicant) {
            throw new AuthorizationException("You do not have access to this job");
        }
        return JobDto.from(job);
    }

    public PaginatedResponse<JobDto> myJobs(User client, JobStatus status, int page, int limit) {
        PageRequest pageable = PageRequests.of(page, limit);
        Page<Job> result = status == null
                ? jobRepository.findByClient_IdAndActiveTrueOrderByCreatedAtDesc(client.getId(), pageable)
                : jobRepository.findByClient_IdAndStatusAndActiveTrueOrderByCreatedAtDesc(client.getId(), status, pageable);
        return PaginatedResponse.of(result, JobDto::from);
    }

    /**
     * Open jobs for a professional: urgent first, then nearest (when coordinates are known and
     * {@code scope} is not {@code all}), then newest.
     */
    public PaginatedResponse<JobDto> feed(User actor, JobFeedQuery query, int page, int limit) {
        JobFeedQuery q = query != null ? query : JobFeedQuery.empty();
        Optional<Professional> profile = professionalRepository.findByUser_Id(actor.getId());

        Double originLat = q.lat() != null ? q.lat() : profile.map(Professional::getLatitude).orElse(null);
        Double originLng = q.lng() != null ? q.lng() : profile.map(Professional::getLongitude).orElse(null);
        boolean byDistance = q.wantsDistance() && originLat != null && originLng != null;

        List<Job> jobs = jobRepository.findFeed(
                actor.getId(),
                JobStatus.PENDING,
                EnumSet.of(LifecycleState.POSTED, LifecycleState.OFFER_PENDING),
                blank(q.category()),
                blank(q.city()),
                blank(q.state()),
                blank(q.q())
        );

        Map<Long, Double> distances = new HashMap<>();
        if (byDistance) {
            for (Job job : jobs) {
                if (job.getLocation() != null && job.getLocation().hasCoordinates()) {
                    distances.put(job.getId(), haversineKm(originLat, originLng,
                            job.getLocation().getLatitude(), job.getLocation().getLongitude()));
                }
            }
        }

        Comparator<Job> order = Comparator.comparing((Job j) -> j.getUrgency() == Urgency.URGENT ? 0 : 1);
        if (byDistance) {
            order = order.thenComparing(j -> distances.get(j.getId()), Comparator.nullsLast(Comparator.naturalOrder()));
        }
        order = order.thenComparing(Job::getCreatedAt, Comparator.reverseOrder());

        List<Job> filtered = jobs.stream()
                .filter(j -> q.urgency() == null || j.getUrgency() == q.urgency())
                .sorted(order)
                .toList();

        PageRequest pageable = PageRequests.of(page, limit);
        int from = (int) Math.min(pageable.getOffset(), filtered.size());
        int to = Math.min(from + pageable.getPageSize(), filtered.size());
        List<JobDto> items = filtered.subList(from, to).stream()
                .map(j -> JobDto.from(j, distances.get(j.getId())))
                .toList();

        return new PaginatedResponse<>(items, filtered.size(), pageable.getPageNumber() + 1, pageable.getPageSize());
    }

    static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Job buildJob(User client, CreateJobRequest request) {
        CreateJobRequest.BudgetInput budget = request.budget();
        if (budget == null || budget.min() == null || budget.max() == null) {
            throw new ValidationException("Budget min and max are required");
        }
        if (budget.min() < 0 || budget.max() < 0 || budget.min() > budget.max()) {
            throw new ValidationException("Budget must satisfy 0 <= min <= max");
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new ValidationException("Title is required");
        }

        Job job = new Job();
        job.setClient(client);
        job.setTitle(request.title().trim());
        job.setDescription(request.description());
        job.setCategory(request.category());
        job.setBudget(new Budget(budget.min(), budget.max()));
        CreateJobRequest.LocationInput loc = request.location();
        if (loc != null) {
            job.setLocation(new JobLocation(loc.address(), loc.city(), loc.state(), loc.lat(), loc.lng()));
        }
        job.setPreferredDate(request.preferredDate());
        job.setPreferredTime(request.preferredTime());
        job.setUrgency(request.urgency() != null ? request.urgency() : Urgency.REGULAR);
        job.setStatus(JobStatus.PENDING);
        job.setCreatedAt(Instant.now());
        return job;
    }

    private Job requireJob(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found"));
    }

    private Job persist(Job job) {
        job.setUpdatedAt(Instant.now());
        return jobRepository.save(job);
    }

    private void notifyUser(Long userId, NotificationType type, Priority priority, String title, String message, Job job) {
        NotificationData data = new NotificationData(
                job.getId(),
                job.getConversationId(),
                job.getProfessional() != null ? job.getProfessional().getId() : null,
                null
        );
        notificationService.notifySafely(userId, type, title, message, data, priority);
    }

    private void notifyRejected(Job job, String acceptedId) {
        List<Long> rejectedIds = job.getApplications().stream()
                .filter(a -> !a.getId().equals(acceptedId))
                .map(JobApplication::getProfessionalId)
                .toList();
        if (rejectedIds.isEmpty()) return;

        try {
            for (Professional p : professionalRepository.findAllById(rejectedIds)) {
                notifyUser(p.getUser().getId(), NotificationType.JOB_REJECTED, Priority.LOW,
                        "Application not selected",
                        "Another professional was chosen for \"" + job.getTitle() + "\"",
                        job);
            }
        } catch (RuntimeException ex) {
            log.warn("Could not notify rejected applicants of job {}: {}", job.getId(), ex.getMessage(), ex);
        }
    }

    private List<Channel> audience(Job job) {
        List<Channel> channels = new ArrayList<>();
        if (job.getConversationId() != null) {
            channels.add(new ConversationChannel(job.getConversationId()));
        }
        channels.add(new UserChannel(job.getClient().getId()));
        if (job.getProfessional() != null && job.getProfessional().getUser() != null) {
            channels.add(new UserChannel(job.getProfessional().getUser().getId()));
        }
        return channels;
    }

    private void publishUpdate(Job job) {
        RealtimeEvent event = new RealtimeEvent(RealtimeEvent.JOB_UPDATE, new JobUpdatePayload(job.getConversationId(), JobDto.from(job)));
        for (Channel channel : audience(job)) {
            publisher.publish(channel, event);
        }
    }

    private static String blank(String value) {
        return value == null ? "" : value.trim();
    }
}
