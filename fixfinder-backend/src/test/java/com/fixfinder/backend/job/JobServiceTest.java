package com.fixfinder.backend.job;

import com.fixfinder.backend.conversation.Conversation;
import com.fixfinder.backend.conversation.ConversationService;
import com.fixfinder.backend.conversation.Participant;
import com.fixfinder.backend.conversation.ParticipantRole;
import com.fixfinder.backend.job.dto.*;
import com.fixfinder.backend.notification.NotificationService;
import com.fixfinder.backend.notification.NotificationType;
import com.fixfinder.backend.professional.Professional;
import com.fixfinder.backend.professional.ProfessionalRepository;
import com.fixfinder.backend.realtime.BestEffortPublisher;
import com.fixfinder.backend.realtime.ConversationChannel;
import com.fixfinder.backend.realtime.RealtimeEvent;
import com.fixfinder.backend.realtime.RealtimePublisher;
import com.fixfinder.backend.shared.PaginatedResponse;
import com.fixfinder.backend.shared.error.AuthorizationException;
import com.fixfinder.backend.shared.error.ConflictException;
import com.fixfinder.backend.shared.error.NotFoundException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.Role;
import com.fixfinder.backend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class JobServiceTest {

    private JobRepository jobRepository;
    private ProfessionalRepository professionalRepository;
    private ConversationService conversationService;
    private NotificationService notificationService;
    private RealtimePublisher publisher;
    private JobService jobService;

    private User client;
    private User proUser;
    private User otherProUser;
    private Professional pro;
    private Professional otherPro;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        professionalRepository = mock(ProfessionalRepository.class);
        conversationService = mock(ConversationService.class);
        notificationService = mock(NotificationService.class);
        publisher = mock(RealtimePublisher.class);

        jobService = new JobService(jobRepository, professionalRepository, conversationService, notificationService, publisher);

        when(jobRepository.save(any(Job.class))).thenAnswer(inv -> {
            Job j = inv.getArgument(0);
            if (j.getId() == null) j.setId(100L);
            return j;
        });

        client = user(1L, Role.CLIENT, "Cleo Client");
        proUser = user(2L, Role.PROFESSIONAL, "Pat Plumber");
        otherProUser = user(3L, Role.PROFESSIONAL, "Olly Other");
        pro = professional(20L, proUser);
        otherPro = professional(30L, otherProUser);

        when(professionalRepository.findByUser_Id(2L)).thenReturn(Optional.of(pro));
        when(professionalRepository.findByUser_Id(3L)).thenReturn(Optional.of(otherPro));
        when(professionalRepository.findById(20L)).thenReturn(Optional.of(pro));
        when(professionalRepository.findById(30L)).thenReturn(Optional.of(otherPro));
    }

    // --- create ---------------------------------------------------------

    @Test
    void createPostsJobWithOnlyTitleAndBudget() {
        JobDto created = jobService.create(client, request("Fix sink", 5000, 10000));

        assertEquals(JobStatus.PENDING, created.status());
        assertEquals(LifecycleState.POSTED, created.lifecycleState());
        assertEquals(5000, created.budget().getMin());
        assertEquals(10000, created.budget().getMax());
        assertTrue(created.applications().isEmpty());
    }

    @Test
    void createRejectsNonClients() {
        assertThrows(AuthorizationException.class, () -> jobService.create(proUser, request("Fix sink", 1, 2)));
        verify(jobRepository, never()).save(any());
    }

    @Test
    void createRejectsInvertedBudget() {
        assertThrows(ValidationException.class, () -> jobService.create(client, request("Fix sink", 10, 5)));
    }

    // --- apply / accept -------------------------------------------------

    @Test
    void applyAppendsPendingApplicationAndNotifiesClient() {
        Job job = postedJob();
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        JobDto result = jobService.apply(proUser, 100L, new ApplyRequest("I can do it", 7000, "2h"));

        assertEquals(1, result.applications().size());
        ApplicationDto app = result.applications().get(0);
        assertEquals(ApplicationStatus.PENDING, app.status());
        assertEquals(20L, app.professionalId());
        assertEquals(LifecycleState.OFFER_PENDING, result.lifecycleState());
        verify(notificationService).notifySafely(eq(1L), eq(NotificationType.JOB_APPLICATION), anyString(), anyString(), any(), any());
    }

    @Test
    void applyingTwiceIsAConflict() {
        Job job = postedJob();
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));
        jobService.apply(proUser, 100L, null);

        assertThrows(ConflictException.class, () -> jobService.apply(proUser, 100L, null));
        assertEquals(1, job.getApplications().size());
    }

    @Test
    void applyWithoutProfessionalProfileIsForbidden() {
        when(professionalRepository.findByUser_Id(1L)).thenReturn(Optional.empty());
        assertThrows(AuthorizationException.class, () -> jobService.apply(client, 100L, null));
    }

    @Test
    void acceptApplicationLeavesExactlyOneAcceptedAndOpensChat() {
        Job job = postedJob();
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));
        jobService.apply(proUser, 100L, null);
        jobService.apply(otherProUser, 100L, null);
        String chosenId = job.getApplications().get(0).getId();

        Conversation conversation = conversation(77L, 1L, 2L);
        when(conversationService.findOrCreate(1L, ParticipantRole.CLIENT, 2L, ParticipantRole.PROFESSIONAL, 100L))
                .thenReturn(conversation);
        when(professionalRepository.findAllById(List.of(30L))).thenReturn(List.of(otherPro));

        JobDto result = jobService.acceptApplication(client, 100L, chosenId);

        assertEquals(LifecycleState.CHAT_OPEN, result.lifecycleState());
        assertEquals(JobStatus.PENDING, result.status());
        assertEquals(20L, result.professionalId());
        assertEquals(77L, result.conversationId());
        assertEquals(1, result.applications().stream().filter(a -> a.status() == ApplicationStatus.ACCEPTED).count());
        assertEquals(ApplicationStatus.REJECTED, result.applications().get(1).status());

        verify(notificationService).notifySafely(eq(2L), eq(NotificationType.JOB_ACCEPTED), anyString(), anyString(), any(), any());
        verify(notificationService).notifySafely(eq(3L), eq(NotificationType.JOB_REJECTED), anyString(), anyString(), any(), any());
        verify(publisher).publish(eq(new ConversationChannel(77L)), any(RealtimeEvent.class));
    }

    @Test
    void acceptApplicationByAnotherUserIsForbidden() {
        Job job = postedJob();
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));
        jobService.apply(proUser, 100L, null);
        String appId = job.getApplications().get(0).getId();

        assertThrows(AuthorizationException.class, () -> jobService.acceptApplication(otherProUser, 100L, appId));
    }

    @Test
    void acceptingUnknownApplicationIsNotFound() {
        when(jobRepository.findById(100L)).thenReturn(Optional.of(postedJob()));
        assertThrows(NotFoundException.class, () -> jobService.acceptApplication(client, 100L, "missing"));
    }

    // --- chat-originated jobs --------------------------------------------

    @Test
    void jobRequestInChatBindsConversationAndProfessional() {
        Conversation conversation = conversation(55L, 1L, 2L);
        when(conversationService.requireConversation(55L)).thenReturn(conversation);

        JobDto result = jobService.createJobRequestInChat(client, 55L, request("Paint fence", 100, 200));

        assertEquals(LifecycleState.JOB_REQUESTED, result.lifecycleState());
        assertEquals(55L, result.conversationId());
        assertEquals(20L, result.professionalId());
        verify(conversationService).attachJob(55L, 100L);
        verify(notificationService).notifySafely(eq(2L), eq(NotificationType.JOB_REQUESTED), anyString(), anyString(), any(), any());
    }

    @Test
    void jobRequestInChatNeedsProfessionalCounterpart() {
        Conversation conversation = conversation(55L, 1L, 2L);
        when(conversationService.requireConversation(55L)).thenReturn(conversation);
        when(professionalRepository.findByUser_Id(2L)).thenReturn(Optional.empty());

        assertThrows(ValidationException.class,
                () -> jobService.createJobRequestInChat(client, 55L, request("Paint fence", 100, 200)));
        verify(jobRepository, never()).save(any());
    }

    @Test
    void jobRequestInChatByOutsiderIsForbidden() {
        Conversation conversation = conversation(55L, 1L, 2L);
        when(conversationService.requireConversation(55L)).thenReturn(conversation);
        User stranger = user(9L, Role.CLIENT, "Stranger");

        assertThrows(AuthorizationException.class,
                () -> jobService.createJobRequestInChat(stranger, 55L, request("Paint fence", 100, 200)));
    }

    // --- progress ---------------------------------------------------------

    @Test
    void unassignedProfessionalCannotAcceptJobRequest() {
        Job job = requestedJob();
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        assertThrows(AuthorizationException.class, () -> jobService.acceptJobRequest(otherProUser, 100L));
        assertEquals(LifecycleState.JOB_REQUESTED, job.getLifecycleState());
        assertEquals(JobStatus.PENDING, job.getStatus());
        verify(jobRepository, never()).save(any());
    }

    @Test
    void assignedProfessionalAcceptsJobRequest() {
        when(jobRepository.findById(100L)).thenReturn(Optional.of(requestedJob()));

        JobDto result = jobService.acceptJobRequest(proUser, 100L);

        assertEquals(LifecycleState.IN_PROGRESS, result.lifecycleState());
        assertEquals(JobStatus.IN_PROGRESS, result.status());
        verify(notificationService).notifySafely(eq(1L), eq(NotificationType.JOB_IN_PROGRESS), anyString(), anyString(), any(), any());
    }

    @Test
    void confirmCompletionBeforeProfessionalMarksCompletedIsRejected() {
        Job job = requestedJob();
        job.transitionTo(LifecycleState.IN_PROGRESS);
        job.setStatus(JobStatus.IN_PROGRESS);
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        assertThrows(ValidationException.class, () -> jobService.confirmCompletion(client, 100L));
        assertEquals(LifecycleState.IN_PROGRESS, job.getLifecycleState());
        verify(professionalRepository, never()).incrementCompletedJobs(any());
    }

    @Test
    void twoStepCloseCompletesJobAndCountsIt() {
        Job job = requestedJob();
        job.transitionTo(LifecycleState.IN_PROGRESS);
        job.setStatus(JobStatus.IN_PROGRESS);
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        JobDto marked = jobService.proMarkCompleted(proUser, 100L);
        assertEquals(LifecycleState.COMPLETED_BY_PRO, marked.lifecycleState());
        assertEquals(JobStatus.IN_PROGRESS, marked.status());

        JobDto closed = jobService.confirmCompletion(client, 100L);
        assertEquals(LifecycleState.CLOSED, closed.lifecycleState());
        assertEquals(JobStatus.COMPLETED, closed.status());
        assertNotNull(closed.completedAt());
        verify(professionalRepository).incrementCompletedJobs(20L);
        verify(notificationService).notifySafely(eq(2L), eq(NotificationType.JOB_CLOSED), anyString(), anyString(), any(), any());
    }

    @Test
    void legacyCompleteRoutesByActor() {
        Job job = requestedJob();
        job.transitionTo(LifecycleState.IN_PROGRESS);
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        assertEquals(LifecycleState.COMPLETED_BY_PRO, jobService.complete(proUser, 100L).lifecycleState());
        assertEquals(LifecycleState.CLOSED, jobService.complete(client, 100L).lifecycleState());
        assertThrows(AuthorizationException.class, () -> jobService.complete(otherProUser, 100L));
    }

    // --- cancel / delete --------------------------------------------------

    @Test
    void cancelNotifiesCounterparty() {
        Job job = requestedJob();
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        JobDto result = jobService.cancel(client, 100L, "Changed my mind");

        assertEquals(LifecycleState.CANCELLED, result.lifecycleState());
        assertEquals(JobStatus.CANCELLED, result.status());
        assertEquals("Changed my mind", result.cancellationReason());
        verify(notificationService).notifySafely(eq(2L), eq(NotificationType.JOB_CANCELLED), anyString(), anyString(), any(), any());
    }

    @Test
    void terminalJobsRejectEveryTransition() {
        Job job = requestedJob();
        job.transitionTo(LifecycleState.CANCELLED);
        job.setStatus(JobStatus.CANCELLED);
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        assertThrows(ValidationException.class, () -> jobService.cancel(client, 100L, null));
        assertThrows(ValidationException.class, () -> jobService.acceptJobRequest(proUser, 100L));
        assertThrows(ValidationException.class, () -> jobService.proMarkCompleted(proUser, 100L));
        assertThrows(ValidationException.class, () -> jobService.confirmCompletion(client, 100L));
        verify(jobRepository, never()).save(any());
    }

    @Test
    void deleteRequiresCancelledJob() {
        when(jobRepository.findById(100L)).thenReturn(Optional.of(requestedJob()));
        assertThrows(ValidationException.class, () -> jobService.delete(client, 100L));
        verify(jobRepository, never()).delete(any());
    }

    @Test
    void deleteUnlinksConversationAndPushesEmptyJob() {
        Job job = requestedJob();
        job.transitionTo(LifecycleState.CANCELLED);
        job.setStatus(JobStatus.CANCELLED);
        when(jobRepository.findById(100L)).thenReturn(Optional.of(job));

        jobService.delete(client, 100L);

        verify(conversationService).detachJob(55L, 100L);
        verify(jobRepository).delete(job);
        ArgumentCaptor<RealtimeEvent> event = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(publisher).publish(eq(new ConversationChannel(55L)), event.capture());
        JobUpdatePayload payload = (JobUpdatePayload) event.getValue().data();
        assertEquals(55L, payload.conversationId());
        assertNull(payload.job());
    }

    // --- best effort --------------------------------------------------------

    @Test
    void failingPushDoesNotUndoTransition() {
        RealtimePublisher broken = mock(RealtimePublisher.class);
        doThrow(new IllegalStateException("socket gone")).when(broken).publish(any(), any());
        JobService service = new JobService(jobRepository, professionalRepository, conversationService,
                notificationService, new BestEffortPublisher(broken));
        when(jobRepository.findById(100L)).thenReturn(Optional.of(requestedJob()));

        JobDto result = service.acceptJobRequest(proUser, 100L);

        assertEquals(LifecycleState.IN_PROGRESS, result.lifecycleState());
        verify(jobRepository).save(any(Job.class));
    }

    // --- reads --------------------------------------------------------------

    @Test
    void getJobIsLimitedToParties() {
        when(jobRepository.findById(100L)).thenReturn(Optional.of(requestedJob()));
        when(professionalRepository.findByUser_Id(9L)).thenReturn(Optional.empty());

        assertNotNull(jobService.getJob(client, 100L));
        assertNotNull(jobService.getJob(proUser, 100L));
        assertThrows(AuthorizationException.class, () -> jobService.getJob(user(9L, Role.CLIENT, "Nosy"), 100L));
    }

    @Test
    void feedPutsUrgentFirstThenNearest() {
        pro.setLatitude(40.0);
        pro.setLongitude(-74.0);
        Job far = feedJob(1L, Urgency.REGULAR, 41.0, -74.0, Instant.parse("2024-01-03T00:00:00Z"));
        Job near = feedJob(2L, Urgency.REGULAR, 40.01, -74.0, Instant.parse("2024-01-01T00:00:00Z"));
        Job urgent = feedJob(3L, Urgency.URGENT, 45.0, -74.0, Instant.parse("2024-01-02T00:00:00Z"));
        when(jobRepository.findFeed(eq(2L), eq(JobStatus.PENDING), any(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(List.of(far, near, urgent));

        PaginatedResponse<JobDto> page = jobService.feed(proUser, JobFeedQuery.empty(), 1, 10);

        assertEquals(List.of(3L, 2L, 1L), page.getItems().stream().map(JobDto::id).toList());
        assertNotNull(page.getItems().get(1).distanceKm());
    }

    @Test
    void feedWithScopeAllIgnoresDistance() {
        pro.setLatitude(40.0);
        pro.setLongitude(-74.0);
        Job far = feedJob(1L, Urgency.REGULAR, 41.0, -74.0, Instant.parse("2024-01-03T00:00:00Z"));
        Job near = feedJob(2L, Urgency.REGULAR, 40.01, -74.0, Instant.parse("2024-01-01T00:00:00Z"));
        when(jobRepository.findFeed(anyLong(), any(), any(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(List.of(near, far));

        JobFeedQuery query = new JobFeedQuery(null, null, null, null, null, "all", null, null);
        PaginatedResponse<JobDto> page = jobService.feed(proUser, query, 1, 10);

        assertEquals(List.of(1L, 2L), page.getItems().stream().map(JobDto::id).toList());
    }

    @Test
    void haversineMatchesKnownDistance() {
        assertEquals(0.0, JobService.haversineKm(10, 10, 10, 10), 1e-9);
        assertEquals(111.19, JobService.haversineKm(0, 0, 0, 1), 0.01);
    }

    // --- fixtures -------------------------------------------------------------

    private static User user(long id, Role role, String name) {
        User u = new User();
        u.setId(id);
        u.setRole(role);
        u.setName(name);
        u.setEmail(name.replace(' ', '.').toLowerCase() + "@example.com");
        return u;
    }

    private static Professional professional(long id, User owner) {
        Professional p = new Professional();
        p.setId(id);
        p.setUser(owner);
        p.setName(owner.getName());
        p.setCategory("plumbing");
        return p;
    }

    private static CreateJobRequest request(String title, int min, int max) {
        return new CreateJobRequest(title, null, null, null, new CreateJobRequest.BudgetInput(min, max),
                null, null, null);
    }

    private static Conversation conversation(long id, long clientId, long proUserId) {
        Conversation c = Conversation.between(
                new Participant(clientId, ParticipantRole.CLIENT),
                new Participant(proUserId, ParticipantRole.PROFESSIONAL),
                null);
        c.setId(id);
        return c;
    }

    private Job postedJob() {
        Job job = new Job();
        job.setId(100L);
        job.setClient(client);
        job.setTitle("Fix sink");
        job.setBudget(new Budget(5000, 10000));
        return job;
    }

    private Job requestedJob() {
        Job job = postedJob();
        job.setProfessional(pro);
        job.transitionTo(LifecycleState.JOB_REQUESTED);
        job.linkConversation(55L);
        return job;
    }

    private Job feedJob(long id, Urgency urgency, double lat, double lng, Instant createdAt) {
        Job job = postedJob();
        job.setId(id);
        job.setUrgency(urgency);
        job.setLocation(new JobLocation(null, "Springfield", "NY", lat, lng));
        job.setCreatedAt(createdAt);
        return job;
    }
}
