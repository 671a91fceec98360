package com.fixfinder.backend.job;

import com.fixfinder.backend.auth.CustomUserDetails;
import com.fixfinder.backend.job.dto.*;
import com.fixfinder.backend.shared.PaginatedResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @PostMapping
    public ResponseEntity<JobDto> create(
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody CreateJobRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.create(principal.getUser(), request));
    }

    @GetMapping("/my-jobs")
    public PaginatedResponse<JobDto> myJobs(
            @AuthenticationPrincipal CustomUserDetails principal,
            @RequestParam(required = false) JobStatus status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit
    ) {
        return jobService.myJobs(principal.getUser(), status, page, limit);
    }

    @GetMapping("/feed")
    public PaginatedResponse<JobDto> feed(
            @AuthenticationPrincipal CustomUserDetails principal,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) Urgency urgency,
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lng,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit
    ) {
        JobFeedQuery query = new JobFeedQuery(q, category, city, state, urgency, scope, lat, lng);
        return jobService.feed(principal.getUser(), query, page, limit);
    }

    @GetMapping("/{id}")
    public JobDto getJob(@PathVariable Long id, @AuthenticationPrincipal CustomUserDetails principal) {
        return jobService.getJob(principal.getUser(), id);
    }

    @PostMapping("/{id}/apply")
    public JobDto apply(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody(required = false) ApplyRequest request
    ) {
        return jobService.apply(principal.getUser(), id, request);
    }

    @PostMapping("/{id}/accept/{applicationId}")
    public JobDto acceptApplication(
            @PathVariable Long id,
            @PathVariable String applicationId,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return jobService.acceptApplication(principal.getUser(), id, applicationId);
    }

    @PostMapping("/chat/{conversationId}/request")
    public ResponseEntity<JobDto> requestInChat(
            @PathVariable Long conversationId,
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody CreateJobRequest request
    ) {
        JobDto created = jobService.createJobRequestInChat(principal.getUser(), conversationId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/{id}/accept-request")
    public JobDto acceptRequest(@PathVariable Long id, @AuthenticationPrincipal CustomUserDetails principal) {
        return jobService.acceptJobRequest(principal.getUser(), id);
    }

    @PostMapping("/{id}/complete-by-pro")
    public JobDto completeByPro(@PathVariable Long id, @AuthenticationPrincipal CustomUserDetails principal) {
        return jobService.proMarkCompleted(principal.getUser(), id);
    }

    @PostMapping("/{id}/confirm-completion")
    public JobDto confirmCompletion(@PathVariable Long id, @AuthenticationPrincipal CustomUserDetails principal) {
        return jobService.confirmCompletion(principal.getUser(), id);
    }

    @PostMapping("/{id}/complete")
    public JobDto complete(@PathVariable Long id, @AuthenticationPrincipal CustomUserDetails principal) {
        return jobService.complete(principal.getUser(), id);
    }

    @PostMapping("/{id}/cancel")
    public JobDto cancel(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody(required = false) CancelRequest request
    ) {
        return jobService.cancel(principal.getUser(), id, request != null ? request.reason() : null);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, @AuthenticationPrincipal CustomUserDetails principal) {
        jobService.delete(principal.getUser(), id);
        return ResponseEntity.noContent().build();
    }
}
