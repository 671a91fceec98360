package com.fixfinder.backend.job.dto;

/** Body of a {@code job:update} push; {@code job} is null once the job has been deleted. */
public record JobUpdatePayload(Long conversationId, JobDto job) {
}
