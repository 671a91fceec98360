package com.fixfinder.backend.job;

/** Coarse status shown in listings; {@link LifecycleState} carries the workflow position. */
public enum JobStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
