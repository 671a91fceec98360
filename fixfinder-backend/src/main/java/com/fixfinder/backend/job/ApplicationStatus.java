package com.fixfinder.backend.job;

public enum ApplicationStatus {
    PENDING,
    ACCEPTED,
    REJECTED
}
