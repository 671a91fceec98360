package com.fixfinder.backend.notification;

public enum NotificationType {
    JOB_APPLICATION,
    JOB_ACCEPTED,
    JOB_REJECTED,
    JOB_REQUESTED,
    JOB_IN_PROGRESS,
    JOB_COMPLETED_BY_PRO,
    JOB_COMPLETED,
    JOB_CLOSED,
    JOB_CANCELLED,
    NEW_MESSAGE,
    REVIEW_RECEIVED,
    PROFILE_VERIFIED,
    PAYMENT_RECEIVED,
    SYSTEM_ANNOUNCEMENT,
    REMINDER
}
