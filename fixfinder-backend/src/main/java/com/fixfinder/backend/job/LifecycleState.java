package com.fixfinder.backend.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Position of a job in the hiring workflow. Both hiring paths share one graph:
 *
 * <pre>
 * POSTED -> OFFER_PENDING -> CHAT_OPEN -> IN_PROGRESS -> COMPLETED_BY_PRO -> CLOSED
 * JOB_REQUESTED -> IN_PROGRESS
 * any non-terminal -> CANCELLED
 * </pre>
 */
public enum LifecycleState {
    POSTED,
    OFFER_PENDING,
    CHAT_OPEN,
    JOB_REQUESTED,
    IN_PROGRESS,
    COMPLETED_BY_PRO,
    CLOSED,
    CANCELLED;

    public boolean isTerminal() {
        return this == CLOSED || this == CANCELLED;
    }

    /** True when a job accepting applications is in this state. */
    public boolean isOpenForApplications() {
        return this == POSTED || this == OFFER_PENDING;
    }

    public Set<LifecycleState> successors() {
        return switch (this) {
            case POSTED -> EnumSet.of(OFFER_PENDING, CHAT_OPEN, JOB_REQUESTED, CANCELLED);
            case OFFER_PENDING -> EnumSet.of(CHAT_OPEN, CANCELLED);
            case CHAT_OPEN, JOB_REQUESTED -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED_BY_PRO, CANCELLED);
            case COMPLETED_BY_PRO -> EnumSet.of(CLOSED, CANCELLED);
            case CLOSED, CANCELLED -> EnumSet.noneOf(LifecycleState.class);
        };
    }

    public boolean canTransitionTo(LifecycleState target) {
        return target != null && successors().contains(target);
    }
}
