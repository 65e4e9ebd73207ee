package com.footage.platform.scheduler.entity;

/**
 * Lifecycle of a publish job. {@code FAILED} is transient: a failed dispatch is resolved to
 * {@code PENDING} (retry) or {@code ABANDONED} within the same tick.
 */
public enum PublishJobState {
    PENDING,
    DUE_NOT_YET_DISPATCHED,
    DISPATCHING,
    SUCCEEDED,
    FAILED,
    ABANDONED;

    public boolean canTransitionTo(PublishJobState next) {
        return switch (this) {
            case PENDING -> next == DUE_NOT_YET_DISPATCHED;
            case DUE_NOT_YET_DISPATCHED -> next == DISPATCHING;
            case DISPATCHING -> next == SUCCEEDED || next == FAILED;
            case FAILED -> next == PENDING || next == ABANDONED;
            case ABANDONED -> next == PENDING;
            case SUCCEEDED -> false;
        };
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ABANDONED;
    }
}
