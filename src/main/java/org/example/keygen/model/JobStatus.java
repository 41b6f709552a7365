package org.example.keygen.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a key-generation job. Status only moves forward:
 * {@code submitted -> pending -> complete|error}, with {@code submitted -> error}
 * allowed when a message fails validation before it is claimed.
 */
public enum JobStatus {
    SUBMITTED("submitted"),
    PENDING("pending"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case SUBMITTED -> next == PENDING || next == ERROR;
            case PENDING -> next == COMPLETE || next == ERROR;
            case COMPLETE, ERROR -> false;
        };
    }

    public void requireTransitionTo(JobStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(this, next);
        }
    }
}
