package org.example.keygen.model;

public class IllegalStatusTransitionException extends IllegalStateException {

    private final JobStatus from;
    private final JobStatus to;

    public IllegalStatusTransitionException(JobStatus from, JobStatus to) {
        super("Illegal status transition " + from.wireName() + " -> " + to.wireName());
        this.from = from;
        this.to = to;
    }

    public JobStatus from() {
        return from;
    }

    public JobStatus to() {
        return to;
    }
}
