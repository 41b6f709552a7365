package org.example.keygen.queue;

public class JobEnqueueException extends RuntimeException {

    private final String requestId;

    public JobEnqueueException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
