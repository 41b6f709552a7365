package org.example.keygen.worker;

// Thrown out of the listener so the queue redelivers the message
public class TransientProcessingException extends RuntimeException {

    private final String requestId;

    public TransientProcessingException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
