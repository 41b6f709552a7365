package org.example.keygen.deadletter;

public class DeadLetterMonitorUnavailableException extends RuntimeException {

    public DeadLetterMonitorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
