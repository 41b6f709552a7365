package org.example.keygen.crypto;

public class KeyGenerationException extends Exception {

    private final boolean retryable;

    public KeyGenerationException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * {@code true} for resource/provider faults worth another attempt,
     * {@code false} when the parameters themselves are rejected.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
