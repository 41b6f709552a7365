package org.example.keygen.store;

// Backing store unreachable or failing; callers treat it as transient
public class ResultStoreException extends RuntimeException {

    public ResultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
