package org.example.keygen.model;

// Client input (or a forged/stale queue message) names an unsupported key type/size
public class InvalidKeySpecRequestException extends RuntimeException {

    public InvalidKeySpecRequestException(String message) {
        super(message);
    }
}
