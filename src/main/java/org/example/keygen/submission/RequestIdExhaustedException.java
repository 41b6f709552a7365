package org.example.keygen.submission;

// Every generated id collided with a live record; points at a broken id source
public class RequestIdExhaustedException extends RuntimeException {

    public RequestIdExhaustedException(int attempts) {
        super("No free request id after " + attempts + " attempts");
    }
}
