package org.example.keygen.result;

// Unknown or expired request id; distinct from a job that ended in error
public class ResultNotFoundException extends RuntimeException {

    private final String requestId;

    public ResultNotFoundException(String requestId) {
        super("No result for request " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
