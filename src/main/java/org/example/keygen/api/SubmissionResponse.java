package org.example.keygen.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.example.keygen.model.JobStatus;

public record SubmissionResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("status") JobStatus status
) {}
