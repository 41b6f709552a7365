package org.example.keygen.submission;

import org.example.keygen.model.JobStatus;

public record SubmissionReceipt(String requestId, JobStatus status) {
}
