package org.example.keygen.submission;

import org.example.keygen.config.KeygenProperties;
import org.example.keygen.model.JobRequest;
import org.example.keygen.model.KeySpec;
import org.example.keygen.model.ResultRecord;
import org.example.keygen.queue.JobEnqueueException;
import org.example.keygen.queue.JobPublisher;
import org.example.keygen.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Accepts key-generation jobs: validate, create the {@code submitted} record, enqueue.
 *
 * <p>The record write and the queue publish are not atomic. If the publish fails the
 * record stays {@code submitted} until it expires and the failure is reported to the
 * caller, who may resubmit.
 */
@Service
public class SubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(SubmissionService.class);

    private final ResultStore resultStore;
    private final JobPublisher jobPublisher;
    private final RequestIdGenerator requestIdGenerator;
    private final KeygenProperties properties;
    private final Clock clock;

    public SubmissionService(ResultStore resultStore, JobPublisher jobPublisher,
                             RequestIdGenerator requestIdGenerator, KeygenProperties properties, Clock clock) {
        this.resultStore = resultStore;
        this.jobPublisher = jobPublisher;
        this.requestIdGenerator = requestIdGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    public SubmissionReceipt submit(String keyType, Integer keyBits) {
        // Fails fast with InvalidKeySpecRequestException, nothing written yet
        KeySpec spec = KeySpec.resolve(keyType, keyBits, properties.getRsa().getDefaultBits());

        ResultRecord record = createRecord(spec);
        try {
            jobPublisher.publish(JobRequest.of(record.requestId(), spec));
        } catch (JobEnqueueException e) {
            logger.error("Job {} recorded as submitted but could not be enqueued", record.requestId(), e);
            throw e;
        }

        logger.info("Submitted job {} ({}{})", record.requestId(), spec.keyType().wireName(),
                spec.keyBits() == null ? "" : "-" + spec.keyBits());
        return new SubmissionReceipt(record.requestId(), record.status());
    }

    private ResultRecord createRecord(KeySpec spec) {
        int maxAttempts = properties.getSubmission().getMaxIdAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Instant now = clock.instant();
            ResultRecord record = ResultRecord.submitted(requestIdGenerator.next(), spec, now,
                    properties.getStore().getTtl());
            if (resultStore.createIfAbsent(record)) {
                return record;
            }
            logger.warn("Request id {} already in use, generating another (attempt {} of {})",
                    record.requestId(), attempt, maxAttempts);
        }
        throw new RequestIdExhaustedException(maxAttempts);
    }
}
