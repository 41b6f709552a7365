package org.example.keygen.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.keygen.config.KeygenProperties;
import org.example.keygen.crypto.KeyGenerationException;
import org.example.keygen.crypto.KeyMaterialGenerator;
import org.example.keygen.model.InvalidKeySpecRequestException;
import org.example.keygen.model.JobRequest;
import org.example.keygen.model.KeyMaterial;
import org.example.keygen.model.KeySpec;
import org.example.keygen.model.ResultRecord;
import org.example.keygen.store.ResultStore;
import org.example.keygen.store.ResultStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Drives one job through {@code submitted -> pending -> complete|error}.
 *
 * <p>Deliveries are at-least-once, so the same message may arrive several times,
 * concurrently on different consumers. Every write is a compare-and-set against the
 * record as last read: entering {@code pending} takes a lease, and the terminal write
 * only succeeds for the consumer still holding it. A delivery that loses any of these
 * races is a duplicate and is acknowledged without further work.
 */
@Component
public class JobProcessor {

    private static final Logger logger = LoggerFactory.getLogger(JobProcessor.class);

    private final ResultStore resultStore;
    private final KeyMaterialGenerator keyMaterialGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration leaseDuration;

    public JobProcessor(ResultStore resultStore, KeyMaterialGenerator keyMaterialGenerator,
                        ObjectMapper objectMapper, Clock clock, KeygenProperties properties) {
        this.resultStore = resultStore;
        this.keyMaterialGenerator = keyMaterialGenerator;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.leaseDuration = properties.getQueue().getVisibilityTimeout();
    }

    /**
     * @param messageKey request id the message was keyed by, may be null
     * @param payload    JSON {@link JobRequest}
     * @throws TransientProcessingException when the job should be retried
     * @throws ResultStoreException         when the store is unavailable
     */
    public ProcessingOutcome process(String messageKey, String payload) {
        JobRequest job = null;
        String rejection = null;
        if (payload == null) {
            rejection = "Empty job message";
        } else {
            try {
                job = objectMapper.readValue(payload, JobRequest.class);
                if (job == null) {
                    rejection = "Empty job message";
                }
            } catch (JsonProcessingException e) {
                rejection = "Malformed job message: " + e.getOriginalMessage();
            }
        }

        String requestId = messageKey != null ? messageKey : (job != null ? job.requestId() : null);
        if (requestId == null) {
            logger.warn("Dropping job message without a request id: {}", payload);
            return ProcessingOutcome.ORPHANED;
        }

        ResultRecord current = resultStore.find(requestId).orElse(null);
        if (current == null) {
            logger.warn("No live result record for request {}, dropping message", requestId);
            return ProcessingOutcome.ORPHANED;
        }
        Instant now = clock.instant();
        if (!current.isClaimable(now, leaseDuration)) {
            logger.info("Duplicate delivery for request {} (status {}), skipping", requestId, current.status().wireName());
            return ProcessingOutcome.DUPLICATE;
        }

        // Validate again: the message may be stale or forged
        KeySpec spec = null;
        if (rejection == null) {
            try {
                spec = validate(requestId, job, current);
            } catch (InvalidKeySpecRequestException e) {
                rejection = e.getMessage();
            }
        }
        if (rejection != null) {
            return recordFailure(current, rejection);
        }

        ResultRecord claimed = current.claim(UUID.randomUUID().toString(), now);
        if (!resultStore.compareAndSet(current, claimed)) {
            logger.info("Request {} was claimed concurrently, skipping", requestId);
            return ProcessingOutcome.DUPLICATE;
        }
        logger.info("Request {} {} -> pending (claim {})", requestId, current.status().wireName(), claimed.claimId());

        KeyMaterial material;
        try {
            material = keyMaterialGenerator.generate(spec);
        } catch (KeyGenerationException e) {
            if (!e.isRetryable()) {
                return recordFailure(claimed, e.getMessage());
            }
            releaseClaim(claimed);
            throw new TransientProcessingException(requestId, e.getMessage(), e);
        } catch (RuntimeException e) {
            releaseClaim(claimed);
            throw e;
        }

        if (resultStore.compareAndSet(claimed, claimed.complete(material))) {
            logger.info("Request {} pending -> complete", requestId);
            return ProcessingOutcome.COMPLETED;
        }
        logger.warn("Request {} lease {} was taken over before completion, discarding generated keys",
                requestId, claimed.claimId());
        return ProcessingOutcome.DUPLICATE;
    }

    private static KeySpec validate(String requestId, JobRequest job, ResultRecord record) {
        if (job.requestId() != null && !requestId.equals(job.requestId())) {
            throw new InvalidKeySpecRequestException("Message key " + requestId
                    + " does not match request_id " + job.requestId());
        }
        KeySpec spec = job.keySpec();
        if (spec.keyType() != record.keyType() || !Objects.equals(spec.keyBits(), record.keyBits())) {
            throw new InvalidKeySpecRequestException("Job parameters do not match the submitted request");
        }
        return spec;
    }

    private ProcessingOutcome recordFailure(ResultRecord expected, String message) {
        if (resultStore.compareAndSet(expected, expected.fail(message))) {
            logger.error("Request {} {} -> error: {}", expected.requestId(), expected.status().wireName(), message);
            return ProcessingOutcome.FAILED;
        }
        logger.info("Request {} changed concurrently, not recording failure", expected.requestId());
        return ProcessingOutcome.DUPLICATE;
    }

    // Lets the redelivered message re-claim at once instead of waiting out the lease
    private void releaseClaim(ResultRecord claimed) {
        try {
            if (resultStore.compareAndSet(claimed, claimed.releaseClaim())) {
                logger.warn("Released claim {} on request {} for redelivery", claimed.claimId(), claimed.requestId());
            }
        } catch (ResultStoreException e) {
            logger.warn("Could not release claim {} on request {}; it lapses after {}",
                    claimed.claimId(), claimed.requestId(), leaseDuration, e);
        }
    }
}
