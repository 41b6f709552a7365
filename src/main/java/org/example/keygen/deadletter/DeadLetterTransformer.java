package org.example.keygen.deadletter;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.kstream.Transformer;
import org.apache.kafka.streams.processor.ProcessorContext;
import org.apache.kafka.streams.processor.PunctuationType;
import org.apache.kafka.streams.state.KeyValueIterator;
import org.apache.kafka.streams.state.KeyValueStore;
import org.example.keygen.model.JobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.support.KafkaHeaders;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Records every job that exhausted its deliveries in a state store, and purges
 * entries once they are older than the retention (the result record they refer
 * to is gone by then).
 */
public class DeadLetterTransformer implements Transformer<String, JobRequest, KeyValue<String, DeadLetterEntry>> {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterTransformer.class);

    private final String stateStoreName;
    private final Duration retention;
    private final Duration punctuationInterval;

    private ProcessorContext context;
    private KeyValueStore<String, DeadLetterEntry> stateStore;

    public DeadLetterTransformer(String stateStoreName, Duration retention, Duration punctuationInterval) {
        this.stateStoreName = stateStoreName;
        this.retention = retention;
        this.punctuationInterval = punctuationInterval;
    }

    @Override
    public void init(ProcessorContext context) {
        this.context = context;
        this.stateStore = context.getStateStore(stateStoreName);
        if (this.stateStore == null) {
            throw new IllegalStateException("State store [" + stateStoreName + "] not found.");
        }
        logger.info("Initializing DeadLetterTransformer for task {} with state store {}", context.taskId(), stateStoreName);

        context.schedule(punctuationInterval, PunctuationType.WALL_CLOCK_TIME, this::punctuate);
    }

    @Override
    public KeyValue<String, DeadLetterEntry> transform(String key, JobRequest value) {
        String requestId = key != null ? key : (value != null ? value.requestId() : null);
        if (requestId == null) {
            logger.error("Dead-lettered job without a request id at offset {}, cannot track it", context.offset());
            return null;
        }

        DeadLetterEntry entry = new DeadLetterEntry(
                requestId,
                value != null ? value.keyType() : null,
                value != null ? value.keyBits() : null,
                reason(),
                context.currentSystemTimeMs());
        stateStore.put(requestId, entry);

        // The result record stays pending; this is the operator's signal
        logger.error("Job {} dead-lettered after exhausting deliveries, record left pending. Reason: {}",
                requestId, entry.reason());
        return null;
    }

    private String reason() {
        Header header = context.headers().lastHeader(KafkaHeaders.DLT_EXCEPTION_MESSAGE);
        if (header == null || header.value() == null) {
            return "unknown";
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }

    private void punctuate(long currentTimestamp) {
        logger.trace("Dead-letter retention sweep at {}", Instant.ofEpochMilli(currentTimestamp));
        try (KeyValueIterator<String, DeadLetterEntry> iterator = stateStore.all()) {
            while (iterator.hasNext()) {
                KeyValue<String, DeadLetterEntry> entry = iterator.next();
                if (entry.value == null) {
                    continue;
                }
                if (currentTimestamp - entry.value.deadLetteredAtMillis() >= retention.toMillis()) {
                    logger.info("Dropping dead-letter entry for {} past retention", entry.key);
                    stateStore.delete(entry.key);
                }
            }
        }
    }

    @Override
    public void close() {
        logger.info("Closing DeadLetterTransformer for task {}", context != null ? context.taskId() : "N/A");
    }
}
