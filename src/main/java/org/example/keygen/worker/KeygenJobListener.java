package org.example.keygen.worker;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Queue consumer. Runs on every listener container thread
 * ({@code spring.kafka.listener.concurrency}); consumers share no state and
 * coordinate only through the result store.
 */
@Service
public class KeygenJobListener {

    private static final Logger logger = LoggerFactory.getLogger(KeygenJobListener.class);

    private final JobProcessor jobProcessor;

    public KeygenJobListener(JobProcessor jobProcessor) {
        this.jobProcessor = jobProcessor;
    }

    @KafkaListener(topics = "${keygen.queue.request-topic}", groupId = "${keygen.queue.consumer-group}")
    public void listen(ConsumerRecord<String, String> record) {
        logger.info("Received job on topic [{}] Partition [{}] Offset [{}]: Key='{}'",
                record.topic(),
                record.partition(),
                record.offset(),
                record.key());

        // Exceptions propagate to the container's error handler for redelivery
        ProcessingOutcome outcome = jobProcessor.process(record.key(), record.value());
        logger.debug("Job {} at offset {} finished as {}", record.key(), record.offset(), outcome);
    }
}
