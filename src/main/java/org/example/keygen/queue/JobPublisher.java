package org.example.keygen.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.keygen.config.KeygenProperties;
import org.example.keygen.model.JobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes jobs onto the request topic, keyed by request id, and waits for the
 * broker to acknowledge so the caller knows whether the job is durable.
 */
@Component
public class JobPublisher {

    private static final Logger logger = LoggerFactory.getLogger(JobPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Duration publishTimeout;

    public JobPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                        KeygenProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = properties.getQueue().getRequestTopic();
        this.publishTimeout = properties.getQueue().getPublishTimeout();
    }

    public void publish(JobRequest job) {
        String key = job.requestId();
        String messageValue;
        try {
            messageValue = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new JobEnqueueException(key, "Could not serialize job " + key, e);
        }

        logger.info("Sending job to topic [{}]: Key='{}', Value='{}'", topic, key, messageValue);
        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, messageValue)
                    .get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("Job {} stored at partition {} offset {}", key,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobEnqueueException(key, "Interrupted while enqueueing job " + key, e);
        } catch (ExecutionException e) {
            throw new JobEnqueueException(key, "Queue rejected job " + key, e.getCause());
        } catch (TimeoutException e) {
            throw new JobEnqueueException(key, "Queue did not acknowledge job " + key + " within " + publishTimeout, e);
        }
    }
}
