package org.example.keygen.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.kafka.DefaultKafkaConsumerFactoryCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.util.backoff.FixedBackOff;

import java.util.Map;

/**
 * Queue wiring: topics, redelivery policy and the dead-letter path.
 */
@Configuration
@EnableKafka
@EnableConfigurationProperties(KeygenProperties.class)
public class KafkaConfig {

    private static final Logger logger = LoggerFactory.getLogger(KafkaConfig.class);

    @Bean
    public NewTopic requestTopic(KeygenProperties properties) {
        return TopicBuilder.name(properties.getQueue().getRequestTopic())
                .partitions(properties.getQueue().getPartitions())
                .build();
    }

    @Bean
    public NewTopic deadLetterTopic(KeygenProperties properties) {
        return TopicBuilder.name(properties.getQueue().getDeadLetterTopic())
                .partitions(properties.getQueue().getPartitions())
                .build();
    }

    /**
     * A consumer that does not come back to poll within the visibility timeout
     * loses its partitions, and its unacknowledged record goes to another consumer.
     */
    @Bean
    public DefaultKafkaConsumerFactoryCustomizer visibilityTimeoutCustomizer(KeygenProperties properties) {
        long visibilityMillis = properties.getQueue().getVisibilityTimeout().toMillis();
        return consumerFactory -> consumerFactory.updateConfigs(
                Map.<String, Object>of(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, (int) Math.min(visibilityMillis, Integer.MAX_VALUE)));
    }

    @Bean
    public DeadLetterPublishingRecoverer deadLetterPublishingRecoverer(KafkaOperations<String, String> kafkaTemplate,
                                                                       KeygenProperties properties) {
        String deadLetterTopic = properties.getQueue().getDeadLetterTopic();
        // Same partition as the original, so the DLT needs at least as many partitions
        return new DeadLetterPublishingRecoverer(kafkaTemplate,
                (record, ex) -> new TopicPartition(deadLetterTopic, record.partition()));
    }

    /**
     * Redelivers a failed record up to {@code max-delivery-attempts} deliveries in
     * total, then diverts it to the dead-letter topic and moves on.
     */
    @Bean
    public DefaultErrorHandler kafkaErrorHandler(DeadLetterPublishingRecoverer recoverer, KeygenProperties properties) {
        KeygenProperties.Queue queue = properties.getQueue();
        FixedBackOff backOff = new FixedBackOff(queue.getRedeliveryBackoff().toMillis(), queue.getMaxDeliveryAttempts() - 1L);
        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer, backOff);
        handler.addNotRetryableExceptions(DeserializationException.class, MessageConversionException.class);
        handler.setRetryListeners((record, ex, deliveryAttempt) ->
                logger.warn("Delivery attempt {} of {} failed for request {}: {}",
                        deliveryAttempt, queue.getMaxDeliveryAttempts(), record.key(), ex.getMessage()));
        return handler;
    }
}
