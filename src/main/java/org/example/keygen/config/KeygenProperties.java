package org.example.keygen.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Deployment parameters of the pipeline ({@code keygen.*}). Validated at startup;
 * the application refuses to start with a missing or nonsensical value.
 */
@Validated
@ConfigurationProperties(prefix = "keygen")
public class KeygenProperties {

    @Valid
    private final Queue queue = new Queue();

    @Valid
    private final Store store = new Store();

    @Valid
    private final Submission submission = new Submission();

    @Valid
    private final Rsa rsa = new Rsa();

    public Queue getQueue() {
        return queue;
    }

    public Store getStore() {
        return store;
    }

    public Submission getSubmission() {
        return submission;
    }

    public Rsa getRsa() {
        return rsa;
    }

    public static class Queue {

        @NotBlank
        private String requestTopic = "keygen-requests";

        @NotBlank
        private String deadLetterTopic = "keygen-requests.DLT";

        @NotBlank
        private String consumerGroup = "keygen-workers";

        @Min(1)
        private int partitions = 3;

        // Lease on a pending record, and the consumer's max poll interval
        @NotNull
        private Duration visibilityTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration redeliveryBackoff = Duration.ofSeconds(2);

        @Min(1)
        private int maxDeliveryAttempts = 5;

        @NotNull
        private Duration publishTimeout = Duration.ofSeconds(10);

        public String getRequestTopic() {
            return requestTopic;
        }

        public void setRequestTopic(String requestTopic) {
            this.requestTopic = requestTopic;
        }

        public String getDeadLetterTopic() {
            return deadLetterTopic;
        }

        public void setDeadLetterTopic(String deadLetterTopic) {
            this.deadLetterTopic = deadLetterTopic;
        }

        public String getConsumerGroup() {
            return consumerGroup;
        }

        public void setConsumerGroup(String consumerGroup) {
            this.consumerGroup = consumerGroup;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public Duration getRedeliveryBackoff() {
            return redeliveryBackoff;
        }

        public void setRedeliveryBackoff(Duration redeliveryBackoff) {
            this.redeliveryBackoff = redeliveryBackoff;
        }

        public int getMaxDeliveryAttempts() {
            return maxDeliveryAttempts;
        }

        public void setMaxDeliveryAttempts(int maxDeliveryAttempts) {
            this.maxDeliveryAttempts = maxDeliveryAttempts;
        }

        public Duration getPublishTimeout() {
            return publishTimeout;
        }

        public void setPublishTimeout(Duration publishTimeout) {
            this.publishTimeout = publishTimeout;
        }
    }

    public static class Store {

        @NotNull
        private Duration ttl = Duration.ofHours(24);

        // Redis keys are <keyPrefix><request id>
        @NotBlank
        private String keyPrefix = "keygen:result:";

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Submission {

        @Min(1)
        private int maxIdAttempts = 3;

        public int getMaxIdAttempts() {
            return maxIdAttempts;
        }

        public void setMaxIdAttempts(int maxIdAttempts) {
            this.maxIdAttempts = maxIdAttempts;
        }
    }

    public static class Rsa {

        private int defaultBits = 2048;

        public int getDefaultBits() {
            return defaultBits;
        }

        public void setDefaultBits(int defaultBits) {
            this.defaultBits = defaultBits;
        }
    }
}
