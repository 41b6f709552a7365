package org.example.keygen.deadletter;

import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.streams.StreamsBuilder;
import org.apache.kafka.streams.kstream.Consumed;
import org.apache.kafka.streams.kstream.KStream;
import org.apache.kafka.streams.state.Stores;
import org.example.keygen.config.KeygenProperties;
import org.example.keygen.model.JobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class DeadLetterTopology {

    public static final String STATE_STORE_NAME = "dead-lettered-jobs";
    public static final Duration PUNCTUATION_INTERVAL = Duration.ofMinutes(1);

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterTopology.class);

    private final Serde<String> stringSerde;
    private final Serde<JobRequest> jobRequestSerde;
    private final Serde<DeadLetterEntry> deadLetterEntrySerde;
    private final KeygenProperties properties;

    public DeadLetterTopology(Serde<String> stringSerde, Serde<JobRequest> jobRequestSerde,
                              Serde<DeadLetterEntry> deadLetterEntrySerde, KeygenProperties properties) {
        this.stringSerde = stringSerde;
        this.jobRequestSerde = jobRequestSerde;
        this.deadLetterEntrySerde = deadLetterEntrySerde;
        this.properties = properties;
    }

    @Bean
    public KStream<String, JobRequest> deadLetterStream(StreamsBuilder builder) {
        String deadLetterTopic = properties.getQueue().getDeadLetterTopic();
        Duration retention = properties.getStore().getTtl();
        logger.info("Building dead-letter monitoring topology on '{}'", deadLetterTopic);
        return build(builder, deadLetterTopic, retention, stringSerde, jobRequestSerde, deadLetterEntrySerde);
    }

    @SuppressWarnings("deprecation") // KStream#transform
    static KStream<String, JobRequest> build(StreamsBuilder builder, String deadLetterTopic, Duration retention,
                                             Serde<String> stringSerde, Serde<JobRequest> jobRequestSerde,
                                             Serde<DeadLetterEntry> deadLetterEntrySerde) {
        builder.addStateStore(Stores.keyValueStoreBuilder(
                Stores.persistentKeyValueStore(STATE_STORE_NAME),
                stringSerde,
                deadLetterEntrySerde
        ));

        KStream<String, JobRequest> deadLetters = builder.stream(
                deadLetterTopic,
                Consumed.with(stringSerde, jobRequestSerde)
        );

        // Everything happens in the store; nothing is forwarded downstream
        deadLetters.transform(
                () -> new DeadLetterTransformer(STATE_STORE_NAME, retention, PUNCTUATION_INTERVAL),
                STATE_STORE_NAME
        );
        return deadLetters;
    }
}
