package org.example.keygen.deadletter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.streams.StreamsBuilder;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.TestInputTopic;
import org.apache.kafka.streams.Topology;
import org.apache.kafka.streams.TopologyTestDriver;
import org.apache.kafka.streams.state.KeyValueStore;
import org.apache.kafka.streams.test.TestRecord;
import org.example.keygen.model.JobRequest;
import org.example.keygen.model.KeyType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.kafka.support.serializer.JsonSerde;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterTopologyTest {

    private static final String DEAD_LETTER_TOPIC = "keygen-requests.DLT";
    private static final Duration RETENTION = Duration.ofMinutes(10);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Serde<String> stringSerde = Serdes.String();
    private final Serde<JobRequest> requestSerde = new JsonSerde<>(JobRequest.class, objectMapper).noTypeInfo();
    private final Serde<DeadLetterEntry> entrySerde = new JsonSerde<>(DeadLetterEntry.class, objectMapper).noTypeInfo();

    private TopologyTestDriver testDriver;
    private TestInputTopic<String, JobRequest> deadLetterTopic;
    private KeyValueStore<String, DeadLetterEntry> stateStore;
    private Instant testStartTime;

    @BeforeEach
    void setUp() {
        StreamsBuilder builder = new StreamsBuilder();
        DeadLetterTopology.build(builder, DEAD_LETTER_TOPIC, RETENTION, stringSerde, requestSerde, entrySerde);
        Topology topology = builder.build();

        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG, "test-dead-letter-topology");
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, "dummy:9092");
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG, Serdes.StringSerde.class.getName());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG, Serdes.StringSerde.class.getName());

        testStartTime = Instant.parse("2026-08-01T00:00:00Z");
        testDriver = new TopologyTestDriver(topology, props, testStartTime);

        deadLetterTopic = testDriver.createInputTopic(DEAD_LETTER_TOPIC, stringSerde.serializer(), requestSerde.serializer());
        stateStore = testDriver.getKeyValueStore(DeadLetterTopology.STATE_STORE_NAME);
        assertThat(stateStore).isNotNull();
    }

    @AfterEach
    void tearDown() {
        if (testDriver != null) {
            testDriver.close();
        }
        requestSerde.close();
        entrySerde.close();
    }

    @Test
    void recordsDeadLetteredJobWithReason() {
        RecordHeaders headers = new RecordHeaders();
        headers.add(KafkaHeaders.DLT_EXCEPTION_MESSAGE, "entropy exhausted".getBytes(StandardCharsets.UTF_8));

        deadLetterTopic.pipeInput(new TestRecord<>("R1", new JobRequest("R1", KeyType.RSA, 4096), headers, testStartTime));

        DeadLetterEntry entry = stateStore.get("R1");
        assertThat(entry).isNotNull();
        assertThat(entry.requestId()).isEqualTo("R1");
        assertThat(entry.keyType()).isEqualTo(KeyType.RSA);
        assertThat(entry.keyBits()).isEqualTo(4096);
        assertThat(entry.reason()).isEqualTo("entropy exhausted");
        assertThat(entry.deadLetteredAtMillis()).isEqualTo(testStartTime.toEpochMilli());
    }

    @Test
    void missingReasonHeaderIsRecordedAsUnknown() {
        deadLetterTopic.pipeInput("R2", new JobRequest("R2", KeyType.ED25519, null), testStartTime);

        assertThat(stateStore.get("R2").reason()).isEqualTo("unknown");
    }

    @Test
    void redeadLetteringSameRequestKeepsOneEntry() {
        deadLetterTopic.pipeInput("R3", new JobRequest("R3", KeyType.ED25519, null), testStartTime);
        deadLetterTopic.pipeInput("R3", new JobRequest("R3", KeyType.ED25519, null), testStartTime);

        assertThat(stateStore.approximateNumEntries()).isEqualTo(1);
    }

    @Test
    void entriesArePurgedAfterRetention() {
        deadLetterTopic.pipeInput("R4", new JobRequest("R4", KeyType.ED25519, null), testStartTime);

        testDriver.advanceWallClockTime(RETENTION.minusMinutes(2));
        assertThat(stateStore.get("R4")).isNotNull();

        // past retention and at least one punctuation later
        testDriver.advanceWallClockTime(DeadLetterTopology.PUNCTUATION_INTERVAL.plusMinutes(2));
        assertThat(stateStore.get("R4")).isNull();
    }
}
