package org.example.keygen.deadletter;

import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.StoreQueryParameters;
import org.apache.kafka.streams.errors.InvalidStateStoreException;
import org.apache.kafka.streams.state.KeyValueIterator;
import org.apache.kafka.streams.state.QueryableStoreTypes;
import org.apache.kafka.streams.state.ReadOnlyKeyValueStore;
import org.springframework.kafka.config.StreamsBuilderFactoryBean;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Interactive queries against the local dead-letter store.
 */
@Service
public class DeadLetterQueryService {

    private final StreamsBuilderFactoryBean streamsBuilderFactoryBean;

    public DeadLetterQueryService(StreamsBuilderFactoryBean streamsBuilderFactoryBean) {
        this.streamsBuilderFactoryBean = streamsBuilderFactoryBean;
    }

    public List<DeadLetterEntry> listEntries() {
        List<DeadLetterEntry> entries = new ArrayList<>();
        try (KeyValueIterator<String, DeadLetterEntry> iterator = store().all()) {
            while (iterator.hasNext()) {
                KeyValue<String, DeadLetterEntry> entry = iterator.next();
                if (entry.value != null) {
                    entries.add(entry.value);
                }
            }
        } catch (InvalidStateStoreException e) {
            throw new DeadLetterMonitorUnavailableException("Dead-letter store is not queryable right now", e);
        }
        entries.sort(Comparator.comparingLong(DeadLetterEntry::deadLetteredAtMillis));
        return entries;
    }

    private ReadOnlyKeyValueStore<String, DeadLetterEntry> store() {
        KafkaStreams kafkaStreams = streamsBuilderFactoryBean.getKafkaStreams();
        if (kafkaStreams == null || kafkaStreams.state() != KafkaStreams.State.RUNNING) {
            throw new DeadLetterMonitorUnavailableException("Dead-letter monitor is not running", null);
        }
        return kafkaStreams.store(StoreQueryParameters.fromNameAndType(
                DeadLetterTopology.STATE_STORE_NAME, QueryableStoreTypes.keyValueStore()));
    }
}
