package org.example.keygen.store;

import org.example.keygen.model.ResultRecord;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-JVM {@link ResultStore} for tests that need to steer expiry with a test
 * clock. Conditional writes map onto {@code putIfAbsent}/{@code replace(key, old, new)},
 * which compare records by value.
 */
public class InMemoryResultStore implements ResultStore {

    private final Map<String, ResultRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResultStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<ResultRecord> find(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        ResultRecord record = records.get(requestId);
        if (record == null) {
            return Optional.empty();
        }
        if (record.isExpired(clock.instant())) {
            records.remove(requestId, record);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public boolean createIfAbsent(ResultRecord record) {
        Objects.requireNonNull(record, "record");
        ResultRecord previous = records.putIfAbsent(record.requestId(), record);
        if (previous == null) {
            return true;
        }
        return previous.isExpired(clock.instant()) && records.replace(record.requestId(), previous, record);
    }

    @Override
    public boolean compareAndSet(ResultRecord expected, ResultRecord updated) {
        ResultStore.checkUpdate(expected, updated);
        if (expected.isExpired(clock.instant())) {
            return false;
        }
        return records.replace(expected.requestId(), expected, updated);
    }
}
