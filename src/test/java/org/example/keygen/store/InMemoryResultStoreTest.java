package org.example.keygen.store;

import org.example.keygen.MutableClock;
import org.example.keygen.model.ResultRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryResultStoreTest extends AbstractResultStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final InMemoryResultStore store = new InMemoryResultStore(clock);

    @Override
    protected ResultStore store() {
        return store;
    }

    @Override
    protected Instant now() {
        return clock.instant();
    }

    @Test
    void expiredRecordIsNotRetrievable() {
        store.createIfAbsent(submitted("a"));

        clock.advance(TTL.minusSeconds(1));
        assertThat(store.find("a")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.find("a")).isEmpty();
    }

    @Test
    void expiredRecordCannotBeUpdated() {
        ResultRecord original = submitted("a");
        store.createIfAbsent(original);
        clock.advance(TTL);

        assertThat(store.compareAndSet(original, original.claim("c1", clock.instant()))).isFalse();
    }

    @Test
    void expiredIdCanBeReused() {
        store.createIfAbsent(submitted("a"));
        clock.advance(TTL.plusSeconds(1));

        ResultRecord fresh = submitted("a");
        assertThat(store.createIfAbsent(fresh)).isTrue();
        assertThat(store.find("a")).contains(fresh);
    }
}
