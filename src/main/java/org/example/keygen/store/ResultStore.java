package org.example.keygen.store;

import org.example.keygen.model.ResultRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Keyed item store holding one {@link ResultRecord} per request id.
 *
 * <p>All writes are conditional. Each item carries its own expiry, enforced by the
 * backing engine: an expired item is never returned and never blocks a create.
 * Implementations throw {@link ResultStoreException} when the engine is unavailable.
 */
public interface ResultStore {

    Optional<ResultRecord> find(String requestId);

    /**
     * Stores {@code record} only if no live item exists under its request id.
     *
     * @return {@code false} when the id is already taken
     */
    boolean createIfAbsent(ResultRecord record);

    /**
     * Replaces {@code expected} with {@code updated} only if the stored item still
     * equals {@code expected}. Status changes must be legal transitions.
     *
     * @return {@code false} when the stored item changed (or expired) in the meantime
     */
    boolean compareAndSet(ResultRecord expected, ResultRecord updated);

    /**
     * Rejects an update that changes the request id or makes an illegal status move.
     */
    static void checkUpdate(ResultRecord expected, ResultRecord updated) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(updated, "updated");
        if (!expected.requestId().equals(updated.requestId())) {
            throw new IllegalArgumentException("Cannot move record " + expected.requestId()
                    + " to another request id " + updated.requestId());
        }
        if (expected.status() != updated.status()) {
            expected.status().requireTransitionTo(updated.status());
        }
    }
}
