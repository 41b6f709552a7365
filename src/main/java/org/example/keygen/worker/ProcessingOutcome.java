package org.example.keygen.worker;

/**
 * What one delivery of a job message amounted to. Every outcome acknowledges the
 * message; only a thrown exception leads to redelivery.
 */
public enum ProcessingOutcome {
    /** Key material written, record is {@code complete}. */
    COMPLETED,
    /** Permanent failure written, record is {@code error}. */
    FAILED,
    /** Record already terminal or leased by another consumer; nothing done. */
    DUPLICATE,
    /** No live record for the message (never created, or expired). */
    ORPHANED
}
