package org.example.keygen.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The single source of truth for one job's state, keyed by {@code requestId}.
 *
 * <p>Instances are immutable; every mutation returns a new record and goes through
 * {@link JobStatus#requireTransitionTo(JobStatus)}. While {@code pending}, the record
 * carries the processing lease ({@code claimId}/{@code claimedAt}) of the consumer
 * currently working on it.
 */
public record ResultRecord(
        String requestId,
        JobStatus status,
        KeyType keyType,
        Integer keyBits,
        String publicKey,
        String privateKey,
        String publicKeyOpenSsh,
        String errorMessage,
        Instant createdAt,
        Instant expiresAt,
        String claimId,
        Instant claimedAt
) {

    public ResultRecord {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static ResultRecord submitted(String requestId, KeySpec spec, Instant now, Duration ttl) {
        return new ResultRecord(requestId, JobStatus.SUBMITTED, spec.keyType(), spec.keyBits(),
                null, null, null, null, now, now.plus(ttl), null, null);
    }

    /**
     * Takes the processing lease. From {@code submitted} this is the move into
     * {@code pending}; from {@code pending} it is a re-claim of a released or
     * expired lease and the status does not change.
     */
    public ResultRecord claim(String newClaimId, Instant now) {
        if (status != JobStatus.PENDING) {
            status.requireTransitionTo(JobStatus.PENDING);
        }
        return new ResultRecord(requestId, JobStatus.PENDING, keyType, keyBits,
                null, null, null, null, createdAt, expiresAt, newClaimId, now);
    }

    public ResultRecord releaseClaim() {
        if (status != JobStatus.PENDING) {
            throw new IllegalStatusTransitionException(status, JobStatus.PENDING);
        }
        return new ResultRecord(requestId, status, keyType, keyBits,
                null, null, null, null, createdAt, expiresAt, null, null);
    }

    public ResultRecord complete(KeyMaterial material) {
        status.requireTransitionTo(JobStatus.COMPLETE);
        return new ResultRecord(requestId, JobStatus.COMPLETE, keyType, keyBits,
                material.publicKeyB64(), material.privateKeyB64(), material.publicKeyOpenSsh(), null,
                createdAt, expiresAt, null, null);
    }

    public ResultRecord fail(String message) {
        status.requireTransitionTo(JobStatus.ERROR);
        return new ResultRecord(requestId, JobStatus.ERROR, keyType, keyBits,
                null, null, null, message, createdAt, expiresAt, null, null);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isClaimedBy(String someClaimId) {
        return claimId != null && claimId.equals(someClaimId);
    }

    /**
     * A record can be worked on when it was never claimed, or when it is pending
     * and its lease was released or has run past {@code leaseDuration}.
     */
    public boolean isClaimable(Instant now, Duration leaseDuration) {
        return switch (status) {
            case SUBMITTED -> true;
            case PENDING -> claimedAt == null || !now.isBefore(claimedAt.plus(leaseDuration));
            case COMPLETE, ERROR -> false;
        };
    }

    @Override
    public String toString() {
        return "ResultRecord[requestId=" + requestId + ", status=" + status.wireName()
                + ", keyType=" + keyType + ", keyBits=" + keyBits + ", claimId=" + claimId
                + ", createdAt=" + createdAt + ", expiresAt=" + expiresAt + "]";
    }
}
