package org.example.keygen.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.example.keygen.model.JobStatus;
import org.example.keygen.model.KeyType;
import org.example.keygen.model.ResultRecord;

import java.time.Instant;

/**
 * Poll response. Key material appears only once the job is complete; the
 * processing lease is internal and never exposed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultResponse(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("key_type") KeyType keyType,
        @JsonProperty("key_bits") Integer keyBits,
        @JsonProperty("public_key_b64") String publicKeyB64,
        @JsonProperty("private_key_b64") String privateKeyB64,
        @JsonProperty("public_key_openssh") String publicKeyOpenSsh,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt
) {

    public static ResultResponse from(ResultRecord record) {
        boolean complete = record.status() == JobStatus.COMPLETE;
        return new ResultResponse(
                record.requestId(),
                record.status(),
                record.keyType(),
                record.keyBits(),
                complete ? record.publicKey() : null,
                complete ? record.privateKey() : null,
                complete ? record.publicKeyOpenSsh() : null,
                record.status() == JobStatus.ERROR ? record.errorMessage() : null,
                record.createdAt(),
                record.expiresAt());
    }
}
