package org.example.keygen.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Queue payload for one key-generation job. Immutable once enqueued; the
 * message key carries the same {@code request_id}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRequest(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("key_type") KeyType keyType,
        @JsonProperty("key_bits") Integer keyBits
) {

    public static JobRequest of(String requestId, KeySpec spec) {
        return new JobRequest(requestId, spec.keyType(), spec.keyBits());
    }

    // Re-validates the parameters; throws InvalidKeySpecRequestException
    public KeySpec keySpec() {
        return new KeySpec(keyType, keyBits);
    }
}
