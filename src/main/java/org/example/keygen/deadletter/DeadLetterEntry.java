package org.example.keygen.deadletter;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.example.keygen.model.KeyType;

// Represents the value stored in the dead-letter state store
public record DeadLetterEntry(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("key_type") KeyType keyType,
        @JsonProperty("key_bits") Integer keyBits,
        @JsonProperty("reason") String reason,
        @JsonProperty("dead_lettered_at_millis") long deadLetteredAtMillis // wall clock when it arrived on the DLT
) {}
