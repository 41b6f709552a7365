package org.example.keygen.api;

import com.fasterxml.jackson.annotation.JsonProperty;

// Both fields optional; defaults are applied during validation
public record KeygenRequest(
        @JsonProperty("key_type") String keyType,
        @JsonProperty("key_bits") Integer keyBits
) {}
