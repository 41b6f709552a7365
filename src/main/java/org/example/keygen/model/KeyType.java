package org.example.keygen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum KeyType {
    RSA("rsa"),
    ED25519("ed25519");

    private final String wireName;

    KeyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    // Exact, case-sensitive match on the wire name
    public static Optional<KeyType> find(String value) {
        for (KeyType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    // An unknown value fails deserialization
    @JsonCreator
    public static KeyType fromWireName(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown key_type: " + value));
    }
}
