package org.example.keygen.submission;

import org.springframework.stereotype.Component;

import java.util.UUID;

// Random (type 4) UUIDs: 122 random bits from a SecureRandom
@Component
public class RequestIdGenerator {

    public String next() {
        return UUID.randomUUID().toString();
    }
}
