package org.example.keygen.model;

import java.util.Set;

/**
 * Validated key type/size pair. {@code keyBits} is always null for ed25519.
 */
public record KeySpec(KeyType keyType, Integer keyBits) {

    public static final Set<Integer> RSA_KEY_SIZES = Set.of(2048, 4096);

    public KeySpec {
        if (keyType == null) {
            throw new InvalidKeySpecRequestException("key_type is required");
        }
        if (keyType == KeyType.RSA) {
            if (keyBits == null || !RSA_KEY_SIZES.contains(keyBits)) {
                throw new InvalidKeySpecRequestException(
                        "key_bits must be one of 2048 or 4096 for rsa, got " + keyBits);
            }
        } else {
            keyBits = null; // ignored for fixed-size key types
        }
    }

    /**
     * Resolves raw client input, applying defaults: a missing key type means rsa,
     * a missing rsa size means {@code defaultRsaBits}.
     */
    public static KeySpec resolve(String rawKeyType, Integer rawKeyBits, int defaultRsaBits) {
        KeyType keyType;
        if (rawKeyType == null) {
            keyType = KeyType.RSA;
        } else {
            keyType = KeyType.find(rawKeyType)
                    .orElseThrow(() -> new InvalidKeySpecRequestException(
                            "key_type must be one of rsa or ed25519, got '" + rawKeyType + "'"));
        }
        Integer keyBits = rawKeyBits;
        if (keyType == KeyType.RSA && keyBits == null) {
            keyBits = defaultRsaBits;
        }
        return new KeySpec(keyType, keyBits);
    }
}
