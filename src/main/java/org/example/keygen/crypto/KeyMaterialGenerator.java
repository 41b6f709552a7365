package org.example.keygen.crypto;

import org.example.keygen.model.KeyMaterial;
import org.example.keygen.model.KeySpec;

/**
 * Produces a fresh key pair for a validated {@link KeySpec}. Pure: no external state.
 */
public interface KeyMaterialGenerator {

    KeyMaterial generate(KeySpec spec) throws KeyGenerationException;
}
