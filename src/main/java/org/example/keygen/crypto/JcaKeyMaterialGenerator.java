package org.example.keygen.crypto;

import org.example.keygen.model.KeyMaterial;
import org.example.keygen.model.KeySpec;
import org.example.keygen.model.KeyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.InvalidParameterException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates key pairs through the JCA providers of the running JDK.
 */
@Component
public class JcaKeyMaterialGenerator implements KeyMaterialGenerator {

    private static final Logger logger = LoggerFactory.getLogger(JcaKeyMaterialGenerator.class);

    private final SecureRandom secureRandom;

    public JcaKeyMaterialGenerator() {
        this(new SecureRandom());
    }

    public JcaKeyMaterialGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    @Override
    public KeyMaterial generate(KeySpec spec) throws KeyGenerationException {
        long started = System.nanoTime();
        KeyPair keyPair;
        try {
            keyPair = newKeyPairGenerator(spec).generateKeyPair();
        } catch (NoSuchAlgorithmException | InvalidParameterException e) {
            throw new KeyGenerationException("Unsupported key parameters " + describe(spec), false, e);
        } catch (ProviderException e) {
            throw new KeyGenerationException("Key provider failed for " + describe(spec), true, e);
        }
        logger.debug("Generated {} key pair in {} ms", describe(spec), (System.nanoTime() - started) / 1_000_000);

        Base64.Encoder encoder = Base64.getEncoder();
        return new KeyMaterial(
                encoder.encodeToString(keyPair.getPublic().getEncoded()),   // X.509 SubjectPublicKeyInfo
                encoder.encodeToString(keyPair.getPrivate().getEncoded()),  // PKCS#8
                OpenSshPublicKeyEncoder.encode(keyPair.getPublic()));
    }

    private KeyPairGenerator newKeyPairGenerator(KeySpec spec) throws NoSuchAlgorithmException {
        if (spec.keyType() == KeyType.RSA) {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(spec.keyBits(), secureRandom);
            return generator;
        }
        // Ed25519 has a fixed size; any requested bit size is ignored
        KeyPairGenerator generator = KeyPairGenerator.getInstance("Ed25519");
        generator.initialize(255, secureRandom);
        return generator;
    }

    private static String describe(KeySpec spec) {
        return spec.keyBits() == null ? spec.keyType().wireName() : spec.keyType().wireName() + "-" + spec.keyBits();
    }
}
