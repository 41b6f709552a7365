package org.example.keygen.crypto;

import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.util.OpenSSHPublicKeyUtil;
import org.junit.jupiter.api.Test;

import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenSshPublicKeyEncoderTest {

    @Test
    void rsaLineDecodesToSameModulusAndExponent() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        RSAPublicKey publicKey = (RSAPublicKey) generator.generateKeyPair().getPublic();

        String line = OpenSshPublicKeyEncoder.encode(publicKey);

        assertThat(line).startsWith("ssh-rsa ");
        AsymmetricKeyParameter parsed = decode(line);
        assertThat(parsed).isInstanceOf(RSAKeyParameters.class);
        assertThat(((RSAKeyParameters) parsed).getModulus()).isEqualTo(publicKey.getModulus());
        assertThat(((RSAKeyParameters) parsed).getExponent()).isEqualTo(publicKey.getPublicExponent());
    }

    @Test
    void ed25519LineCarriesTheRawPublicKey() throws Exception {
        PublicKey publicKey = KeyPairGenerator.getInstance("Ed25519").generateKeyPair().getPublic();

        String line = OpenSshPublicKeyEncoder.encode(publicKey);

        assertThat(line).startsWith("ssh-ed25519 ");
        AsymmetricKeyParameter parsed = decode(line);
        assertThat(parsed).isInstanceOf(Ed25519PublicKeyParameters.class);
        byte[] rawKey = ((Ed25519PublicKeyParameters) parsed).getEncoded();
        assertThat(rawKey).hasSize(Ed25519PublicKeyParameters.KEY_SIZE);
        assertThat(publicKey.getEncoded()).endsWith(rawKey);
    }

    @Test
    void otherAlgorithmsAreRejected() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(256);
        PublicKey publicKey = generator.generateKeyPair().getPublic();

        assertThatThrownBy(() -> OpenSshPublicKeyEncoder.encode(publicKey))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AsymmetricKeyParameter decode(String line) {
        String[] parts = line.split(" ");
        assertThat(parts).hasSize(2);
        return OpenSSHPublicKeyUtil.parsePublicKey(Base64.getDecoder().decode(parts[1]));
    }
}
