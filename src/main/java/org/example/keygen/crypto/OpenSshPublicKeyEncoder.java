package org.example.keygen.crypto;

import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.util.OpenSSHPublicKeyUtil;
import org.bouncycastle.crypto.util.PublicKeyFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.PublicKey;
import java.util.Base64;

/**
 * Renders public keys as OpenSSH {@code authorized_keys} lines.
 */
public final class OpenSshPublicKeyEncoder {

    static final String SSH_RSA = "ssh-rsa";
    static final String SSH_ED25519 = "ssh-ed25519";

    private OpenSshPublicKeyEncoder() {
    }

    public static String encode(PublicKey publicKey) {
        try {
            AsymmetricKeyParameter keyParameter = PublicKeyFactory.createKey(publicKey.getEncoded());
            byte[] blob = OpenSSHPublicKeyUtil.encodePublicKey(keyParameter);
            return sshKeyType(keyParameter) + " " + Base64.getEncoder().encodeToString(blob);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot encode " + publicKey.getAlgorithm() + " public key for OpenSSH", e);
        }
    }

    private static String sshKeyType(AsymmetricKeyParameter keyParameter) {
        if (keyParameter instanceof RSAKeyParameters) {
            return SSH_RSA;
        }
        if (keyParameter instanceof Ed25519PublicKeyParameters) {
            return SSH_ED25519;
        }
        throw new IllegalArgumentException("Unsupported public key type " + keyParameter.getClass().getSimpleName());
    }
}
