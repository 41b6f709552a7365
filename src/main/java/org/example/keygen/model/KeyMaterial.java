package org.example.keygen.model;

/**
 * Generated key pair in transport-safe text form.
 *
 * @param publicKeyB64     Base64 of the X.509 SubjectPublicKeyInfo DER encoding
 * @param privateKeyB64    Base64 of the PKCS#8 DER encoding
 * @param publicKeyOpenSsh OpenSSH {@code authorized_keys} line for the public key
 */
public record KeyMaterial(String publicKeyB64, String privateKeyB64, String publicKeyOpenSsh) {

    @Override
    public String toString() {
        // never print the private half
        return "KeyMaterial[publicKeyOpenSsh=" + publicKeyOpenSsh + "]";
    }
}
