package com.keyforge.node.key;

/**
 * PEM-encoded signing keypair shared by every key-consuming node of the process.
 *
 * @param publicKey PEM-encoded public key
 * @param privateKey PEM-encoded private key
 */
public record KeypairMaterial(String publicKey, String privateKey) {

    public KeypairMaterial {
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("Public key cannot be null or blank");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("Private key cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "KeypairMaterial[publicKey=" + publicKey.length() + " chars, privateKey=<redacted>]";
    }
}
