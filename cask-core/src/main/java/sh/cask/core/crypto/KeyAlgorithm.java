// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import sh.cask.core.error.EncodingException;

/**
 * Signature algorithms accepted by the network, identified on the wire by a one-byte
 * tag that prefixes every public key and signature.
 */
public enum KeyAlgorithm {

    /** Ed25519; 32-byte public key, signs the message directly. */
    ED25519(0x01, 32, "ed25519"),

    /** ECDSA over secp256k1; 33-byte compressed public key, signs SHA-256 of the message. */
    SECP256K1(0x02, 33, "secp256k1");

    private final int tag;
    private final int publicKeyLength;
    private final String algorithmName;

    KeyAlgorithm(final int tag, final int publicKeyLength, final String algorithmName) {
        this.tag = tag;
        this.publicKeyLength = publicKeyLength;
        this.algorithmName = algorithmName;
    }

    public int tag() {
        return tag;
    }

    /** Length of the raw public key, excluding the tag byte. */
    public int publicKeyLength() {
        return publicKeyLength;
    }

    /** Lowercase name mixed into account-hash derivation. */
    public String algorithmName() {
        return algorithmName;
    }

    /**
     * @throws EncodingException if no algorithm uses {@code tag}
     */
    public static KeyAlgorithm fromTag(final int tag) {
        for (KeyAlgorithm algorithm : values()) {
            if (algorithm.tag == tag) {
                return algorithm;
            }
        }
        throw new EncodingException("Unknown key algorithm tag: 0x" + Integer.toHexString(tag & 0xFF));
    }
}
