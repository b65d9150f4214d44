// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import java.security.SecureRandom;
import java.util.Objects;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import sh.cask.core.error.SigningException;

/**
 * Ed25519 (RFC 8032) over BouncyCastle's lightweight API.
 *
 * <p>
 * The message is passed to the signer as is. Ed25519 hashes internally, so callers
 * must not pre-hash the deploy hash.
 */
final class Ed25519 {

    static final int PRIVATE_KEY_SIZE = 32;

    private Ed25519() {
    }

    static byte[] generatePrivateKey(final SecureRandom random) {
        return new Ed25519PrivateKeyParameters(random).getEncoded();
    }

    static byte[] derivePublicKey(final byte[] privateKey) {
        return privateParameters(privateKey).generatePublicKey().getEncoded();
    }

    static byte[] sign(final byte[] message, final byte[] privateKey) {
        Objects.requireNonNull(message, "message cannot be null");
        final Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateParameters(privateKey));
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    /**
     * Returns false for any mismatch, including a public key that is not a valid
     * curve point.
     */
    static boolean verify(final byte[] message, final byte[] signature, final byte[] publicKey) {
        if (publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE
                || signature.length != Ed25519PrivateKeyParameters.SIGNATURE_SIZE) {
            return false;
        }
        final Ed25519PublicKeyParameters params;
        try {
            params = new Ed25519PublicKeyParameters(publicKey, 0);
        } catch (IllegalArgumentException e) {
            return false;
        }
        final Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, params);
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    private static Ed25519PrivateKeyParameters privateParameters(final byte[] privateKey) {
        Objects.requireNonNull(privateKey, "private key cannot be null");
        if (privateKey.length != PRIVATE_KEY_SIZE) {
            throw new SigningException(
                    "Ed25519 private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + privateKey.length);
        }
        return new Ed25519PrivateKeyParameters(privateKey, 0);
    }
}
