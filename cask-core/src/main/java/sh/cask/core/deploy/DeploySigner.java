// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.util.Arrays;
import java.util.Objects;

import sh.cask.core.DebugLogger;
import sh.cask.core.LogFormatter;
import sh.cask.core.crypto.KeyAlgorithm;
import sh.cask.core.crypto.PublicKey;
import sh.cask.core.crypto.Signature;
import sh.cask.core.crypto.Signer;
import sh.cask.core.error.EncodingException;
import sh.cask.core.types.Hash;
import sh.cask.primitives.Hex;

/**
 * Signs deploy hashes and verifies approvals.
 *
 * <p>
 * Signing errors (destroyed or malformed keys) propagate. Verification never throws
 * for a mismatch: a wrong key, a flipped bit or an algorithm mix-up returns
 * {@code false}. Only malformed hex input raises {@link EncodingException}.
 *
 * <h2>Multisig</h2>
 *
 * <pre>{@code
 * Deploy signed = DeploySigner.signDeploy(deploy, alice);
 * signed = DeploySigner.signDeploy(signed, bob);
 * assert signed.approvals().size() == 2;
 * assert DeploySigner.verifyApprovals(signed);
 * }</pre>
 */
public final class DeploySigner {

    private static final String ED25519_PREFIX = "01";

    private DeploySigner() {
    }

    public static Signature sign(final Hash deployHash, final Signer signer) {
        Objects.requireNonNull(deployHash, "deploy hash cannot be null");
        Objects.requireNonNull(signer, "signer cannot be null");
        return signer.sign(deployHash.toBytes());
    }

    public static boolean verify(final Hash deployHash, final Signature signature, final PublicKey publicKey) {
        Objects.requireNonNull(deployHash, "deploy hash cannot be null");
        Objects.requireNonNull(publicKey, "public key cannot be null");
        return publicKey.verify(deployHash.toBytes(), signature);
    }

    /**
     * Verifies hex-encoded inputs as exchanged with other tools.
     *
     * <p>
     * The algorithm is taken from the public key prefix: {@code 01} selects Ed25519,
     * anything else secp256k1. The leading tag byte of the signature is stripped
     * regardless of its value. A prefix that selects the wrong algorithm, or lengths
     * that do not fit it, return {@code false}.
     *
     * @throws EncodingException if any argument is not valid hex, or the hash is not 32 bytes
     */
    public static boolean verify(final String deployHashHex, final String signatureHex, final String publicKeyHex) {
        final byte[] hash = decode(deployHashHex, "deploy hash");
        if (hash.length != Hash.BYTE_LENGTH) {
            throw new EncodingException("Deploy hash must be " + Hash.BYTE_LENGTH + " bytes, got " + hash.length);
        }
        final byte[] signature = decode(signatureHex, "signature");
        final byte[] publicKey = decode(publicKeyHex, "public key");
        if (signature.length != Signature.LENGTH + 1 || publicKey.length == 0) {
            return false;
        }

        final KeyAlgorithm algorithm = Hex.cleanPrefix(publicKeyHex).startsWith(ED25519_PREFIX)
                ? KeyAlgorithm.ED25519
                : KeyAlgorithm.SECP256K1;
        final byte[] raw = Arrays.copyOfRange(publicKey, 1, publicKey.length);
        if (raw.length != algorithm.publicKeyLength()) {
            return false;
        }
        final Signature sig = new Signature(algorithm, Arrays.copyOfRange(signature, 1, signature.length));
        return PublicKey.of(algorithm, raw).verify(hash, sig);
    }

    /**
     * Signs {@code deploy.hash} and returns a copy of the deploy with the approval appended.
     */
    public static Deploy signDeploy(final Deploy deploy, final Signer signer) {
        Objects.requireNonNull(deploy, "deploy cannot be null");
        final Signature signature = sign(deploy.hash(), signer);
        final Deploy signed = deploy.withApproval(new DeployApproval(signer.publicKey(), signature));
        DebugLogger.logSigning(LogFormatter.formatApproval(
                deploy.hash().value(), signer.publicKey().toHex(), signed.approvals().size()));
        return signed;
    }

    /**
     * @return true if every approval verifies against {@code deploy.hash}; vacuously true
     *         when there are none
     */
    public static boolean verifyApprovals(final Deploy deploy) {
        Objects.requireNonNull(deploy, "deploy cannot be null");
        for (DeployApproval approval : deploy.approvals()) {
            final boolean valid = verify(deploy.hash(), approval.signature(), approval.signer());
            DebugLogger.logSigning(LogFormatter.formatVerify(
                    deploy.hash().value(), approval.signer().toHex(), valid));
            if (!valid) {
                return false;
            }
        }
        return true;
    }

    private static byte[] decode(final String hex, final String what) {
        Objects.requireNonNull(hex, what + " cannot be null");
        try {
            return Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Invalid " + what + " hex: " + hex, e);
        }
    }
}
