// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

/**
 * Something that can approve a deploy: a local key pair, or an external signer such
 * as a hardware wallet or KMS.
 */
public interface Signer {

    /**
     * Returns the public key that verifies this signer's signatures.
     *
     * @return the tagged public key
     */
    PublicKey publicKey();

    /**
     * Signs a 32-byte deploy hash.
     * <p>
     * Implementations apply the algorithm's own procedure: Ed25519 signs the bytes as
     * given, secp256k1 signs their SHA-256 digest.
     *
     * @param deployHash the 32-byte deploy hash
     * @return the signature, tagged with this signer's algorithm
     */
    Signature sign(byte[] deployHash);
}
