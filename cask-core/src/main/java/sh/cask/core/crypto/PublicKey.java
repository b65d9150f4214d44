// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.cask.core.error.EncodingException;
import sh.cask.core.types.AccountHash;
import sh.cask.primitives.Hex;

/**
 * A public key tagged with its algorithm.
 *
 * <p>
 * The wire form is the tag byte followed by the raw key: 33 bytes for
 * {@link KeyAlgorithm#ED25519}, 34 bytes for {@link KeyAlgorithm#SECP256K1}. The hex
 * form is the same bytes, e.g. {@code 01d75a98...}.
 *
 * <p>
 * Construction checks the raw length only; whether the bytes decode to a curve point
 * is decided at verification time, where an invalid point yields {@code false}.
 *
 * @param algorithm the key algorithm
 * @param raw       raw key bytes, without the tag
 */
public record PublicKey(KeyAlgorithm algorithm, byte[] raw) {

    public PublicKey {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(raw, "raw cannot be null");
        if (raw.length != algorithm.publicKeyLength()) {
            throw new EncodingException(algorithm + " public key must be "
                    + algorithm.publicKeyLength() + " bytes, got " + raw.length);
        }
        raw = Arrays.copyOf(raw, raw.length);
    }

    public static PublicKey of(final KeyAlgorithm algorithm, final byte[] raw) {
        return new PublicKey(algorithm, raw);
    }

    /**
     * Parses a tagged public key from its bytes.
     *
     * @throws EncodingException if the tag is unknown or the length does not match it
     */
    public static PublicKey fromBytes(final byte[] tagged) {
        Objects.requireNonNull(tagged, "bytes cannot be null");
        if (tagged.length == 0) {
            throw new EncodingException("Public key bytes are empty");
        }
        return new PublicKey(KeyAlgorithm.fromTag(tagged[0]), Arrays.copyOfRange(tagged, 1, tagged.length));
    }

    /**
     * Parses a tagged public key from hex ({@code 01...} or {@code 02...}).
     *
     * @throws EncodingException if the hex is malformed or the key is invalid
     */
    public static PublicKey fromHex(final String hex) {
        Objects.requireNonNull(hex, "hex cannot be null");
        final byte[] tagged;
        try {
            tagged = Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Invalid public key hex: " + hex, e);
        }
        return fromBytes(tagged);
    }

    @Override
    public byte[] raw() {
        return Arrays.copyOf(raw, raw.length);
    }

    /** Tag byte followed by the raw key. */
    public byte[] toBytes() {
        final byte[] out = new byte[raw.length + 1];
        out[0] = (byte) algorithm.tag();
        System.arraycopy(raw, 0, out, 1, raw.length);
        return out;
    }

    public String toHex() {
        return Hex.encode(toBytes());
    }

    public AccountHash accountHash() {
        return AccountHash.fromPublicKey(algorithm, raw);
    }

    /**
     * Verifies {@code signature} over {@code message} with this key.
     *
     * @return false when the signature does not match, was produced by the other
     *         algorithm, or the key is not a valid curve point
     */
    public boolean verify(final byte[] message, final Signature signature) {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (signature.algorithm() != algorithm) {
            return false;
        }
        final byte[] sig = signature.bytes();
        switch (algorithm) {
            case ED25519:
                return Ed25519.verify(message, sig, raw);
            case SECP256K1:
                return Secp256k1.verify(message, sig, raw);
            default:
                return false;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof PublicKey other))
            return false;
        return algorithm == other.algorithm && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, Arrays.hashCode(raw));
    }

    @Override
    public String toString() {
        return toHex();
    }
}
