// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.cask.core.error.EncodingException;
import sh.cask.primitives.Hex;

/**
 * A 64-byte signature tagged with the algorithm that produced it.
 *
 * <p>
 * For {@link KeyAlgorithm#SECP256K1} the bytes are {@code r || s}, each a 32-byte
 * big-endian integer with {@code s} normalized to the lower half of the curve order.
 * The wire and JSON form is the tag byte followed by the 64 bytes.
 *
 * @param algorithm the signing algorithm
 * @param bytes     64 signature bytes, without the tag
 */
public record Signature(KeyAlgorithm algorithm, byte[] bytes) {

    public static final int LENGTH = 64;

    public Signature {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new EncodingException("Signature must be " + LENGTH + " bytes, got " + bytes.length);
        }
        bytes = Arrays.copyOf(bytes, LENGTH);
    }

    /**
     * Parses a tagged signature ({@code 01...} or {@code 02...}, 130 hex chars).
     *
     * @throws EncodingException if the hex is malformed, the tag is unknown or the length is wrong
     */
    public static Signature fromHex(final String hex) {
        Objects.requireNonNull(hex, "hex cannot be null");
        final byte[] tagged;
        try {
            tagged = Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Invalid signature hex: " + hex, e);
        }
        return fromBytes(tagged);
    }

    public static Signature fromBytes(final byte[] tagged) {
        Objects.requireNonNull(tagged, "bytes cannot be null");
        if (tagged.length != LENGTH + 1) {
            throw new EncodingException(
                    "Tagged signature must be " + (LENGTH + 1) + " bytes, got " + tagged.length);
        }
        return new Signature(KeyAlgorithm.fromTag(tagged[0]), Arrays.copyOfRange(tagged, 1, tagged.length));
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /** Tag byte followed by the 64 signature bytes. */
    public byte[] toBytes() {
        final byte[] out = new byte[LENGTH + 1];
        out[0] = (byte) algorithm.tag();
        System.arraycopy(bytes, 0, out, 1, LENGTH);
        return out;
    }

    public String toHex() {
        return Hex.encode(toBytes());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return algorithm == other.algorithm && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, Arrays.hashCode(bytes));
    }

    @Override
    public String toString() {
        return "Signature[" + toHex() + "]";
    }
}
