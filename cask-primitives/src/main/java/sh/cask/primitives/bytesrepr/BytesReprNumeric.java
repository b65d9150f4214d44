// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.primitives.bytesrepr;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Variable-length unsigned integer encoding used by {@code U128}, {@code U256} and
 * {@code U512}.
 *
 * <p>Layout: {@code [len][magnitude]} where {@code magnitude} is the little-endian
 * unsigned value with most-significant zero bytes removed, keeping at least one byte,
 * and {@code len} is the magnitude's byte count. Zero therefore encodes as
 * {@code [0x01, 0x00]}.
 *
 * @since 0.1.0
 */
public final class BytesReprNumeric {

    private BytesReprNumeric() {
        // Utility class
    }

    /**
     * Encodes a non-negative integer in the variable-length form.
     *
     * @param value    the value to encode
     * @param maxBytes maximum magnitude width (16, 32 or 64 for U128/U256/U512)
     * @return {@code [len][little-endian magnitude]}
     * @throws IllegalArgumentException if the value is negative or wider than {@code maxBytes}
     */
    public static byte[] encodeUnsigned(final BigInteger value, final int maxBytes) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("unsigned value cannot be negative: " + value);
        }
        if (maxBytes < 1 || maxBytes > 0xFF) {
            throw new IllegalArgumentException("maxBytes must be in range 1-255: " + maxBytes);
        }

        final int length = minimalByteSize(value);
        if (length > maxBytes) {
            throw new IllegalArgumentException(
                    "value " + value + " needs " + length + " bytes, maximum is " + maxBytes);
        }

        // BigInteger.toByteArray() is big-endian two's complement, possibly with a leading 0x00.
        final byte[] bigEndian = value.toByteArray();
        final byte[] result = new byte[1 + length];
        result[0] = (byte) length;
        for (int i = 0; i < length; i++) {
            result[1 + i] = bigEndian[bigEndian.length - 1 - i];
        }
        return result;
    }

    /**
     * Decodes {@code [len][little-endian magnitude]} back into a {@link BigInteger}.
     *
     * @param encoded the encoded bytes, exactly {@code 1 + len} long
     * @return the decoded non-negative value
     * @throws IllegalArgumentException if the length byte disagrees with the payload
     */
    public static BigInteger decodeUnsigned(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        if (encoded.length == 0) {
            throw new IllegalArgumentException("encoded value is empty");
        }
        final int length = encoded[0] & 0xFF;
        if (encoded.length != 1 + length) {
            throw new IllegalArgumentException(
                    "length byte " + length + " does not match payload of " + (encoded.length - 1) + " bytes");
        }
        final byte[] bigEndian = new byte[length];
        for (int i = 0; i < length; i++) {
            bigEndian[i] = encoded[length - i];
        }
        return new BigInteger(1, bigEndian);
    }

    private static int minimalByteSize(final BigInteger value) {
        if (value.signum() == 0) {
            return 1;
        }
        return (value.bitLength() + 7) >>> 3;
    }
}
