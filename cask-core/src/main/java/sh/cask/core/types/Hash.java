// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.cask.primitives.Hex;

/**
 * Hex-encoded 32-byte Blake2b-256 digest.
 * <p>
 * Used for deploy hashes, body hashes and contract hashes.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Exactly 64 hex characters (32 bytes), no {@code 0x} prefix</li>
 * <li>Normalized to lowercase</li>
 * </ul>
 */
public record Hash(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
