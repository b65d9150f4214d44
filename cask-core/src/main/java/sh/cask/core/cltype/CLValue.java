// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.cask.primitives.Hex;

/**
 * An encoded argument value: its type descriptor, its wire bytes and a display-only
 * rendering.
 *
 * <p>
 * {@code parsed} is carried for JSON rendering only. It never reaches the wire and is
 * ignored by {@link #equals(Object)}. Build values with {@link CLValues}.
 *
 * @param type   the type descriptor
 * @param bytes  the encoded value
 * @param parsed display form (string, number, boolean, list or map), or null
 */
public record CLValue(CLType type, byte[] bytes, @Nullable Object parsed) {

    public CLValue {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(bytes, "bytes cannot be null");
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /** Encoded value bytes as lowercase hex. */
    public String hex() {
        return Hex.encode(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof CLValue other))
            return false;
        return type.equals(other.type) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, Arrays.hashCode(bytes));
    }

    @Override
    public String toString() {
        return "CLValue[" + type.typeName() + ", " + hex() + "]";
    }
}
