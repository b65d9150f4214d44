// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import java.util.Objects;

import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * {@code Map<K,V>}: tag 17 followed by the key type, then the value type.
 */
public record MapType(CLType key, CLType value) implements CLType {

    public static final int TAG = 17;

    public MapType {
        Objects.requireNonNull(key, "key type cannot be null");
        Objects.requireNonNull(value, "value type cannot be null");
    }

    @Override
    public int tag() {
        return TAG;
    }

    @Override
    public void writeTo(final ByteWriter out) {
        out.writeU8(TAG);
        key.writeTo(out);
        value.writeTo(out);
    }

    @Override
    public String typeName() {
        return "Map(" + key.typeName() + "," + value.typeName() + ")";
    }
}
