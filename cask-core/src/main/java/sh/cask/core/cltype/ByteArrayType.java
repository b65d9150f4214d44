// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import sh.cask.core.error.EncodingException;
import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * {@code ByteArray(n)}: tag 15 followed by {@code n} as a little-endian u32. Values of
 * this type are the raw {@code n} bytes with no length prefix.
 */
public record ByteArrayType(int length) implements CLType {

    public static final int TAG = 15;

    public ByteArrayType {
        if (length < 0) {
            throw new EncodingException("ByteArray length cannot be negative: " + length);
        }
    }

    @Override
    public int tag() {
        return TAG;
    }

    @Override
    public void writeTo(final ByteWriter out) {
        out.writeU8(TAG);
        out.writeU32(length);
    }

    @Override
    public String typeName() {
        return "ByteArray(" + length + ")";
    }
}
