// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import java.util.Objects;

import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * {@code Option<T>}: tag 13 followed by the inner type.
 */
public record OptionType(CLType inner) implements CLType {

    public static final int TAG = 13;

    public OptionType {
        Objects.requireNonNull(inner, "inner type cannot be null");
    }

    @Override
    public int tag() {
        return TAG;
    }

    @Override
    public void writeTo(final ByteWriter out) {
        out.writeU8(TAG);
        inner.writeTo(out);
    }

    @Override
    public String typeName() {
        return "Option(" + inner.typeName() + ")";
    }
}
