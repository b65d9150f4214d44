// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import java.util.Objects;

import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * {@code List<T>}: tag 14 followed by the element type.
 */
public record ListType(CLType element) implements CLType {

    public static final int TAG = 14;

    public ListType {
        Objects.requireNonNull(element, "element type cannot be null");
    }

    @Override
    public int tag() {
        return TAG;
    }

    @Override
    public void writeTo(final ByteWriter out) {
        out.writeU8(TAG);
        element.writeTo(out);
    }

    @Override
    public String typeName() {
        return "List(" + element.typeName() + ")";
    }
}
