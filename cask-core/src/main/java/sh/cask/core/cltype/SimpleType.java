// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * CLTypes without inner types. Each serializes as its tag byte alone.
 */
public enum SimpleType implements CLType {
    BOOL(0, "Bool"),
    I32(1, "I32"),
    I64(2, "I64"),
    U8(3, "U8"),
    U32(4, "U32"),
    U64(5, "U64"),
    U128(6, "U128"),
    U256(7, "U256"),
    U512(8, "U512"),
    UNIT(9, "Unit"),
    STRING(10, "String"),
    KEY(11, "Key"),
    UREF(12, "URef"),
    PUBLIC_KEY(22, "PublicKey");

    private final int tag;
    private final String typeName;

    SimpleType(final int tag, final String typeName) {
        this.tag = tag;
        this.typeName = typeName;
    }

    @Override
    public int tag() {
        return tag;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public void writeTo(final ByteWriter out) {
        out.writeU8(tag);
    }
}
