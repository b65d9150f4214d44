// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * Type descriptor of a {@link CLValue}.
 *
 * <p>
 * Simple types serialize as a single tag byte. Composite types write their tag
 * followed by their inner types, recursively:
 *
 * <pre>
 * Option&lt;T&gt;     13 ++ T
 * List&lt;T&gt;       14 ++ T
 * ByteArray(n)  15 ++ u32 n
 * Map&lt;K,V&gt;      17 ++ K ++ V
 * </pre>
 *
 * The descriptor is self-delimiting, so it is written without a length prefix.
 */
public sealed interface CLType permits SimpleType, OptionType, ListType, ByteArrayType, MapType {

    int tag();

    /** Appends this descriptor's bytes to {@code out}. */
    void writeTo(ByteWriter out);

    /** Human-readable name, e.g. {@code Option(U64)}. */
    String typeName();

    default byte[] toBytes() {
        final ByteWriter out = new ByteWriter(8);
        writeTo(out);
        return out.toByteArray();
    }

    static CLType option(final CLType inner) {
        return new OptionType(inner);
    }

    static CLType list(final CLType element) {
        return new ListType(element);
    }

    static CLType byteArray(final int length) {
        return new ByteArrayType(length);
    }

    static CLType map(final CLType key, final CLType value) {
        return new MapType(key, value);
    }
}
