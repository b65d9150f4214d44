// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.primitives.bytesrepr;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Growable little-endian buffer for Casper's bytesrepr serialization.
 *
 * <p>Conventions:
 * <ul>
 * <li>Fixed-width integers are written little-endian.</li>
 * <li>Variable-length payloads ({@code Bytes}, {@code String}, lists) carry a
 * {@code u32} little-endian length prefix.</li>
 * <li>Raw writes ({@link #writeRaw(byte[])}) add no framing; the reader must know
 * the width from context (hashes, public keys, {@code ByteArray(n)}).</li>
 * </ul>
 *
 * <p>Not thread-safe. Each serialization call should use its own writer.
 *
 * @since 0.1.0
 */
public final class ByteWriter {

    private static final int DEFAULT_CAPACITY = 128;

    private byte[] buffer;
    private int size;

    public ByteWriter() {
        this(DEFAULT_CAPACITY);
    }

    public ByteWriter(final int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity cannot be negative: " + initialCapacity);
        }
        this.buffer = new byte[Math.max(initialCapacity, 16)];
    }

    public ByteWriter writeU8(final int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("u8 out of range: " + value);
        }
        ensureCapacity(1);
        buffer[size++] = (byte) value;
        return this;
    }

    public ByteWriter writeBool(final boolean value) {
        return writeU8(value ? 1 : 0);
    }

    public ByteWriter writeI32(final int value) {
        ensureCapacity(4);
        for (int i = 0; i < 4; i++) {
            buffer[size++] = (byte) (value >>> (8 * i));
        }
        return this;
    }

    /**
     * Writes an unsigned 32-bit value.
     *
     * @param value value in the range {@code [0, 2^32)}
     * @return this writer
     * @throws IllegalArgumentException if the value does not fit in a u32
     */
    public ByteWriter writeU32(final long value) {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("u32 out of range: " + value);
        }
        return writeI32((int) value);
    }

    public ByteWriter writeI64(final long value) {
        ensureCapacity(8);
        for (int i = 0; i < 8; i++) {
            buffer[size++] = (byte) (value >>> (8 * i));
        }
        return this;
    }

    /**
     * Writes an unsigned 64-bit value. Negative Java longs are rejected, not
     * reinterpreted as values above {@code 2^63}.
     *
     * @param value non-negative value
     * @return this writer
     */
    public ByteWriter writeU64(final long value) {
        if (value < 0) {
            throw new IllegalArgumentException("u64 cannot be negative: " + value);
        }
        return writeI64(value);
    }

    public ByteWriter writeRaw(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
        return this;
    }

    /** Writes {@code [u32 length][bytes]}. */
    public ByteWriter writeBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        writeU32(bytes.length);
        return writeRaw(bytes);
    }

    /** Writes {@code [u32 length][utf8 bytes]}. */
    public ByteWriter writeString(final String value) {
        Objects.requireNonNull(value, "value cannot be null");
        return writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public int size() {
        return size;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(final int additional) {
        final int required = size + additional;
        if (required < 0) {
            throw new IllegalStateException("bytesrepr buffer overflow");
        }
        if (required > buffer.length) {
            int newCapacity = buffer.length << 1;
            if (newCapacity < required) {
                newCapacity = required;
            }
            buffer = Arrays.copyOf(buffer, newCapacity);
        }
    }
}
