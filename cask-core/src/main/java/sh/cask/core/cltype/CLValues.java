// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.cask.core.crypto.PublicKey;
import sh.cask.core.error.EncodingException;
import sh.cask.core.types.AccountHash;
import sh.cask.primitives.Hex;
import sh.cask.primitives.bytesrepr.ByteWriter;
import sh.cask.primitives.bytesrepr.BytesReprNumeric;

/**
 * Factories for {@link CLValue}s.
 *
 * <p>
 * Every factory validates its input against the declared type and fails with
 * {@link EncodingException} before producing any bytes.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CLValue amount = CLValues.u512("2500000000");      // 04 00f90295
 * CLValue id = CLValues.optionSome(CLValues.u64(7)); // 01 0700000000000000
 * CLValue none = CLValues.optionNone(SimpleType.U64);
 * }</pre>
 */
public final class CLValues {

    private static final long MAX_U32 = 0xFFFF_FFFFL;
    private static final int U128_BYTES = 16;
    private static final int U256_BYTES = 32;
    private static final int U512_BYTES = 64;
    private static final int UREF_ADDR_LENGTH = 32;

    /** READ | ADD | WRITE */
    public static final int ACCESS_READ_ADD_WRITE = 0x07;

    private CLValues() {
    }

    public static CLValue bool(final boolean value) {
        return new CLValue(SimpleType.BOOL, new byte[] {(byte) (value ? 1 : 0)}, value);
    }

    public static CLValue i32(final int value) {
        return new CLValue(SimpleType.I32, new ByteWriter(4).writeI32(value).toByteArray(), value);
    }

    public static CLValue i64(final long value) {
        return new CLValue(SimpleType.I64, new ByteWriter(8).writeI64(value).toByteArray(), value);
    }

    public static CLValue u8(final int value) {
        if (value < 0 || value > 0xFF) {
            throw new EncodingException("U8 out of range: " + value);
        }
        return new CLValue(SimpleType.U8, new byte[] {(byte) value}, value);
    }

    public static CLValue u32(final long value) {
        if (value < 0 || value > MAX_U32) {
            throw new EncodingException("U32 out of range: " + value);
        }
        return new CLValue(SimpleType.U32, new ByteWriter(4).writeU32(value).toByteArray(), value);
    }

    public static CLValue u64(final long value) {
        if (value < 0) {
            throw new EncodingException("U64 cannot be negative: " + value);
        }
        return new CLValue(SimpleType.U64, new ByteWriter(8).writeU64(value).toByteArray(), value);
    }

    public static CLValue u128(final BigInteger value) {
        return bigUnsigned(SimpleType.U128, value, U128_BYTES);
    }

    public static CLValue u128(final long value) {
        return u128(BigInteger.valueOf(value));
    }

    public static CLValue u128(final String decimal) {
        return u128(parseDecimal(SimpleType.U128, decimal));
    }

    public static CLValue u256(final BigInteger value) {
        return bigUnsigned(SimpleType.U256, value, U256_BYTES);
    }

    public static CLValue u256(final long value) {
        return u256(BigInteger.valueOf(value));
    }

    public static CLValue u256(final String decimal) {
        return u256(parseDecimal(SimpleType.U256, decimal));
    }

    public static CLValue u512(final BigInteger value) {
        return bigUnsigned(SimpleType.U512, value, U512_BYTES);
    }

    public static CLValue u512(final long value) {
        return u512(BigInteger.valueOf(value));
    }

    /**
     * @param decimal base-10 digits, e.g. motes as {@code "2500000000"}
     * @throws EncodingException if {@code decimal} is not a non-negative integer or
     *                           exceeds 512 bits
     */
    public static CLValue u512(final String decimal) {
        return u512(parseDecimal(SimpleType.U512, decimal));
    }

    public static CLValue string(final String value) {
        Objects.requireNonNull(value, "value cannot be null");
        return new CLValue(SimpleType.STRING, new ByteWriter().writeString(value).toByteArray(), value);
    }

    public static CLValue unit() {
        return new CLValue(SimpleType.UNIT, new byte[0], null);
    }

    /** The tagged key bytes, unmodified. */
    public static CLValue publicKey(final PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "public key cannot be null");
        return new CLValue(SimpleType.PUBLIC_KEY, publicKey.toBytes(), publicKey.toHex());
    }

    public static CLValue publicKey(final String publicKeyHex) {
        return publicKey(PublicKey.fromHex(publicKeyHex));
    }

    /**
     * {@code Key}: variant tag byte followed by the raw key bytes.
     *
     * @throws EncodingException if the hex is malformed or has the wrong length for the variant
     */
    public static CLValue key(final KeyVariant variant, final String keyHex) {
        Objects.requireNonNull(variant, "variant cannot be null");
        final byte[] raw = decodeHex(keyHex, "key");
        if (raw.length != variant.length()) {
            throw new EncodingException(
                    variant + " key must be " + variant.length() + " bytes, got " + raw.length);
        }
        final byte[] bytes = new ByteWriter(raw.length + 1).writeU8(variant.tag()).writeRaw(raw).toByteArray();
        final String parsed = variant == KeyVariant.UREF
                ? urefText(Arrays.copyOf(raw, UREF_ADDR_LENGTH), raw[UREF_ADDR_LENGTH] & 0xFF)
                : variant.prefix() + Hex.encode(raw);
        return new CLValue(SimpleType.KEY, bytes, parsed);
    }

    /**
     * @param variantName {@code account}, {@code hash} or {@code uref}, any case
     * @throws EncodingException for an unknown variant name
     */
    public static CLValue key(final String variantName, final String keyHex) {
        return key(KeyVariant.fromName(variantName), keyHex);
    }

    public static CLValue uref(final String addressHex) {
        return uref(addressHex, ACCESS_READ_ADD_WRITE);
    }

    /**
     * {@code URef}: 32-byte address followed by the access-rights byte.
     */
    public static CLValue uref(final String addressHex, final int accessRights) {
        final byte[] address = decodeHex(addressHex, "uref");
        if (address.length != UREF_ADDR_LENGTH) {
            throw new EncodingException("URef address must be " + UREF_ADDR_LENGTH + " bytes, got " + address.length);
        }
        if (accessRights < 0 || accessRights > ACCESS_READ_ADD_WRITE) {
            throw new EncodingException("Invalid access rights: " + accessRights);
        }
        final byte[] bytes = new ByteWriter(UREF_ADDR_LENGTH + 1).writeRaw(address).writeU8(accessRights).toByteArray();
        return new CLValue(SimpleType.UREF, bytes, urefText(address, accessRights));
    }

    /** Raw 32 bytes typed as {@code ByteArray(32)}. */
    public static CLValue accountHash(final AccountHash accountHash) {
        Objects.requireNonNull(accountHash, "account hash cannot be null");
        return new CLValue(CLType.byteArray(32), accountHash.toBytes(), accountHash.toText());
    }

    /**
     * @param text {@code account-hash-<hex>} or bare hex
     */
    public static CLValue accountHash(final String text) {
        return accountHash(AccountHash.parse(text));
    }

    public static CLValue byteArray(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new CLValue(CLType.byteArray(bytes.length), bytes, Hex.encode(bytes));
    }

    public static CLValue optionSome(final CLValue inner) {
        Objects.requireNonNull(inner, "inner cannot be null");
        final byte[] innerBytes = inner.bytes();
        final byte[] bytes = new ByteWriter(innerBytes.length + 1).writeU8(1).writeRaw(innerBytes).toByteArray();
        return new CLValue(CLType.option(inner.type()), bytes, inner.parsed());
    }

    public static CLValue optionNone(final CLType innerType) {
        return new CLValue(CLType.option(innerType), new byte[] {0}, null);
    }

    /**
     * {@code List<T>}: u32 count followed by each element's bytes.
     *
     * @throws EncodingException if an element's type differs from {@code elementType}
     */
    public static CLValue list(final CLType elementType, final List<CLValue> elements) {
        Objects.requireNonNull(elementType, "element type cannot be null");
        Objects.requireNonNull(elements, "elements cannot be null");
        final ByteWriter out = new ByteWriter().writeU32(elements.size());
        final List<Object> parsed = new ArrayList<>(elements.size());
        for (CLValue element : elements) {
            requireType(elementType, element, "list element");
            out.writeRaw(element.bytes());
            parsed.add(element.parsed());
        }
        return new CLValue(CLType.list(elementType), out.toByteArray(), parsed);
    }

    /**
     * {@code Map<K,V>}: u32 count followed by key bytes and value bytes per entry, in the
     * map's iteration order.
     *
     * @throws EncodingException if a key or value type differs from the declared type
     */
    public static CLValue map(final CLType keyType, final CLType valueType, final Map<CLValue, CLValue> entries) {
        Objects.requireNonNull(keyType, "key type cannot be null");
        Objects.requireNonNull(valueType, "value type cannot be null");
        Objects.requireNonNull(entries, "entries cannot be null");
        final ByteWriter out = new ByteWriter().writeU32(entries.size());
        final List<Object> parsed = new ArrayList<>(entries.size());
        for (Map.Entry<CLValue, CLValue> entry : entries.entrySet()) {
            requireType(keyType, entry.getKey(), "map key");
            requireType(valueType, entry.getValue(), "map value");
            out.writeRaw(entry.getKey().bytes());
            out.writeRaw(entry.getValue().bytes());
            final Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("key", entry.getKey().parsed());
            pair.put("value", entry.getValue().parsed());
            parsed.add(pair);
        }
        return new CLValue(CLType.map(keyType, valueType), out.toByteArray(), parsed);
    }

    private static CLValue bigUnsigned(final SimpleType type, final BigInteger value, final int maxBytes) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new EncodingException(type.typeName() + " cannot be negative: " + value);
        }
        if (value.bitLength() > maxBytes * 8) {
            throw new EncodingException(type.typeName() + " exceeds " + (maxBytes * 8) + " bits: " + value);
        }
        return new CLValue(type, BytesReprNumeric.encodeUnsigned(value, maxBytes), value.toString());
    }

    private static BigInteger parseDecimal(final SimpleType type, final String decimal) {
        Objects.requireNonNull(decimal, "value cannot be null");
        if (decimal.isEmpty() || !decimal.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new EncodingException(type.typeName() + " is not a non-negative integer: \"" + decimal + "\"");
        }
        return new BigInteger(decimal);
    }

    private static byte[] decodeHex(final String hex, final String what) {
        Objects.requireNonNull(hex, what + " hex cannot be null");
        try {
            return Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new EncodingException("Invalid " + what + " hex: " + hex, e);
        }
    }

    private static void requireType(final CLType expected, final CLValue value, final String what) {
        Objects.requireNonNull(value, what + " cannot be null");
        if (!expected.equals(value.type())) {
            throw new EncodingException(what + " has type " + value.type().typeName()
                    + ", expected " + expected.typeName());
        }
    }

    private static String urefText(final byte[] address, final int accessRights) {
        return String.format("uref-%s-%03x", Hex.encode(address), accessRights);
    }
}
