// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.cask.core.crypto.PublicKey;
import sh.cask.core.error.EncodingException;
import sh.cask.core.types.AccountHash;
import sh.cask.primitives.bytesrepr.BytesReprNumeric;

class CLValuesTest {

    @Test
    void someSevenAsU64() {
        CLValue value = CLValues.optionSome(CLValues.u64(7));

        assertArrayEquals(new byte[] {1, 7, 0, 0, 0, 0, 0, 0, 0}, value.bytes());
        assertEquals(CLType.option(SimpleType.U64), value.type());
        assertEquals(7L, value.parsed());
    }

    @Test
    void noneHasNoPayload() {
        CLValue value = CLValues.optionNone(SimpleType.U64);

        assertArrayEquals(new byte[] {0}, value.bytes());
        assertArrayEquals(new byte[] {13, 5}, value.type().toBytes());
        assertNull(value.parsed());
    }

    @Test
    void fixedWidthIntegersAreLittleEndian() {
        assertEquals("01", CLValues.bool(true).hex());
        assertEquals("00", CLValues.bool(false).hex());
        assertEquals("ffffffff", CLValues.i32(-1).hex());
        assertEquals("0100000000000000", CLValues.i64(1).hex());
        assertEquals("ff", CLValues.u8(255).hex());
        assertEquals("ffffffff", CLValues.u32(0xFFFF_FFFFL).hex());
        assertEquals("e803000000000000", CLValues.u64(1000).hex());
    }

    @Test
    void bigNumbersUseLengthPrefixedMagnitude() {
        assertEquals("0400f90295", CLValues.u512("2500000000").hex());
        assertEquals("0100", CLValues.u512(0).hex());
        assertEquals("020001", CLValues.u256(256).hex());
        assertEquals("0400e1f505", CLValues.u128(BigInteger.valueOf(100_000_000)).hex());
        assertEquals("2500000000", CLValues.u512("2500000000").parsed());
    }

    @Test
    void bigNumberDecodesBack() {
        BigInteger value = new BigInteger("123456789012345678901234567890");

        assertEquals(value, BytesReprNumeric.decodeUnsigned(CLValues.u512(value).bytes()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "-1", "12a", "1.5", " 1", "0x10"})
    void rejectsNonNumericBigNumbers(String input) {
        assertThrows(EncodingException.class, () -> CLValues.u512(input));
    }

    @Test
    void rejectsOverflow() {
        BigInteger twoTo128 = BigInteger.ONE.shiftLeft(128);

        assertThrows(EncodingException.class, () -> CLValues.u128(twoTo128));
        assertEquals(18, CLValues.u256(twoTo128).bytes().length);
        assertThrows(EncodingException.class, () -> CLValues.u512(BigInteger.ONE.shiftLeft(512)));
        assertThrows(EncodingException.class, () -> CLValues.u8(256));
        assertThrows(EncodingException.class, () -> CLValues.u32(-1));
        assertThrows(EncodingException.class, () -> CLValues.u64(-1));
        assertThrows(EncodingException.class, () -> CLValues.u128(-5));
    }

    @Test
    void stringIsLengthPrefixedUtf8() {
        assertEquals("0500000068656c6c6f", CLValues.string("hello").hex());
    }

    @Test
    void unitIsEmpty() {
        assertEquals(0, CLValues.unit().bytes().length);
        assertEquals(SimpleType.UNIT, CLValues.unit().type());
    }

    @Test
    void publicKeyBytesAreTaggedKey() {
        String hex = "02" + "aa".repeat(33);

        CLValue value = CLValues.publicKey(hex);

        assertEquals(hex, value.hex());
        assertEquals(SimpleType.PUBLIC_KEY, value.type());
        assertEquals(CLValues.publicKey(PublicKey.fromHex(hex)), value);
    }

    @Test
    void keyIsVariantTagPlusRawBytes() {
        String hash = "11".repeat(32);

        CLValue account = CLValues.key("account", hash);
        CLValue contract = CLValues.key(KeyVariant.HASH, hash);

        assertEquals("00" + hash, account.hex());
        assertEquals("01" + hash, contract.hex());
        assertEquals("account-hash-" + hash, account.parsed());
        assertEquals("hash-" + hash, contract.parsed());
    }

    @Test
    void urefKeyCarriesAccessRights() {
        CLValue value = CLValues.key(KeyVariant.UREF, "22".repeat(32) + "07");

        assertEquals("02" + "22".repeat(32) + "07", value.hex());
        assertEquals("uref-" + "22".repeat(32) + "-007", value.parsed());
    }

    @Test
    void keyRejectsUnknownVariantAndWrongLength() {
        assertThrows(EncodingException.class, () -> CLValues.key("balance", "11".repeat(32)));
        assertThrows(EncodingException.class, () -> CLValues.key("hash", "11".repeat(31)));
        assertThrows(EncodingException.class, () -> CLValues.key("hash", "xyz"));
    }

    @Test
    void urefDefaultsToReadAddWrite() {
        CLValue value = CLValues.uref("33".repeat(32));

        assertEquals("33".repeat(32) + "07", value.hex());
        assertEquals("uref-" + "33".repeat(32) + "-007", value.parsed());
        assertEquals("33".repeat(32) + "01", CLValues.uref("33".repeat(32), 1).hex());
        assertThrows(EncodingException.class, () -> CLValues.uref("33".repeat(32), 8));
    }

    @Test
    void accountHashIsByteArray32WithPrefixStripped() {
        String hex = "ab".repeat(32);

        CLValue value = CLValues.accountHash("account-hash-" + hex);

        assertEquals(hex, value.hex());
        assertEquals(CLType.byteArray(32), value.type());
        assertEquals("account-hash-" + hex, value.parsed());
        assertEquals(value, CLValues.accountHash(AccountHash.parse(hex)));
    }

    @Test
    void byteArrayHasNoLengthPrefix() {
        CLValue value = CLValues.byteArray(new byte[] {1, 2, 3});

        assertEquals("010203", value.hex());
        assertEquals(CLType.byteArray(3), value.type());
    }

    @Test
    void listCountsThenConcatenates() {
        CLValue value = CLValues.list(SimpleType.U32, List.of(CLValues.u32(1), CLValues.u32(2)));

        assertEquals("02000000" + "01000000" + "02000000", value.hex());
        assertEquals(List.of(1L, 2L), value.parsed());
        assertThrows(EncodingException.class,
                () -> CLValues.list(SimpleType.U32, List.of(CLValues.u64(1))));
    }

    @Test
    void mapKeepsInsertionOrder() {
        Map<CLValue, CLValue> entries = new LinkedHashMap<>();
        entries.put(CLValues.string("b"), CLValues.u8(2));
        entries.put(CLValues.string("a"), CLValues.u8(1));

        CLValue value = CLValues.map(SimpleType.STRING, SimpleType.U8, entries);

        assertEquals("02000000" + "0100000062" + "02" + "0100000061" + "01", value.hex());
        assertArrayEquals(new byte[] {17, 10, 3}, value.type().toBytes());
        assertThrows(EncodingException.class,
                () -> CLValues.map(SimpleType.U8, SimpleType.U8, entries));
    }

    @Test
    void equalityIgnoresParsed() {
        CLValue a = new CLValue(SimpleType.U8, new byte[] {1}, "one");
        CLValue b = new CLValue(SimpleType.U8, new byte[] {1}, 1);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new CLValue(SimpleType.I32, new byte[] {1}, 1));
    }

    @Test
    void bytesAreDefensivelyCopied() {
        byte[] raw = {5};
        CLValue value = new CLValue(SimpleType.U8, raw, 5);
        raw[0] = 6;
        value.bytes()[0] = 7;

        assertEquals("05", value.hex());
    }
}
