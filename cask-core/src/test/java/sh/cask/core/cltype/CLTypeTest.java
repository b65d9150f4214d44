// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import sh.cask.core.error.EncodingException;

class CLTypeTest {

    @ParameterizedTest
    @CsvSource({
        "BOOL, 0", "I32, 1", "I64, 2", "U8, 3", "U32, 4", "U64, 5", "U128, 6", "U256, 7",
        "U512, 8", "UNIT, 9", "STRING, 10", "KEY, 11", "UREF, 12", "PUBLIC_KEY, 22"
    })
    void simpleTypesAreASingleTagByte(SimpleType type, int tag) {
        assertArrayEquals(new byte[] {(byte) tag}, type.toBytes());
        assertEquals(tag, type.tag());
    }

    @Test
    void optionOfU64() {
        assertArrayEquals(new byte[] {13, 5}, CLType.option(SimpleType.U64).toBytes());
        assertEquals("Option(U64)", CLType.option(SimpleType.U64).typeName());
    }

    @Test
    void listOfString() {
        assertArrayEquals(new byte[] {14, 10}, CLType.list(SimpleType.STRING).toBytes());
    }

    @Test
    void byteArrayCarriesLittleEndianLength() {
        assertArrayEquals(new byte[] {15, 32, 0, 0, 0}, CLType.byteArray(32).toBytes());
        assertArrayEquals(new byte[] {15, 0, 1, 0, 0}, CLType.byteArray(256).toBytes());
    }

    @Test
    void mapWritesKeyThenValue() {
        assertArrayEquals(new byte[] {17, 10, 8}, CLType.map(SimpleType.STRING, SimpleType.U512).toBytes());
    }

    @Test
    void nestedCompositesRecurse() {
        CLType type = CLType.option(CLType.list(CLType.map(SimpleType.STRING, CLType.byteArray(2))));

        assertArrayEquals(new byte[] {13, 14, 17, 10, 15, 2, 0, 0, 0}, type.toBytes());
        assertEquals("Option(List(Map(String,ByteArray(2))))", type.typeName());
    }

    @Test
    void structuralEquality() {
        assertEquals(CLType.option(SimpleType.U64), new OptionType(SimpleType.U64));
    }

    @Test
    void rejectsNegativeByteArrayLength() {
        assertThrows(EncodingException.class, () -> CLType.byteArray(-1));
    }

    @Test
    void keyVariantNames() {
        assertEquals(KeyVariant.ACCOUNT, KeyVariant.fromName("Account"));
        assertEquals(KeyVariant.HASH, KeyVariant.fromName("hash"));
        assertEquals(KeyVariant.UREF, KeyVariant.fromName("UREF"));
        assertThrows(EncodingException.class, () -> KeyVariant.fromName("balance"));
    }
}
