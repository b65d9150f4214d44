// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import sh.cask.core.error.EncodingException;

class HashTest {

    @Test
    void normalizesToLowercase() {
        assertEquals("ab".repeat(32), new Hash("AB".repeat(32)).value());
    }

    @Test
    void rejectsPrefixedOrShortHex() {
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x" + "ab".repeat(32)));
        assertThrows(IllegalArgumentException.class, () -> new Hash("ab".repeat(31)));
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(new byte[31]));
    }

    @Test
    void bytesRoundTrip() {
        byte[] bytes = new byte[32];
        bytes[31] = 7;

        assertArrayEquals(bytes, Hash.fromBytes(bytes).toBytes());
        assertEquals("00".repeat(31) + "07", Hash.fromBytes(bytes).toString());
    }

    @Test
    void accountHashTextForm() {
        AccountHash hash = AccountHash.parse("account-hash-" + "CD".repeat(32));

        assertEquals("cd".repeat(32), hash.value());
        assertEquals("account-hash-" + "cd".repeat(32), hash.toText());
        assertEquals(hash, AccountHash.parse("cd".repeat(32)));
        assertThrows(EncodingException.class, () -> AccountHash.parse("account-hash-zz"));
        assertThrows(EncodingException.class, () -> AccountHash.fromBytes(new byte[33]));
    }
}
