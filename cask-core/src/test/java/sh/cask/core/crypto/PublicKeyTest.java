// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.cask.core.error.EncodingException;
import sh.cask.core.types.AccountHash;
import sh.cask.primitives.Hex;

class PublicKeyTest {

    private static final String ED_KEY = "01d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a";

    @Test
    void parsesTaggedHex() {
        PublicKey key = PublicKey.fromHex(ED_KEY);

        assertEquals(KeyAlgorithm.ED25519, key.algorithm());
        assertEquals(32, key.raw().length);
        assertEquals(ED_KEY, key.toHex());
        assertEquals(ED_KEY, key.toString());
    }

    @Test
    void secp256k1KeyIsThirtyFourBytesTagged() {
        PublicKey key = PublicKey.fromHex("02" + "aa".repeat(33));

        assertEquals(KeyAlgorithm.SECP256K1, key.algorithm());
        assertEquals(34, key.toBytes().length);
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(EncodingException.class, () -> PublicKey.fromHex("01zz"));
        assertThrows(EncodingException.class, () -> PublicKey.fromHex("03" + "aa".repeat(33)));
        assertThrows(EncodingException.class, () -> PublicKey.fromHex("01" + "aa".repeat(33)));
        assertThrows(EncodingException.class, () -> PublicKey.fromHex(""));
    }

    @Test
    void accountHashIsBlake2bOfNameSeparatorAndKey() {
        PublicKey key = PublicKey.fromHex(ED_KEY);
        byte[] expected = Blake2b256.hash(
                "ed25519".getBytes(StandardCharsets.US_ASCII), new byte[] {0}, key.raw());

        AccountHash accountHash = key.accountHash();

        assertArrayEquals(expected, accountHash.toBytes());
        assertEquals("account-hash-" + Hex.encode(expected), accountHash.toText());
    }

    @Test
    void signatureFromOtherAlgorithmVerifiesFalse() {
        KeyPair ed = KeyPair.generate(KeyAlgorithm.ED25519);
        byte[] hash = new byte[32];
        Signature signature = ed.sign(hash);
        Signature relabelled = new Signature(KeyAlgorithm.SECP256K1, signature.bytes());

        assertFalse(ed.publicKey().verify(hash, relabelled));
    }

    @Test
    void defensiveCopies() {
        byte[] raw = Hex.decode(ED_KEY.substring(2));
        PublicKey key = PublicKey.of(KeyAlgorithm.ED25519, raw);
        raw[0] = 0;
        key.raw()[1] = 0;

        assertEquals(ED_KEY, key.toHex());
    }
}
