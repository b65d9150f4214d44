// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import sh.cask.core.error.EncodingException;

class SignatureTest {

    @Test
    void hexCarriesAlgorithmTag() {
        Signature signature = new Signature(KeyAlgorithm.SECP256K1, new byte[64]);

        assertEquals("02" + "00".repeat(64), signature.toHex());
        assertEquals(signature, Signature.fromHex(signature.toHex()));
    }

    @Test
    void rejectsWrongLengths() {
        assertThrows(EncodingException.class, () -> new Signature(KeyAlgorithm.ED25519, new byte[63]));
        assertThrows(EncodingException.class, () -> Signature.fromHex("01" + "00".repeat(63)));
    }

    @Test
    void rejectsUnknownTagAndBadHex() {
        assertThrows(EncodingException.class, () -> Signature.fromHex("07" + "00".repeat(64)));
        assertThrows(EncodingException.class, () -> Signature.fromHex("0g"));
    }
}
