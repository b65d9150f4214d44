// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import sh.cask.core.builder.DeployBuilder;
import sh.cask.core.cltype.CLValues;
import sh.cask.core.crypto.KeyAlgorithm;
import sh.cask.core.crypto.KeyPair;

class CaskExceptionTest {

    @Test
    void subtypesShareTheRoot() {
        assertInstanceOf(CaskException.class, new ValidationException("v"));
        assertInstanceOf(CaskException.class, new EncodingException("e"));
        assertInstanceOf(CaskException.class, new SigningException("s"));
    }

    @Test
    void causeIsPreserved() {
        IllegalArgumentException cause = new IllegalArgumentException("bad");

        EncodingException e = new EncodingException("wrapped", cause);

        assertSame(cause, e.getCause());
        assertEquals("wrapped", e.getMessage());
    }

    @Test
    void failuresSurfaceAsTheirCategory() {
        assertThrows(ValidationException.class, () -> DeployBuilder.create().build());
        assertThrows(EncodingException.class, () -> CLValues.u8(256));
        assertThrows(SigningException.class, () -> KeyPair.fromPrivateKey(KeyAlgorithm.SECP256K1, new byte[32]));
    }
}
