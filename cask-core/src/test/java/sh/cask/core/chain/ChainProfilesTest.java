// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class ChainProfilesTest {

    @Test
    void chainNamesAreCorrect() {
        assertEquals("casper", ChainProfiles.MAINNET.chainName());
        assertEquals("casper-test", ChainProfiles.TESTNET.chainName());
        assertEquals("casper-net-1", ChainProfiles.LOCAL_NCTL.chainName());
    }

    @Test
    void presetsShareDefaults() {
        assertEquals(Duration.ofMillis(1_800_000), ChainProfiles.TESTNET.defaultTtl());
        assertEquals(1L, ChainProfiles.MAINNET.defaultGasPrice());
    }

    @Test
    void rejectsInvalidProfiles() {
        assertThrows(IllegalArgumentException.class, () -> ChainProfile.of(" ", Duration.ofMinutes(1), 1));
        assertThrows(IllegalArgumentException.class, () -> ChainProfile.of("x", Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> ChainProfile.of("x", Duration.ofMinutes(1), 0));
        assertThrows(NullPointerException.class, () -> ChainProfile.of(null, Duration.ofMinutes(1), 1));
    }
}
