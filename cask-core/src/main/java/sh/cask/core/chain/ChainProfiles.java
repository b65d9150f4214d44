// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.chain;

import java.time.Duration;

/**
 * Pre-configured profiles for the public networks and a local NCTL network.
 *
 * <p>
 * All presets use a 30-minute ttl and gas price 1.
 *
 * <pre>{@code
 * ChainProfile custom = ChainProfile.of("my-private-net", Duration.ofMinutes(10), 1);
 * DeployBuilder.create(custom)...
 * }</pre>
 *
 * @see ChainProfile
 */
public final class ChainProfiles {
    private ChainProfiles() {}

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    public static final long DEFAULT_GAS_PRICE = 1L;

    /** Casper mainnet ("casper"). */
    public static final ChainProfile MAINNET = ChainProfile.of("casper", DEFAULT_TTL, DEFAULT_GAS_PRICE);

    /** Casper testnet ("casper-test"); the builder default. */
    public static final ChainProfile TESTNET = ChainProfile.of("casper-test", DEFAULT_TTL, DEFAULT_GAS_PRICE);

    /** First network of a local NCTL setup ("casper-net-1"). */
    public static final ChainProfile LOCAL_NCTL = ChainProfile.of("casper-net-1", DEFAULT_TTL, DEFAULT_GAS_PRICE);
}
