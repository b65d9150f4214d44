// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.chain;

import java.time.Duration;
import java.util.Objects;

/**
 * Network settings that seed a deploy header.
 *
 * <p>
 * <strong>Field constraints:</strong>
 * <ul>
 * <li>{@code chainName} - non-blank; part of the signed header, so a deploy built for one
 * network is rejected by every other</li>
 * <li>{@code defaultTtl} - positive, whole milliseconds</li>
 * <li>{@code defaultGasPrice} - positive</li>
 * </ul>
 *
 * @param chainName       the network name written into the header
 * @param defaultTtl      time-to-live applied when the builder is not given one
 * @param defaultGasPrice gas price applied when the builder is not given one
 *
 * @see ChainProfiles
 */
public record ChainProfile(String chainName, Duration defaultTtl, long defaultGasPrice) {

    /**
     * @throws IllegalArgumentException if a field violates its constraint
     * @throws NullPointerException     if chainName or defaultTtl is null
     */
    public ChainProfile {
        Objects.requireNonNull(chainName, "chainName cannot be null");
        if (chainName.isBlank()) {
            throw new IllegalArgumentException("chainName cannot be blank");
        }
        Objects.requireNonNull(defaultTtl, "defaultTtl cannot be null");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive, got: " + defaultTtl);
        }
        if (defaultGasPrice <= 0) {
            throw new IllegalArgumentException("defaultGasPrice must be positive, got: " + defaultGasPrice);
        }
    }

    public static ChainProfile of(final String chainName, final Duration defaultTtl, final long defaultGasPrice) {
        return new ChainProfile(chainName, defaultTtl, defaultGasPrice);
    }
}
