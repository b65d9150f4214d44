// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.types;

import java.util.regex.Pattern;

/**
 * Utility for validating fixed-length hex strings.
 * <p>
 * Casper renders hashes and keys without a {@code 0x} prefix, so the patterns here
 * accept bare hex only. Used by {@link Hash} and {@link AccountHash}.
 */
public final class HexValidator {
    private HexValidator() {}

    /**
     * Creates a compiled pattern that matches hex strings of exactly the specified byte length.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern matching {@code byteLength * 2} hex characters
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^[0-9a-fA-F]{" + hexChars + "}$");
    }
}
