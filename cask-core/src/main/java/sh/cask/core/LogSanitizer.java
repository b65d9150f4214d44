// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts private key values to prevent credential leakage</li>
 * <li>Truncates excessively long logs (module bytes can run to hundreds of KB)</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "privateKey":"..." and "private_key":"..." JSON values, hex with or without 0x. */
    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"(privateKey|private_key)\"\\s*:\\s*\"[^\"]+\"");

    private static final String PRIVATE_KEY_REPLACEMENT = "\"$1\":\"***[REDACTED]***\"";

    /** Matches "module_bytes":"..." values, which can carry whole wasm binaries. */
    private static final Pattern MODULE_BYTES_PATTERN =
            Pattern.compile("\"module_bytes\"\\s*:\\s*\"([0-9a-fA-F]{64})[0-9a-fA-F]+\"");

    private static final String MODULE_BYTES_REPLACEMENT = "\"module_bytes\":\"$1...\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"") || sanitized.contains("\"private_key\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }

        if (sanitized.contains("\"module_bytes\"")) {
            sanitized = MODULE_BYTES_PATTERN.matcher(sanitized).replaceAll(MODULE_BYTES_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
