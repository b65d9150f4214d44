// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core;

import static sh.cask.core.AnsiColors.*;

/**
 * Formats deploy and signing events for {@link DebugLogger}.
 *
 * <p>
 * Hashes and keys are shortened to {@code 0123ab...cdef}. Only public data is ever
 * formatted; private keys never pass through this class.
 *
 * <pre>{@code
 * DebugLogger.logDeploy(LogFormatter.formatDeployBuilt(hash, bodyHash, "casper-test", "Transfer", 120));
 * // [DEPLOY-BUILT] hash=0123ab...cdef body=9f8e7d...6543 chain=casper-test session=Transfer 120μs
 * }</pre>
 *
 * @see AnsiColors
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [DEPLOY-BUILT] hash=0123ab...cdef body=... chain=casper-test session=Transfer 120μs
     */
    public static String formatDeployBuilt(
            String hash, String bodyHash, String chainName, String sessionKind, long durationMicros) {
        return String.format(
                "%s[DEPLOY-BUILT]%s hash=%s body=%s chain=%s session=%s %s%s%s",
                LAVENDER, RESET,
                shortenHash(hash),
                shortenHash(bodyHash),
                chainName,
                sessionKind,
                SLATE, duration(durationMicros), RESET);
    }

    /**
     * Format: [DEPLOY-SIGNED] hash=0123ab...cdef signer=01d75a...511a approvals=2
     */
    public static String formatApproval(String hash, String signer, int approvalCount) {
        return String.format(
                "%s[DEPLOY-SIGNED]%s hash=%s signer=%s approvals=%d",
                AMBER, RESET,
                shortenHash(hash),
                shortenHash(signer),
                approvalCount);
    }

    /**
     * Format: ✓ [VERIFY] hash=... signer=... or ✗ [VERIFY] ...
     */
    public static String formatVerify(String hash, String signer, boolean valid) {
        return String.format(
                "%s%s%s [VERIFY] hash=%s signer=%s",
                valid ? TEAL : CORAL,
                valid ? "✓" : "✗",
                RESET,
                shortenHash(hash),
                shortenHash(signer));
    }

    static String shortenHash(String value) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= HASH_SHORTEN_THRESHOLD) {
            return value;
        }
        return value.substring(0, HASH_PREFIX_LENGTH) + "..." + value.substring(value.length() - HASH_SUFFIX_LENGTH);
    }
}
