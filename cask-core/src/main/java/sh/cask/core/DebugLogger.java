// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for deploy and signing events.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.cask.debug");

    private DebugLogger() {
    }

    public static void logDeploy(final String message, final Object... args) {
        if (!CaskDebug.isDeployLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logSigning(final String message, final Object... args) {
        if (!CaskDebug.isSigningLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Direct output to stdout for colored logs in TTY environments.
     * Falls back to SLF4J for non-TTY environments.
     * Always sanitizes, so key material never reaches either sink.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);

        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
