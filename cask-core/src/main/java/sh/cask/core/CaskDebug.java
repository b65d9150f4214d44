// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core;

/**
 * Global toggle for verbose debug logging of deploy construction and signing.
 *
 * <p>Both flags are off by default; the library stays silent unless the calling
 * application opts in.
 *
 * <p>Thread safety: The individual boolean fields are volatile, ensuring visibility
 * across threads. The compound check in {@link #isEnabled()} is not atomic, which
 * only matters for best-effort logging.
 */
public final class CaskDebug {

    private static volatile boolean deployLogging = false;
    private static volatile boolean signingLogging = false;

    private CaskDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either deploy or signing logging is enabled
     */
    public static boolean isEnabled() {
        return deployLogging || signingLogging;
    }

    public static void setEnabled(final boolean enabled) {
        deployLogging = enabled;
        signingLogging = enabled;
    }

    public static void setDeployLogging(final boolean enabled) {
        deployLogging = enabled;
    }

    public static boolean isDeployLoggingEnabled() {
        return deployLogging;
    }

    public static void setSigningLogging(final boolean enabled) {
        signingLogging = enabled;
    }

    public static boolean isSigningLoggingEnabled() {
        return signingLogging;
    }
}
