// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.error;

/**
 * Thrown when a value cannot be represented in its declared CLType, or when hex
 * input is malformed.
 *
 * @since 0.1.0
 */
public final class EncodingException extends CaskException {

    public EncodingException(final String message) {
        super(message);
    }

    public EncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
