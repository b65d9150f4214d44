// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.error;

/**
 * Thrown when a deploy is missing a required field or a builder input is out of range.
 * Raised before any hash is computed.
 *
 * @since 0.1.0
 */
public final class ValidationException extends CaskException {

    public ValidationException(final String message) {
        super(message);
    }

    public ValidationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
