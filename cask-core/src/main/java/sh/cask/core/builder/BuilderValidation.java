// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.builder;

import sh.cask.core.error.ValidationException;
import sh.cask.core.types.Hash;

/**
 * Shared validation utilities for {@link DeployBuilder}.
 */
final class BuilderValidation {

    private BuilderValidation() {
        // Utility class
    }

    /**
     * @throws ValidationException naming {@code field} if {@code value} is null
     */
    static <T> T requireSet(final T value, final String field) {
        if (value == null) {
            throw new ValidationException("Deploy is missing required field: " + field);
        }
        return value;
    }

    static String requireNotBlank(final String value, final String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " cannot be blank");
        }
        return value;
    }

    static long requirePositive(final long value, final String field) {
        if (value <= 0) {
            throw new ValidationException(field + " must be positive, got: " + value);
        }
        return value;
    }

    /**
     * Parses a 32-byte hex hash supplied as a builder argument.
     *
     * @throws ValidationException if {@code hex} is not 64 hex characters
     */
    static Hash parseHash(final String hex, final String field) {
        if (hex == null) {
            throw new ValidationException(field + " cannot be null");
        }
        try {
            return new Hash(hex);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " is not a 32-byte hex hash: " + hex, e);
        }
    }
}
