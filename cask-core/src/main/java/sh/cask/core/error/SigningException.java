// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.error;

/**
 * Thrown when key material is unusable: wrong private key length, a key outside the
 * curve order, or malformed private key hex. Signing with a destroyed
 * {@link sh.cask.core.crypto.KeyPair} throws {@link IllegalStateException} instead.
 *
 * @since 0.1.0
 */
public final class SigningException extends CaskException {

    public SigningException(final String message) {
        super(message);
    }

    public SigningException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
