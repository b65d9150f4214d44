// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.error;

/**
 * Base runtime exception for all cask failures.
 *
 * <p>
 * Every failure is terminal for the build or sign call that raised it. Nothing is
 * retried internally, since each subtype signals a programming or input error
 * rather than a transient condition.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * CaskException
 * ├── {@link ValidationException} - a required deploy field is missing or malformed
 * ├── {@link EncodingException} - a value cannot be represented in its declared type
 * └── {@link SigningException} - key material is malformed or the algorithm is unsupported
 * </pre>
 *
 * <p>
 * Signature verification never throws for a mismatching signature; it returns
 * {@code false}.
 *
 * <pre>{@code
 * try {
 *     Deploy deploy = DeployBuilder.create()...build();
 * } catch (ValidationException e) {
 *     // missing sender, payment or session
 * } catch (CaskException e) {
 *     // any other cask error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class CaskException extends RuntimeException
        permits ValidationException, EncodingException, SigningException {

    public CaskException(final String message) {
        super(message);
    }

    public CaskException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
