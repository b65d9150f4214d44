// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * Blake2b hashing with a 32-byte digest and no key, the hash used for deploy bodies,
 * deploy headers and account hashes.
 *
 * <pre>{@code
 * byte[] bodyHash = Blake2b256.hash(paymentBytes, sessionBytes);
 * }</pre>
 *
 * <h2>Thread Safety and Memory Management</h2>
 *
 * <p>
 * Digest instances are cached per thread. In pooled environments call {@link #cleanup()}
 * when a thread leaves the application context.
 */
public final class Blake2b256 {

    public static final int DIGEST_LENGTH = 32;

    private static final ThreadLocal<Blake2bDigest> DIGEST =
            ThreadLocal.withInitial(() -> new Blake2bDigest(DIGEST_LENGTH * 8));

    private Blake2b256() {
        // Utility class
    }

    /**
     * Computes the Blake2b-256 hash of the input bytes.
     *
     * @param input the data to hash, may be empty
     * @return 32-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");

        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        digest.update(input, 0, input.length);
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Computes the Blake2b-256 hash of multiple input arrays concatenated.
     *
     * @param inputs the data arrays to hash
     * @return 32-byte hash
     * @throws NullPointerException if inputs or any element is null
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");

        final Blake2bDigest digest = DIGEST.get();
        digest.reset();
        for (byte[] input : inputs) {
            Objects.requireNonNull(input, "input element cannot be null");
            digest.update(input, 0, input.length);
        }
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Removes the cached digest instance from the current thread. Safe to call
     * even if {@link #hash} was never used on this thread.
     */
    public static void cleanup() {
        DIGEST.remove();
    }
}
