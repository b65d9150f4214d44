// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import sh.cask.core.error.SigningException;
import sh.cask.core.types.AccountHash;
import sh.cask.primitives.Hex;

/**
 * A private key with its derived public key, for either supported algorithm.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * KeyPair sender = KeyPair.fromPrivateKeyHex(KeyAlgorithm.ED25519, "9d61b19d...");
 * Deploy signed = DeploySigner.signDeploy(deploy, sender);
 * }</pre>
 *
 * <h2>Security Considerations</h2>
 *
 * <p>
 * This class implements {@link Destroyable}. {@link #destroy()} zeroes the private key
 * bytes held by this instance; subsequent signing fails with
 * {@link IllegalStateException}. The public key stays available.
 *
 * <p>
 * {@link #generate(KeyAlgorithm)} draws from a new {@link SecureRandom} on every call,
 * so concurrent generation shares no random state.
 */
public final class KeyPair implements Signer, Destroyable {

    private final KeyAlgorithm algorithm;
    private final PublicKey publicKey;
    private volatile byte[] privateKey;
    private volatile boolean destroyed = false;

    private KeyPair(final KeyAlgorithm algorithm, final byte[] privateKey) {
        this.algorithm = algorithm;
        this.publicKey = PublicKey.of(algorithm, derivePublicKey(algorithm, privateKey));
        this.privateKey = Arrays.copyOf(privateKey, privateKey.length);
    }

    public static KeyPair generate(final KeyAlgorithm algorithm) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        final SecureRandom random = new SecureRandom();
        final byte[] secret = algorithm == KeyAlgorithm.ED25519
                ? Ed25519.generatePrivateKey(random)
                : Secp256k1.generatePrivateKey(random);
        try {
            return new KeyPair(algorithm, secret);
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    /**
     * Creates a key pair from raw private key bytes. The caller's array is not modified.
     *
     * @throws SigningException if the key has the wrong length or, for secp256k1, is
     *                          outside {@code [1, n-1]}
     */
    public static KeyPair fromPrivateKey(final KeyAlgorithm algorithm, final byte[] privateKey) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(privateKey, "private key cannot be null");
        return new KeyPair(algorithm, privateKey);
    }

    /**
     * Creates a key pair from a hex private key, with or without {@code 0x}.
     *
     * @throws SigningException if the hex is malformed or the key is invalid
     */
    public static KeyPair fromPrivateKeyHex(final KeyAlgorithm algorithm, final String privateKeyHex) {
        Objects.requireNonNull(privateKeyHex, "private key hex cannot be null");
        final byte[] secret;
        try {
            secret = Hex.decode(privateKeyHex);
        } catch (IllegalArgumentException e) {
            throw new SigningException("Private key is not valid hex", e);
        }
        try {
            return fromPrivateKey(algorithm, secret);
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    public KeyAlgorithm algorithm() {
        return algorithm;
    }

    @Override
    public PublicKey publicKey() {
        return publicKey;
    }

    public AccountHash accountHash() {
        return publicKey.accountHash();
    }

    /**
     * @throws IllegalArgumentException if {@code deployHash} is not 32 bytes
     * @throws IllegalStateException    if the key has been destroyed
     */
    @Override
    public Signature sign(final byte[] deployHash) {
        Objects.requireNonNull(deployHash, "deploy hash cannot be null");
        if (deployHash.length != 32) {
            throw new IllegalArgumentException("Deploy hash must be 32 bytes, got " + deployHash.length);
        }
        final byte[] secret;
        synchronized (this) {
            checkNotDestroyed();
            // destroy() zeroes privateKey in place; sign from a private copy
            secret = Arrays.copyOf(privateKey, privateKey.length);
        }
        try {
            final byte[] sig = algorithm == KeyAlgorithm.ED25519
                    ? Ed25519.sign(deployHash, secret)
                    : Secp256k1.sign(deployHash, secret);
            return new Signature(algorithm, sig);
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            if (privateKey != null) {
                Arrays.fill(privateKey, (byte) 0);
            }
            privateKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("KeyPair has been destroyed");
        }
    }

    private static byte[] derivePublicKey(final KeyAlgorithm algorithm, final byte[] privateKey) {
        switch (algorithm) {
            case ED25519:
                return Ed25519.derivePublicKey(privateKey);
            case SECP256K1:
                return Secp256k1.derivePublicKey(privateKey);
            default:
                throw new SigningException("Unsupported key algorithm: " + algorithm);
        }
    }

    /** Never includes private key material. */
    @Override
    public String toString() {
        return destroyed ? "KeyPair[destroyed]" : "KeyPair[publicKey=" + publicKey.toHex() + "]";
    }
}
