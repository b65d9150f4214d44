// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.crypto;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.cask.core.error.SigningException;

/**
 * Deterministic ECDSA over secp256k1.
 *
 * <p>
 * The message is first digested with SHA-256; the digest is signed with an
 * <a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a> nonce and the result is
 * normalized to low-s. Signatures are encoded as {@code r || s}, 32 bytes each,
 * big-endian.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless. Each call creates its own {@link HMacDSAKCalculator} and digest; the
 * shared {@link FixedPointCombMultiplier} keeps no mutable state between calls.
 */
final class Secp256k1 {

    static final int PRIVATE_KEY_SIZE = 32;

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1() {
    }

    static byte[] generatePrivateKey(final SecureRandom random) {
        final byte[] candidate = new byte[PRIVATE_KEY_SIZE];
        BigInteger d;
        do {
            random.nextBytes(candidate);
            d = new BigInteger(1, candidate);
        } while (d.signum() == 0 || d.compareTo(CURVE.getN()) >= 0);
        return candidate;
    }

    /** Compressed (33-byte) public key for the given private key. */
    static byte[] derivePublicKey(final byte[] privateKey) {
        final BigInteger d = toScalar(privateKey);
        return MULTIPLIER.multiply(CURVE.getG(), d).normalize().getEncoded(true);
    }

    static byte[] sign(final byte[] message, final byte[] privateKey) {
        Objects.requireNonNull(message, "message cannot be null");
        final BigInteger d = toScalar(privateKey);
        final byte[] digest = sha256(message);
        final BigInteger n = CURVE.getN();
        final BigInteger z = new BigInteger(1, digest);

        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(n, d, digest);

        BigInteger r;
        BigInteger s;
        do {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();

            // r = x1 mod n
            r = p.getAffineXCoord().toBigInteger().mod(n);
            // s = k^-1 * (z + r * d) mod n
            s = k.modInverse(n).multiply(z.add(r.multiply(d))).mod(n);
        } while (r.signum() == 0 || s.signum() == 0);

        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            s = n.subtract(s);
        }

        final byte[] out = new byte[64];
        System.arraycopy(toBytes32(r), 0, out, 0, 32);
        System.arraycopy(toBytes32(s), 0, out, 32, 32);
        return out;
    }

    /**
     * Returns false for any mismatch, including an off-curve public key or out-of-range
     * signature components.
     */
    static boolean verify(final byte[] message, final byte[] signature, final byte[] publicKey) {
        if (signature.length != 64) {
            return false;
        }
        final ECPoint q;
        try {
            q = CURVE.getCurve().decodePoint(publicKey);
        } catch (IllegalArgumentException e) {
            return false;
        }
        final BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        final BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));

        final ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, new ECPublicKeyParameters(q, CURVE));
        return verifier.verifySignature(sha256(message), r, s);
    }

    private static BigInteger toScalar(final byte[] privateKey) {
        Objects.requireNonNull(privateKey, "private key cannot be null");
        if (privateKey.length != PRIVATE_KEY_SIZE) {
            throw new SigningException(
                    "secp256k1 private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + privateKey.length);
        }
        final BigInteger d = new BigInteger(1, privateKey);
        if (d.signum() == 0) {
            throw new SigningException("secp256k1 private key cannot be zero");
        }
        if (d.compareTo(CURVE.getN()) >= 0) {
            throw new SigningException("secp256k1 private key must be less than curve order");
        }
        return d;
    }

    private static byte[] sha256(final byte[] message) {
        final SHA256Digest sha = new SHA256Digest();
        sha.update(message, 0, message.length);
        final byte[] out = new byte[sha.getDigestSize()];
        sha.doFinal(out, 0);
        return out;
    }

    private static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        final byte[] result = new byte[32];
        if (bytes.length == 32) {
            return bytes;
        } else if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            // drop BigInteger's sign byte
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
