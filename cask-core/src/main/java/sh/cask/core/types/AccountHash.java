// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.cask.core.crypto.Blake2b256;
import sh.cask.core.crypto.KeyAlgorithm;
import sh.cask.core.error.EncodingException;
import sh.cask.primitives.Hex;

/**
 * 32-byte account identifier derived from a public key.
 * <p>
 * Derivation: {@code blake2b256(algorithmName ++ 0x00 ++ rawPublicKey)}, where
 * {@code algorithmName} is {@code "ed25519"} or {@code "secp256k1"}.
 * <p>
 * The textual form is {@code account-hash-<64 hex>}; the prefix is stripped before
 * encoding and re-added when rendering.
 *
 * @param value 64 lowercase hex characters, no prefix
 */
public record AccountHash(String value) {
    public static final String PREFIX = "account-hash-";
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public AccountHash {
        Objects.requireNonNull(value, "account hash");
        if (!HEX.matcher(value).matches()) {
            throw new EncodingException("Invalid account hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code account-hash-<hex>} or bare hex.
     *
     * @throws EncodingException if the hex part is not 32 bytes of valid hex
     */
    public static AccountHash parse(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return new AccountHash(text.startsWith(PREFIX) ? text.substring(PREFIX.length()) : text);
    }

    public static AccountHash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new EncodingException("Account hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new AccountHash(Hex.encode(bytes));
    }

    public static AccountHash fromPublicKey(final KeyAlgorithm algorithm, final byte[] rawPublicKey) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(rawPublicKey, "public key cannot be null");
        final byte[] name = algorithm.algorithmName().getBytes(StandardCharsets.US_ASCII);
        return fromBytes(Blake2b256.hash(name, new byte[] {0}, rawPublicKey));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public String toText() {
        return PREFIX + value;
    }

    @Override
    public String toString() {
        return toText();
    }
}
