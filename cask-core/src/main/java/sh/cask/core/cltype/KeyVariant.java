// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.cltype;

import java.util.Locale;
import java.util.Objects;

import sh.cask.core.error.EncodingException;

/**
 * Variants of a {@code Key} value, with their wire tag, raw payload length and textual
 * prefix.
 */
public enum KeyVariant {
    ACCOUNT(0x00, 32, "account-hash-"),
    HASH(0x01, 32, "hash-"),
    /** 32-byte address followed by one access-rights byte. */
    UREF(0x02, 33, "uref-");

    private final int tag;
    private final int length;
    private final String prefix;

    KeyVariant(final int tag, final int length, final String prefix) {
        this.tag = tag;
        this.length = length;
        this.prefix = prefix;
    }

    public int tag() {
        return tag;
    }

    public int length() {
        return length;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Looks a variant up by name, case-insensitively ({@code "account"}, {@code "hash"},
     * {@code "uref"}).
     *
     * @throws EncodingException for any other name
     */
    public static KeyVariant fromName(final String name) {
        Objects.requireNonNull(name, "name cannot be null");
        switch (name.toLowerCase(Locale.ROOT)) {
            case "account":
                return ACCOUNT;
            case "hash":
                return HASH;
            case "uref":
                return UREF;
            default:
                throw new EncodingException("Unknown key variant: " + name);
        }
    }
}
