// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.cask.core.crypto.PublicKey;
import sh.cask.core.types.Hash;
import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * Deploy header. Its serialization is the preimage of the deploy hash.
 *
 * <p>
 * Field order on the wire is fixed:
 *
 * <pre>
 * account      tagged public key, no length prefix
 * timestamp    u64 ms since epoch
 * ttl          u64 ms
 * gas_price    u64
 * body_hash    32 bytes, no length prefix
 * dependencies u32 count ++ 32 bytes each
 * chain_name   string
 * </pre>
 *
 * @param account      the sending account's public key
 * @param timestamp    creation time, ms since epoch
 * @param ttl          time-to-live in ms
 * @param gasPrice     gas price
 * @param bodyHash     hash of the serialized payment and session
 * @param dependencies deploys that must execute first
 * @param chainName    target network name
 */
public record DeployHeader(
        PublicKey account,
        long timestamp,
        long ttl,
        long gasPrice,
        Hash bodyHash,
        List<Hash> dependencies,
        String chainName) {

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    public DeployHeader {
        Objects.requireNonNull(account, "account cannot be null");
        Objects.requireNonNull(bodyHash, "bodyHash cannot be null");
        Objects.requireNonNull(dependencies, "dependencies cannot be null");
        Objects.requireNonNull(chainName, "chainName cannot be null");
        dependencies = List.copyOf(dependencies);
    }

    public void writeTo(final ByteWriter out) {
        out.writeRaw(account.toBytes());
        out.writeU64(timestamp);
        out.writeU64(ttl);
        out.writeU64(gasPrice);
        out.writeRaw(bodyHash.toBytes());
        out.writeU32(dependencies.size());
        for (Hash dependency : dependencies) {
            out.writeRaw(dependency.toBytes());
        }
        out.writeString(chainName);
    }

    public byte[] toBytes() {
        final ByteWriter out = new ByteWriter(128);
        writeTo(out);
        return out.toByteArray();
    }

    /** Timestamp as {@code yyyy-MM-ddTHH:mm:ss.SSSZ} in UTC. */
    public String timestampIso() {
        return ISO_MILLIS.format(Instant.ofEpochMilli(timestamp));
    }

    /**
     * Ttl in the node's human-readable form: {@code "30m"}, {@code "1h 30m"},
     * {@code "1day 2h"}, {@code "500ms"}.
     */
    public String ttlText() {
        return formatDuration(ttl);
    }

    static String formatDuration(final long millis) {
        if (millis == 0) {
            return "0s";
        }
        long rest = millis;
        final long days = rest / 86_400_000L;
        rest %= 86_400_000L;
        final long hours = rest / 3_600_000L;
        rest %= 3_600_000L;
        final long minutes = rest / 60_000L;
        rest %= 60_000L;
        final long seconds = rest / 1_000L;
        final long ms = rest % 1_000L;

        final List<String> parts = new ArrayList<>(5);
        if (days > 0)
            parts.add(days + (days == 1 ? "day" : "days"));
        if (hours > 0)
            parts.add(hours + "h");
        if (minutes > 0)
            parts.add(minutes + "m");
        if (seconds > 0)
            parts.add(seconds + "s");
        if (ms > 0)
            parts.add(ms + "ms");
        return String.join(" ", parts);
    }
}
