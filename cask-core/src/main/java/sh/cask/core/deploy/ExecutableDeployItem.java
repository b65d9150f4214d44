// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.cask.core.cltype.CLValues;
import sh.cask.core.error.EncodingException;
import sh.cask.core.types.Hash;
import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * The payment or session part of a deploy.
 *
 * <p>
 * Every variant serializes as its tag byte followed by its fields:
 *
 * <pre>
 * 0 ModuleBytes                    u32 len ++ module ++ args
 * 1 StoredContractByHash           hash[32] ++ string entryPoint ++ args
 * 2 StoredContractByName           string name ++ string entryPoint ++ args
 * 3 StoredVersionedContractByHash  hash[32] ++ Option&lt;u32&gt; version ++ string entryPoint ++ args
 * 4 StoredVersionedContractByName  string name ++ Option&lt;u32&gt; version ++ string entryPoint ++ args
 * 5 Transfer                       args
 * </pre>
 */
public sealed interface ExecutableDeployItem {

    int tag();

    /** Variant name as rendered in JSON, e.g. {@code "ModuleBytes"}. */
    String variantName();

    RuntimeArgs args();

    void writeTo(ByteWriter out);

    default byte[] toBytes() {
        final ByteWriter out = new ByteWriter();
        writeTo(out);
        return out.toByteArray();
    }

    /**
     * Payment through the system's standard payment code: empty module bytes with a single
     * {@code amount: U512} argument.
     *
     * @param amount motes to pay for execution
     */
    static ExecutableDeployItem standardPayment(final BigInteger amount) {
        return new ModuleBytes(new byte[0], RuntimeArgs.of("amount", CLValues.u512(amount)));
    }

    /** @see #standardPayment(BigInteger) */
    static ExecutableDeployItem standardPayment(final String amount) {
        return new ModuleBytes(new byte[0], RuntimeArgs.of("amount", CLValues.u512(amount)));
    }

    /** Wasm module bytes; empty for standard payment. */
    record ModuleBytes(byte[] moduleBytes, RuntimeArgs args) implements ExecutableDeployItem {
        public static final int TAG = 0;

        public ModuleBytes {
            Objects.requireNonNull(moduleBytes, "moduleBytes cannot be null");
            Objects.requireNonNull(args, "args cannot be null");
            moduleBytes = Arrays.copyOf(moduleBytes, moduleBytes.length);
        }

        @Override
        public byte[] moduleBytes() {
            return Arrays.copyOf(moduleBytes, moduleBytes.length);
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String variantName() {
            return "ModuleBytes";
        }

        @Override
        public void writeTo(final ByteWriter out) {
            out.writeU8(TAG);
            out.writeBytes(moduleBytes);
            args.writeTo(out);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof ModuleBytes other))
                return false;
            return Arrays.equals(moduleBytes, other.moduleBytes) && args.equals(other.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Arrays.hashCode(moduleBytes), args);
        }

        @Override
        public String toString() {
            return "ModuleBytes[" + moduleBytes.length + " bytes, args=" + args + "]";
        }
    }

    record StoredContractByHash(Hash hash, String entryPoint, RuntimeArgs args) implements ExecutableDeployItem {
        public static final int TAG = 1;

        public StoredContractByHash {
            Objects.requireNonNull(hash, "hash cannot be null");
            Objects.requireNonNull(entryPoint, "entryPoint cannot be null");
            Objects.requireNonNull(args, "args cannot be null");
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String variantName() {
            return "StoredContractByHash";
        }

        @Override
        public void writeTo(final ByteWriter out) {
            out.writeU8(TAG);
            out.writeRaw(hash.toBytes());
            out.writeString(entryPoint);
            args.writeTo(out);
        }
    }

    record StoredContractByName(String name, String entryPoint, RuntimeArgs args) implements ExecutableDeployItem {
        public static final int TAG = 2;

        public StoredContractByName {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(entryPoint, "entryPoint cannot be null");
            Objects.requireNonNull(args, "args cannot be null");
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String variantName() {
            return "StoredContractByName";
        }

        @Override
        public void writeTo(final ByteWriter out) {
            out.writeU8(TAG);
            out.writeString(name);
            out.writeString(entryPoint);
            args.writeTo(out);
        }
    }

    /**
     * @param version contract version, or null for the latest enabled version
     */
    record StoredVersionedContractByHash(Hash hash, @Nullable Long version, String entryPoint, RuntimeArgs args)
            implements ExecutableDeployItem {
        public static final int TAG = 3;

        public StoredVersionedContractByHash {
            Objects.requireNonNull(hash, "hash cannot be null");
            checkVersion(version);
            Objects.requireNonNull(entryPoint, "entryPoint cannot be null");
            Objects.requireNonNull(args, "args cannot be null");
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String variantName() {
            return "StoredVersionedContractByHash";
        }

        @Override
        public void writeTo(final ByteWriter out) {
            out.writeU8(TAG);
            out.writeRaw(hash.toBytes());
            writeVersion(out, version);
            out.writeString(entryPoint);
            args.writeTo(out);
        }
    }

    /**
     * @param version contract version, or null for the latest enabled version
     */
    record StoredVersionedContractByName(String name, @Nullable Long version, String entryPoint, RuntimeArgs args)
            implements ExecutableDeployItem {
        public static final int TAG = 4;

        public StoredVersionedContractByName {
            Objects.requireNonNull(name, "name cannot be null");
            checkVersion(version);
            Objects.requireNonNull(entryPoint, "entryPoint cannot be null");
            Objects.requireNonNull(args, "args cannot be null");
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String variantName() {
            return "StoredVersionedContractByName";
        }

        @Override
        public void writeTo(final ByteWriter out) {
            out.writeU8(TAG);
            out.writeString(name);
            writeVersion(out, version);
            out.writeString(entryPoint);
            args.writeTo(out);
        }
    }

    /** Native transfer; everything it needs travels in the args. */
    record Transfer(RuntimeArgs args) implements ExecutableDeployItem {
        public static final int TAG = 5;

        public Transfer {
            Objects.requireNonNull(args, "args cannot be null");
        }

        @Override
        public int tag() {
            return TAG;
        }

        @Override
        public String variantName() {
            return "Transfer";
        }

        @Override
        public void writeTo(final ByteWriter out) {
            out.writeU8(TAG);
            args.writeTo(out);
        }
    }

    private static void checkVersion(final @Nullable Long version) {
        if (version != null && (version < 0 || version > 0xFFFF_FFFFL)) {
            throw new EncodingException("Contract version must fit in u32, got " + version);
        }
    }

    // Option<u32>
    private static void writeVersion(final ByteWriter out, final @Nullable Long version) {
        if (version == null) {
            out.writeU8(0);
        } else {
            out.writeU8(1);
            out.writeU32(version);
        }
    }
}
