// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.cask.core.cltype.CLValue;
import sh.cask.primitives.bytesrepr.ByteWriter;

/**
 * Ordered runtime arguments of an executable item.
 *
 * <p>
 * Wire form: {@code u32 count}, then per argument in insertion order
 * {@code string name ++ u32 valueLength ++ valueBytes ++ typeDescriptor}.
 *
 * <pre>{@code
 * RuntimeArgs args = RuntimeArgs.builder()
 *     .add("amount", CLValues.u512("2500000000"))
 *     .add("target", CLValues.publicKey(target))
 *     .build();
 * }</pre>
 */
public final class RuntimeArgs {

    private static final RuntimeArgs EMPTY = new RuntimeArgs(List.of());

    private final List<NamedArg> args;

    private RuntimeArgs(final List<NamedArg> args) {
        this.args = List.copyOf(args);
    }

    public static RuntimeArgs empty() {
        return EMPTY;
    }

    public static RuntimeArgs of(final List<NamedArg> args) {
        Objects.requireNonNull(args, "args cannot be null");
        return args.isEmpty() ? EMPTY : new RuntimeArgs(args);
    }

    public static RuntimeArgs of(final String name, final CLValue value) {
        return new RuntimeArgs(List.of(new NamedArg(name, value)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<NamedArg> args() {
        return args;
    }

    public int size() {
        return args.size();
    }

    public boolean isEmpty() {
        return args.isEmpty();
    }

    /** First argument with the given name. */
    public Optional<CLValue> get(final String name) {
        for (NamedArg arg : args) {
            if (arg.name().equals(name)) {
                return Optional.of(arg.value());
            }
        }
        return Optional.empty();
    }

    public void writeTo(final ByteWriter out) {
        out.writeU32(args.size());
        for (NamedArg arg : args) {
            out.writeString(arg.name());
            out.writeBytes(arg.value().bytes());
            arg.value().type().writeTo(out);
        }
    }

    public byte[] toBytes() {
        final ByteWriter out = new ByteWriter();
        writeTo(out);
        return out.toByteArray();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof RuntimeArgs other))
            return false;
        return args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return args.hashCode();
    }

    @Override
    public String toString() {
        return "RuntimeArgs" + args;
    }

    /** Collects arguments in call order. */
    public static final class Builder {
        private final List<NamedArg> args = new ArrayList<>();

        private Builder() {
        }

        public Builder add(final String name, final CLValue value) {
            args.add(new NamedArg(name, value));
            return this;
        }

        public RuntimeArgs build() {
            return RuntimeArgs.of(args);
        }
    }
}
