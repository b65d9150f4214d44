// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.util.Objects;

import sh.cask.core.cltype.CLValue;

/**
 * One runtime argument: a name and its typed value.
 *
 * @param name  argument name looked up by the receiving contract
 * @param value the encoded value
 */
public record NamedArg(String name, CLValue value) {

    public NamedArg {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
