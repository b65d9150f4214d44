// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import sh.cask.core.crypto.Blake2b256;
import sh.cask.core.types.Hash;

/**
 * The two content hashes of a deploy. Both use Blake2b-256.
 */
public final class DeployHashes {

    private DeployHashes() {
    }

    /** {@code blake2b256(serialize(payment) ++ serialize(session))} */
    public static Hash bodyHash(final ExecutableDeployItem payment, final ExecutableDeployItem session) {
        return Hash.fromBytes(Blake2b256.hash(payment.toBytes(), session.toBytes()));
    }

    /** {@code blake2b256(serialize(header))} */
    public static Hash deployHash(final DeployHeader header) {
        return Hash.fromBytes(Blake2b256.hash(header.toBytes()));
    }
}
