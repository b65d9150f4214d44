// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.util.Objects;

import sh.cask.core.crypto.PublicKey;
import sh.cask.core.crypto.Signature;

/**
 * A signer's approval of a deploy hash.
 *
 * @param signer    public key that verifies {@code signature}
 * @param signature signature over the deploy hash
 */
public record DeployApproval(PublicKey signer, Signature signature) {

    public DeployApproval {
        Objects.requireNonNull(signer, "signer cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
    }
}
