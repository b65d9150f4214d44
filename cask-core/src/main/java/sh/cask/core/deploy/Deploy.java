// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.cask.core.error.ValidationException;
import sh.cask.core.types.Hash;

/**
 * A built deploy, ready to be signed and handed to a transport.
 *
 * <p>
 * Immutable. Both hashes are recomputed on construction: {@code header.bodyHash} must
 * match payment and session, and {@code hash} must match the header.
 * Approvals are added by {@link #withApproval(DeployApproval)}, which
 * returns a new instance with the approval appended; approvals keep insertion order
 * and are not deduplicated.
 *
 * @param hash      hash of the serialized header
 * @param header    the header
 * @param payment   payment item
 * @param session   session item
 * @param approvals signatures over {@code hash}
 *
 * @see sh.cask.core.builder.DeployBuilder
 * @see DeploySigner
 */
public record Deploy(
        Hash hash,
        DeployHeader header,
        ExecutableDeployItem payment,
        ExecutableDeployItem session,
        List<DeployApproval> approvals) {

    /**
     * @throws ValidationException if {@code hash} or {@code header.bodyHash} does not match
     *                             the recomputed value
     */
    public Deploy {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(header, "header cannot be null");
        Objects.requireNonNull(payment, "payment cannot be null");
        Objects.requireNonNull(session, "session cannot be null");
        Objects.requireNonNull(approvals, "approvals cannot be null");
        approvals = List.copyOf(approvals);
        final Hash bodyHash = DeployHashes.bodyHash(payment, session);
        if (!header.bodyHash().equals(bodyHash)) {
            throw new ValidationException(
                    "Body hash " + header.bodyHash() + " does not match payment and session (" + bodyHash + ")");
        }
        final Hash deployHash = DeployHashes.deployHash(header);
        if (!hash.equals(deployHash)) {
            throw new ValidationException("Deploy hash " + hash + " does not match header (" + deployHash + ")");
        }
    }

    public Deploy withApproval(final DeployApproval approval) {
        Objects.requireNonNull(approval, "approval cannot be null");
        final List<DeployApproval> next = new ArrayList<>(approvals.size() + 1);
        next.addAll(approvals);
        next.add(approval);
        return new Deploy(hash, header, payment, session, next);
    }

    /**
     * Recomputes both hashes and compares them with the stored ones. Always true for
     * a constructed instance.
     */
    public boolean isHashConsistent() {
        return header.bodyHash().equals(DeployHashes.bodyHash(payment, session))
                && hash.equals(DeployHashes.deployHash(header));
    }
}
