// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.builder;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.cask.core.DebugLogger;
import sh.cask.core.LogFormatter;
import sh.cask.core.chain.ChainProfile;
import sh.cask.core.chain.ChainProfiles;
import sh.cask.core.cltype.CLValue;
import sh.cask.core.cltype.CLValues;
import sh.cask.core.cltype.SimpleType;
import sh.cask.core.crypto.PublicKey;
import sh.cask.core.deploy.Deploy;
import sh.cask.core.deploy.DeployHashes;
import sh.cask.core.deploy.DeployHeader;
import sh.cask.core.deploy.ExecutableDeployItem;
import sh.cask.core.deploy.RuntimeArgs;
import sh.cask.core.error.ValidationException;
import sh.cask.core.types.AccountHash;
import sh.cask.core.types.Hash;

/**
 * Builder for deploys.
 *
 * <p>
 * Chain name, ttl and gas price default to the builder's {@link ChainProfile}
 * ({@link ChainProfiles#TESTNET} unless given). Setters reject malformed values
 * immediately; {@link #build()} checks that the account, payment and session are set.
 *
 * <p>
 * The header timestamp is the current time of the builder's {@link Clock}, or the
 * pinned {@link #timestamp(Instant)}, minus 30 seconds to stay behind the node's
 * clock, truncated to milliseconds.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * Deploy deploy = DeployBuilder.create()
 *     .account(sender.publicKey())
 *     .standardPayment("100000000")
 *     .transfer("2500000000", target, 1L)
 *     .build();
 * Deploy signed = DeploySigner.signDeploy(deploy, sender);
 * }</pre>
 *
 * <p>Builders are not thread-safe; build one deploy per builder or per thread.
 */
public final class DeployBuilder {

    /** Subtracted from the base time so nodes with slightly slow clocks accept the deploy. */
    public static final Duration CLOCK_SKEW_MARGIN = Duration.ofSeconds(30);

    private PublicKey account;
    private String chainName;
    private long gasPrice;
    private long ttlMillis;
    private final List<Hash> dependencies = new ArrayList<>();
    private Clock clock = Clock.systemUTC();
    private Instant timestamp;
    private ExecutableDeployItem payment;
    private ExecutableDeployItem session;

    private DeployBuilder(final ChainProfile profile) {
        Objects.requireNonNull(profile, "profile cannot be null");
        this.chainName = profile.chainName();
        this.gasPrice = profile.defaultGasPrice();
        this.ttlMillis = profile.defaultTtl().toMillis();
    }

    /** Builder with {@link ChainProfiles#TESTNET} defaults. */
    public static DeployBuilder create() {
        return new DeployBuilder(ChainProfiles.TESTNET);
    }

    public static DeployBuilder create(final ChainProfile profile) {
        return new DeployBuilder(profile);
    }

    /**
     * Sets the sending account.
     *
     * @param account the account's public key
     * @return this builder for chaining
     */
    public DeployBuilder account(final PublicKey account) {
        this.account = account;
        return this;
    }

    public DeployBuilder chainName(final String chainName) {
        this.chainName = BuilderValidation.requireNotBlank(chainName, "chainName");
        return this;
    }

    public DeployBuilder gasPrice(final long gasPrice) {
        this.gasPrice = BuilderValidation.requirePositive(gasPrice, "gasPrice");
        return this;
    }

    public DeployBuilder ttl(final Duration ttl) {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        this.ttlMillis = BuilderValidation.requirePositive(ttl.toMillis(), "ttl");
        return this;
    }

    public DeployBuilder ttlMillis(final long ttlMillis) {
        this.ttlMillis = BuilderValidation.requirePositive(ttlMillis, "ttl");
        return this;
    }

    public DeployBuilder dependency(final Hash dependency) {
        dependencies.add(Objects.requireNonNull(dependency, "dependency cannot be null"));
        return this;
    }

    /**
     * @throws ValidationException if {@code dependencyHex} is not a 32-byte hex hash
     */
    public DeployBuilder dependency(final String dependencyHex) {
        dependencies.add(BuilderValidation.parseHash(dependencyHex, "dependency"));
        return this;
    }

    /**
     * Replaces the dependency list.
     */
    public DeployBuilder dependencies(final List<Hash> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies cannot be null");
        this.dependencies.clear();
        for (Hash dependency : dependencies) {
            dependency(dependency);
        }
        return this;
    }

    /**
     * Sets the clock that supplies the base time. Ignored once a timestamp is pinned.
     */
    public DeployBuilder clock(final Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        return this;
    }

    /**
     * Pins the base time, making {@link #build()} reproducible. The 30-second margin is
     * still subtracted.
     *
     * @param baseTime base time, or null to go back to the clock
     */
    public DeployBuilder timestamp(final @Nullable Instant baseTime) {
        this.timestamp = baseTime;
        return this;
    }

    public DeployBuilder payment(final ExecutableDeployItem payment) {
        this.payment = Objects.requireNonNull(payment, "payment cannot be null");
        return this;
    }

    /** @see ExecutableDeployItem#standardPayment(BigInteger) */
    public DeployBuilder standardPayment(final BigInteger amount) {
        return payment(ExecutableDeployItem.standardPayment(amount));
    }

    /** @see ExecutableDeployItem#standardPayment(String) */
    public DeployBuilder standardPayment(final String amount) {
        return payment(ExecutableDeployItem.standardPayment(amount));
    }

    public DeployBuilder session(final ExecutableDeployItem session) {
        this.session = Objects.requireNonNull(session, "session cannot be null");
        return this;
    }

    /**
     * Native transfer session with arguments {@code amount: U512}, {@code target: PublicKey}
     * and {@code id: Option<U64>}.
     *
     * @param amount motes, as decimal digits
     * @param target receiving account
     * @param id     transfer id, or null for {@code None}
     */
    public DeployBuilder transfer(final String amount, final PublicKey target, final @Nullable Long id) {
        return transfer(CLValues.u512(amount), CLValues.publicKey(target), id);
    }

    public DeployBuilder transfer(final BigInteger amount, final PublicKey target, final @Nullable Long id) {
        return transfer(CLValues.u512(amount), CLValues.publicKey(target), id);
    }

    /**
     * Transfer to an account hash; {@code target} is encoded as {@code ByteArray(32)}.
     */
    public DeployBuilder transfer(final String amount, final AccountHash target, final @Nullable Long id) {
        return transfer(CLValues.u512(amount), CLValues.accountHash(target), id);
    }

    public DeployBuilder moduleBytes(final byte[] wasm, final RuntimeArgs args) {
        return session(new ExecutableDeployItem.ModuleBytes(wasm, args));
    }

    public DeployBuilder storedContractByHash(final Hash contractHash, final String entryPoint, final RuntimeArgs args) {
        return session(new ExecutableDeployItem.StoredContractByHash(contractHash, entryPoint, args));
    }

    /**
     * @throws ValidationException if {@code contractHashHex} is not a 32-byte hex hash
     */
    public DeployBuilder storedContractByHash(final String contractHashHex, final String entryPoint, final RuntimeArgs args) {
        return storedContractByHash(BuilderValidation.parseHash(contractHashHex, "contractHash"), entryPoint, args);
    }

    public DeployBuilder storedContractByName(final String name, final String entryPoint, final RuntimeArgs args) {
        return session(new ExecutableDeployItem.StoredContractByName(
                BuilderValidation.requireNotBlank(name, "contract name"), entryPoint, args));
    }

    /**
     * @param version contract version, or null for the latest
     */
    public DeployBuilder storedVersionedContractByHash(
            final Hash contractHash, final @Nullable Long version, final String entryPoint, final RuntimeArgs args) {
        return session(new ExecutableDeployItem.StoredVersionedContractByHash(contractHash, version, entryPoint, args));
    }

    /**
     * @param version contract version, or null for the latest
     */
    public DeployBuilder storedVersionedContractByName(
            final String name, final @Nullable Long version, final String entryPoint, final RuntimeArgs args) {
        return session(new ExecutableDeployItem.StoredVersionedContractByName(
                BuilderValidation.requireNotBlank(name, "contract name"), version, entryPoint, args));
    }

    /**
     * Serializes payment and session, hashes the body, assembles the header and hashes
     * it. Nothing is hashed unless every check passes.
     *
     * @return the built deploy, without approvals
     * @throws ValidationException if account, payment or session is missing
     */
    public Deploy build() {
        final long start = System.nanoTime();
        final PublicKey sender = BuilderValidation.requireSet(account, "account");
        final ExecutableDeployItem pay = BuilderValidation.requireSet(payment, "payment");
        final ExecutableDeployItem sess = BuilderValidation.requireSet(session, "session");

        final long millis = headerTimestamp();
        final Hash bodyHash = DeployHashes.bodyHash(pay, sess);
        final DeployHeader header = new DeployHeader(
                sender, millis, ttlMillis, gasPrice, bodyHash, dependencies, chainName);
        final Hash hash = DeployHashes.deployHash(header);

        DebugLogger.logDeploy(LogFormatter.formatDeployBuilt(
                hash.value(), bodyHash.value(), chainName, sess.variantName(),
                (System.nanoTime() - start) / 1_000L));
        return new Deploy(hash, header, pay, sess, List.of());
    }

    private long headerTimestamp() {
        final Instant base = timestamp != null ? timestamp : clock.instant();
        final long millis = base.minus(CLOCK_SKEW_MARGIN).truncatedTo(ChronoUnit.MILLIS).toEpochMilli();
        if (millis < 0) {
            throw new ValidationException("timestamp is before the epoch: " + base);
        }
        return millis;
    }

    private DeployBuilder transfer(final CLValue amount, final CLValue target, final @Nullable Long id) {
        final CLValue transferId = id == null
                ? CLValues.optionNone(SimpleType.U64)
                : CLValues.optionSome(CLValues.u64(id));
        return session(new ExecutableDeployItem.Transfer(RuntimeArgs.builder()
                .add("amount", amount)
                .add("target", target)
                .add("id", transferId)
                .build()));
    }
}
