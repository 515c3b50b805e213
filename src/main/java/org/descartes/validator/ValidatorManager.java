package org.descartes.validator;

import org.descartes.validator.configuration.Property;
import org.descartes.validator.configuration.RuntimeProperties;
import org.descartes.validator.internal.ValidatorManagerFactory;
import org.descartes.validator.logger.ClaimEventLogger;
import org.descartes.validator.metrics.ValidatorMetrics;
import org.descartes.validator.util.TimeService;
import org.descartes.validator.util.ValidatorBitSet;
import org.jgroups.Address;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.descartes.validator.configuration.RuntimeProperties.PROPERTY_PREFIX;

/**
 * Tracks which validators endorsed the claim of the current epoch and arbitrates between conflicting claims.
 *
 * <p>
 * The manager owns a fixed roster of validators. A validator's position in the roster is its permanent bit index.
 * Two bit-sets are kept over these indices: the <i>consensus goal</i>, holding every validator that is still active,
 * and the <i>agreement</i>, holding every validator that endorsed the current claim during the current epoch. The
 * agreement is always a subset of the goal, and consensus is reached exactly when both are equal.
 * </p>
 *
 * <h3>Authorization</h3>
 *
 * <p>
 * Only the orchestrator given at construction may call {@link #submitClaim}, {@link #resolveDispute} and
 * {@link #advanceEpoch}. Every other caller fails with an {@link org.descartes.validator.exceptions.AuthorizationException}.
 * </p>
 *
 * <h3>Ordering and atomicity</h3>
 *
 * <p>
 * Calls are expected one at a time, in the total order chosen by the orchestrator. The order is meaningful: the first
 * claim of an epoch becomes the baseline every later claim is compared with, and the endorser reported in a conflict
 * depends on which validators arrived before. Every mutating call either commits all of its changes or fails with a
 * {@link org.descartes.validator.exceptions.ValidatorException} before changing anything.
 * </p>
 *
 * <h3>Notifications</h3>
 *
 * <p>
 * After a call commits, every registered {@link ClaimListener} receives the returned {@link ClaimResult} and the
 * configured {@link ClaimEventLogger} receives a matching audit event.
 * </p>
 *
 * @since 1.0
 */
public interface ValidatorManager {

    Property UNKNOWN_LOSER_POLICY = Property.create(PROPERTY_PREFIX + ".validator.unknown-loser-policy")
            .withDisplayName("Unknown dispute loser policy")
            .withDescription("SKIP ignores a dispute loser that is no longer an active validator and keeps evaluating "
                    + "the outcome, REJECT fails the whole call")
            .withDefaultValue(UnknownLoserPolicy.SKIP)
            .build();

    /**
     * Submits a validator's claim for the current epoch.
     *
     * <p>
     * The first claim of an epoch is adopted as the current claim. A claim equal to the current one adds the validator
     * to the agreement, and completes the epoch with {@link Outcome#CONSENSUS} if the agreement now equals the goal.
     * A different claim yields {@link Outcome#CONFLICT} against the lowest-index endorser of the current claim, and
     * leaves the agreement untouched.
     * </p>
     *
     * @param caller the orchestrator
     * @param validator the validator submitting the claim
     * @param claim the claimed value, never {@link Claim#NONE}
     * @return the outcome with its claim and validator pairs
     * @throws org.descartes.validator.exceptions.AuthorizationException if the caller is not the orchestrator
     * @throws org.descartes.validator.exceptions.InvalidClaimException if the claim is {@link Claim#NONE}
     * @throws org.descartes.validator.exceptions.UnknownValidatorException if the validator is not active
     * @throws org.descartes.validator.exceptions.InvariantViolationException if a conflict has no endorser to report
     */
    ClaimResult submitClaim(Address caller, Address validator, Claim claim);

    /**
     * Records the outcome of an external dispute.
     *
     * <p>
     * The loser is removed for good: its slot is tombstoned and its bit cleared from both bit-sets. Then:
     * <ol>
     *     <li>if the winning claim is the current claim, the result is {@link Outcome#CONSENSUS} or
     *     {@link Outcome#NO_CONFLICT} depending on the remaining agreement;</li>
     *     <li>otherwise, if other validators still endorse the current claim, the dispute continues with a
     *     {@link Outcome#CONFLICT} between the lowest-index of them and the winner;</li>
     *     <li>otherwise the winning claim becomes the current claim, endorsed by the winner.</li>
     * </ol>
     * A loser that is not an active validator is handled according to {@link #UNKNOWN_LOSER_POLICY}.
     * </p>
     *
     * @param caller the orchestrator
     * @param winner the validator who won the dispute, must be active
     * @param loser the validator who lost the dispute
     * @param winningClaim the claim the winner defended, never {@link Claim#NONE}
     * @return the outcome with its claim and validator pairs
     * @throws IllegalArgumentException if winner and loser are the same validator
     */
    ClaimResult resolveDispute(Address caller, Address winner, Address loser, Claim winningClaim);

    /**
     * Closes the current epoch.
     *
     * <p>
     * Resets the current claim and the agreement. The consensus goal is kept as is.
     * </p>
     *
     * @param caller the orchestrator
     * @return the claim of the epoch that just ended, or {@link Claim#NONE} if nobody claimed
     */
    Claim advanceEpoch(Address caller);

    ValidatorBitSet agreementBitset();

    ValidatorBitSet consensusGoalBitset();

    Claim currentClaim();

    /**
     * Returns the identity at the given roster slot, or {@code null} if that validator was removed.
     */
    Address validatorAt(int index);

    /**
     * Returns the roster slot of an active validator, or -1.
     */
    int indexOf(Address validator);

    Address orchestrator();

    ValidatorMetrics metrics();

    void addClaimListener(ClaimListener listener);

    void removeClaimListener(ClaimListener listener);

    /**
     * Writes the roster, the agreement and the current claim. The orchestrator identity is not part of the snapshot.
     */
    void writeContentTo(DataOutput out) throws IOException;

    /**
     * Replaces the roster state, the agreement and the current claim with a snapshot.
     *
     * <p>
     * The snapshot must have the same roster size. A validator removed locally must be removed in the snapshot as well,
     * and an active slot must hold the same identity or be removed. Nothing changes when validation fails.
     * </p>
     *
     * @throws org.descartes.validator.exceptions.ValidatorException if the snapshot is unreadable or inconsistent
     */
    void readContentFrom(DataInput in);

    /**
     * Receives every committed result, in call order.
     */
    @FunctionalInterface
    interface ClaimListener {

        void onResult(ClaimResult result);

        default void onEpochFinalized(Claim claim) { }
    }

    enum UnknownLoserPolicy {
        SKIP,
        REJECT,
    }

    static Builder builder(Address orchestrator) {
        return new Builder(orchestrator);
    }

    final class Builder {
        private final Address orchestrator;
        private final List<Address> validators = new ArrayList<>();
        private ClaimEventLogger eventLogger = ClaimEventLogger.disabled();
        private RuntimeProperties properties = RuntimeProperties.empty();
        private TimeService timeService = TimeService.system();

        private Builder(Address orchestrator) {
            this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator can not be null");
        }

        public Builder withValidator(Address validator) {
            validators.add(validator);
            return this;
        }

        public Builder withValidators(List<Address> validators) {
            this.validators.addAll(validators);
            return this;
        }

        public Builder withEventLogger(ClaimEventLogger eventLogger) {
            this.eventLogger = Objects.requireNonNull(eventLogger, "event logger can not be null");
            return this;
        }

        public Builder withRuntimeProperties(RuntimeProperties properties) {
            this.properties = Objects.requireNonNull(properties, "properties can not be null");
            return this;
        }

        public Builder withTimeService(TimeService timeService) {
            this.timeService = Objects.requireNonNull(timeService, "time service can not be null");
            return this;
        }

        public ValidatorManager build() {
            return ValidatorManagerFactory.create(orchestrator, new ArrayList<>(validators), eventLogger, properties, timeService);
        }
    }
}
