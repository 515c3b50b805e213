package org.descartes.validator.coordinator;

import org.descartes.validator.Claim;
import org.descartes.validator.ClaimResult;
import org.descartes.validator.ValidatorManager;
import org.descartes.validator.configuration.Property;
import org.descartes.validator.configuration.RuntimeProperties;
import org.descartes.validator.logger.ClaimEventLogger;
import org.descartes.validator.logger.ClaimEventLogger.EventType;
import org.descartes.validator.util.TimeService;
import org.jgroups.Address;
import org.jgroups.logging.Log;
import org.jgroups.logging.LogFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import net.jcip.annotations.NotThreadSafe;

import static org.descartes.validator.configuration.RuntimeProperties.PROPERTY_PREFIX;

/**
 * Drives epochs through their phases and is the only caller of its {@link ValidatorManager}.
 *
 * <p>
 * An epoch starts in {@link Phase#INPUT_ACCUMULATION}. Once the input window expired, the next input notification or
 * claim seals the epoch and claims are forwarded to the validator manager. A conflict is handed to the
 * {@link DisputeManager} and claims are refused until its decision arrives through {@link #resolveDispute}. The epoch is
 * finalized as soon as all active validators agree, or through {@link #finalizeEpoch()} when the challenge period passed
 * without anybody contesting the current claim.
 * </p>
 *
 * <p>
 * Calls must be serialized by the owner, the same way the validator manager expects them.
 * </p>
 *
 * @since 1.0
 */
@NotThreadSafe
public final class EpochCoordinator {
    private static final Log log = LogFactory.getLog(EpochCoordinator.class);

    public static final String COORDINATOR_PROPERTY_PREFIX = PROPERTY_PREFIX + ".coordinator";

    public static final Property INPUT_DURATION = Property.create(COORDINATOR_PROPERTY_PREFIX + ".input-duration")
            .withDisplayName("Input duration")
            .withDescription("Milliseconds an epoch accepts inputs before it can be sealed")
            .withDefaultValue(Duration.ofDays(1).toMillis())
            .build();

    public static final Property CHALLENGE_PERIOD = Property.create(COORDINATOR_PROPERTY_PREFIX + ".challenge-period")
            .withDisplayName("Challenge period")
            .withDescription("Milliseconds after the last move before an uncontested claim can be finalized")
            .withDefaultValue(Duration.ofDays(7).toMillis())
            .build();

    private final Address self;
    private final ValidatorManager manager;
    private final DisputeManager disputeManager;
    private final ClaimEventLogger eventLogger;
    private final TimeService timeService;
    private final Duration inputDuration;
    private final Duration challengePeriod;
    private final List<Claim> finalizedClaims = new ArrayList<>();

    private Phase phase = Phase.INPUT_ACCUMULATION;
    private Instant inputAccumulationStart;
    private Instant roundStart;
    private Instant firstClaimTime;
    private Dispute pendingDispute;

    private EpochCoordinator(Builder builder) {
        this.self = builder.self;
        this.disputeManager = builder.disputeManager;
        this.eventLogger = builder.eventLogger;
        this.timeService = builder.timeService;
        this.inputDuration = Duration.ofMillis(builder.properties.getLong(INPUT_DURATION));
        this.challengePeriod = Duration.ofMillis(builder.properties.getLong(CHALLENGE_PERIOD));
        this.manager = ValidatorManager.builder(self)
                .withValidators(builder.validators)
                .withEventLogger(eventLogger)
                .withRuntimeProperties(builder.properties)
                .withTimeService(timeService)
                .build();
        this.inputAccumulationStart = timeService.now();
    }

    public static Builder builder(Address self) {
        return new Builder(self);
    }

    /**
     * Seals the accumulating epoch if its input window expired.
     *
     * @return true if the phase changed
     */
    public boolean notifyInput() {
        return sealIfExpired();
    }

    /**
     * Forwards a validator's claim for the sealed epoch.
     *
     * @throws IllegalStateException if the epoch is still accumulating inputs or a dispute is pending
     */
    public ClaimResult claim(Address validator, Claim claim) {
        sealIfExpired();
        if (phase != Phase.AWAITING_CONSENSUS)
            throw new IllegalStateException(String.format("claims are not accepted in phase %s", phase));

        ClaimResult result = manager.submitClaim(self, validator, claim);
        if (firstClaimTime == null)
            firstClaimTime = timeService.now();
        handle(result);
        return result;
    }

    /**
     * Applies the decision of the pending dispute.
     *
     * @throws IllegalStateException if no dispute is pending
     */
    public ClaimResult resolveDispute(Address winner, Address loser, Claim winningClaim) {
        if (phase != Phase.AWAITING_DISPUTE)
            throw new IllegalStateException(String.format("no dispute to resolve in phase %s", phase));

        ClaimResult result = manager.resolveDispute(self, winner, loser, winningClaim);
        pendingDispute = null;
        roundStart = timeService.now();
        changePhase(Phase.AWAITING_CONSENSUS);
        handle(result);
        return result;
    }

    /**
     * Finalizes the epoch with its current claim once the challenge period passed since the last move, that is the
     * later of the first claim and the start of the current round.
     *
     * @return the finalized claim
     * @throws IllegalStateException if there is nothing to finalize yet
     */
    public Claim finalizeEpoch() {
        if (phase != Phase.AWAITING_CONSENSUS)
            throw new IllegalStateException(String.format("epoch can not be finalized in phase %s", phase));
        if (manager.currentClaim().isNone())
            throw new IllegalStateException("there is no claim to finalize");

        Instant lastMove = firstClaimTime != null && firstClaimTime.isAfter(roundStart) ? firstClaimTime : roundStart;
        Instant deadline = lastMove.plus(challengePeriod);
        if (!timeService.now().isAfter(deadline))
            throw new IllegalStateException(String.format("challenge period runs until %s", deadline));

        log.info("challenge period expired, finalizing epoch %d without full agreement", currentEpoch());
        return finalizeCurrentEpoch();
    }

    public Phase phase() {
        return phase;
    }

    /**
     * Number of the epoch being settled, starting at 0.
     */
    public long currentEpoch() {
        return finalizedClaims.size();
    }

    public int numberOfFinalizedEpochs() {
        return finalizedClaims.size();
    }

    public Claim finalizedClaim(int epoch) {
        return finalizedClaims.get(Objects.checkIndex(epoch, finalizedClaims.size()));
    }

    public Optional<Dispute> pendingDispute() {
        return Optional.ofNullable(pendingDispute);
    }

    public ValidatorManager validatorManager() {
        return manager;
    }

    private boolean sealIfExpired() {
        if (phase != Phase.INPUT_ACCUMULATION)
            return false;

        Instant now = timeService.now();
        if (!now.isAfter(inputAccumulationStart.plus(inputDuration)))
            return false;

        roundStart = now;
        changePhase(Phase.AWAITING_CONSENSUS);
        return true;
    }

    private void handle(ClaimResult result) {
        switch (result.outcome()) {
            case CONFLICT -> {
                pendingDispute = Dispute.of(currentEpoch(), result);
                changePhase(Phase.AWAITING_DISPUTE);
                try {
                    disputeManager.initiateDispute(pendingDispute);
                } catch (Throwable t) {
                    log.error(String.format("dispute manager failed to start %s", pendingDispute), t);
                }
            }
            case CONSENSUS -> finalizeCurrentEpoch();
            default -> { }
        }
    }

    private Claim finalizeCurrentEpoch() {
        Claim finalized = manager.advanceEpoch(self);
        finalizedClaims.add(finalized);
        inputAccumulationStart = timeService.now();
        firstClaimTime = null;
        roundStart = null;
        changePhase(Phase.INPUT_ACCUMULATION);
        return finalized;
    }

    private void changePhase(Phase next) {
        if (phase == next)
            return;

        Phase previous = phase;
        phase = next;
        log.info("epoch %d: %s -> %s", currentEpoch(), previous, next);
        Map<String, String> details = Map.of(
                "epoch", String.valueOf(currentEpoch()),
                "from", previous.name(),
                "to", next.name());
        try {
            eventLogger.logEvent(ClaimEventLogger.create(EventType.PHASE_CHANGE, timeService.now(), details));
        } catch (Throwable t) {
            log.error(String.format("event logger failed to record phase change %s", details), t);
        }
    }

    public static final class Builder {
        private final Address self;
        private final List<Address> validators = new ArrayList<>();
        private DisputeManager disputeManager = DisputeManager.none();
        private ClaimEventLogger eventLogger = ClaimEventLogger.disabled();
        private RuntimeProperties properties = RuntimeProperties.empty();
        private TimeService timeService = TimeService.system();

        private Builder(Address self) {
            this.self = Objects.requireNonNull(self, "coordinator address can not be null");
        }

        public Builder withValidators(List<Address> validators) {
            this.validators.addAll(validators);
            return this;
        }

        public Builder withDisputeManager(DisputeManager disputeManager) {
            this.disputeManager = Objects.requireNonNull(disputeManager, "dispute manager can not be null");
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

        public EpochCoordinator build() {
            return new EpochCoordinator(this);
        }
    }
}
