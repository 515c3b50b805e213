package org.descartes.validator.internal;

import org.descartes.validator.Claim;
import org.descartes.validator.ClaimResult;
import org.descartes.validator.Outcome;
import org.descartes.validator.ValidatorManager;
import org.descartes.validator.exceptions.AuthorizationException;
import org.descartes.validator.exceptions.InvalidClaimException;
import org.descartes.validator.exceptions.InvariantViolationException;
import org.descartes.validator.exceptions.UnknownValidatorException;
import org.descartes.validator.exceptions.ValidatorException;
import org.descartes.validator.internal.metrics.ValidatorMetricsCollector;
import org.descartes.validator.logger.ClaimEventLogger;
import org.descartes.validator.logger.ClaimEventLogger.EventType;
import org.descartes.validator.metrics.ValidatorMetrics;
import org.descartes.validator.util.Roster;
import org.descartes.validator.util.ValidatorBitSet;
import org.jgroups.Address;
import org.jgroups.logging.Log;
import org.jgroups.logging.LogFactory;
import org.jgroups.util.Util;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import net.jcip.annotations.NotThreadSafe;

/**
 * Default implementation of the {@link ValidatorManager} interface.
 *
 * <p>
 * Every mutating call follows the same three steps: validate the arguments against the committed state, compute the new
 * bit-sets and claim into locals, then assign them. Nothing can fail once the assignment starts, which is what makes
 * a failed call leave the state untouched. Listeners and the event logger are notified last.
 * </p>
 *
 * @since 1.0
 * @see ValidatorManager
 */
@NotThreadSafe
final class ValidatorManagerImpl implements ValidatorManager {
    private static final Log log = LogFactory.getLog(ValidatorManagerImpl.class);

    private final Address orchestrator;
    private final Roster roster;
    private final UnknownLoserPolicy loserPolicy;
    private final ClaimEventLogger eventLogger;
    private final ValidatorManagerParameters parameters;
    private final ValidatorMetricsCollector metrics;
    private final List<ClaimListener> listeners = new CopyOnWriteArrayList<>();

    private ValidatorBitSet consensusGoal;
    private ValidatorBitSet agreement;
    private Claim currentClaim = Claim.NONE;

    ValidatorManagerImpl(ValidatorManagerParameters parameters) {
        this.parameters = parameters;
        this.orchestrator = Objects.requireNonNull(parameters.orchestrator(), "orchestrator can not be null");
        this.roster = new Roster(parameters.validators());
        this.loserPolicy = parameters.runtimeProperties().getEnum(UNKNOWN_LOSER_POLICY, UnknownLoserPolicy.class);
        this.eventLogger = parameters.eventLogger();
        this.consensusGoal = roster.occupied();
        this.agreement = ValidatorBitSet.empty(roster.capacity());

        boolean metricsEnabled = parameters.runtimeProperties().getBoolean(ValidatorMetrics.METRICS_ENABLED);
        this.metrics = new ValidatorMetricsCollector(metricsEnabled, roster::capacity, () -> consensusGoal.cardinality());
        log.debug("created validator manager with roster %s, loser policy %s", roster, loserPolicy);
    }

    @Override
    public ClaimResult submitClaim(Address caller, Address validator, Claim claim) {
        checkOrchestrator(caller);
        checkClaim(claim);
        int sender = roster.indexOf(validator);
        if (sender < 0)
            throw new UnknownValidatorException(validator);

        long start = metrics.start();
        Claim baseline = currentClaim.isNone() ? claim : currentClaim;
        ClaimResult result;
        if (!claim.equals(baseline)) {
            // The agreement is left as is, the standoff is settled by a dispute.
            result = ClaimResult.conflict(baseline, claim, lowestEndorser(agreement), validator);
        } else {
            ValidatorBitSet endorsed = agreement.set(sender);
            result = evaluate(endorsed, consensusGoal, baseline, validator);
            currentClaim = baseline;
            agreement = endorsed;
        }

        log.debug("claim %s from %s: %s", claim, validator, result);
        metrics.claimProcessed(result, start);
        publish(EventType.CLAIM_RECEIVED, result);
        return result;
    }

    @Override
    public ClaimResult resolveDispute(Address caller, Address winner, Address loser, Claim winningClaim) {
        checkOrchestrator(caller);
        checkClaim(winningClaim);
        if (Objects.equals(winner, loser))
            throw new IllegalArgumentException(String.format("winner and loser are both %s", winner));
        int winnerIdx = roster.indexOf(winner);
        if (winnerIdx < 0)
            throw new UnknownValidatorException(winner);
        int loserIdx = roster.indexOf(loser);
        if (loserIdx < 0 && loserPolicy == UnknownLoserPolicy.REJECT)
            throw new UnknownValidatorException(loser);

        long start = metrics.start();
        ValidatorBitSet goal = consensusGoal;
        ValidatorBitSet endorsed = agreement;
        if (loserIdx >= 0) {
            goal = goal.clear(loserIdx);
            endorsed = endorsed.clear(loserIdx);
        } else {
            log.warn("dispute loser %s is not an active validator, skipping removal", loser);
        }

        Claim claim = currentClaim;
        ClaimResult result;
        if (winningClaim.equals(claim)) {
            result = evaluate(endorsed, goal, claim, winner);
        } else if (!endorsed.isEmpty()) {
            // Someone else still backs the losing claim, the winner has to face them next.
            result = ClaimResult.conflict(claim, winningClaim, roster.validatorAt(endorsed.lowestSetBit()), winner);
        } else {
            claim = winningClaim;
            endorsed = endorsed.set(winnerIdx);
            result = evaluate(endorsed, goal, claim, winner);
        }

        // commit
        if (loserIdx >= 0)
            roster.tombstone(loserIdx);
        consensusGoal = goal;
        agreement = endorsed;
        currentClaim = claim;

        if (loserIdx >= 0) {
            log.info("removed validator %s (slot %d), goal is now %s", loser, loserIdx, goal);
            logEvent(EventType.VALIDATOR_REMOVED, Map.of("validator", String.valueOf(loser), "slot", String.valueOf(loserIdx)));
        }
        log.debug("dispute %s beat %s with %s: %s", winner, loser, winningClaim, result);
        metrics.disputeProcessed(result, loserIdx >= 0, start);
        publish(EventType.DISPUTE_RESOLVED, result);
        return result;
    }

    @Override
    public Claim advanceEpoch(Address caller) {
        checkOrchestrator(caller);

        Claim finalized = currentClaim;
        currentClaim = Claim.NONE;
        agreement = ValidatorBitSet.empty(roster.capacity());

        log.info("epoch finalized with claim %s", finalized);
        metrics.epochFinalized();
        logEvent(EventType.EPOCH_FINALIZED, Map.of("claim", finalized.toHex()));
        for (ClaimListener listener : listeners) {
            try {
                listener.onEpochFinalized(finalized);
            } catch (Throwable t) {
                log.error(String.format("listener %s failed on epoch finalization", listener), t);
            }
        }
        return finalized;
    }

    @Override
    public ValidatorBitSet agreementBitset() {
        return agreement;
    }

    @Override
    public ValidatorBitSet consensusGoalBitset() {
        return consensusGoal;
    }

    @Override
    public Claim currentClaim() {
        return currentClaim;
    }

    @Override
    public Address validatorAt(int index) {
        return roster.validatorAt(index);
    }

    @Override
    public int indexOf(Address validator) {
        return roster.indexOf(validator);
    }

    @Override
    public Address orchestrator() {
        return orchestrator;
    }

    @Override
    public ValidatorMetrics metrics() {
        return metrics.view();
    }

    @Override
    public void addClaimListener(ClaimListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener can not be null"));
    }

    @Override
    public void removeClaimListener(ClaimListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void writeContentTo(DataOutput out) throws IOException {
        out.writeInt(roster.capacity());
        for (int i = 0; i < roster.capacity(); i++) {
            Address mbr = roster.validatorAt(i);
            out.writeBoolean(mbr != null);
            if (mbr != null)
                Util.writeAddress(mbr, out);
        }
        out.writeInt(agreement.toInt());
        out.write(currentClaim.toBytes());
    }

    @Override
    public void readContentFrom(DataInput in) {
        Address[] slots;
        ValidatorBitSet endorsed;
        Claim claim;
        try {
            int capacity = in.readInt();
            if (capacity != roster.capacity())
                throw new ValidatorException(String.format("snapshot has %d slots, roster has %d", capacity, roster.capacity()));
            slots = new Address[capacity];
            for (int i = 0; i < capacity; i++)
                slots[i] = in.readBoolean() ? Util.readAddress(in) : null;
            endorsed = ValidatorBitSet.of(capacity, in.readInt());
            byte[] buf = new byte[Claim.SIZE];
            in.readFully(buf);
            claim = Claim.of(buf);
        } catch (IOException | ClassNotFoundException | IllegalArgumentException e) {
            throw new ValidatorException("failed reading validator snapshot", e);
        }

        ValidatorBitSet goal = roster.occupied();
        for (int i = 0; i < slots.length; i++) {
            Address local = roster.validatorAt(i);
            if (slots[i] == null)
                goal = goal.clear(i);
            else if (!slots[i].equals(local))
                throw new ValidatorException(String.format("snapshot slot %d holds %s, local slot holds %s", i, slots[i], local));
        }
        if (!endorsed.isSubsetOf(goal))
            throw new ValidatorException(String.format("snapshot agreement %s is not a subset of goal %s", endorsed, goal));
        if (!endorsed.isEmpty() && claim.isNone())
            throw new ValidatorException("snapshot agreement is not empty but there is no claim");

        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null && roster.validatorAt(i) != null)
                roster.tombstone(i);
        }
        consensusGoal = goal;
        agreement = endorsed;
        currentClaim = claim;
        log.info("restored snapshot: goal %s, agreement %s, claim %s", goal, endorsed, claim);
    }

    private void checkOrchestrator(Address caller) {
        if (!orchestrator.equals(caller))
            throw new AuthorizationException(caller);
    }

    private static void checkClaim(Claim claim) {
        if (claim == null || claim.isNone())
            throw new InvalidClaimException("claim can not be empty");
    }

    private static ClaimResult evaluate(ValidatorBitSet endorsed, ValidatorBitSet goal, Claim claim, Address validator) {
        return endorsed.equals(goal)
                ? ClaimResult.consensus(claim, validator)
                : ClaimResult.noConflict();
    }

    // Lowest slot index wins among the endorsers of the current claim.
    private Address lowestEndorser(ValidatorBitSet endorsed) {
        int idx = endorsed.lowestSetBit();
        if (idx < 0)
            throw new InvariantViolationException(String.format("conflict against claim %s without any endorser", currentClaim));
        return roster.validatorAt(idx);
    }

    private void publish(EventType type, ClaimResult result) {
        logEvent(type, Map.of(
                "outcome", result.outcome().name(),
                "claims", result.firstClaim().toHex() + "," + result.secondClaim().toHex(),
                "validators", result.firstValidator() + "," + result.secondValidator()));

        for (ClaimListener listener : listeners) {
            try {
                listener.onResult(result);
            } catch (Throwable t) {
                log.error(String.format("listener %s failed on %s", listener, result), t);
            }
        }
        if (result.outcome() == Outcome.CONSENSUS)
            log.info("consensus on claim %s, agreement %s", result.firstClaim(), agreement);
    }

    // Runs after the commit, failures are only logged.
    private void logEvent(EventType type, Map<String, String> details) {
        try {
            eventLogger.logEvent(ClaimEventLogger.create(type, parameters.timeService().now(), details));
        } catch (Throwable t) {
            log.error(String.format("event logger failed to record %s %s", type, details), t);
        }
    }

    @Override
    public String toString() {
        return String.format("roster=%s, goal=%s, agreement=%s, claim=%s", roster, consensusGoal, agreement, currentClaim);
    }
}
