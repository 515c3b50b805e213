package org.descartes.validator;

import org.jgroups.Address;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of a mutating call together with the claim pair and the validator pair it refers to.
 *
 * <ul>
 *     <li>{@link Outcome#NO_CONFLICT}: (none, none), (null, null).</li>
 *     <li>{@link Outcome#CONSENSUS}: (agreed claim, none), (validator that completed the agreement, null).</li>
 *     <li>{@link Outcome#CONFLICT}: (current claim, challenging claim), (endorser of the current claim, challenger).</li>
 * </ul>
 *
 * Listeners receive the exact instance returned to the caller.
 *
 * @since 1.0
 */
public record ClaimResult(Outcome outcome, Claim firstClaim, Claim secondClaim, Address firstValidator, Address secondValidator) {

    private static final ClaimResult NO_CONFLICT = new ClaimResult(Outcome.NO_CONFLICT, Claim.NONE, Claim.NONE, null, null);

    public ClaimResult {
        Objects.requireNonNull(outcome, "outcome can not be null");
        Objects.requireNonNull(firstClaim, "claim can not be null, use Claim.NONE");
        Objects.requireNonNull(secondClaim, "claim can not be null, use Claim.NONE");
    }

    public static ClaimResult noConflict() {
        return NO_CONFLICT;
    }

    public static ClaimResult consensus(Claim claim, Address validator) {
        return new ClaimResult(Outcome.CONSENSUS, claim, Claim.NONE, validator, null);
    }

    public static ClaimResult conflict(Claim currentClaim, Claim challengingClaim, Address endorser, Address challenger) {
        return new ClaimResult(Outcome.CONFLICT, currentClaim, challengingClaim, endorser, challenger);
    }

    public List<Claim> claims() {
        return List.of(firstClaim, secondClaim);
    }

    public List<Address> validators() {
        return Collections.unmodifiableList(Arrays.asList(firstValidator, secondValidator));
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", outcome, claims(), validators());
    }
}
