package org.descartes.validator.coordinator;

import org.descartes.validator.Claim;
import org.descartes.validator.ClaimResult;
import org.descartes.validator.Outcome;
import org.jgroups.Address;

/**
 * A conflict waiting for an external decision: the endorser of the current claim against the challenger.
 *
 * @since 1.0
 */
public record Dispute(long epoch, Claim currentClaim, Claim challengingClaim, Address endorser, Address challenger) {

    static Dispute of(long epoch, ClaimResult conflict) {
        if (conflict.outcome() != Outcome.CONFLICT)
            throw new IllegalArgumentException("not a conflict: " + conflict);
        return new Dispute(epoch, conflict.firstClaim(), conflict.secondClaim(), conflict.firstValidator(), conflict.secondValidator());
    }
}
