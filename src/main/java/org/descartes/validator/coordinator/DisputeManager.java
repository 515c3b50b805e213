package org.descartes.validator.coordinator;

/**
 * External process deciding disputes.
 *
 * <p>
 * The coordinator hands over every conflict and then waits in {@link Phase#AWAITING_DISPUTE}. How the winner is found
 * is not the coordinator's concern; the decision comes back through {@link EpochCoordinator#resolveDispute}.
 * </p>
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DisputeManager {

    void initiateDispute(Dispute dispute);

    static DisputeManager none() {
        return dispute -> { };
    }
}
