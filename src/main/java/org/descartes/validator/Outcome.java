package org.descartes.validator;

/**
 * Result of a claim submission or a dispute outcome.
 *
 * <pre>
 *     Idle ── Claimed ── Agreeing ── Consensus
 *                │           │
 *                └─ Disputed ┘   (resolved externally, may shrink the goal)
 * </pre>
 *
 * @since 1.0
 */
public enum Outcome {

    /**
     * The claim stands and at least one active validator has not endorsed it yet.
     */
    NO_CONFLICT,

    /**
     * Every active validator endorsed the current claim, the agreement bit-set equals the consensus goal.
     */
    CONSENSUS,

    /**
     * Two different claims are on the table. The standoff is left for an external dispute which eventually reports a
     * winner and a loser through {@link ValidatorManager#resolveDispute}.
     */
    CONFLICT,
}
