package org.descartes.validator.coordinator;

/**
 * Phase of the epoch currently being settled.
 *
 * <pre>
 *     INPUT_ACCUMULATION ── AWAITING_CONSENSUS ──┬── (finalized) ── INPUT_ACCUMULATION
 *                                 ↑              │
 *                                 └─ AWAITING_DISPUTE
 * </pre>
 *
 * @since 1.0
 */
public enum Phase {

    /**
     * The epoch is open for inputs. Claims are accepted only once the input window expired.
     */
    INPUT_ACCUMULATION,

    /**
     * The epoch is sealed and validators are submitting claims.
     */
    AWAITING_CONSENSUS,

    /**
     * Two claims conflict and the coordinator waits for the dispute outcome.
     */
    AWAITING_DISPUTE,
}
