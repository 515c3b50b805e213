package org.descartes.validator;

import org.descartes.validator.exceptions.AuthorizationException;
import org.descartes.validator.exceptions.InvalidClaimException;
import org.descartes.validator.exceptions.InvariantViolationException;
import org.descartes.validator.exceptions.UnknownValidatorException;
import org.descartes.validator.tests.harness.Claims;
import org.descartes.validator.tests.harness.RecordingClaimListener;
import org.descartes.validator.util.ValidatorBitSet;
import org.jgroups.Address;
import org.jgroups.Global;
import org.jgroups.util.Util;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Claim submission and epoch rollover.
 *
 * @since 1.0
 */
@Test(groups = Global.FUNCTIONAL, singleThreaded = true)
public class ValidatorManagerTest {
    private static final Logger LOGGER = LogManager.getLogger(ValidatorManagerTest.class);

    protected static final Address orchestrator = Util.createRandomAddress("orchestrator"),
            a = Util.createRandomAddress("A"), b = Util.createRandomAddress("B"),
            c = Util.createRandomAddress("C"), outsider = Util.createRandomAddress("X");

    protected static final Claim X = Claims.filled(0x11), Y = Claims.filled(0x22), Z = Claims.filled(0x33);

    private ValidatorManager manager;
    private RecordingClaimListener listener;

    @BeforeMethod
    protected void create() {
        manager = ValidatorManager.builder(orchestrator)
                .withValidators(Arrays.asList(a, b, c))
                .build();
        listener = new RecordingClaimListener();
        manager.addClaimListener(listener);
    }

    public void testInitialState() {
        assertThat(manager.consensusGoalBitset()).isEqualTo(ValidatorBitSet.of(3, 0b111));
        assertThat(manager.agreementBitset().isEmpty()).isTrue();
        assertThat(manager.currentClaim()).isEqualTo(Claim.NONE);
        assertThat(manager.orchestrator()).isEqualTo(orchestrator);
        assertThat(manager.indexOf(b)).isEqualTo(1);
        assertThat(manager.validatorAt(2)).isEqualTo(c);
    }

    public void testAllAgree() {
        ClaimResult r = manager.submitClaim(orchestrator, a, X);
        assertThat(r).isEqualTo(ClaimResult.noConflict());
        assert manager.agreementBitset().toInt() == 0b001;
        assertThat(manager.currentClaim()).isEqualTo(X);

        r = manager.submitClaim(orchestrator, b, X);
        assertThat(r.outcome()).isEqualTo(Outcome.NO_CONFLICT);
        assert manager.agreementBitset().toInt() == 0b011;

        r = manager.submitClaim(orchestrator, c, X);
        LOGGER.info("result = {}", r);
        assertThat(r.outcome()).isEqualTo(Outcome.CONSENSUS);
        assertThat(r.claims()).containsExactly(X, Claim.NONE);
        assertThat(r.validators()).containsExactly(c, null);
        assert manager.agreementBitset().toInt() == 0b111;
        assertThat(manager.agreementBitset()).isEqualTo(manager.consensusGoalBitset());
    }

    public void testSingleValidatorReachesConsensusAlone() {
        ValidatorManager single = ValidatorManager.builder(orchestrator).withValidator(a).build();
        ClaimResult r = single.submitClaim(orchestrator, a, X);
        assertThat(r).isEqualTo(ClaimResult.consensus(X, a));
    }

    public void testConflict() {
        manager.submitClaim(orchestrator, a, X);
        ClaimResult r = manager.submitClaim(orchestrator, b, Y);
        LOGGER.info("result = {}", r);

        assertThat(r.outcome()).isEqualTo(Outcome.CONFLICT);
        assertThat(r.claims()).containsExactly(X, Y);
        assertThat(r.validators()).containsExactly(a, b);
        // the challenger is not added and the claim stays
        assert manager.agreementBitset().toInt() == 0b001;
        assertThat(manager.currentClaim()).isEqualTo(X);
    }

    public void testConflictReportsLowestEndorser() {
        manager.submitClaim(orchestrator, c, X);
        manager.submitClaim(orchestrator, b, X);
        ClaimResult r = manager.submitClaim(orchestrator, a, Y);
        // b has the lowest slot among the endorsers {b, c}, regardless of arrival order
        assertThat(r.validators()).containsExactly(b, a);
    }

    public void testResubmittingCurrentClaimAfterConflict() {
        manager.submitClaim(orchestrator, a, X);
        assertThat(manager.submitClaim(orchestrator, b, Y).outcome()).isEqualTo(Outcome.CONFLICT);

        ClaimResult r = manager.submitClaim(orchestrator, b, X);
        assertThat(r.outcome()).isEqualTo(Outcome.NO_CONFLICT);
        assert manager.agreementBitset().toInt() == 0b011;
        assertThat(listener.results.stream().map(ClaimResult::outcome))
                .containsExactly(Outcome.NO_CONFLICT, Outcome.CONFLICT, Outcome.NO_CONFLICT);
    }

    public void testRepeatedEndorsementIsIdempotent() {
        manager.submitClaim(orchestrator, a, X);
        manager.submitClaim(orchestrator, a, X);
        assert manager.agreementBitset().toInt() == 0b001;
    }

    public void testAdvanceEpoch() {
        manager.submitClaim(orchestrator, a, X);
        manager.submitClaim(orchestrator, b, X);
        ValidatorBitSet goal = manager.consensusGoalBitset();

        assertThat(manager.advanceEpoch(orchestrator)).isEqualTo(X);
        assert manager.agreementBitset().toInt() == 0;
        assertThat(manager.currentClaim()).isEqualTo(Claim.NONE);
        assertThat(manager.consensusGoalBitset()).isEqualTo(goal);
        assertThat(listener.finalized).containsExactly(X);

        // the next epoch starts over with a new baseline
        manager.submitClaim(orchestrator, b, Y);
        assertThat(manager.currentClaim()).isEqualTo(Y);
        assert manager.agreementBitset().toInt() == 0b010;
    }

    public void testAdvanceEpochWithoutClaims() {
        assertThat(manager.advanceEpoch(orchestrator)).isSameAs(Claim.NONE);
        assertThat(manager.advanceEpoch(orchestrator)).isSameAs(Claim.NONE);
    }

    public void testOnlyOrchestratorMutates() {
        assertThatThrownBy(() -> manager.submitClaim(a, a, X)).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> manager.submitClaim(null, a, X)).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> manager.resolveDispute(b, a, b, X)).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> manager.advanceEpoch(outsider)).isInstanceOf(AuthorizationException.class);
        assertUntouched();
    }

    public void testRejectsEmptyClaim() {
        assertThatThrownBy(() -> manager.submitClaim(orchestrator, a, Claim.NONE)).isInstanceOf(InvalidClaimException.class);
        assertThatThrownBy(() -> manager.submitClaim(orchestrator, a, null)).isInstanceOf(InvalidClaimException.class);
        assertUntouched();
    }

    public void testRejectsUnknownSender() {
        assertThatThrownBy(() -> manager.submitClaim(orchestrator, outsider, X))
                .isInstanceOf(UnknownValidatorException.class)
                .hasMessageContaining("not an active validator");
        assertUntouched();
    }

    public void testFailedCallLeavesStateIntact() {
        manager.submitClaim(orchestrator, a, X);
        ValidatorBitSet agreement = manager.agreementBitset();

        assertThatThrownBy(() -> manager.submitClaim(orchestrator, outsider, Y)).isInstanceOf(UnknownValidatorException.class);
        assertThatThrownBy(() -> manager.submitClaim(b, b, X)).isInstanceOf(AuthorizationException.class);

        assertThat(manager.agreementBitset()).isEqualTo(agreement);
        assertThat(manager.currentClaim()).isEqualTo(X);
        assertThat(listener.results).hasSize(1);
    }

    public void testConflictWithoutEndorserIsInvariantViolation() {
        // a is the only endorser of X and loses against b, but the winning claim is X itself:
        // X stays current while nobody endorses it any more
        manager.submitClaim(orchestrator, a, X);
        manager.resolveDispute(orchestrator, b, a, X);
        assertThat(manager.currentClaim()).isEqualTo(X);
        assertThat(manager.agreementBitset().isEmpty()).isTrue();

        assertThatThrownBy(() -> manager.submitClaim(orchestrator, c, Z)).isInstanceOf(InvariantViolationException.class);
        assertThat(manager.currentClaim()).isEqualTo(X);
        assertThat(manager.agreementBitset().isEmpty()).isTrue();
    }

    public void testListenerFailureDoesNotAbortCall() {
        manager.addClaimListener(result -> {
            throw new IllegalStateException("boom");
        });
        RecordingClaimListener last = new RecordingClaimListener();
        manager.addClaimListener(last);

        ClaimResult r = manager.submitClaim(orchestrator, a, X);
        assertThat(r.outcome()).isEqualTo(Outcome.NO_CONFLICT);
        assertThat(last.results).containsExactly(r);
        assertThat(manager.currentClaim()).isEqualTo(X);
    }

    public void testEventLoggerFailureDoesNotAbortCall() {
        ValidatorManager m = ValidatorManager.builder(orchestrator)
                .withValidators(Arrays.asList(a, b))
                .withEventLogger(event -> {
                    throw new IllegalStateException("indexer down");
                })
                .build();
        RecordingClaimListener recorder = new RecordingClaimListener();
        m.addClaimListener(recorder);

        ClaimResult r = m.submitClaim(orchestrator, a, X);
        assertThat(r).isEqualTo(ClaimResult.noConflict());
        assertThat(m.currentClaim()).isEqualTo(X);
        assert m.agreementBitset().toInt() == 0b001;

        assertThat(m.submitClaim(orchestrator, b, Y).outcome()).isEqualTo(Outcome.CONFLICT);
        r = m.resolveDispute(orchestrator, a, b, X);
        assertThat(r).isEqualTo(ClaimResult.consensus(X, a));
        assert m.consensusGoalBitset().toInt() == 0b001;

        assertThat(m.advanceEpoch(orchestrator)).isEqualTo(X);
        assertThat(m.currentClaim()).isEqualTo(Claim.NONE);
        // listeners are still notified after the logger failed
        assertThat(recorder.results).hasSize(3);
        assertThat(recorder.finalized).containsExactly(X);
    }

    public void testListenersSeeReturnedResults() {
        ClaimResult r1 = manager.submitClaim(orchestrator, a, X);
        ClaimResult r2 = manager.submitClaim(orchestrator, b, Y);
        manager.removeClaimListener(listener);
        manager.submitClaim(orchestrator, c, X);
        assertThat(listener.results).containsExactly(r1, r2);
    }

    public void testInvalidRoster() {
        assertThatThrownBy(() -> ValidatorManager.builder(orchestrator).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValidatorManager.builder(orchestrator).withValidators(Arrays.asList(a, a)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValidatorManager.builder(null)).isInstanceOf(NullPointerException.class);
    }

    private void assertUntouched() {
        assertThat(manager.currentClaim()).isEqualTo(Claim.NONE);
        assertThat(manager.agreementBitset().isEmpty()).isTrue();
        assertThat(manager.consensusGoalBitset()).isEqualTo(ValidatorBitSet.full(3));
        assertThat(listener.results).isEmpty();
    }
}
