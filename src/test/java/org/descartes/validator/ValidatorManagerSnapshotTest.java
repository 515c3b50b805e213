package org.descartes.validator;

import org.descartes.validator.exceptions.ValidatorException;
import org.descartes.validator.tests.harness.Claims;
import org.descartes.validator.util.ValidatorBitSet;
import org.jgroups.Address;
import org.jgroups.Global;
import org.jgroups.util.Util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Writing the manager state and restoring it into a fresh instance with the same roster.
 */
@Test(groups = Global.FUNCTIONAL, singleThreaded = true)
public class ValidatorManagerSnapshotTest {

    protected static final Address orchestrator = Util.createRandomAddress("orchestrator"),
            a = Util.createRandomAddress("A"), b = Util.createRandomAddress("B"),
            c = Util.createRandomAddress("C");

    protected static final Claim X = Claims.filled(0x11), Y = Claims.filled(0x22);

    public void testRestoreIntoFreshManager() throws IOException {
        ValidatorManager source = create(a, b, c);
        source.submitClaim(orchestrator, a, X);
        source.submitClaim(orchestrator, b, Y);
        source.resolveDispute(orchestrator, a, b, X);
        source.submitClaim(orchestrator, a, X);

        ValidatorManager target = create(a, b, c);
        target.readContentFrom(read(write(source)));

        assertThat(target.consensusGoalBitset()).isEqualTo(source.consensusGoalBitset());
        assertThat(target.agreementBitset()).isEqualTo(source.agreementBitset());
        assertThat(target.currentClaim()).isEqualTo(X);
        assertThat(target.validatorAt(1)).isNull();
        assertThat(target.indexOf(b)).isEqualTo(-1);

        // the restored manager continues where the source stopped
        assertThat(target.submitClaim(orchestrator, c, X)).isEqualTo(ClaimResult.consensus(X, c));
    }

    public void testRestoreEmptyEpoch() throws IOException {
        ValidatorManager source = create(a, b);
        ValidatorManager target = create(a, b);
        target.submitClaim(orchestrator, a, X);

        target.readContentFrom(read(write(source)));
        assertThat(target.currentClaim()).isEqualTo(Claim.NONE);
        assertThat(target.agreementBitset().isEmpty()).isTrue();
        assertThat(target.consensusGoalBitset()).isEqualTo(ValidatorBitSet.full(2));
    }

    public void testRosterSizeMismatch() throws IOException {
        byte[] snapshot = write(create(a, b, c));
        ValidatorManager target = create(a, b);

        assertThatThrownBy(() -> target.readContentFrom(read(snapshot)))
                .isInstanceOf(ValidatorException.class)
                .hasMessageContaining("3 slots");
    }

    public void testRemovedValidatorCanNotBeRevived() throws IOException {
        byte[] snapshot = write(create(a, b, c));

        ValidatorManager target = create(a, b, c);
        target.submitClaim(orchestrator, a, X);
        target.submitClaim(orchestrator, c, Y);
        target.resolveDispute(orchestrator, a, c, X);
        ValidatorBitSet goal = target.consensusGoalBitset(), agreement = target.agreementBitset();

        assertThatThrownBy(() -> target.readContentFrom(read(snapshot))).isInstanceOf(ValidatorException.class);
        assertThat(target.consensusGoalBitset()).isEqualTo(goal);
        assertThat(target.agreementBitset()).isEqualTo(agreement);
        assertThat(target.currentClaim()).isEqualTo(X);
        assertThat(target.validatorAt(2)).isNull();
    }

    public void testDifferentIdentityRejected() throws IOException {
        byte[] snapshot = write(create(a, b, c));
        ValidatorManager target = create(a, c, b);

        assertThatThrownBy(() -> target.readContentFrom(read(snapshot)))
                .isInstanceOf(ValidatorException.class)
                .hasMessageContaining("slot 1");
        assertThat(target.consensusGoalBitset()).isEqualTo(ValidatorBitSet.full(3));
    }

    public void testTruncatedSnapshot() throws IOException {
        ValidatorManager source = create(a, b);
        source.submitClaim(orchestrator, a, X);
        byte[] snapshot = write(source);
        byte[] truncated = Arrays.copyOf(snapshot, snapshot.length - 8);

        ValidatorManager target = create(a, b);
        assertThatThrownBy(() -> target.readContentFrom(read(truncated)))
                .isInstanceOf(ValidatorException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(target.currentClaim()).isEqualTo(Claim.NONE);
    }

    private static ValidatorManager create(Address... validators) {
        return ValidatorManager.builder(orchestrator)
                .withValidators(Arrays.asList(validators))
                .build();
    }

    private static byte[] write(ValidatorManager manager) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(baos)) {
            manager.writeContentTo(out);
        }
        return baos.toByteArray();
    }

    private static DataInputStream read(byte[] snapshot) {
        return new DataInputStream(new ByteArrayInputStream(snapshot));
    }
}
