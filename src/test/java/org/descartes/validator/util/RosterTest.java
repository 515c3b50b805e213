package org.descartes.validator.util;

import org.jgroups.Address;
import org.jgroups.Global;
import org.jgroups.util.Util;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @since 1.0
 */
@Test(groups=Global.FUNCTIONAL)
public class RosterTest {
    protected static final Address a=Util.createRandomAddress("A"), b=Util.createRandomAddress("B"),
      c=Util.createRandomAddress("C"), d=Util.createRandomAddress("D");

    public void testIndexIsPosition() {
        Roster roster=new Roster(Arrays.asList(a, b, c));
        assert roster.capacity() == 3;
        assert roster.indexOf(a) == 0 && roster.indexOf(b) == 1 && roster.indexOf(c) == 2;
        assert roster.indexOf(d) == -1;
        assert roster.indexOf(null) == -1;
        assert roster.occupied().equals(ValidatorBitSet.full(3));
    }

    public void testTombstoneKeepsOtherSlots() {
        Roster roster=new Roster(Arrays.asList(a, b, c));
        assert roster.tombstone(1) == b;
        assert roster.validatorAt(1) == null;
        assert roster.indexOf(b) == -1;
        assert roster.indexOf(c) == 2;
        assert roster.occupied().toInt() == 0b101;
        // second removal of the same slot is a no-op
        assert roster.tombstone(1) == null;
        assert roster.validatorAt(0) == a && roster.validatorAt(2) == c;
    }

    public void testInvalidRosters() {
        assertThatThrownBy(() -> new Roster(Collections.emptyList())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Roster(Arrays.asList(a, b, a))).isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("twice");
        assertThatThrownBy(() -> new Roster(Arrays.asList(a, null))).isInstanceOf(IllegalArgumentException.class);

        List<Address> many=new ArrayList<>();
        for(int i=0; i < 33; i++)
            many.add(Util.createRandomAddress("V" + i));
        assertThatThrownBy(() -> new Roster(many)).isInstanceOf(IllegalArgumentException.class);
        assert new Roster(many.subList(0, 32)).occupied().toInt() == -1;
    }
}
