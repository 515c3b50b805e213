package org.descartes.validator.util;

import org.jgroups.Address;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import net.jcip.annotations.NotThreadSafe;

/**
 * Ordered, fixed-capacity list of validator slots. A slot's position is its permanent bit index.<p/>
 * Removing a validator tombstones its slot: the slot keeps its index, holds no identity and is never reassigned, so
 * the remaining validators are never renumbered. An identity to index map backs {@link #indexOf(Address)}.
 * @since  1.0
 */
@NotThreadSafe
public class Roster {
    protected final Address[]            slots;
    protected final Map<Address,Integer> index=new HashMap<>();


    public Roster(List<Address> validators) {
        Objects.requireNonNull(validators, "validators can not be null");
        if(validators.isEmpty() || validators.size() > ValidatorBitSet.MAX_CAPACITY)
            throw new IllegalArgumentException(String.format("roster size must be in [1..%d]: %d",
                                                             ValidatorBitSet.MAX_CAPACITY, validators.size()));
        slots=new Address[validators.size()];
        for(int i=0; i < slots.length; i++) {
            Address mbr=validators.get(i);
            if(mbr == null)
                throw new IllegalArgumentException(String.format("validator at slot %d is null", i));
            if(index.putIfAbsent(mbr, i) != null)
                throw new IllegalArgumentException(String.format("validator %s is listed twice", mbr));
            slots[i]=mbr;
        }
    }

    public int capacity() {return slots.length;}

    /** Returns the slot index of an occupied slot holding {@code mbr}, or -1 */
    public int indexOf(Address mbr) {
        if(mbr == null)
            return -1;
        Integer idx=index.get(mbr);
        return idx == null? -1 : idx;
    }

    /** Returns the identity in the given slot, or null if the slot was tombstoned */
    public Address validatorAt(int idx) {
        Objects.checkIndex(idx, slots.length);
        return slots[idx];
    }

    /** Vacates the slot for good. Returns the removed identity, or null if the slot was already tombstoned */
    public Address tombstone(int idx) {
        Objects.checkIndex(idx, slots.length);
        Address removed=slots[idx];
        if(removed != null) {
            slots[idx]=null;
            index.remove(removed);
        }
        return removed;
    }

    /** The bit-set of occupied slots */
    public ValidatorBitSet occupied() {
        ValidatorBitSet bs=ValidatorBitSet.empty(slots.length);
        for(int i=0; i < slots.length; i++)
            if(slots[i] != null)
                bs=bs.set(i);
        return bs;
    }

    @Override
    public String toString() {
        StringJoiner sj=new StringJoiner(", ", "[", "]");
        for(int i=0; i < slots.length; i++)
            sj.add(i + ":" + (slots[i] == null? "-" : slots[i]));
        return sj.toString();
    }
}
