package org.descartes.validator.util;

import java.util.StringJoiner;

import net.jcip.annotations.Immutable;

/**
 * Fixed-capacity set of roster slot indices, backed by a single int.<p/>
 * Instances are immutable: {@link #set(int)} and {@link #clear(int)} return a new bit-set, which lets callers stage
 * a complete change and commit it with a single assignment.
 * @since  1.0
 */
@Immutable
public final class ValidatorBitSet {
    public static final int MAX_CAPACITY=Integer.SIZE;

    private final int capacity;
    private final int bits;

    private ValidatorBitSet(int capacity, int bits) {
        this.capacity=capacity;
        this.bits=bits;
    }

    public static ValidatorBitSet empty(int capacity) {
        return new ValidatorBitSet(checkCapacity(capacity), 0);
    }

    /** All {@code capacity} low bits set */
    public static ValidatorBitSet full(int capacity) {
        checkCapacity(capacity);
        return new ValidatorBitSet(capacity, capacity == MAX_CAPACITY? -1 : (1 << capacity) - 1);
    }

    public static ValidatorBitSet of(int capacity, int bits) {
        checkCapacity(capacity);
        if(capacity < MAX_CAPACITY && (bits >>> capacity) != 0)
            throw new IllegalArgumentException(String.format("bits 0x%x exceed capacity %d", bits, capacity));
        return new ValidatorBitSet(capacity, bits);
    }

    public int     capacity()    {return capacity;}
    public int     toInt()       {return bits;}
    public boolean isEmpty()     {return bits == 0;}
    public int     cardinality() {return Integer.bitCount(bits);}

    public boolean get(int index) {
        return (bits & mask(index)) != 0;
    }

    public ValidatorBitSet set(int index) {
        int m=mask(index);
        return (bits & m) != 0? this : new ValidatorBitSet(capacity, bits | m);
    }

    public ValidatorBitSet clear(int index) {
        int m=mask(index);
        return (bits & m) == 0? this : new ValidatorBitSet(capacity, bits & ~m);
    }

    /** Returns the lowest index set, or -1 if the set is empty */
    public int lowestSetBit() {
        return bits == 0? -1 : Integer.numberOfTrailingZeros(bits);
    }

    public boolean isSubsetOf(ValidatorBitSet other) {
        return (bits & ~other.bits) == 0;
    }

    private int mask(int index) {
        if(index < 0 || index >= capacity)
            throw new IndexOutOfBoundsException(String.format("index %d, capacity %d", index, capacity));
        return 1 << index;
    }

    private static int checkCapacity(int capacity) {
        if(capacity < 1 || capacity > MAX_CAPACITY)
            throw new IllegalArgumentException(String.format("capacity must be in [1..%d]: %d", MAX_CAPACITY, capacity));
        return capacity;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;
        if(!(obj instanceof ValidatorBitSet))
            return false;
        ValidatorBitSet other=(ValidatorBitSet)obj;
        return capacity == other.capacity && bits == other.bits;
    }

    @Override
    public int hashCode() {
        return 31 * capacity + bits;
    }

    @Override
    public String toString() {
        StringJoiner sj=new StringJoiner(",", "{", "}");
        for(int i=0; i < capacity; i++)
            if(get(i))
                sj.add(String.valueOf(i));
        return sj.toString();
    }
}
