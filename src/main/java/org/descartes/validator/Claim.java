package org.descartes.validator;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * A 32-byte claim over the final state of an epoch.
 *
 * <p>
 * The all-zero value is the empty sentinel {@link #NONE}: it is what {@link ValidatorManager#currentClaim()} returns
 * before any submission in an epoch, and it is never accepted as a submitted claim.
 * </p>
 *
 * @since 1.0
 */
@Immutable
public final class Claim {

    public static final int SIZE = 32;

    public static final Claim NONE = new Claim(new byte[SIZE]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] value;

    private Claim(byte[] value) {
        this.value = value;
    }

    /**
     * Creates a claim from a copy of the given bytes.
     *
     * @param value exactly {@link #SIZE} bytes
     * @return the claim, {@link #NONE} if all bytes are zero
     */
    public static Claim of(byte[] value) {
        Objects.requireNonNull(value, "claim value can not be null");
        if (value.length != SIZE)
            throw new IllegalArgumentException(String.format("claim must have %d bytes: %d", SIZE, value.length));

        for (byte b : value) {
            if (b != 0) return new Claim(value.clone());
        }
        return NONE;
    }

    /**
     * Parses 64 hex digits, with or without a {@code 0x} prefix.
     */
    public static Claim fromHex(String hex) {
        Objects.requireNonNull(hex, "hex can not be null");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return of(HEX.parseHex(digits));
    }

    public boolean isNone() {
        return this == NONE || Arrays.equals(value, NONE.value);
    }

    public byte[] toBytes() {
        return value.clone();
    }

    public String toHex() {
        return "0x" + HEX.formatHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Claim)) return false;
        return Arrays.equals(value, ((Claim) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return isNone() ? "none" : toHex().substring(0, 10) + "..";
    }
}
