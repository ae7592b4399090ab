package com.lattice.wfst.props;

import com.lattice.wfst.algo.PropertyComputer;
import com.lattice.wfst.api.Fst;

/**
 * Mutable cache of structural properties for one FST.
 *
 * <p>
 * Each {@link Property} is unknown, known true or known false. Known
 * properties are trusted; {@link #verify(Property, Fst)} is the only way an
 * unknown property becomes known without a caller asserting it.
 */
public final class PropertySet {
    private long bits;

    public PropertySet() {
        this(0L);
    }

    public PropertySet(long bits) {
        this.bits = bits;
    }

    public boolean known(Property p) {
        return (bits & p.mask()) != 0;
    }

    /**
     * Returns the value of a known property.
     *
     * @throws IllegalStateException if the property is unknown.
     */
    public boolean value(Property p) {
        if (!known(p))
            throw new IllegalStateException("Property " + p + " is unknown");
        return (bits & p.trueBit()) != 0;
    }

    public void setKnownTrue(Property p) {
        bits = (bits & ~p.mask()) | p.trueBit();
    }

    public void setKnownFalse(Property p) {
        bits = (bits & ~p.mask()) | p.falseBit();
    }

    /** Forgets a property. */
    public void clear(Property p) {
        bits &= ~p.mask();
    }

    /** Overwrites the bits selected by {@code mask} with those of {@code props}. */
    public void set(long props, long mask) {
        bits = (bits & ~mask) | (props & mask);
    }

    public long get(long mask) {
        return bits & mask;
    }

    public long bits() {
        return bits;
    }

    /** Bits whose value is known, see {@link Properties#knownProperties(long)}. */
    public long knownMask() {
        return Properties.knownProperties(bits);
    }

    /**
     * Returns the value of {@code p}, computing it from the structure of
     * {@code fst} first if it is unknown. Computation fills in every trinary
     * property at once and caches all of them.
     */
    public boolean verify(Property p, Fst<?> fst) {
        if (!known(p)) {
            long computed = PropertyComputer.compute(fst);
            long unknown = Properties.TRINARY_PROPERTIES & ~knownMask();
            bits |= computed & unknown;
        }
        return value(p);
    }

    @Override
    public String toString() {
        return Properties.toString(bits);
    }
}
