package com.lattice.wfst.weight;

import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;

/** Double-precision log semiring value; arc type "log64". */
public final class Log64Weight implements Weight {
    public static final WeightType<Log64Weight> TYPE = new FloatWeightType<>(
            "log64", "log64", Log64Weight.class, true,
            Log64Weight::new, Log64Weight::value);

    public static final Log64Weight ZERO = TYPE.zero();
    public static final Log64Weight ONE = TYPE.one();

    private final double value;

    private Log64Weight(double value) {
        this.value = value;
    }

    public static Log64Weight of(double value) {
        return value == 0.0 ? ONE : new Log64Weight(value);
    }

    public double value() {
        return value;
    }

    @Override
    public String typeName() {
        return TYPE.name();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Log64Weight other && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return value == Double.POSITIVE_INFINITY ? "Infinity" : Double.toString(value);
    }
}
