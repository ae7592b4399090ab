package com.lattice.wfst.weight;

import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;

/** Log semiring value (-log(e^-x + e^-y), +) stored as a float; arc type "log". */
public final class LogWeight implements Weight {
    public static final WeightType<LogWeight> TYPE = new FloatWeightType<>(
            "log", "log", LogWeight.class, false,
            v -> new LogWeight((float) v), LogWeight::value);

    public static final LogWeight ZERO = TYPE.zero();
    public static final LogWeight ONE = TYPE.one();

    private final float value;

    private LogWeight(float value) {
        this.value = value;
    }

    public static LogWeight of(float value) {
        return value == 0f ? ONE : new LogWeight(value);
    }

    public float value() {
        return value;
    }

    @Override
    public String typeName() {
        return TYPE.name();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LogWeight other && Float.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Float.hashCode(value);
    }

    @Override
    public String toString() {
        return value == Float.POSITIVE_INFINITY ? "Infinity" : Float.toString(value);
    }
}
