package com.lattice.wfst.weight;

import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;

/** Tropical semiring value (min, +) stored as a float; arc type "standard". */
public final class TropicalWeight implements Weight {
    public static final WeightType<TropicalWeight> TYPE = new FloatWeightType<>(
            "tropical", "standard", TropicalWeight.class, false,
            v -> new TropicalWeight((float) v), TropicalWeight::value);

    public static final TropicalWeight ZERO = TYPE.zero();
    public static final TropicalWeight ONE = TYPE.one();

    private final float value;

    private TropicalWeight(float value) {
        this.value = value;
    }

    public static TropicalWeight of(float value) {
        return value == 0f ? ONE : new TropicalWeight(value);
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
        return o instanceof TropicalWeight other && Float.compare(value, other.value) == 0;
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
