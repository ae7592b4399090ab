package com.lattice.wfst.weight;

import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstOutput;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.function.DoubleFunction;
import java.util.function.ToDoubleFunction;

/**
 * {@link WeightType} for semirings whose values are a single float (4 bytes)
 * or double (8 bytes), with zero at +infinity and one at 0.
 */
final class FloatWeightType<W extends Weight> implements WeightType<W> {
    private final String name;
    private final String arcType;
    private final Class<W> weightClass;
    private final boolean doublePrecision;
    private final DoubleFunction<W> factory;
    private final ToDoubleFunction<W> value;
    private final W zero;
    private final W one;

    FloatWeightType(String name, String arcType, Class<W> weightClass, boolean doublePrecision,
            DoubleFunction<W> factory, ToDoubleFunction<W> value) {
        this.name = name;
        this.arcType = arcType;
        this.weightClass = weightClass;
        this.doublePrecision = doublePrecision;
        this.factory = factory;
        this.value = value;
        this.zero = factory.apply(Double.POSITIVE_INFINITY);
        this.one = factory.apply(0.0);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String arcType() {
        return arcType;
    }

    @Override
    public Class<W> weightClass() {
        return weightClass;
    }

    @Override
    public W zero() {
        return zero;
    }

    @Override
    public W one() {
        return one;
    }

    @Override
    public int byteSize() {
        return doublePrecision ? 8 : 4;
    }

    @Override
    public W read(FstInput in) throws IOException {
        return factory.apply(doublePrecision ? in.readDouble() : in.readFloat());
    }

    @Override
    public void write(W weight, FstOutput out) throws IOException {
        if (doublePrecision)
            out.writeDouble(value.applyAsDouble(weight));
        else
            out.writeFloat((float) value.applyAsDouble(weight));
    }

    @Override
    public W get(ByteBuffer buffer, int offset) {
        return factory.apply(doublePrecision ? buffer.getDouble(offset) : buffer.getFloat(offset));
    }

    @Override
    public String toString() {
        return name;
    }
}
