package com.lattice.wfst.api;

import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstOutput;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Describes a semiring to the core: its names, its two distinguished values
 * and its fixed-width binary encoding.
 *
 * <p>
 * {@link #zero()} marks a non-final state; {@link #one()} is the weight of an
 * unweighted arc. Both are used only for bookkeeping (property computation,
 * compaction), never for arithmetic.
 *
 * @param <W> The weight value class.
 */
public interface WeightType<W extends Weight> {

    /** Semiring name, e.g. "tropical". */
    String name();

    /** Arc type name persisted in FST headers, e.g. "standard". */
    String arcType();

    Class<W> weightClass();

    W zero();

    W one();

    /** Number of bytes {@link #write} produces for any value. */
    int byteSize();

    W read(FstInput in) throws IOException;

    void write(W weight, FstOutput out) throws IOException;

    /** Decodes a value stored at an absolute offset of a little-endian buffer. */
    W get(ByteBuffer buffer, int offset);

    default boolean isZero(W weight) {
        return zero().equals(weight);
    }

    default boolean isOne(W weight) {
        return one().equals(weight);
    }

    /**
     * Casts an erased weight to this type.
     *
     * @throws IllegalArgumentException if the weight belongs to another semiring.
     */
    default W cast(Weight weight) {
        if (!weightClass().isInstance(weight))
            throw new IllegalArgumentException(
                    "Weight " + weight + " is not a " + name() + " weight");
        return weightClass().cast(weight);
    }
}
