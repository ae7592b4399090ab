package com.lattice.wfst.script;

import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.io.FstRegistry;

/** Handle over a {@link VectorFst}. */
public class VectorFstClass extends MutableFstClass {

    VectorFstClass(MutableFst<?> fst, FstConfig config) {
        super(fst, config);
    }

    /**
     * An empty FST of a registered arc type.
     *
     * @throws IllegalArgumentException if the arc type is not registered.
     */
    public VectorFstClass(String arcType) {
        this(arcType, FstConfig.defaults());
    }

    public VectorFstClass(String arcType, FstConfig config) {
        super(empty(requireWeightType(arcType)), config);
    }

    /** A vector copy of any handle. */
    public VectorFstClass(FstClass other) {
        super(copy(other.getFst()), other.getConfig());
    }

    private static WeightType<?> requireWeightType(String arcType) {
        WeightType<?> wt = FstRegistry.defaultRegistry().weightType(arcType);
        if (wt == null)
            throw new IllegalArgumentException("Unknown arc type: " + arcType);
        return wt;
    }

    private static <W extends Weight> VectorFst<W> empty(WeightType<W> wt) {
        return new VectorFst<>(wt);
    }

    private static <W extends Weight> VectorFst<W> copy(Fst<W> fst) {
        return VectorFst.copyOf(fst);
    }
}
