package com.lattice.wfst.script;

import com.lattice.wfst.algo.Convert;
import com.lattice.wfst.algo.TopSort;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.io.FstRegistry;

import lombok.extern.log4j.Log4j2;

/** Algorithms over type-erased handles. */
@Log4j2
public final class FstScripts {

    private FstScripts() {
    }

    public static FstClass convert(FstClass fst, String fstType) {
        return convert(fst, fstType, FstRegistry.defaultRegistry());
    }

    /**
     * Converts to another encoding.
     *
     * @return a new handle, or null (logged) if the type is unknown or cannot
     *         represent the FST.
     */
    public static FstClass convert(FstClass fst, String fstType, FstRegistry registry) {
        Fst<?> converted = Convert.convert(fst.getFst(), fstType, registry);
        return converted == null ? null : FstClass.wrap(converted, fst.getConfig());
    }

    /** Sorts a mutable handle in place; false if it has a cycle. */
    public static boolean topSort(MutableFstClass fst) {
        return topSort(fst.getMutableFst());
    }

    private static <W extends Weight> boolean topSort(MutableFst<W> fst) {
        return TopSort.topSort(fst);
    }

    /**
     * Sorts any handle. A mutable handle is sorted in place; any other is
     * first copied into a vector FST. The returned handle is the one to use
     * from now on.
     */
    public static TopSortResult topSort(FstClass fst) {
        MutableFstClass target;
        if (fst instanceof MutableFstClass m) {
            target = m;
        } else {
            log.debug("Copying {} FST into a vector FST for sorting", fst.fstType());
            target = new VectorFstClass(fst);
        }
        return new TopSortResult(target, topSort(target));
    }

    /** The handle to use after a sort, and whether the FST was acyclic. */
    public record TopSortResult(MutableFstClass fst, boolean acyclic) {
    }
}
