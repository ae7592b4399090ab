package com.lattice.wfst.algo;

import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.io.FstError;
import com.lattice.wfst.io.FstFactory;
import com.lattice.wfst.io.FstFormatException;
import com.lattice.wfst.io.FstRegistry;

import lombok.extern.log4j.Log4j2;

/**
 * Builds a new FST of a named encoding from any FST, copying states in id
 * order, arcs in stored order and every final weight.
 *
 * <p>
 * Converting to the encoding the FST already has returns a fresh copy.
 */
@Log4j2
public final class Convert {

    private Convert() {
    }

    public static <W extends Weight> Fst<W> convert(Fst<W> fst, String fstType) {
        return convert(fst, fstType, FstRegistry.defaultRegistry());
    }

    /**
     * @return the converted FST, or null (logged) if {@code fstType} is not
     *         registered or cannot represent {@code fst}.
     */
    public static <W extends Weight> Fst<W> convert(Fst<W> fst, String fstType, FstRegistry registry) {
        FstFactory factory = registry.factory(fstType);
        if (factory == null) {
            log.error("{}: Convert: Unknown FST type \"{}\"", FstError.UNKNOWN_FST_TYPE, fstType);
            return null;
        }
        try {
            Fst<W> converted = factory.convert(fst);
            log.debug("Converted {} FST to {}: {} states", fst.type(), fstType, converted.numStates());
            return converted;
        } catch (FstFormatException e) {
            log.error("Convert: {}", e.getMessage());
            return null;
        }
    }
}
