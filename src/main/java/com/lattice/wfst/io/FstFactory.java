package com.lattice.wfst.io;

import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;

import java.io.IOException;

/** Reads and builds one concrete encoding, for any weight type. */
public interface FstFactory {

    /** Encoding name written in headers, e.g. "const". */
    String type();

    /**
     * Materializes an FST of this encoding. If {@code options.getHeader()} is
     * null the stream is positioned at the header, otherwise just after it.
     */
    <W extends Weight> Fst<W> read(FstInput in, FstReadOptions options, WeightType<W> weightType)
            throws IOException;

    /**
     * Builds an equivalent FST of this encoding from any FST.
     *
     * @throws FstFormatException {@link FstError#TYPE_MISMATCH} if the encoding
     *                            cannot represent {@code fst}.
     */
    <W extends Weight> Fst<W> convert(Fst<W> fst) throws FstFormatException;
}
