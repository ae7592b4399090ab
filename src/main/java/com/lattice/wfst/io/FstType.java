package com.lattice.wfst.io;

import com.lattice.wfst.impl.CompactFst;
import com.lattice.wfst.impl.Compactor;
import com.lattice.wfst.impl.ConstFst;
import com.lattice.wfst.impl.LookaheadFst;
import com.lattice.wfst.impl.VectorFst;

import java.util.function.Supplier;

/** Built-in encodings and their factories. */
public enum FstType {
    VECTOR("vector", VectorFst.Factory::new),
    CONST("const", ConstFst.Factory::new),
    COMPACT_ACCEPTOR("compact_acceptor", () -> new CompactFst.Factory(Compactor.ACCEPTOR)),
    COMPACT_UNWEIGHTED("compact_unweighted", () -> new CompactFst.Factory(Compactor.UNWEIGHTED)),
    COMPACT_UNWEIGHTED_ACCEPTOR("compact_unweighted_acceptor",
            () -> new CompactFst.Factory(Compactor.UNWEIGHTED_ACCEPTOR)),
    COMPACT_STRING("compact_string", () -> new CompactFst.Factory(Compactor.STRING)),
    COMPACT_WEIGHTED_STRING("compact_weighted_string",
            () -> new CompactFst.Factory(Compactor.WEIGHTED_STRING)),
    ARC_LOOKAHEAD("arc_lookahead", () -> new LookaheadFst.Factory(LookaheadFst.Kind.ARC)),
    ILABEL_LOOKAHEAD("ilabel_lookahead", () -> new LookaheadFst.Factory(LookaheadFst.Kind.ILABEL)),
    OLABEL_LOOKAHEAD("olabel_lookahead", () -> new LookaheadFst.Factory(LookaheadFst.Kind.OLABEL));

    private final String typeName;
    private final Supplier<FstFactory> factory;

    FstType(String typeName, Supplier<FstFactory> factory) {
        this.typeName = typeName;
        this.factory = factory;
    }

    public String typeName() {
        return typeName;
    }

    public FstFactory newFactory() {
        return factory.get();
    }
}
