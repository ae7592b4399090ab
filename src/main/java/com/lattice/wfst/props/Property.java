package com.lattice.wfst.props;

/**
 * A single trinary structural predicate, identified by its positive and
 * negative bits in the property word.
 */
public enum Property {
    ACCEPTOR(Properties.ACCEPTOR, Properties.NOT_ACCEPTOR),
    I_DETERMINISTIC(Properties.I_DETERMINISTIC, Properties.NON_I_DETERMINISTIC),
    O_DETERMINISTIC(Properties.O_DETERMINISTIC, Properties.NON_O_DETERMINISTIC),
    EPSILONS(Properties.EPSILONS, Properties.NO_EPSILONS),
    I_EPSILONS(Properties.I_EPSILONS, Properties.NO_I_EPSILONS),
    O_EPSILONS(Properties.O_EPSILONS, Properties.NO_O_EPSILONS),
    I_LABEL_SORTED(Properties.I_LABEL_SORTED, Properties.NOT_I_LABEL_SORTED),
    O_LABEL_SORTED(Properties.O_LABEL_SORTED, Properties.NOT_O_LABEL_SORTED),
    WEIGHTED(Properties.WEIGHTED, Properties.UNWEIGHTED),
    CYCLIC(Properties.CYCLIC, Properties.ACYCLIC),
    INITIAL_CYCLIC(Properties.INITIAL_CYCLIC, Properties.INITIAL_ACYCLIC),
    TOP_SORTED(Properties.TOP_SORTED, Properties.NOT_TOP_SORTED),
    ACCESSIBLE(Properties.ACCESSIBLE, Properties.NOT_ACCESSIBLE),
    CO_ACCESSIBLE(Properties.CO_ACCESSIBLE, Properties.NOT_CO_ACCESSIBLE),
    STRING(Properties.STRING, Properties.NOT_STRING),
    WEIGHTED_CYCLES(Properties.WEIGHTED_CYCLES, Properties.UNWEIGHTED_CYCLES);

    private final long trueBit;
    private final long falseBit;

    Property(long trueBit, long falseBit) {
        this.trueBit = trueBit;
        this.falseBit = falseBit;
    }

    public long trueBit() {
        return trueBit;
    }

    public long falseBit() {
        return falseBit;
    }

    /** Both bits of the pair. */
    public long mask() {
        return trueBit | falseBit;
    }
}
