package com.lattice.wfst.api;

import java.util.Collection;

/**
 * An FST whose states, arcs and final weights can be changed in place.
 *
 * <p>
 * Every mutator keeps the cached properties consistent: properties that the
 * change may invalidate are forgotten, properties it certainly establishes
 * are set.
 */
public interface MutableFst<W extends Weight> extends Fst<W> {

    void setStart(int state);

    void setFinal(int state, W weight);

    /** Adds a non-final state with no arcs and returns its id. */
    int addState();

    /** Adds {@code n} states. */
    void addStates(int n);

    void addArc(int state, Arc<W> arc);

    /**
     * Deletes the given states and every arc into them. Surviving states are
     * renumbered densely, keeping their relative order.
     */
    void deleteStates(Collection<Integer> states);

    /** Deletes every state; the FST becomes empty. */
    void deleteStates();

    /** Deletes all arcs leaving a state. */
    void deleteArcs(int state);

    /** Overwrites the property bits selected by {@code mask}. */
    void setProperties(long props, long mask);

    void setInputSymbols(SymbolTable symbols);

    void setOutputSymbols(SymbolTable symbols);

    @Override
    MutableFst<W> copy();
}
