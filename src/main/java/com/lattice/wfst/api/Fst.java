package com.lattice.wfst.api;

import com.lattice.wfst.io.FstOutput;
import com.lattice.wfst.io.FstWriteOptions;

import java.io.IOException;
import java.util.List;

/**
 * The automaton contract every concrete encoding implements.
 *
 * <p>
 * States are dense integers {@code 0 .. numStates() - 1}. Arcs of a state are
 * returned in their stored order, which is significant: determinism and
 * sortedness properties, conversion and serialization all depend on it.
 *
 * <p>
 * Algorithms are written once against this interface. The concrete encoding
 * (growable, constant, compacted, lookahead-indexed) is identified by
 * {@link #type()} and never needs to be known by the caller.
 *
 * @param <W> The weight type carried on arcs and final states.
 */
public interface Fst<W extends Weight> {

    int NO_STATE_ID = -1;

    /** Returns the start state, or {@link #NO_STATE_ID} if there is none. */
    int start();

    /** Returns the final weight of a state; {@code weightType().zero()} if non-final. */
    W finalWeight(int state);

    default boolean isFinal(int state) {
        return !weightType().isZero(finalWeight(state));
    }

    int numStates();

    int numArcs(int state);

    int numInputEpsilons(int state);

    int numOutputEpsilons(int state);

    /**
     * Returns the outgoing arcs of a state as an unmodifiable list. The list can
     * be traversed any number of times and always yields the same order.
     */
    List<Arc<W>> arcs(int state);

    /**
     * Returns the stored properties selected by {@code mask}. If {@code test} is
     * true, properties in the mask that are unknown are computed first and
     * cached.
     */
    long properties(long mask, boolean test);

    /** Name of the concrete encoding, e.g. "vector" or "const". */
    String type();

    WeightType<W> weightType();

    default String arcType() {
        return weightType().arcType();
    }

    /** May be null. */
    SymbolTable inputSymbols();

    /** May be null. */
    SymbolTable outputSymbols();

    /** Returns an independent FST of the same encoding. */
    Fst<W> copy();

    /**
     * Writes header, symbol tables and body.
     *
     * @throws IOException if the underlying stream faults.
     */
    void write(FstOutput out, FstWriteOptions options) throws IOException;

    /** Total number of arcs across all states. */
    default long numArcsTotal() {
        long total = 0;
        for (int s = 0; s < numStates(); s++)
            total += numArcs(s);
        return total;
    }
}
