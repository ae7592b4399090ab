package com.lattice.wfst.algo;

import static com.lattice.wfst.props.Properties.*;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.Weight;

import java.util.ArrayList;
import java.util.List;

/** Renumbers the states of a mutable FST by a permutation. */
public final class StateSort {

    /** Properties that do not depend on state numbering. */
    static final long STATE_SORT_PROPERTIES = BINARY_PROPERTIES
            | ACCEPTOR | NOT_ACCEPTOR | I_DETERMINISTIC | NON_I_DETERMINISTIC
            | O_DETERMINISTIC | NON_O_DETERMINISTIC | EPSILONS | NO_EPSILONS
            | I_EPSILONS | NO_I_EPSILONS | O_EPSILONS | NO_O_EPSILONS
            | I_LABEL_SORTED | NOT_I_LABEL_SORTED | O_LABEL_SORTED | NOT_O_LABEL_SORTED
            | WEIGHTED | UNWEIGHTED | CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
            | ACCESSIBLE | NOT_ACCESSIBLE | CO_ACCESSIBLE | NOT_CO_ACCESSIBLE
            | WEIGHTED_CYCLES | UNWEIGHTED_CYCLES;

    private StateSort() {
    }

    /**
     * Moves state {@code s} to id {@code order[s]}. Arc order within a state
     * is kept.
     *
     * @throws IllegalArgumentException if {@code order} is not a permutation
     *                                  of the state ids.
     */
    public static <W extends Weight> void sort(MutableFst<W> fst, int[] order) {
        int n = fst.numStates();
        if (order.length != n)
            throw new IllegalArgumentException("Order has " + order.length + " entries for " + n + " states");
        boolean[] used = new boolean[n];
        boolean identity = true;
        for (int s = 0; s < n; s++) {
            int t = order[s];
            if (t < 0 || t >= n || used[t])
                throw new IllegalArgumentException("Order is not a permutation at state " + s);
            used[t] = true;
            identity &= t == s;
        }
        if (identity)
            return;

        long props = fst.properties(FST_PROPERTIES, false) & STATE_SORT_PROPERTIES;
        List<W> finals = new ArrayList<>(n);
        List<List<Arc<W>>> arcs = new ArrayList<>(n);
        for (int s = 0; s < n; s++) {
            finals.add(null);
            arcs.add(null);
        }
        for (int s = 0; s < n; s++) {
            finals.set(order[s], fst.finalWeight(s));
            List<Arc<W>> renumbered = new ArrayList<>(fst.numArcs(s));
            for (Arc<W> arc : fst.arcs(s))
                renumbered.add(arc.withNextState(order[arc.nextState()]));
            arcs.set(order[s], renumbered);
        }
        int start = fst.start();

        fst.deleteStates();
        fst.addStates(n);
        for (int s = 0; s < n; s++) {
            fst.setFinal(s, finals.get(s));
            for (Arc<W> arc : arcs.get(s))
                fst.addArc(s, arc);
        }
        if (start != Fst.NO_STATE_ID)
            fst.setStart(order[start]);
        fst.setProperties(props, FST_PROPERTIES);
    }
}
