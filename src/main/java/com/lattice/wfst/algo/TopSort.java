package com.lattice.wfst.algo;

import static com.lattice.wfst.props.Properties.*;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.Weight;

import lombok.extern.log4j.Log4j2;

/**
 * Topological sort: renumbers the states so that every arc goes from a lower
 * to a higher state id.
 *
 * <p>
 * Every state is ordered, including states unreachable from the start. A
 * cycle is a finding, not an error: the FST is left untouched.
 */
@Log4j2
public final class TopSort {
    private static final long ORDER_PROPERTIES = CYCLIC | ACYCLIC | INITIAL_CYCLIC | INITIAL_ACYCLIC
            | TOP_SORTED | NOT_TOP_SORTED;

    private TopSort() {
    }

    /**
     * Sorts {@code fst} in place.
     *
     * @return true if the FST is acyclic and was sorted; false if it has a
     *         cycle, in which case nothing, not even the property cache, was
     *         changed.
     */
    public static <W extends Weight> boolean topSort(MutableFst<W> fst) {
        int[] order = topOrder(fst);
        if (order == null) {
            log.debug("TopSort: cycle found in {} FST with {} states", fst.type(), fst.numStates());
            return false;
        }
        StateSort.sort(fst, order);
        fst.setProperties(ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED, ORDER_PROPERTIES);
        return true;
    }

    /**
     * Computes a topological order without changing {@code fst}.
     *
     * @return {@code order[s]} = new id of state {@code s}, or null if the FST
     *         has a cycle.
     */
    public static <W extends Weight> int[] topOrder(Fst<W> fst) {
        TopOrderVisitor<W> visitor = new TopOrderVisitor<>();
        DfsVisit.visit(fst, visitor, false);
        return visitor.acyclic ? visitor.order : null;
    }

    /** Numbers states by reverse DFS finish time; stops at the first back arc. */
    private static final class TopOrderVisitor<W extends Weight> implements DfsVisitor<W> {
        private int[] finishOrder;
        private int finished;
        private int[] order;
        private boolean acyclic;

        @Override
        public void initVisit(Fst<W> fst) {
            finishOrder = new int[fst.numStates()];
            finished = 0;
            acyclic = true;
        }

        @Override
        public boolean initState(int state, int root) {
            return true;
        }

        @Override
        public boolean backArc(int state, Arc<W> arc) {
            acyclic = false;
            return false;
        }

        @Override
        public void finishState(int state, int parent, Arc<W> parentArc) {
            finishOrder[finished++] = state;
        }

        @Override
        public void finishVisit() {
            if (!acyclic)
                return;
            int n = finishOrder.length;
            order = new int[n];
            for (int i = 0; i < n; i++)
                order[finishOrder[i]] = n - 1 - i;
        }
    }
}
