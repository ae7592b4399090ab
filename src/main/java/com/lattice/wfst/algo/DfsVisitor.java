package com.lattice.wfst.algo;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;

/**
 * Callbacks of a depth-first traversal, see {@link DfsVisit}. Returning false
 * from any boolean callback stops the traversal; states still on the stack
 * are then finished in order.
 */
public interface DfsVisitor<W extends Weight> {

    void initVisit(Fst<W> fst);

    /** A state is discovered; {@code root} is the root of its DFS tree. */
    boolean initState(int state, int root);

    /** Arc to an undiscovered state. */
    default boolean treeArc(int state, Arc<W> arc) {
        return true;
    }

    /** Arc to a state still on the stack: closes a cycle. */
    default boolean backArc(int state, Arc<W> arc) {
        return true;
    }

    /** Arc to a finished state. */
    default boolean forwardOrCrossArc(int state, Arc<W> arc) {
        return true;
    }

    /**
     * All arcs of a state are explored. {@code parent} is -1 and
     * {@code parentArc} null for a tree root.
     */
    void finishState(int state, int parent, Arc<W> parentArc);

    void finishVisit();
}
