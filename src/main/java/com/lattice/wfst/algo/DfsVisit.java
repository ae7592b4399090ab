package com.lattice.wfst.algo;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Iterative three-colour depth-first traversal.
 *
 * <p>
 * The search starts at the start state, then restarts from every state still
 * unvisited in id order (unless {@code accessOnly}). An FST without a start
 * state is searched from state 0 upward. The explicit stack keeps deep
 * automata off the Java call stack.
 */
public final class DfsVisit {
    private static final byte WHITE = 0; // undiscovered
    private static final byte GREY = 1; // on the stack
    private static final byte BLACK = 2; // finished

    private DfsVisit() {
    }

    public static <W extends Weight> void visit(Fst<W> fst, DfsVisitor<W> visitor, boolean accessOnly) {
        visitor.initVisit(fst);
        int n = fst.numStates();
        int start = fst.start();
        if (n == 0 || (start == Fst.NO_STATE_ID && accessOnly)) {
            visitor.finishVisit();
            return;
        }
        byte[] color = new byte[n];
        int[] stateStack = new int[16];
        int[] arcStack = new int[16];
        List<List<Arc<W>>> arcLists = new ArrayList<>();
        int depth = 0;
        boolean dfs = true;

        int root = start == Fst.NO_STATE_ID ? 0 : start;
        while (dfs && root < n) {
            color[root] = GREY;
            stateStack[0] = root;
            arcStack[0] = 0;
            arcLists.clear();
            arcLists.add(fst.arcs(root));
            depth = 1;
            dfs = visitor.initState(root, root);

            while (depth > 0) {
                int s = stateStack[depth - 1];
                List<Arc<W>> arcs = arcLists.get(depth - 1);
                int ai = arcStack[depth - 1];
                if (!dfs || ai >= arcs.size()) {
                    color[s] = BLACK;
                    depth--;
                    arcLists.remove(depth);
                    if (depth > 0) {
                        int p = stateStack[depth - 1];
                        visitor.finishState(s, p, arcLists.get(depth - 1).get(arcStack[depth - 1]));
                        arcStack[depth - 1]++;
                    } else {
                        visitor.finishState(s, -1, null);
                    }
                    continue;
                }
                Arc<W> arc = arcs.get(ai);
                int next = arc.nextState();
                switch (color[next]) {
                    case WHITE -> {
                        dfs = visitor.treeArc(s, arc);
                        if (!dfs)
                            continue;
                        color[next] = GREY;
                        if (depth == stateStack.length) {
                            stateStack = Arrays.copyOf(stateStack, depth * 2);
                            arcStack = Arrays.copyOf(arcStack, depth * 2);
                        }
                        stateStack[depth] = next;
                        arcStack[depth] = 0;
                        arcLists.add(fst.arcs(next));
                        depth++;
                        dfs = visitor.initState(next, root);
                    }
                    case GREY -> {
                        dfs = visitor.backArc(s, arc);
                        arcStack[depth - 1]++;
                    }
                    default -> {
                        dfs = visitor.forwardOrCrossArc(s, arc);
                        arcStack[depth - 1]++;
                    }
                }
            }
            if (accessOnly)
                break;
            // Next tree root.
            root = root == start ? 0 : root + 1;
            while (root < n && color[root] != WHITE)
                root++;
        }
        visitor.finishVisit();
    }
}
