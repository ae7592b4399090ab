package com.lattice.wfst.algo;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.props.Properties;

import java.util.Arrays;

/**
 * Tarjan's strongly connected components over a {@link DfsVisit}.
 *
 * <p>
 * Yields per-state SCC ids (numbered in topological order of the component
 * graph), accessibility and co-accessibility, and the cyclic, initial-cyclic,
 * accessible and co-accessible property pairs.
 */
public final class SccVisitor<W extends Weight> implements DfsVisitor<W> {
    private Fst<W> fst;
    private int start;
    private int[] scc;
    private boolean[] access;
    private boolean[] coaccess;
    private int[] dfnumber;
    private int[] lowlink;
    private boolean[] onstack;
    private int[] sccStack;
    private int sccTop;
    private int nstates;
    private int nscc;
    private long props;

    @Override
    public void initVisit(Fst<W> fst) {
        this.fst = fst;
        this.start = fst.start();
        int n = fst.numStates();
        scc = new int[n];
        Arrays.fill(scc, -1);
        access = new boolean[n];
        coaccess = new boolean[n];
        dfnumber = new int[n];
        Arrays.fill(dfnumber, -1);
        lowlink = new int[n];
        onstack = new boolean[n];
        sccStack = new int[n];
        sccTop = 0;
        nstates = 0;
        nscc = 0;
        props = Properties.ACYCLIC | Properties.INITIAL_ACYCLIC | Properties.ACCESSIBLE | Properties.CO_ACCESSIBLE;
    }

    @Override
    public boolean initState(int s, int root) {
        sccStack[sccTop++] = s;
        dfnumber[s] = nstates;
        lowlink[s] = nstates;
        onstack[s] = true;
        if (root == start && start != Fst.NO_STATE_ID) {
            access[s] = true;
        } else {
            props |= Properties.NOT_ACCESSIBLE;
            props &= ~Properties.ACCESSIBLE;
        }
        nstates++;
        return true;
    }

    @Override
    public boolean backArc(int s, Arc<W> arc) {
        int t = arc.nextState();
        if (dfnumber[t] < lowlink[s])
            lowlink[s] = dfnumber[t];
        if (coaccess[t])
            coaccess[s] = true;
        props |= Properties.CYCLIC;
        props &= ~Properties.ACYCLIC;
        if (t == start) {
            props |= Properties.INITIAL_CYCLIC;
            props &= ~Properties.INITIAL_ACYCLIC;
        }
        return true;
    }

    @Override
    public boolean forwardOrCrossArc(int s, Arc<W> arc) {
        int t = arc.nextState();
        if (dfnumber[t] < dfnumber[s] && onstack[t] && dfnumber[t] < lowlink[s])
            lowlink[s] = dfnumber[t];
        if (coaccess[t])
            coaccess[s] = true;
        return true;
    }

    @Override
    public void finishState(int s, int parent, Arc<W> parentArc) {
        if (fst.isFinal(s))
            coaccess[s] = true;
        if (dfnumber[s] == lowlink[s]) {
            // s is the root of a component.
            boolean sccCoaccess = false;
            int i = sccTop;
            int t;
            do {
                t = sccStack[--i];
                if (coaccess[t])
                    sccCoaccess = true;
            } while (s != t);
            do {
                t = sccStack[--sccTop];
                scc[t] = nscc;
                if (sccCoaccess)
                    coaccess[t] = true;
                onstack[t] = false;
            } while (s != t);
            if (!sccCoaccess) {
                props |= Properties.NOT_CO_ACCESSIBLE;
                props &= ~Properties.CO_ACCESSIBLE;
            }
            nscc++;
        }
        if (parent != -1) {
            if (coaccess[s])
                coaccess[parent] = true;
            if (lowlink[s] < lowlink[parent])
                lowlink[parent] = lowlink[s];
        }
    }

    @Override
    public void finishVisit() {
        // Tarjan finishes components in reverse topological order.
        for (int s = 0; s < scc.length; s++)
            if (scc[s] >= 0)
                scc[s] = nscc - 1 - scc[s];
    }

    /** Component id per state; -1 for states the search did not reach. */
    public int[] scc() {
        return scc;
    }

    public int numScc() {
        return nscc;
    }

    public boolean[] access() {
        return access;
    }

    public boolean[] coaccess() {
        return coaccess;
    }

    /** The cyclic, initial-cyclic, accessible and co-accessible pairs. */
    public long properties() {
        return props;
    }
}
