package com.lattice.wfst.algo;

import static com.lattice.wfst.props.Properties.*;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.props.Properties;

import java.util.HashSet;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Computes structural properties directly from an FST, ignoring whatever the
 * FST has cached.
 */
@Log4j2
public final class PropertyComputer {

    private PropertyComputer() {
    }

    /** Every trinary property of {@code fst}; exactly one bit of each pair is set. */
    public static <W extends Weight> long compute(Fst<W> fst) {
        int n = fst.numStates();
        if (n == 0)
            return NULL_PROPERTIES;

        SccVisitor<W> sccVisitor = new SccVisitor<>();
        DfsVisit.visit(fst, sccVisitor, false);
        int[] scc = sccVisitor.scc();
        long props = sccVisitor.properties();

        props |= ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS
                | I_LABEL_SORTED | O_LABEL_SORTED | UNWEIGHTED | TOP_SORTED | STRING | UNWEIGHTED_CYCLES;
        WeightType<W> wt = fst.weightType();
        if (fst.start() != Fst.NO_STATE_ID && fst.start() != 0)
            props = flip(props, STRING, NOT_STRING);

        Set<Integer> ilabels = new HashSet<>();
        Set<Integer> olabels = new HashSet<>();
        int nfinal = 0;
        for (int s = 0; s < n; s++) {
            ilabels.clear();
            olabels.clear();
            Arc<W> prev = null;
            int narcs = 0;
            for (Arc<W> arc : fst.arcs(s)) {
                if (!ilabels.add(arc.ilabel()))
                    props = flip(props, I_DETERMINISTIC, NON_I_DETERMINISTIC);
                if (!olabels.add(arc.olabel()))
                    props = flip(props, O_DETERMINISTIC, NON_O_DETERMINISTIC);
                if (arc.ilabel() != arc.olabel())
                    props = flip(props, ACCEPTOR, NOT_ACCEPTOR);
                if (arc.isInputEpsilon() && arc.isOutputEpsilon())
                    props = flip(props, NO_EPSILONS, EPSILONS);
                if (arc.isInputEpsilon())
                    props = flip(props, NO_I_EPSILONS, I_EPSILONS);
                if (arc.isOutputEpsilon())
                    props = flip(props, NO_O_EPSILONS, O_EPSILONS);
                if (prev != null) {
                    if (arc.ilabel() < prev.ilabel())
                        props = flip(props, I_LABEL_SORTED, NOT_I_LABEL_SORTED);
                    if (arc.olabel() < prev.olabel())
                        props = flip(props, O_LABEL_SORTED, NOT_O_LABEL_SORTED);
                }
                if (!wt.isOne(arc.weight()) && !wt.isZero(arc.weight()))
                    props = flip(props, UNWEIGHTED, WEIGHTED);
                if (!wt.isOne(arc.weight()) && scc[s] >= 0 && scc[s] == scc[arc.nextState()])
                    props = flip(props, UNWEIGHTED_CYCLES, WEIGHTED_CYCLES);
                if (arc.nextState() <= s)
                    props = flip(props, TOP_SORTED, NOT_TOP_SORTED);
                if (arc.nextState() != s + 1)
                    props = flip(props, STRING, NOT_STRING);
                prev = arc;
                narcs++;
            }
            // A final state that is not the last one.
            if (nfinal > 0)
                props = flip(props, STRING, NOT_STRING);
            W fw = fst.finalWeight(s);
            if (!wt.isZero(fw)) {
                if (!wt.isOne(fw))
                    props = flip(props, UNWEIGHTED, WEIGHTED);
                nfinal++;
            } else if (narcs != 1) {
                props = flip(props, STRING, NOT_STRING);
            }
        }
        return props & TRINARY_PROPERTIES;
    }

    private static long flip(long props, long from, long to) {
        return (props & ~from) | to;
    }

    /**
     * Returns the properties of {@code fst} in {@code mask}. If {@code verify},
     * the stored known properties are checked against freshly computed ones
     * and a mismatch is logged; the computed value is returned.
     */
    public static long testProperties(Fst<?> fst, long mask, boolean verify) {
        if (!verify)
            return fst.properties(mask, true);
        long stored = fst.properties(FST_PROPERTIES, false);
        long computed = compute(fst) | (stored & BINARY_PROPERTIES);
        if (!Properties.compatProperties(stored, computed)) {
            long known = Properties.knownProperties(stored) & TRINARY_PROPERTIES;
            long wrong = (stored ^ computed) & known;
            log.error("Property check failed for {} FST: stored [{}] but computed [{}]",
                    fst.type(), Properties.toString(stored & wrong), Properties.toString(computed & wrong));
        }
        return computed & mask;
    }
}
