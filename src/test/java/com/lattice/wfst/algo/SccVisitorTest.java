package com.lattice.wfst.algo;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.lattice.wfst.TestFsts.arc;
import static org.junit.Assert.*;

public class SccVisitorTest {

    @Test
    public void testComponentsInTopologicalOrder() {
        // 0 -> {1 <-> 2} -> 3
        VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalWeight.TYPE);
        fst.addStates(4);
        fst.setStart(0);
        fst.addArc(0, arc(1, 1, 0f, 1));
        fst.addArc(1, arc(2, 2, 0f, 2));
        fst.addArc(2, arc(3, 3, 0f, 1));
        fst.addArc(2, arc(4, 4, 0f, 3));
        fst.setFinal(3, TropicalWeight.ONE);

        SccVisitor<TropicalWeight> scc = new SccVisitor<>();
        DfsVisit.visit(fst, scc, false);
        assertEquals(3, scc.numScc());
        assertArrayEquals(new int[] { 0, 1, 1, 2 }, scc.scc());
        assertEquals(Properties.CYCLIC | Properties.INITIAL_ACYCLIC | Properties.ACCESSIBLE
                | Properties.CO_ACCESSIBLE, scc.properties());
    }

    @Test
    public void testAccessAndCoaccess() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.addStates(2);
        fst.addArc(0, arc(5, 5, 0f, 3));

        SccVisitor<TropicalWeight> scc = new SccVisitor<>();
        DfsVisit.visit(fst, scc, false);
        assertArrayEquals(new boolean[] { true, true, true, true, false }, scc.access());
        assertArrayEquals(new boolean[] { true, true, true, false, false }, scc.coaccess());
        assertEquals(Properties.ACYCLIC | Properties.INITIAL_ACYCLIC | Properties.NOT_ACCESSIBLE
                | Properties.NOT_CO_ACCESSIBLE, scc.properties());
    }

    @Test
    public void testAccessOnlyVisitsFromStart() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.addState();
        List<Integer> seen = new ArrayList<>();
        DfsVisit.visit(fst, new DfsVisitor<TropicalWeight>() {
            @Override
            public void initVisit(Fst<TropicalWeight> f) {
            }

            @Override
            public boolean initState(int s, int root) {
                seen.add(s);
                return true;
            }

            @Override
            public void finishState(int s, int parent, Arc<TropicalWeight> parentArc) {
            }

            @Override
            public void finishVisit() {
            }
        }, true);
        assertEquals(List.of(0, 1, 2), seen);
    }
}
