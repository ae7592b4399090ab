package com.lattice.wfst.util;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Test;

import static org.junit.Assert.*;

public class FstExplainTest {

    @Test
    public void testSummary() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.setInputSymbols(new SymbolTable("words"));
        String summary = FstExplain.summary(fst);
        assertTrue(summary.contains("FST type: vector"));
        assertTrue(summary.contains("Arc type: standard"));
        assertTrue(summary.contains("States: 3"));
        assertTrue(summary.contains("Arcs: 3"));
        assertTrue(summary.contains("Input symbols: words"));
        assertFalse(summary.contains("Output symbols"));
        assertTrue(summary.contains("acceptor"));
    }

    @Test
    public void testDumpStates() {
        String dump = FstExplain.dumpStates(TestFsts.transducer());
        assertTrue(dump.contains("[0] (START)"));
        assertTrue(dump.contains("[2] final=0.5"));
        assertTrue(dump.contains("5:6/1.0 -> 2"));
    }

    @Test
    public void testMermaid() {
        String mermaid = FstExplain.toMermaid(TestFsts.diamond());
        assertTrue(mermaid.startsWith("graph LR;"));
        assertTrue(mermaid.contains("s2((2));"));
        assertTrue(mermaid.contains("s0 -->|\"1:1/1.5\"| s1;"));
        assertTrue(mermaid.contains("style s0 stroke-width:3px;"));
    }
}
