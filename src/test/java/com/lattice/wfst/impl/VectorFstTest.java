package com.lattice.wfst.impl;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstWriteOptions;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static com.lattice.wfst.TestFsts.arc;
import static org.junit.Assert.*;

public class VectorFstTest {

    @Test
    public void testEmpty() {
        VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalWeight.TYPE);
        assertEquals(0, fst.numStates());
        assertEquals(Fst.NO_STATE_ID, fst.start());
        assertEquals("vector", fst.type());
        assertEquals("standard", fst.arcType());
        assertEquals(Properties.NULL_PROPERTIES | Properties.EXPANDED | Properties.MUTABLE,
                fst.properties(Properties.FST_PROPERTIES, false));
    }

    @Test
    public void testBuild() {
        VectorFst<TropicalWeight> fst = TestFsts.transducer();
        assertEquals(3, fst.numStates());
        assertEquals(0, fst.start());
        assertEquals(2, fst.numArcs(0));
        assertEquals(3, fst.numArcsTotal());
        assertEquals(1, fst.numInputEpsilons(0));
        assertEquals(1, fst.numOutputEpsilons(0));
        assertEquals(1, fst.numOutputEpsilons(1));
        assertEquals(0, fst.numInputEpsilons(1));
        assertTrue(fst.isFinal(2));
        assertFalse(fst.isFinal(0));
        assertEquals(TropicalWeight.ZERO, fst.finalWeight(0));
        assertEquals(arc(5, 6, 1f, 2), fst.arcs(0).get(1));
    }

    @Test
    public void testMutationsUpdateProperties() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        assertEquals(Properties.ACCEPTOR, fst.properties(Properties.ACCEPTOR | Properties.NOT_ACCEPTOR, false));
        assertEquals(Properties.TOP_SORTED, fst.properties(Properties.TOP_SORTED, false));

        fst.addArc(2, arc(7, 8, 0f, 0));
        assertEquals(Properties.NOT_ACCEPTOR, fst.properties(Properties.ACCEPTOR | Properties.NOT_ACCEPTOR, false));
        assertEquals(Properties.NOT_TOP_SORTED, fst.properties(Properties.TOP_SORTED | Properties.NOT_TOP_SORTED, false));
        // Not known until computed
        assertEquals(0, fst.properties(Properties.CYCLIC | Properties.ACYCLIC, false));
        assertEquals(Properties.CYCLIC, fst.properties(Properties.CYCLIC | Properties.ACYCLIC, true));
        // Cached after computing
        assertEquals(Properties.CYCLIC, fst.properties(Properties.CYCLIC | Properties.ACYCLIC, false));
    }

    @Test
    public void testSetPropertiesKeepsBinaryBits() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.setProperties(0L, Properties.FST_PROPERTIES);
        assertEquals(Properties.EXPANDED | Properties.MUTABLE, fst.properties(Properties.FST_PROPERTIES, false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testArcToMissingState() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.addArc(0, arc(1, 1, 0f, 3));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testMissingState() {
        TestFsts.diamond().finalWeight(5);
    }

    @Test
    public void testDeleteStatesRenumbers() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.addArc(2, arc(4, 4, 0f, 0));
        fst.deleteStates(List.of(1));

        assertEquals(2, fst.numStates());
        assertEquals(0, fst.start());
        // Arcs into the deleted state are gone, others follow the renumbering
        assertEquals(List.of(arc(3, 3, 0f, 1)), List.copyOf(fst.arcs(0)));
        assertEquals(List.of(arc(4, 4, 0f, 0)), List.copyOf(fst.arcs(1)));
        assertTrue(fst.isFinal(1));
    }

    @Test
    public void testDeleteStartState() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.deleteStates(List.of(0));
        assertEquals(Fst.NO_STATE_ID, fst.start());
        assertEquals(2, fst.numStates());
    }

    @Test
    public void testDeleteAllStates() {
        VectorFst<TropicalWeight> fst = TestFsts.transducer();
        fst.deleteStates();
        assertEquals(0, fst.numStates());
        assertEquals(Fst.NO_STATE_ID, fst.start());
        assertEquals(Properties.ACCEPTOR, fst.properties(Properties.ACCEPTOR, false));
    }

    @Test
    public void testDeleteArcs() {
        VectorFst<TropicalWeight> fst = TestFsts.transducer();
        fst.deleteArcs(0);
        assertEquals(0, fst.numArcs(0));
        assertEquals(0, fst.numInputEpsilons(0));
        assertEquals(0, fst.numOutputEpsilons(0));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testArcsViewIsReadOnly() {
        TestFsts.diamond().arcs(0).add(arc(1, 1, 0f, 1));
    }

    @Test
    public void testCopyIsDeep() {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        VectorFst<TropicalWeight> copy = fst.copy();
        copy.addArc(0, arc(9, 9, 0f, 0));
        assertEquals(2, fst.numArcs(0));
        assertEquals(3, copy.numArcs(0));
    }

    @Test
    public void testWriteThenRead() throws IOException {
        VectorFst<TropicalWeight> fst = TestFsts.transducer();
        SymbolTable words = new SymbolTable("words");
        words.addSymbol("<eps>");
        words.addSymbol("a");
        fst.setInputSymbols(words);

        byte[] bytes = TestFsts.toBytes(fst);
        VectorFst<TropicalWeight> read = VectorFst.read(FstInput.wrap(bytes), new FstReadOptions("test"),
                TropicalWeight.TYPE);
        TestFsts.assertSameFst(fst, read);
        assertEquals(words, read.inputSymbols());
        assertNull(read.outputSymbols());
        assertEquals(fst.properties(Properties.FST_PROPERTIES, false),
                read.properties(Properties.FST_PROPERTIES, false));

        // Writing the copy again gives the same bytes
        assertArrayEquals(bytes, TestFsts.toBytes(read));
    }

    @Test
    public void testSymbolOptions() throws IOException {
        VectorFst<TropicalWeight> fst = TestFsts.diamond();
        fst.setInputSymbols(new SymbolTable("in"));
        fst.setOutputSymbols(new SymbolTable("out"));
        byte[] bytes = TestFsts.toBytes(fst);

        FstReadOptions opts = new FstReadOptions("test");
        opts.setReadInputSymbols(false);
        opts.setOutputSymbols(new SymbolTable("replacement"));
        VectorFst<TropicalWeight> read = VectorFst.read(FstInput.wrap(bytes), opts, TropicalWeight.TYPE);
        assertNull(read.inputSymbols());
        assertEquals("replacement", read.outputSymbols().name());

        // Symbols can be left out when writing
        FstWriteOptions wopts = new FstWriteOptions("test");
        wopts.setWriteInputSymbols(false);
        wopts.setWriteOutputSymbols(false);
        read = VectorFst.read(FstInput.wrap(TestFsts.toBytes(fst, wopts)), new FstReadOptions("test"),
                TropicalWeight.TYPE);
        assertNull(read.inputSymbols());
        assertNull(read.outputSymbols());
    }

    @Test
    public void testReadRejectsDanglingArc() throws IOException {
        VectorFst<TropicalWeight> fst = TestFsts.linear(1);
        byte[] bytes = TestFsts.toBytes(fst);
        // Destination of the only arc, just before the final weight and arc count of state 1
        int arcNext = bytes.length - (4 + 8) - 4;
        bytes[arcNext] = 9;
        try {
            VectorFst.read(FstInput.wrap(bytes), new FstReadOptions("test"), TropicalWeight.TYPE);
            fail("Expected a read failure");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("out of range"));
        }
    }

    @Test
    public void testArcEquality() {
        Arc<TropicalWeight> a = arc(1, 2, 0.5f, 3);
        assertEquals(a, new Arc<>(1, 2, TropicalWeight.of(0.5f), 3));
        assertEquals(a.withNextState(4).nextState(), 4);
    }
}
