package com.lattice.wfst.script;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.impl.ConstFst;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.io.FstFiles;
import com.lattice.wfst.weight.LogWeight;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class MutableFstClassTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testBuildThroughHandle() {
        VectorFstClass fst = new VectorFstClass("standard");
        assertEquals("vector", fst.fstType());
        int s0 = fst.addState();
        int s1 = fst.addState();
        fst.setStart(s0);
        fst.addArc(s0, 1, 2, TropicalWeight.of(0.5f), s1);
        fst.setFinal(s1, TropicalWeight.ONE);
        fst.setInputSymbols(new SymbolTable("in"));

        assertEquals(2, fst.numStates());
        assertEquals(1, fst.numArcs(s0));
        assertEquals(Optional.of(TropicalWeight.ONE), fst.finalWeight(s1));
        assertEquals("in", fst.getFst().inputSymbols().name());

        fst.deleteArcs(s0);
        assertEquals(0, fst.numArcs(s0));
        fst.deleteStates(List.of(s1));
        assertEquals(1, fst.numStates());
        fst.deleteStates();
        assertEquals(0, fst.numStates());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWeightOfOtherSemiring() {
        VectorFstClass fst = new VectorFstClass("standard");
        fst.addState();
        fst.setFinal(0, LogWeight.ONE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownArcType() {
        new VectorFstClass("bogus");
    }

    @Test
    public void testLogArcType() {
        VectorFstClass fst = new VectorFstClass("log", FstConfig.defaults());
        assertEquals("log", fst.arcType());
        assertEquals("log", fst.weightType());
    }

    @Test
    public void testVectorCopyOfAnyHandle() {
        FstClass constFst = new FstClass(ConstFst.copyOf(TestFsts.diamond()));
        VectorFstClass copy = new VectorFstClass(constFst);
        copy.addState();
        assertEquals(4, copy.numStates());
        assertEquals(3, constFst.numStates());
    }

    @Test
    public void testReadRequiresVectorUnlessConverting() throws IOException {
        String path = tmp.newFile("const.fst").getPath();
        assertTrue(FstFiles.write(ConstFst.copyOf(TestFsts.diamond()), path, FstConfig.defaults()));

        assertNull(MutableFstClass.read(path, false));

        MutableFstClass converted = MutableFstClass.read(path, true);
        assertNotNull(converted);
        assertTrue(converted instanceof VectorFstClass);
        assertEquals("vector", converted.fstType());
        assertTrue(converted.getFst() instanceof VectorFst);
        TestFsts.assertSameFst(TestFsts.diamond(), converted.getFst(TropicalWeight.TYPE));
    }

    @Test
    public void testReadVectorWithoutConverting() throws IOException {
        String path = tmp.newFile("vector.fst").getPath();
        assertTrue(FstFiles.write(TestFsts.diamond(), path, FstConfig.defaults()));
        MutableFstClass fst = MutableFstClass.read(path, false);
        assertNotNull(fst);
        fst.addState();
        assertEquals(4, fst.numStates());
    }

    @Test
    public void testReadMissingFile() {
        assertNull(MutableFstClass.read(tmp.getRoot().toPath().resolve("missing.fst").toString(), true));
    }
}
