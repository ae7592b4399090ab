package com.lattice.wfst.tools;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.impl.ConstFst;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.script.FstClass;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;

import static com.lattice.wfst.TestFsts.arc;
import static org.junit.Assert.*;

public class FstTopSortTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static VectorFst<TropicalWeight> reversedChain() {
        VectorFst<TropicalWeight> fst = new VectorFst<>(TropicalWeight.TYPE);
        fst.addStates(3);
        fst.setStart(2);
        fst.addArc(2, arc(1, 1, 0f, 1));
        fst.addArc(1, arc(2, 2, 0f, 0));
        fst.setFinal(0, TropicalWeight.ONE);
        return fst;
    }

    private static FstClass parse(byte[] bytes) {
        return FstClass.read(new ByteArrayInputStream(bytes), "output", FstConfig.defaults(),
                FstRegistry.defaultRegistry());
    }

    @Test
    public void testSortsStdin() throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        int rc = FstTopSort.run(new String[0], new ByteArrayInputStream(TestFsts.toBytes(reversedChain())), stdout);
        assertEquals(0, rc);
        FstClass out = parse(stdout.toByteArray());
        assertEquals(0, out.start());
        TestFsts.assertTopSorted(out.getFst());
        assertEquals(Properties.TOP_SORTED, out.properties(Properties.TOP_SORTED, false));
    }

    @Test
    public void testImmutableInputComesOutAsVector() throws IOException {
        File in = tmp.newFile("in.fst");
        File out = new File(tmp.getRoot(), "out.fst");
        assertTrue(new FstClass(ConstFst.copyOf(reversedChain())).write(in.getPath()));

        assertEquals(0, FstTopSort.run(new String[] { in.getPath(), out.getPath() },
                new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream()));
        FstClass read = FstClass.read(out.getPath());
        assertEquals("vector", read.fstType());
        TestFsts.assertTopSorted(read.getFst());
    }

    @Test
    public void testCyclicInputPassesThrough() throws IOException {
        VectorFst<TropicalWeight> cyclic = reversedChain();
        cyclic.addArc(0, arc(3, 3, 0f, 2));
        byte[] input = TestFsts.toBytes(cyclic);
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();

        // A cycle is reported but is not a failure
        assertEquals(0, FstTopSort.run(new String[0], new ByteArrayInputStream(input), stdout));
        assertArrayEquals(input, stdout.toByteArray());
    }

    @Test
    public void testFailures() {
        assertEquals(1, FstTopSort.run(new String[] { "a", "b", "c" }, new ByteArrayInputStream(new byte[0]),
                new ByteArrayOutputStream()));
        assertEquals(1, FstTopSort.run(new String[0], new ByteArrayInputStream(new byte[] { 9, 9 }),
                new ByteArrayOutputStream()));
        assertEquals(1, FstTopSort.run(new String[] { new File(tmp.getRoot(), "missing.fst").getPath() },
                new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream()));
    }
}
