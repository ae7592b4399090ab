package com.lattice.wfst.tools;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.impl.ConstFst;
import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.script.FstClass;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.Assert.*;

public class FstConvertTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static InputStream noInput() {
        return new ByteArrayInputStream(new byte[0]);
    }

    private static FstClass parse(byte[] bytes) {
        return FstClass.read(new ByteArrayInputStream(bytes), "output", FstConfig.defaults(),
                FstRegistry.defaultRegistry());
    }

    @Test
    public void testStdinToStdout() throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        int rc = FstConvert.run(new String[] { "--fst_type=const" },
                new ByteArrayInputStream(TestFsts.toBytes(TestFsts.transducer())), stdout);
        assertEquals(0, rc);
        FstClass out = parse(stdout.toByteArray());
        assertEquals("const", out.fstType());
        TestFsts.assertSameFst(TestFsts.transducer(), out.getFst(TropicalWeight.TYPE));
    }

    @Test
    public void testDashMeansStandardStreams() throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        int rc = FstConvert.run(new String[] { "--fst_type=compact_acceptor", "-", "-" },
                new ByteArrayInputStream(TestFsts.toBytes(TestFsts.diamond())), stdout);
        assertEquals(0, rc);
        assertEquals("compact_acceptor", parse(stdout.toByteArray()).fstType());
    }

    @Test
    public void testFiles() throws IOException {
        File in = tmp.newFile("in.fst");
        File out = new File(tmp.getRoot(), "out.fst");
        assertTrue(new FstClass(TestFsts.diamond()).write(in.getPath()));

        int rc = FstConvert.run(new String[] { "--fst_type=arc_lookahead", in.getPath(), out.getPath() },
                noInput(), new ByteArrayOutputStream());
        assertEquals(0, rc);
        FstClass read = FstClass.read(out.getPath());
        assertEquals("arc_lookahead", read.fstType());
        TestFsts.assertSameFst(TestFsts.diamond(), read.getFst(TropicalWeight.TYPE));
    }

    @Test
    public void testDefaultsToVector() throws IOException {
        File in = tmp.newFile("in.fst");
        assertTrue(new FstClass(ConstFst.copyOf(TestFsts.diamond())).write(in.getPath()));
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        assertEquals(0, FstConvert.run(new String[] { in.getPath() }, noInput(), stdout));
        assertEquals("vector", parse(stdout.toByteArray()).fstType());
    }

    @Test
    public void testSameTypeIsWrittenUnchanged() throws IOException {
        byte[] input = TestFsts.toBytes(TestFsts.diamond());
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        assertEquals(0, FstConvert.run(new String[0], new ByteArrayInputStream(input), stdout));
        assertArrayEquals(input, stdout.toByteArray());
    }

    @Test
    public void testFailures() throws IOException {
        byte[] transducer = TestFsts.toBytes(TestFsts.transducer());
        // Unknown target type
        assertEquals(1, FstConvert.run(new String[] { "--fst_type=bogus" },
                new ByteArrayInputStream(transducer), new ByteArrayOutputStream()));
        // Target cannot hold a transducer
        assertEquals(1, FstConvert.run(new String[] { "--fst_type=compact_acceptor" },
                new ByteArrayInputStream(transducer), new ByteArrayOutputStream()));
        // Unreadable input
        assertEquals(1, FstConvert.run(new String[0], new ByteArrayInputStream(new byte[] { 1, 2, 3 }),
                new ByteArrayOutputStream()));
        assertEquals(1, FstConvert.run(new String[] { new File(tmp.getRoot(), "missing.fst").getPath() },
                noInput(), new ByteArrayOutputStream()));
        // Too many arguments
        assertEquals(1, FstConvert.run(new String[] { "a", "b", "c" }, noInput(), new ByteArrayOutputStream()));
        // Bad config flag value
        assertEquals(1, FstConvert.run(new String[] { "--v=loud" }, noInput(), new ByteArrayOutputStream()));
    }

    @Test
    public void testUnwritableOutput() throws IOException {
        File in = tmp.newFile("in.fst");
        assertTrue(new FstClass(TestFsts.diamond()).write(in.getPath()));
        String out = new File(tmp.getRoot(), "no/such/dir/out.fst").getPath();
        assertEquals(1, FstConvert.run(new String[] { "--fst_type=const", in.getPath(), out }, noInput(),
                new ByteArrayOutputStream()));
    }
}
