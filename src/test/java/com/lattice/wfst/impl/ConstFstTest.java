package com.lattice.wfst.impl;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.io.FstFiles;
import com.lattice.wfst.io.FstHeader;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstWriteOptions;
import com.lattice.wfst.io.ReadMode;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.weight.LogWeight;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;

import static org.junit.Assert.*;

public class ConstFstTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testCopyOfVector() {
        VectorFst<TropicalWeight> vector = TestFsts.transducer();
        ConstFst<TropicalWeight> fst = ConstFst.copyOf(vector);
        assertEquals("const", fst.type());
        TestFsts.assertSameFst(vector, fst);
        assertEquals(3, fst.numArcsTotal());
        assertFalse(fst.isMapped());
        // Immutable encodings are expanded but not mutable
        assertEquals(Properties.EXPANDED, fst.properties(Properties.BINARY_PROPERTIES, false));
    }

    @Test
    public void testCopyKeepsKnownProperties() {
        VectorFst<TropicalWeight> vector = TestFsts.diamond();
        vector.properties(Properties.FST_PROPERTIES, true);
        ConstFst<TropicalWeight> fst = ConstFst.copyOf(vector);
        assertEquals(Properties.ACYCLIC, fst.properties(Properties.ACYCLIC | Properties.CYCLIC, false));
        assertEquals(Properties.WEIGHTED, fst.properties(Properties.WEIGHTED | Properties.UNWEIGHTED, false));
    }

    @Test
    public void testCopyOfConstSharesData() {
        ConstFst<TropicalWeight> fst = ConstFst.copyOf(TestFsts.diamond());
        ConstFst<TropicalWeight> again = ConstFst.copyOf(fst);
        assertNotSame(fst, again);
        TestFsts.assertSameFst(fst, again);
        TestFsts.assertSameFst(fst, fst.copy());
    }

    @Test
    public void testEmpty() throws IOException {
        ConstFst<LogWeight> fst = ConstFst.copyOf(new VectorFst<>(LogWeight.TYPE));
        assertEquals(0, fst.numStates());
        assertEquals(-1, fst.start());
        ConstFst<LogWeight> read = ConstFst.read(FstInput.wrap(TestFsts.toBytes(fst)), new FstReadOptions("test"),
                LogWeight.TYPE);
        assertEquals(0, read.numStates());
        assertEquals("log", read.arcType());
    }

    @Test
    public void testWriteThenRead() throws IOException {
        ConstFst<TropicalWeight> fst = ConstFst.copyOf(TestFsts.transducer());
        byte[] bytes = TestFsts.toBytes(fst);
        ConstFst<TropicalWeight> read = ConstFst.read(FstInput.wrap(bytes), new FstReadOptions("test"),
                TropicalWeight.TYPE);
        TestFsts.assertSameFst(fst, read);
        assertArrayEquals(bytes, TestFsts.toBytes(read));
    }

    @Test
    public void testAligned() throws IOException {
        ConstFst<TropicalWeight> fst = ConstFst.copyOf(TestFsts.transducer());
        FstConfig config = FstConfig.defaults();
        config.setAlign(true);
        byte[] aligned = TestFsts.toBytes(fst, new FstWriteOptions("test", config));
        byte[] plain = TestFsts.toBytes(fst);
        assertTrue(aligned.length > plain.length);

        FstHeader hdr = FstHeader.read(FstInput.wrap(aligned), "test", false);
        assertTrue(hdr.hasFlag(FstHeader.IS_ALIGNED));

        ConstFst<TropicalWeight> read = ConstFst.read(FstInput.wrap(aligned), new FstReadOptions("test"),
                TropicalWeight.TYPE);
        TestFsts.assertSameFst(fst, read);
    }

    @Test
    public void testMapFromFile() throws IOException {
        FstConfig config = FstConfig.defaults();
        config.setAlign(true);
        config.setReadMode("map");
        File file = tmp.newFile("t.fst");
        assertTrue(FstFiles.write(ConstFst.copyOf(TestFsts.transducer()), file.getPath(), config));

        FstReadOptions opts = new FstReadOptions(file.getPath(), config);
        assertEquals(ReadMode.MEMORY_MAP, opts.getMode());
        try (FstInput in = FstInput.open(file.toPath())) {
            ConstFst<TropicalWeight> read = ConstFst.read(in, opts, TropicalWeight.TYPE);
            assertTrue(read.isMapped());
            TestFsts.assertSameFst(TestFsts.transducer(), read);
        }
    }

    @Test
    public void testMapFallsBackToCopyOnStreams() throws IOException {
        FstConfig config = FstConfig.defaults();
        config.setReadMode("map");
        byte[] bytes = TestFsts.toBytes(ConstFst.copyOf(TestFsts.diamond()));
        ConstFst<TropicalWeight> read = ConstFst.read(FstInput.wrap(bytes), new FstReadOptions("test", config),
                TropicalWeight.TYPE);
        assertFalse(read.isMapped());
        TestFsts.assertSameFst(TestFsts.diamond(), read);
    }

    @Test
    public void testTruncatedFile() throws IOException {
        byte[] bytes = TestFsts.toBytes(ConstFst.copyOf(TestFsts.diamond()));
        File file = tmp.newFile("short.fst");
        Files.write(file.toPath(), Arrays.copyOf(bytes, bytes.length - 5));
        FstConfig config = FstConfig.defaults();
        config.setReadMode("map");
        try (FstInput in = FstInput.open(file.toPath())) {
            ConstFst.read(in, new FstReadOptions("short", config), TropicalWeight.TYPE);
            fail("Expected a read failure");
        } catch (IOException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("end of stream"));
        }
    }

    @Test
    public void testWrongTypeInHeader() throws IOException {
        byte[] bytes = TestFsts.toBytes(TestFsts.diamond());
        try {
            ConstFst.read(FstInput.wrap(bytes), new FstReadOptions("test"), TropicalWeight.TYPE);
            fail("Expected a type mismatch");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("const"));
        }
    }
}
