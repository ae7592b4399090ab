package com.lattice.wfst.algo;

import com.lattice.wfst.TestFsts;
import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.impl.ConstFst;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstReader;
import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.io.FstType;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.weight.Log64Weight;
import com.lattice.wfst.weight.TropicalWeight;

import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.*;

public class ConvertTest {

    @Test
    public void testEveryTypeKeepsTheFst() throws IOException {
        VectorFst<TropicalWeight> source = TestFsts.linear(3, 1, 2);
        for (FstType type : FstType.values()) {
            Fst<TropicalWeight> converted = Convert.convert(source, type.typeName());
            assertNotNull(type.typeName(), converted);
            assertEquals(type.typeName(), converted.type());
            TestFsts.assertSameFst(source, converted);

            // And survives a trip through its own binary form
            Fst<TropicalWeight> read = FstReader.read(FstInput.wrap(TestFsts.toBytes(converted)),
                    new FstReadOptions("test"), FstRegistry.defaultRegistry(), TropicalWeight.TYPE);
            assertEquals(type.typeName(), read.type());
            TestFsts.assertSameFst(source, read);
        }
    }

    @Test
    public void testBackAndForth() {
        VectorFst<TropicalWeight> source = TestFsts.transducer();
        Fst<TropicalWeight> fst = Convert.convert(source, "const");
        fst = Convert.convert(fst, "olabel_lookahead");
        fst = Convert.convert(fst, "vector");
        assertTrue(fst instanceof VectorFst);
        TestFsts.assertSameFst(source, fst);
    }

    @Test
    public void testSameTypeGivesFreshCopy() {
        VectorFst<TropicalWeight> source = TestFsts.diamond();
        Fst<TropicalWeight> copy = Convert.convert(source, "vector");
        assertNotSame(source, copy);
        TestFsts.assertSameFst(source, copy);
        ((VectorFst<TropicalWeight>) copy).addState();
        assertEquals(3, source.numStates());
    }

    @Test
    public void testKeepsKnownProperties() {
        VectorFst<TropicalWeight> source = TestFsts.diamond();
        source.properties(Properties.FST_PROPERTIES, true);
        Fst<TropicalWeight> fst = Convert.convert(source, "const");
        assertEquals(Properties.ACYCLIC | Properties.ACCESSIBLE,
                fst.properties(Properties.ACYCLIC | Properties.ACCESSIBLE, false));
        // Binary properties belong to the new encoding
        assertEquals(Properties.EXPANDED, fst.properties(Properties.BINARY_PROPERTIES, false));
    }

    @Test
    public void testOtherWeightTypes() {
        VectorFst<Log64Weight> source = new VectorFst<>(Log64Weight.TYPE);
        source.addStates(2);
        source.setStart(0);
        source.addArc(0, new Arc<>(1, 1, Log64Weight.of(0.125), 1));
        source.setFinal(1, Log64Weight.ONE);
        Fst<Log64Weight> fst = Convert.convert(source, "compact_weighted_string");
        assertEquals("log64", fst.arcType());
        TestFsts.assertSameFst(source, fst);
    }

    @Test
    public void testUnknownType() {
        assertNull(Convert.convert(TestFsts.diamond(), "bogus"));
    }

    @Test
    public void testUnrepresentable() {
        assertNull(Convert.convert(TestFsts.transducer(), "compact_acceptor"));
        assertNull(Convert.convert(ConstFst.copyOf(TestFsts.diamond()), "compact_string"));
    }
}
