package com.lattice.wfst.props;

import org.junit.Test;

import static com.lattice.wfst.props.Properties.*;
import static org.junit.Assert.*;

public class PropertiesTest {

    @Test
    public void testKnownPropertiesCoversBothBitsOfAPair() {
        long known = knownProperties(ACYCLIC | NOT_ACCEPTOR);
        assertEquals(CYCLIC | ACYCLIC, known & (CYCLIC | ACYCLIC));
        assertEquals(ACCEPTOR | NOT_ACCEPTOR, known & (ACCEPTOR | NOT_ACCEPTOR));
        // Untouched pairs stay unknown
        assertEquals(0, known & (TOP_SORTED | NOT_TOP_SORTED));
        // Binary bits are always known
        assertEquals(BINARY_PROPERTIES, known & BINARY_PROPERTIES);
    }

    @Test
    public void testCompatProperties() {
        assertTrue(compatProperties(ACYCLIC, ACYCLIC | TOP_SORTED));
        assertTrue(compatProperties(ACYCLIC, ACCEPTOR));
        assertFalse(compatProperties(ACYCLIC, CYCLIC));
        assertFalse(compatProperties(MUTABLE, 0L));
        assertTrue(compatProperties(0L, 0L));
    }

    @Test
    public void testNullPropertiesAreConsistent() {
        // Each pair has at most one bit set
        long pos = NULL_PROPERTIES & POS_TRINARY_PROPERTIES;
        long neg = NULL_PROPERTIES & NEG_TRINARY_PROPERTIES;
        assertEquals(0, (pos << 1) & neg);
        assertTrue((NULL_PROPERTIES & ACYCLIC) != 0);
        assertTrue((NULL_PROPERTIES & STRING) != 0);
    }

    @Test
    public void testToString() {
        assertEquals("", Properties.toString(0L));
        assertEquals("mutable, acceptor, acyclic", Properties.toString(MUTABLE | ACCEPTOR | ACYCLIC));
        assertEquals("unweighted cycles", Properties.toString(UNWEIGHTED_CYCLES));
    }
}
