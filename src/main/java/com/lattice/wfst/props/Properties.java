package com.lattice.wfst.props;

/**
 * Bit layout of the structural property word persisted in every FST header.
 *
 * <p>
 * The word holds two kinds of properties:
 * <ul>
 * <li><b>Binary</b> properties (low bits) are always known: they describe the
 * encoding itself (expanded, mutable) or an error condition.</li>
 * <li><b>Trinary</b> properties come in pairs: a positive bit and a negative
 * bit. Neither set means unknown, exactly one set means known true or known
 * false. Both set is a corrupt word.</li>
 * </ul>
 *
 * <p>
 * The numeric values are part of the binary format and must never change.
 */
public final class Properties {

    private Properties() {
        // Constants only
    }

    // ── Binary properties ───────────────────────────────────────────

    /** Encoding can report state count and per-state arc counts directly. */
    public static final long EXPANDED = 0x0000000000000001L;
    /** Encoding supports in-place mutation. */
    public static final long MUTABLE = 0x0000000000000002L;
    /** An error was detected while constructing or reading this FST. */
    public static final long ERROR = 0x0000000000000004L;

    // ── Trinary properties ──────────────────────────────────────────

    public static final long ACCEPTOR = 0x0000000000010000L;
    public static final long NOT_ACCEPTOR = 0x0000000000020000L;
    public static final long I_DETERMINISTIC = 0x0000000000040000L;
    public static final long NON_I_DETERMINISTIC = 0x0000000000080000L;
    public static final long O_DETERMINISTIC = 0x0000000000100000L;
    public static final long NON_O_DETERMINISTIC = 0x0000000000200000L;
    public static final long EPSILONS = 0x0000000000400000L;
    public static final long NO_EPSILONS = 0x0000000000800000L;
    public static final long I_EPSILONS = 0x0000000001000000L;
    public static final long NO_I_EPSILONS = 0x0000000002000000L;
    public static final long O_EPSILONS = 0x0000000004000000L;
    public static final long NO_O_EPSILONS = 0x0000000008000000L;
    public static final long I_LABEL_SORTED = 0x0000000010000000L;
    public static final long NOT_I_LABEL_SORTED = 0x0000000020000000L;
    public static final long O_LABEL_SORTED = 0x0000000040000000L;
    public static final long NOT_O_LABEL_SORTED = 0x0000000080000000L;
    public static final long WEIGHTED = 0x0000000100000000L;
    public static final long UNWEIGHTED = 0x0000000200000000L;
    public static final long CYCLIC = 0x0000000400000000L;
    public static final long ACYCLIC = 0x0000000800000000L;
    public static final long INITIAL_CYCLIC = 0x0000001000000000L;
    public static final long INITIAL_ACYCLIC = 0x0000002000000000L;
    public static final long TOP_SORTED = 0x0000004000000000L;
    public static final long NOT_TOP_SORTED = 0x0000008000000000L;
    public static final long ACCESSIBLE = 0x0000010000000000L;
    public static final long NOT_ACCESSIBLE = 0x0000020000000000L;
    public static final long CO_ACCESSIBLE = 0x0000040000000000L;
    public static final long NOT_CO_ACCESSIBLE = 0x0000080000000000L;
    public static final long STRING = 0x0000100000000000L;
    public static final long NOT_STRING = 0x0000200000000000L;
    public static final long WEIGHTED_CYCLES = 0x0000400000000000L;
    public static final long UNWEIGHTED_CYCLES = 0x0000800000000000L;

    // ── Masks ───────────────────────────────────────────────────────

    public static final long BINARY_PROPERTIES = 0x0000000000000007L;
    public static final long TRINARY_PROPERTIES = 0x0000ffffffff0000L;

    /** Positive half of every trinary pair. */
    public static final long POS_TRINARY_PROPERTIES = TRINARY_PROPERTIES & 0x5555555555555555L;
    /** Negative half of every trinary pair. */
    public static final long NEG_TRINARY_PROPERTIES = TRINARY_PROPERTIES & 0xaaaaaaaaaaaaaaaaL;

    public static final long FST_PROPERTIES = BINARY_PROPERTIES | TRINARY_PROPERTIES;

    /** Properties that survive copying into another encoding. */
    public static final long COPY_PROPERTIES = ERROR | TRINARY_PROPERTIES;

    /** Properties of an FST with no states. */
    public static final long NULL_PROPERTIES = ACCEPTOR | I_DETERMINISTIC | O_DETERMINISTIC
            | NO_EPSILONS | NO_I_EPSILONS | NO_O_EPSILONS | I_LABEL_SORTED | O_LABEL_SORTED
            | UNWEIGHTED | ACYCLIC | INITIAL_ACYCLIC | TOP_SORTED | ACCESSIBLE | CO_ACCESSIBLE
            | STRING | UNWEIGHTED_CYCLES;

    private static final String[] NAMES = {
            "expanded", "mutable", "error", "", "", "", "", "", "", "", "", "", "", "", "", "",
            "acceptor", "not acceptor", "input deterministic", "non input deterministic",
            "output deterministic", "non output deterministic", "input/output epsilons",
            "no input/output epsilons", "input epsilons", "no input epsilons", "output epsilons",
            "no output epsilons", "input label sorted", "not input label sorted",
            "output label sorted", "not output label sorted", "weighted", "unweighted", "cyclic",
            "acyclic", "cyclic at initial state", "acyclic at initial state", "top sorted",
            "not top sorted", "accessible", "not accessible", "coaccessible", "not coaccessible",
            "string", "not string", "weighted cycles", "unweighted cycles" };

    /**
     * Returns the mask of bits whose value is known in {@code props}: every
     * binary bit plus both bits of each trinary pair that has either bit set.
     */
    public static long knownProperties(long props) {
        return BINARY_PROPERTIES
                | (props & TRINARY_PROPERTIES)
                | ((props & POS_TRINARY_PROPERTIES) << 1)
                | ((props & NEG_TRINARY_PROPERTIES) >>> 1);
    }

    /** True if the known bits of both words agree wherever both are known. */
    public static boolean compatProperties(long props1, long props2) {
        long knownBoth = knownProperties(props1) & knownProperties(props2);
        return ((props1 ^ props2) & knownBoth) == 0;
    }

    /** Comma-separated names of the bits set in {@code props}. */
    public static String toString(long props) {
        StringBuilder sb = new StringBuilder(128);
        for (int i = 0; i < NAMES.length; i++) {
            if ((props & (1L << i)) != 0 && !NAMES[i].isEmpty()) {
                if (sb.length() > 0)
                    sb.append(", ");
                sb.append(NAMES[i]);
            }
        }
        return sb.toString();
    }
}
