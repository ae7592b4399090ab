package com.lattice.wfst.impl;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.io.FstError;
import com.lattice.wfst.io.FstFactory;
import com.lattice.wfst.io.FstFormatException;
import com.lattice.wfst.io.FstHeader;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstOutput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstWriteOptions;
import com.lattice.wfst.io.ReadMode;
import com.lattice.wfst.props.Properties;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.AbstractList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable FST stored as two flat little-endian sections.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>states: one fixed-size record per state holding the final weight, the
 * index of its first arc, its arc count and its input/output epsilon counts.
 * <li>arcs: every arc of state 0, then every arc of state 1, and so on.
 * </ul>
 * The arcs of state {@code s} occupy records {@code pos(s) .. pos(s) + narcs(s) - 1},
 * so traversal reads contiguous memory and allocates nothing but the
 * returned {@link Arc} values. Because the file image is the in-memory
 * image, a file can be memory-mapped instead of copied.
 */
@Log4j2
public final class ConstFst<W extends Weight> extends AbstractFst<W> {
    public static final String TYPE = "const";
    static final int FILE_VERSION = 2;
    static final int ALIGNMENT = 16;
    private static final long BINARY = Properties.EXPANDED;

    private final ByteBuffer states;
    private final ByteBuffer arcs;
    private final int stateSize;
    private final int arcSize;
    private final int numStates;
    private final int numArcs;
    private final int start;

    private ConstFst(WeightType<W> wt, ByteBuffer states, ByteBuffer arcs, int numStates, int numArcs,
            int start) {
        super(TYPE, wt, BINARY);
        this.states = states;
        this.arcs = arcs;
        this.stateSize = stateRecordSize(wt);
        this.arcSize = arcRecordSize(wt);
        this.numStates = numStates;
        this.numArcs = numArcs;
        this.start = start;
    }

    /** Shares the immutable sections of {@code other}. */
    private ConstFst(ConstFst<W> other) {
        this(other.weightType, other.states, other.arcs, other.numStates, other.numArcs, other.start);
        properties.set(other.properties.bits(), Properties.FST_PROPERTIES);
        isymbols = other.isymbols;
        osymbols = other.osymbols;
    }

    /** Packs any FST into the constant layout. */
    public static <W extends Weight> ConstFst<W> copyOf(Fst<W> fst) {
        if (fst instanceof ConstFst<W> c)
            return new ConstFst<>(c);
        WeightType<W> wt = fst.weightType();
        int n = fst.numStates();
        ByteArrayOutputStream stateBytes = new ByteArrayOutputStream(n * stateRecordSize(wt));
        ByteArrayOutputStream arcBytes = new ByteArrayOutputStream();
        int pos = 0;
        try (FstOutput so = new FstOutput(stateBytes); FstOutput ao = new FstOutput(arcBytes)) {
            for (int s = 0; s < n; s++) {
                List<Arc<W>> stateArcs = fst.arcs(s);
                wt.write(fst.finalWeight(s), so);
                so.writeInt(pos);
                so.writeInt(stateArcs.size());
                so.writeInt(fst.numInputEpsilons(s));
                so.writeInt(fst.numOutputEpsilons(s));
                for (Arc<W> arc : stateArcs)
                    writeArc(ao, wt, arc);
                pos += stateArcs.size();
            }
        } catch (IOException e) {
            // In-memory streams do not fault.
            throw new UncheckedIOException(e);
        }
        ConstFst<W> c = new ConstFst<>(wt, littleEndian(stateBytes), littleEndian(arcBytes), n, pos, fst.start());
        c.isymbols = fst.inputSymbols() == null ? null : fst.inputSymbols().copy();
        c.osymbols = fst.outputSymbols() == null ? null : fst.outputSymbols().copy();
        c.properties.set(fst.properties(Properties.COPY_PROPERTIES, false), Properties.COPY_PROPERTIES);
        return c;
    }

    private static ByteBuffer littleEndian(ByteArrayOutputStream bytes) {
        return ByteBuffer.wrap(bytes.toByteArray()).order(ByteOrder.LITTLE_ENDIAN);
    }

    static int stateRecordSize(WeightType<?> wt) {
        return wt.byteSize() + 4 * Integer.BYTES;
    }

    @Override
    protected long binaryProperties() {
        return BINARY;
    }

    /** True if the sections live in a memory-mapped file. */
    public boolean isMapped() {
        return states.isDirect();
    }

    // ── Fst ─────────────────────────────────────────────────────────

    @Override
    public int start() {
        return start;
    }

    @Override
    public W finalWeight(int state) {
        return weightType.get(states, record(state));
    }

    @Override
    public int numStates() {
        return numStates;
    }

    @Override
    public int numArcs(int state) {
        return states.getInt(record(state) + weightType.byteSize() + 4);
    }

    @Override
    public int numInputEpsilons(int state) {
        return states.getInt(record(state) + weightType.byteSize() + 8);
    }

    @Override
    public int numOutputEpsilons(int state) {
        return states.getInt(record(state) + weightType.byteSize() + 12);
    }

    @Override
    public long numArcsTotal() {
        return numArcs;
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        int base = record(state);
        int pos = states.getInt(base + weightType.byteSize());
        int narcs = states.getInt(base + weightType.byteSize() + 4);
        return new AbstractList<>() {
            @Override
            public Arc<W> get(int i) {
                if (i < 0 || i >= narcs)
                    throw new IndexOutOfBoundsException(i);
                return arcAt(pos + i);
            }

            @Override
            public int size() {
                return narcs;
            }
        };
    }

    private Arc<W> arcAt(int index) {
        int off = index * arcSize;
        int ilabel = arcs.getInt(off);
        int olabel = arcs.getInt(off + 4);
        W weight = weightType.get(arcs, off + 8);
        int next = arcs.getInt(off + 8 + weightType.byteSize());
        return new Arc<>(ilabel, olabel, weight, next);
    }

    private int record(int state) {
        if (state < 0 || state >= numStates)
            throw new IndexOutOfBoundsException("State " + state + " not in [0, " + numStates + ")");
        return state * stateSize;
    }

    @Override
    public ConstFst<W> copy() {
        return new ConstFst<>(this);
    }

    // ── Serialization ───────────────────────────────────────────────

    @Override
    public void write(FstOutput out, FstWriteOptions opts) throws IOException {
        boolean align = opts.isAlign();
        writeFraming(out, opts, FILE_VERSION, align ? FstHeader.IS_ALIGNED : 0);
        if (align)
            out.align(ALIGNMENT);
        writeSection(out, states, numStates * stateSize);
        if (align)
            out.align(ALIGNMENT);
        writeSection(out, arcs, numArcs * arcSize);
        out.flush();
    }

    private static void writeSection(FstOutput out, ByteBuffer section, int size) throws IOException {
        byte[] chunk = new byte[Math.min(size, 1 << 16)];
        ByteBuffer view = section.duplicate();
        view.position(0);
        int remaining = size;
        while (remaining > 0) {
            int len = Math.min(remaining, chunk.length);
            view.get(chunk, 0, len);
            out.writeBytes(chunk, 0, len);
            remaining -= len;
        }
    }

    static <W extends Weight> ConstFst<W> read(FstInput in, FstReadOptions opts, WeightType<W> wt)
            throws IOException {
        FstHeader hdr = readHeader(in, opts, TYPE, wt, FILE_VERSION);
        String source = opts.getSource();
        checkCount(hdr.getNumStates(), "state", source);
        checkCount(hdr.getNumArcs(), "arc", source);
        int n = (int) hdr.getNumStates();
        int m = (int) hdr.getNumArcs();
        long statesSize = (long) n * stateRecordSize(wt);
        long arcsSize = (long) m * arcRecordSize(wt);
        if (statesSize > Integer.MAX_VALUE || arcsSize > Integer.MAX_VALUE)
            throw new FstFormatException(FstError.READ_FAILED, "FST too large for the const layout: " + source);

        // Symbol tables are read through a temporary so the sections can follow.
        ConstFst<W> framing = new ConstFst<>(wt, ByteBuffer.allocate(0), ByteBuffer.allocate(0), 0, 0, -1);
        framing.readFraming(in, opts, hdr);

        boolean aligned = hdr.hasFlag(FstHeader.IS_ALIGNED);
        boolean map = opts.getMode() == ReadMode.MEMORY_MAP && in.canMap();
        if (opts.getMode() == ReadMode.MEMORY_MAP && !map)
            log.debug("Cannot map {}; copying instead", source);
        if (aligned)
            in.align(ALIGNMENT);
        ByteBuffer states = map ? in.map(statesSize) : in.copy((int) statesSize);
        if (aligned)
            in.align(ALIGNMENT);
        ByteBuffer arcs = map ? in.map(arcsSize) : in.copy((int) arcsSize);

        ConstFst<W> fst = new ConstFst<>(wt, states, arcs, n, m, (int) hdr.getStart());
        fst.isymbols = framing.isymbols;
        fst.osymbols = framing.osymbols;
        fst.properties.set(framing.properties.bits(), Properties.COPY_PROPERTIES);
        fst.validate(source);
        log.debug("Read const FST from {} ({}): {} states, {} arcs",
                source, map ? "mapped" : "copied", n, m);
        return fst;
    }

    private void validate(String source) throws FstFormatException {
        long expected = 0;
        for (int s = 0; s < numStates; s++) {
            int base = s * stateSize + weightType.byteSize();
            int pos = states.getInt(base);
            int narcs = states.getInt(base + 4);
            if (pos != expected || narcs < 0 || pos + (long) narcs > numArcs)
                throw new FstFormatException(FstError.READ_FAILED,
                        "Corrupt arc index for state " + s + " in " + source);
            expected += narcs;
        }
        for (int i = 0; i < numArcs; i++) {
            int next = arcs.getInt(i * arcSize + 8 + weightType.byteSize());
            if (next < 0 || next >= numStates)
                throw new FstFormatException(FstError.READ_FAILED,
                        "Arc destination " + next + " out of range in " + source);
        }
    }

    public static final class Factory implements FstFactory {
        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public <W extends Weight> Fst<W> read(FstInput in, FstReadOptions options, WeightType<W> weightType)
                throws IOException {
            return ConstFst.read(in, options, weightType);
        }

        @Override
        public <W extends Weight> Fst<W> convert(Fst<W> fst) {
            return copyOf(fst);
        }
    }
}
