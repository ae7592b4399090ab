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
import com.lattice.wfst.props.Properties;

import java.io.IOException;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable FST whose arcs are packed by a {@link Compactor}.
 *
 * <p>
 * Arcs are CSR-encoded: the arcs of state {@code s} are records
 * {@code offsets[s] .. offsets[s + 1] - 1}, each {@code compactor.width()}
 * ints in {@code data} plus a weight in {@code weights} when the compactor
 * stores one.
 */
@Log4j2
public final class CompactFst<W extends Weight> extends AbstractFst<W> {
    static final int FILE_VERSION = 2;
    private static final long BINARY = Properties.EXPANDED;

    private final Compactor compactor;
    private final int[] offsets;
    private final List<W> finals;
    private final int[] data;
    private final List<W> weights;
    private final int start;

    private CompactFst(Compactor compactor, WeightType<W> wt, int[] offsets, List<W> finals, int[] data,
            List<W> weights, int start) {
        super(compactor.fstType(), wt, BINARY | compactor.impliedProperties());
        this.compactor = compactor;
        this.offsets = offsets;
        this.finals = finals;
        this.data = data;
        this.weights = weights;
        this.start = start;
    }

    /**
     * Packs any FST with the given strategy.
     *
     * @throws FstFormatException {@link FstError#TYPE_MISMATCH} if some arc
     *                            cannot be represented.
     */
    public static <W extends Weight> CompactFst<W> copyOf(Fst<W> fst, Compactor compactor)
            throws FstFormatException {
        WeightType<W> wt = fst.weightType();
        int n = fst.numStates();
        int[] offsets = new int[n + 1];
        List<W> finals = new ArrayList<>(n);
        for (int s = 0; s < n; s++) {
            int narcs = fst.numArcs(s);
            if (compactor.isLinear() && narcs > 1)
                throw mismatch(compactor, "state " + s + " has " + narcs + " arcs");
            offsets[s + 1] = offsets[s] + narcs;
            finals.add(fst.finalWeight(s));
        }
        int m = offsets[n];
        int width = compactor.width();
        int[] data = new int[m * width];
        List<W> weights = compactor.storesWeight() ? new ArrayList<>(m) : null;
        for (int s = 0; s < n; s++) {
            int i = offsets[s];
            for (Arc<W> arc : fst.arcs(s)) {
                if (!compactor.canCompact(s, arc, wt))
                    throw mismatch(compactor, "arc " + arc + " of state " + s);
                compactor.compact(arc, data, i * width);
                if (weights != null)
                    weights.add(arc.weight());
                i++;
            }
        }
        CompactFst<W> c = new CompactFst<>(compactor, wt, offsets, finals, data, weights, fst.start());
        c.isymbols = fst.inputSymbols() == null ? null : fst.inputSymbols().copy();
        c.osymbols = fst.outputSymbols() == null ? null : fst.outputSymbols().copy();
        long known = fst.properties(Properties.COPY_PROPERTIES, false);
        c.properties.set(known | c.properties.bits(), Properties.COPY_PROPERTIES);
        return c;
    }

    private static FstFormatException mismatch(Compactor compactor, String what) {
        return new FstFormatException(FstError.TYPE_MISMATCH,
                "Cannot convert to " + compactor.fstType() + ": " + what);
    }

    public Compactor compactor() {
        return compactor;
    }

    @Override
    protected long binaryProperties() {
        return BINARY;
    }

    // ── Fst ─────────────────────────────────────────────────────────

    @Override
    public int start() {
        return start;
    }

    @Override
    public W finalWeight(int state) {
        checkState(state);
        return finals.get(state);
    }

    @Override
    public int numStates() {
        return finals.size();
    }

    @Override
    public int numArcs(int state) {
        checkState(state);
        return offsets[state + 1] - offsets[state];
    }

    @Override
    public long numArcsTotal() {
        return offsets[offsets.length - 1];
    }

    @Override
    public int numInputEpsilons(int state) {
        int count = 0;
        for (Arc<W> arc : arcs(state))
            if (arc.isInputEpsilon())
                count++;
        return count;
    }

    @Override
    public int numOutputEpsilons(int state) {
        int count = 0;
        for (Arc<W> arc : arcs(state))
            if (arc.isOutputEpsilon())
                count++;
        return count;
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        checkState(state);
        int begin = offsets[state];
        int size = offsets[state + 1] - begin;
        return new AbstractList<>() {
            @Override
            public Arc<W> get(int i) {
                if (i < 0 || i >= size)
                    throw new IndexOutOfBoundsException(i);
                int idx = begin + i;
                W weight = weights != null ? weights.get(idx) : weightType.one();
                return compactor.expand(state, data, idx * compactor.width(), weight);
            }

            @Override
            public int size() {
                return size;
            }
        };
    }

    private void checkState(int state) {
        if (state < 0 || state >= finals.size())
            throw new IndexOutOfBoundsException("State " + state + " not in [0, " + finals.size() + ")");
    }

    @Override
    public CompactFst<W> copy() {
        CompactFst<W> c = new CompactFst<>(compactor, weightType, offsets, finals, data, weights, start);
        c.properties.set(properties.bits(), Properties.FST_PROPERTIES);
        c.isymbols = isymbols;
        c.osymbols = osymbols;
        return c;
    }

    // ── Serialization ───────────────────────────────────────────────

    @Override
    public void write(FstOutput out, FstWriteOptions opts) throws IOException {
        writeFraming(out, opts, FILE_VERSION, 0);
        out.writeInt(compactor.recordSize(weightType));
        for (int off : offsets)
            out.writeInt(off);
        for (W w : finals)
            weightType.write(w, out);
        int m = offsets[offsets.length - 1];
        int width = compactor.width();
        for (int i = 0; i < m; i++) {
            for (int k = 0; k < width; k++)
                out.writeInt(data[i * width + k]);
            if (weights != null)
                weightType.write(weights.get(i), out);
        }
        out.flush();
    }

    static <W extends Weight> CompactFst<W> read(FstInput in, FstReadOptions opts, WeightType<W> wt,
            Compactor compactor) throws IOException {
        FstHeader hdr = readHeader(in, opts, compactor.fstType(), wt, FILE_VERSION);
        String source = opts.getSource();
        checkCount(hdr.getNumStates(), "state", source);
        checkCount(hdr.getNumArcs(), "arc", source);
        int n = (int) hdr.getNumStates();
        int m = (int) hdr.getNumArcs();

        int[] offsets = new int[n + 1];
        CompactFst<W> framing = new CompactFst<>(compactor, wt, offsets, List.of(), new int[0], null, -1);
        framing.readFraming(in, opts, hdr);

        int recordSize = in.readInt();
        if (recordSize != compactor.recordSize(wt))
            throw new FstFormatException(FstError.READ_FAILED,
                    "Compact record size " + recordSize + " does not match " + compactor.fstType()
                            + " (" + compactor.recordSize(wt) + "): " + source);
        for (int s = 0; s <= n; s++) {
            offsets[s] = in.readInt();
            if (s > 0 && offsets[s] < offsets[s - 1])
                throw new FstFormatException(FstError.READ_FAILED, "Corrupt compact offsets in " + source);
        }
        if (offsets[0] != 0 || offsets[n] != m)
            throw new FstFormatException(FstError.READ_FAILED, "Corrupt compact offsets in " + source);
        List<W> finals = new ArrayList<>(n);
        for (int s = 0; s < n; s++)
            finals.add(wt.read(in));
        int width = compactor.width();
        int[] data = new int[m * width];
        List<W> weights = compactor.storesWeight() ? new ArrayList<>(m) : null;
        for (int i = 0; i < m; i++) {
            for (int k = 0; k < width; k++)
                data[i * width + k] = in.readInt();
            if (weights != null)
                weights.add(wt.read(in));
        }

        CompactFst<W> fst = new CompactFst<>(compactor, wt, offsets, finals, data, weights, (int) hdr.getStart());
        fst.isymbols = framing.isymbols;
        fst.osymbols = framing.osymbols;
        fst.properties.set(framing.properties.bits() | compactor.impliedProperties(), Properties.COPY_PROPERTIES);
        fst.validate(source);
        log.debug("Read {} FST from {}: {} states, {} arcs", compactor.fstType(), source, n, m);
        return fst;
    }

    private void validate(String source) throws FstFormatException {
        int n = numStates();
        for (int s = 0; s < n; s++) {
            if (compactor.isLinear() && numArcs(s) > 1)
                throw new FstFormatException(FstError.READ_FAILED,
                        "State " + s + " of " + compactor.fstType() + " FST has several arcs: " + source);
            for (Arc<W> arc : arcs(s)) {
                if (arc.nextState() < 0 || arc.nextState() >= n)
                    throw new FstFormatException(FstError.READ_FAILED,
                            "Arc destination " + arc.nextState() + " out of range in " + source);
            }
        }
    }

    public static final class Factory implements FstFactory {
        private final Compactor compactor;

        public Factory(Compactor compactor) {
            this.compactor = compactor;
        }

        @Override
        public String type() {
            return compactor.fstType();
        }

        @Override
        public <W extends Weight> Fst<W> read(FstInput in, FstReadOptions options, WeightType<W> weightType)
                throws IOException {
            return CompactFst.read(in, options, weightType, compactor);
        }

        @Override
        public <W extends Weight> Fst<W> convert(Fst<W> fst) throws FstFormatException {
            return copyOf(fst, compactor);
        }
    }
}
