package com.lattice.wfst.impl;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.SymbolTable;
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
import java.util.Arrays;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * A {@link ConstFst} paired with a per-state index of the labels that can be
 * consumed next, so a composition can reject a state without expanding it.
 *
 * <p>
 * The index is CSR-encoded: the labels of state {@code s} are
 * {@code labels[offsets[s] .. offsets[s + 1] - 1]}, sorted and distinct.
 */
@Log4j2
public final class LookaheadFst<W extends Weight> extends AbstractFst<W> {
    static final int FILE_VERSION = 1;

    /** Which labels the index holds. */
    public enum Kind {
        /** Input labels of the state's own arcs. */
        ARC("arc_lookahead"),
        /** First non-epsilon input labels reachable through input-epsilon arcs. */
        ILABEL("ilabel_lookahead"),
        /** First non-epsilon output labels reachable through output-epsilon arcs. */
        OLABEL("olabel_lookahead");

        private final String typeName;

        Kind(String typeName) {
            this.typeName = typeName;
        }

        public String typeName() {
            return typeName;
        }
    }

    private final Kind kind;
    private final ConstFst<W> fst;
    private final int[] offsets;
    private final int[] labels;

    private LookaheadFst(Kind kind, ConstFst<W> fst, int[] offsets, int[] labels) {
        super(kind.typeName(), fst.weightType(), fst.properties(Properties.FST_PROPERTIES, false));
        this.kind = kind;
        this.fst = fst;
        this.offsets = offsets;
        this.labels = labels;
    }

    public static <W extends Weight> LookaheadFst<W> copyOf(Fst<W> fst, Kind kind) {
        ConstFst<W> inner = ConstFst.copyOf(fst);
        int n = inner.numStates();
        int[] offsets = new int[n + 1];
        int[][] perState = new int[n][];
        for (int s = 0; s < n; s++) {
            perState[s] = kind == Kind.ARC ? arcLabels(inner, s) : closureLabels(inner, s, kind == Kind.ILABEL);
            offsets[s + 1] = offsets[s] + perState[s].length;
        }
        int[] labels = new int[offsets[n]];
        for (int s = 0; s < n; s++)
            System.arraycopy(perState[s], 0, labels, offsets[s], perState[s].length);
        return new LookaheadFst<>(kind, inner, offsets, labels);
    }

    private static int[] arcLabels(Fst<?> fst, int s) {
        int[] out = new int[fst.numArcs(s)];
        int i = 0;
        for (Arc<?> arc : fst.arcs(s))
            out[i++] = arc.ilabel();
        return sortedDistinct(out, i);
    }

    /** Labels found by walking epsilon arcs on the indexed side from {@code s}. */
    private static int[] closureLabels(Fst<?> fst, int s, boolean input) {
        int n = fst.numStates();
        boolean[] seen = new boolean[n];
        int[] stack = new int[n];
        int top = 0;
        stack[top++] = s;
        seen[s] = true;
        int[] found = new int[8];
        int count = 0;
        while (top > 0) {
            int q = stack[--top];
            for (Arc<?> arc : fst.arcs(q)) {
                int label = input ? arc.ilabel() : arc.olabel();
                if (label == Arc.EPSILON) {
                    if (!seen[arc.nextState()]) {
                        seen[arc.nextState()] = true;
                        stack[top++] = arc.nextState();
                    }
                } else {
                    if (count == found.length)
                        found = Arrays.copyOf(found, count * 2);
                    found[count++] = label;
                }
            }
        }
        return sortedDistinct(found, count);
    }

    private static int[] sortedDistinct(int[] values, int len) {
        int[] sorted = Arrays.copyOf(values, len);
        Arrays.sort(sorted);
        int k = 0;
        for (int i = 0; i < sorted.length; i++)
            if (k == 0 || sorted[i] != sorted[k - 1])
                sorted[k++] = sorted[i];
        return Arrays.copyOf(sorted, k);
    }

    public Kind kind() {
        return kind;
    }

    /** True if {@code label} can be consumed next from {@code state}. */
    public boolean lookAheadLabel(int state, int label) {
        if (state < 0 || state >= fst.numStates())
            throw new IndexOutOfBoundsException("State " + state + " not in [0, " + fst.numStates() + ")");
        return Arrays.binarySearch(labels, offsets[state], offsets[state + 1], label) >= 0;
    }

    /** The indexed labels of a state, sorted. */
    public int[] lookAheadLabels(int state) {
        return Arrays.copyOfRange(labels, offsets[state], offsets[state + 1]);
    }

    @Override
    protected long binaryProperties() {
        return Properties.EXPANDED;
    }

    // ── Fst (delegated) ─────────────────────────────────────────────

    @Override
    public int start() {
        return fst.start();
    }

    @Override
    public W finalWeight(int state) {
        return fst.finalWeight(state);
    }

    @Override
    public int numStates() {
        return fst.numStates();
    }

    @Override
    public int numArcs(int state) {
        return fst.numArcs(state);
    }

    @Override
    public long numArcsTotal() {
        return fst.numArcsTotal();
    }

    @Override
    public int numInputEpsilons(int state) {
        return fst.numInputEpsilons(state);
    }

    @Override
    public int numOutputEpsilons(int state) {
        return fst.numOutputEpsilons(state);
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        return fst.arcs(state);
    }

    @Override
    public SymbolTable inputSymbols() {
        return fst.inputSymbols();
    }

    @Override
    public SymbolTable outputSymbols() {
        return fst.outputSymbols();
    }

    @Override
    public LookaheadFst<W> copy() {
        LookaheadFst<W> c = new LookaheadFst<>(kind, fst.copy(), offsets, labels);
        c.properties.set(properties.bits(), Properties.FST_PROPERTIES);
        return c;
    }

    // ── Serialization ───────────────────────────────────────────────

    @Override
    public void write(FstOutput out, FstWriteOptions opts) throws IOException {
        FstWriteOptions outer = new FstWriteOptions(opts.getSource());
        outer.setWriteHeader(opts.isWriteHeader());
        outer.setWriteInputSymbols(false);
        outer.setWriteOutputSymbols(false);
        outer.setAlign(opts.isAlign());
        writeFraming(out, outer, FILE_VERSION, 0);

        FstWriteOptions inner = new FstWriteOptions(opts.getSource());
        inner.setWriteInputSymbols(opts.isWriteInputSymbols());
        inner.setWriteOutputSymbols(opts.isWriteOutputSymbols());
        inner.setAlign(opts.isAlign());
        fst.write(out, inner);

        int n = fst.numStates();
        for (int s = 0; s < n; s++) {
            out.writeInt(offsets[s + 1] - offsets[s]);
            for (int i = offsets[s]; i < offsets[s + 1]; i++)
                out.writeInt(labels[i]);
        }
        out.flush();
    }

    static <W extends Weight> LookaheadFst<W> read(FstInput in, FstReadOptions opts, WeightType<W> wt, Kind kind)
            throws IOException {
        FstHeader hdr = readHeader(in, opts, kind.typeName(), wt, FILE_VERSION);
        String source = opts.getSource();

        FstReadOptions innerOpts = new FstReadOptions(source, opts.getConfig());
        innerOpts.setMode(opts.getMode());
        innerOpts.setReadInputSymbols(opts.isReadInputSymbols());
        innerOpts.setReadOutputSymbols(opts.isReadOutputSymbols());
        innerOpts.setInputSymbols(opts.getInputSymbols());
        innerOpts.setOutputSymbols(opts.getOutputSymbols());
        ConstFst<W> inner = ConstFst.read(in, innerOpts, wt);
        if (inner.numStates() != hdr.getNumStates())
            throw new FstFormatException(FstError.READ_FAILED,
                    "Lookahead header and embedded FST disagree on state count: " + source);

        int n = inner.numStates();
        int[] offsets = new int[n + 1];
        int[] labels = new int[Math.max(16, n)];
        for (int s = 0; s < n; s++) {
            int count = in.readInt();
            if (count < 0 || count > inner.numArcsTotal())
                throw new FstFormatException(FstError.READ_FAILED,
                        "Corrupt lookahead index for state " + s + " in " + source);
            offsets[s + 1] = offsets[s] + count;
            if (offsets[s + 1] > labels.length)
                labels = Arrays.copyOf(labels, Math.max(labels.length * 2, offsets[s + 1]));
            for (int i = offsets[s]; i < offsets[s + 1]; i++)
                labels[i] = in.readInt();
        }
        LookaheadFst<W> fst = new LookaheadFst<>(kind, inner, offsets, Arrays.copyOf(labels, offsets[n]));
        fst.properties.set(hdr.getProperties(), Properties.COPY_PROPERTIES);
        log.debug("Read {} FST from {}: {} states", kind.typeName(), source, n);
        return fst;
    }

    public static final class Factory implements FstFactory {
        private final Kind kind;

        public Factory(Kind kind) {
            this.kind = kind;
        }

        @Override
        public String type() {
            return kind.typeName();
        }

        @Override
        public <W extends Weight> Fst<W> read(FstInput in, FstReadOptions options, WeightType<W> weightType)
                throws IOException {
            return LookaheadFst.read(in, options, weightType, kind);
        }

        @Override
        public <W extends Weight> Fst<W> convert(Fst<W> fst) {
            return copyOf(fst, kind);
        }
    }
}
