package com.lattice.wfst.impl;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.io.FstFactory;
import com.lattice.wfst.io.FstHeader;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstOutput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstWriteOptions;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.props.PropertyUpdates;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Growable, mutable FST: one object per state holding its final weight and an
 * arc list.
 *
 * <p>
 * Each state also keeps its input and output epsilon counts so that
 * {@link #numInputEpsilons(int)} is constant time. Mutators keep the property
 * cache consistent through {@link PropertyUpdates}.
 */
@Log4j2
public final class VectorFst<W extends Weight> extends AbstractFst<W> implements MutableFst<W> {
    public static final String TYPE = "vector";
    static final int FILE_VERSION = 2;
    private static final long BINARY = Properties.EXPANDED | Properties.MUTABLE;

    private final List<VectorState<W>> states = new ArrayList<>();
    private int start = NO_STATE_ID;

    public VectorFst(WeightType<W> weightType) {
        super(TYPE, weightType, BINARY | Properties.NULL_PROPERTIES);
    }

    /** Deep copy of any FST, keeping its known copyable properties. */
    public static <W extends Weight> VectorFst<W> copyOf(Fst<W> fst) {
        VectorFst<W> copy = new VectorFst<>(fst.weightType());
        int n = fst.numStates();
        for (int s = 0; s < n; s++) {
            VectorState<W> state = new VectorState<>(fst.finalWeight(s));
            for (Arc<W> arc : fst.arcs(s))
                state.addArc(arc);
            copy.states.add(state);
        }
        copy.start = fst.start();
        copy.isymbols = fst.inputSymbols() == null ? null : fst.inputSymbols().copy();
        copy.osymbols = fst.outputSymbols() == null ? null : fst.outputSymbols().copy();
        copy.properties.set(BINARY | fst.properties(Properties.COPY_PROPERTIES, false), Properties.FST_PROPERTIES);
        return copy;
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
        return state(state).finalWeight;
    }

    @Override
    public int numStates() {
        return states.size();
    }

    @Override
    public int numArcs(int state) {
        return state(state).arcs.size();
    }

    @Override
    public int numInputEpsilons(int state) {
        return state(state).niepsilons;
    }

    @Override
    public int numOutputEpsilons(int state) {
        return state(state).noepsilons;
    }

    @Override
    public List<Arc<W>> arcs(int state) {
        return Collections.unmodifiableList(state(state).arcs);
    }

    @Override
    public VectorFst<W> copy() {
        return copyOf(this);
    }

    // ── MutableFst ──────────────────────────────────────────────────

    @Override
    public void setStart(int state) {
        if (state != NO_STATE_ID)
            state(state);
        start = state;
        properties.set(PropertyUpdates.setStart(properties.bits()), Properties.FST_PROPERTIES);
    }

    @Override
    public void setFinal(int state, W weight) {
        VectorState<W> vs = state(state);
        long props = PropertyUpdates.setFinal(properties.bits(), isWeighted(vs.finalWeight), isWeighted(weight));
        vs.finalWeight = weight;
        properties.set(props, Properties.FST_PROPERTIES);
    }

    @Override
    public int addState() {
        states.add(new VectorState<>(weightType.zero()));
        properties.set(PropertyUpdates.addState(properties.bits()), Properties.FST_PROPERTIES);
        return states.size() - 1;
    }

    @Override
    public void addStates(int n) {
        for (int i = 0; i < n; i++)
            addState();
    }

    @Override
    public void addArc(int state, Arc<W> arc) {
        VectorState<W> vs = state(state);
        if (arc.nextState() < 0 || arc.nextState() >= states.size())
            throw new IllegalArgumentException("Arc destination " + arc.nextState() + " is not a state");
        Arc<W> prev = vs.arcs.isEmpty() ? null : vs.arcs.get(vs.arcs.size() - 1);
        properties.set(PropertyUpdates.addArc(properties.bits(), state, arc, prev, isWeighted(arc.weight())),
                Properties.FST_PROPERTIES);
        vs.addArc(arc);
    }

    @Override
    public void deleteStates(Collection<Integer> dstates) {
        if (dstates.isEmpty())
            return;
        int n = states.size();
        int[] newId = new int[n];
        for (int s : dstates) {
            state(s);
            newId[s] = NO_STATE_ID;
        }
        int next = 0;
        for (int s = 0; s < n; s++) {
            if (newId[s] != NO_STATE_ID)
                newId[s] = next++;
        }
        List<VectorState<W>> kept = new ArrayList<>(next);
        for (int s = 0; s < n; s++) {
            if (newId[s] == NO_STATE_ID)
                continue;
            VectorState<W> vs = states.get(s);
            VectorState<W> renumbered = new VectorState<>(vs.finalWeight);
            for (Arc<W> arc : vs.arcs) {
                int t = newId[arc.nextState()];
                if (t != NO_STATE_ID)
                    renumbered.addArc(arc.withNextState(t));
            }
            kept.add(renumbered);
        }
        states.clear();
        states.addAll(kept);
        start = start == NO_STATE_ID ? NO_STATE_ID : newId[start];
        properties.set(PropertyUpdates.deleteStates(properties.bits()), Properties.FST_PROPERTIES);
    }

    @Override
    public void deleteStates() {
        states.clear();
        start = NO_STATE_ID;
        properties.set(PropertyUpdates.deleteAllStates(properties.bits()), Properties.FST_PROPERTIES);
    }

    @Override
    public void deleteArcs(int state) {
        state(state).clearArcs();
        properties.set(PropertyUpdates.deleteArcs(properties.bits()), Properties.FST_PROPERTIES);
    }

    @Override
    public void setProperties(long props, long mask) {
        long m = mask & ~(Properties.EXPANDED | Properties.MUTABLE);
        properties.set(props, m);
    }

    @Override
    public void setInputSymbols(SymbolTable symbols) {
        isymbols = symbols == null ? null : symbols.copy();
    }

    @Override
    public void setOutputSymbols(SymbolTable symbols) {
        osymbols = symbols == null ? null : symbols.copy();
    }

    private VectorState<W> state(int s) {
        if (s < 0 || s >= states.size())
            throw new IndexOutOfBoundsException("State " + s + " not in [0, " + states.size() + ")");
        return states.get(s);
    }

    // ── Serialization ───────────────────────────────────────────────

    @Override
    public void write(FstOutput out, FstWriteOptions opts) throws IOException {
        writeFraming(out, opts, FILE_VERSION, 0);
        for (VectorState<W> vs : states) {
            weightType.write(vs.finalWeight, out);
            out.writeLong(vs.arcs.size());
            for (Arc<W> arc : vs.arcs)
                writeArc(out, weightType, arc);
        }
        out.flush();
    }

    static <W extends Weight> VectorFst<W> read(FstInput in, FstReadOptions opts, WeightType<W> wt)
            throws IOException {
        FstHeader hdr = readHeader(in, opts, TYPE, wt, FILE_VERSION);
        VectorFst<W> fst = new VectorFst<>(wt);
        fst.readFraming(in, opts, hdr);
        checkCount(hdr.getNumStates(), "state", opts.getSource());
        long numStates = hdr.getNumStates();
        for (long s = 0; s < numStates; s++) {
            VectorState<W> vs = new VectorState<>(wt.read(in));
            long narcs = in.readLong();
            checkCount(narcs, "arc", opts.getSource());
            for (long a = 0; a < narcs; a++)
                vs.addArc(readArc(in, wt, numStates, opts.getSource()));
            fst.states.add(vs);
        }
        fst.start = (int) hdr.getStart();
        fst.properties.set(BINARY, Properties.BINARY_PROPERTIES);
        log.debug("Read vector FST from {}: {} states", opts.getSource(), numStates);
        return fst;
    }

    /** Per-state storage. */
    static final class VectorState<W extends Weight> {
        W finalWeight;
        final List<Arc<W>> arcs = new ArrayList<>();
        int niepsilons;
        int noepsilons;

        VectorState(W finalWeight) {
            this.finalWeight = finalWeight;
        }

        void addArc(Arc<W> arc) {
            if (arc.isInputEpsilon())
                niepsilons++;
            if (arc.isOutputEpsilon())
                noepsilons++;
            arcs.add(arc);
        }

        void clearArcs() {
            arcs.clear();
            niepsilons = 0;
            noepsilons = 0;
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
            return VectorFst.read(in, options, weightType);
        }

        @Override
        public <W extends Weight> Fst<W> convert(Fst<W> fst) {
            return copyOf(fst);
        }
    }
}
