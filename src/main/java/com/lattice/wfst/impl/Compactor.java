package com.lattice.wfst.impl;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.props.Properties;

/**
 * Strategies that store an arc in fewer fields by dropping what the FST
 * shape makes redundant.
 *
 * <p>
 * Each strategy packs an arc into {@link #width()} ints plus, if
 * {@link #storesWeight()}, one weight. String strategies also drop the
 * destination: the single arc of state {@code s} always leads to {@code s + 1}.
 */
public enum Compactor {
    /** ilabel == olabel; keeps label, weight and destination. */
    ACCEPTOR("acceptor", 2, true, false, Properties.ACCEPTOR) {
        @Override
        <W extends Weight> boolean canCompact(int state, Arc<W> arc, WeightType<W> wt) {
            return arc.ilabel() == arc.olabel();
        }

        @Override
        void compact(Arc<?> arc, int[] data, int off) {
            data[off] = arc.ilabel();
            data[off + 1] = arc.nextState();
        }

        @Override
        <W extends Weight> Arc<W> expand(int state, int[] data, int off, W weight) {
            return new Arc<>(data[off], data[off], weight, data[off + 1]);
        }
    },

    /** Every arc weight is one; keeps both labels and destination. */
    UNWEIGHTED("unweighted", 3, false, false, 0L) {
        @Override
        <W extends Weight> boolean canCompact(int state, Arc<W> arc, WeightType<W> wt) {
            return wt.isOne(arc.weight());
        }

        @Override
        void compact(Arc<?> arc, int[] data, int off) {
            data[off] = arc.ilabel();
            data[off + 1] = arc.olabel();
            data[off + 2] = arc.nextState();
        }

        @Override
        <W extends Weight> Arc<W> expand(int state, int[] data, int off, W weight) {
            return new Arc<>(data[off], data[off + 1], weight, data[off + 2]);
        }
    },

    UNWEIGHTED_ACCEPTOR("unweighted_acceptor", 2, false, false, Properties.ACCEPTOR) {
        @Override
        <W extends Weight> boolean canCompact(int state, Arc<W> arc, WeightType<W> wt) {
            return arc.ilabel() == arc.olabel() && wt.isOne(arc.weight());
        }

        @Override
        void compact(Arc<?> arc, int[] data, int off) {
            data[off] = arc.ilabel();
            data[off + 1] = arc.nextState();
        }

        @Override
        <W extends Weight> Arc<W> expand(int state, int[] data, int off, W weight) {
            return new Arc<>(data[off], data[off], weight, data[off + 1]);
        }
    },

    /** A linear unweighted acceptor; keeps only the label. */
    STRING("string", 1, false, true, Properties.ACCEPTOR | Properties.ACYCLIC
            | Properties.INITIAL_ACYCLIC | Properties.TOP_SORTED) {
        @Override
        <W extends Weight> boolean canCompact(int state, Arc<W> arc, WeightType<W> wt) {
            return arc.ilabel() == arc.olabel() && wt.isOne(arc.weight()) && arc.nextState() == state + 1;
        }

        @Override
        void compact(Arc<?> arc, int[] data, int off) {
            data[off] = arc.ilabel();
        }

        @Override
        <W extends Weight> Arc<W> expand(int state, int[] data, int off, W weight) {
            return new Arc<>(data[off], data[off], weight, state + 1);
        }
    },

    /** A linear acceptor; keeps label and weight. */
    WEIGHTED_STRING("weighted_string", 1, true, true, Properties.ACCEPTOR | Properties.ACYCLIC
            | Properties.INITIAL_ACYCLIC | Properties.TOP_SORTED) {
        @Override
        <W extends Weight> boolean canCompact(int state, Arc<W> arc, WeightType<W> wt) {
            return arc.ilabel() == arc.olabel() && arc.nextState() == state + 1;
        }

        @Override
        void compact(Arc<?> arc, int[] data, int off) {
            data[off] = arc.ilabel();
        }

        @Override
        <W extends Weight> Arc<W> expand(int state, int[] data, int off, W weight) {
            return new Arc<>(data[off], data[off], weight, state + 1);
        }
    };

    private final String suffix;
    private final int width;
    private final boolean storesWeight;
    private final boolean linear;
    private final long impliedProperties;

    Compactor(String suffix, int width, boolean storesWeight, boolean linear, long impliedProperties) {
        this.suffix = suffix;
        this.width = width;
        this.storesWeight = storesWeight;
        this.linear = linear;
        this.impliedProperties = impliedProperties;
    }

    /** Encoding name, e.g. "compact_acceptor". */
    public String fstType() {
        return "compact_" + suffix;
    }

    /** Ints stored per arc. */
    public int width() {
        return width;
    }

    public boolean storesWeight() {
        return storesWeight;
    }

    /** True if states hold at most one arc, always to the next state id. */
    public boolean isLinear() {
        return linear;
    }

    /** Properties every FST of this encoding has. */
    public long impliedProperties() {
        return impliedProperties;
    }

    /** Bytes per stored arc record for a weight type. */
    public int recordSize(WeightType<?> wt) {
        return width * Integer.BYTES + (storesWeight ? wt.byteSize() : 0);
    }

    abstract <W extends Weight> boolean canCompact(int state, Arc<W> arc, WeightType<W> wt);

    abstract void compact(Arc<?> arc, int[] data, int off);

    /**
     * Rebuilds an arc; {@code weight} is the stored weight, or one if the
     * strategy does not store weights.
     */
    abstract <W extends Weight> Arc<W> expand(int state, int[] data, int off, W weight);
}
