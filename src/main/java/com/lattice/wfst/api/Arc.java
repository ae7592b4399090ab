package com.lattice.wfst.api;

/**
 * A transition: consumes {@code ilabel}, emits {@code olabel}, carries
 * {@code weight} and moves to {@code nextState}. Label 0 is epsilon.
 */
public record Arc<W extends Weight>(int ilabel, int olabel, W weight, int nextState) {

    public static final int EPSILON = 0;
    public static final int NO_LABEL = -1;

    public Arc {
        if (weight == null)
            throw new IllegalArgumentException("Arc weight must not be null");
    }

    public boolean isInputEpsilon() {
        return ilabel == EPSILON;
    }

    public boolean isOutputEpsilon() {
        return olabel == EPSILON;
    }

    public Arc<W> withNextState(int next) {
        return next == nextState ? this : new Arc<>(ilabel, olabel, weight, next);
    }
}
