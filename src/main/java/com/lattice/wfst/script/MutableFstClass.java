package com.lattice.wfst.script;

import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.io.FstRegistry;

import java.util.Collection;

/**
 * Handle over a mutable FST. Weights passed in are checked against the
 * wrapped FST's weight type.
 */
public class MutableFstClass extends FstClass {

    public MutableFstClass(MutableFst<?> fst, FstConfig config) {
        super(fst, config);
    }

    /**
     * Reads a mutable FST from a file, or standard input if {@code path} is
     * empty. Without {@code convert} the file must hold a vector FST; any
     * other encoding is logged as a type mismatch and yields null. With
     * {@code convert} an immutable encoding is copied into a vector FST.
     */
    public static MutableFstClass read(String path, boolean convert) {
        return read(path, convert, FstConfig.defaults());
    }

    public static MutableFstClass read(String path, boolean convert, FstConfig config) {
        if (!convert)
            return (MutableFstClass) read(path, VectorFst.TYPE, config, FstRegistry.defaultRegistry());
        FstClass fst = read(path, config);
        if (fst == null)
            return null;
        return fst instanceof MutableFstClass m ? m : new VectorFstClass(fst);
    }

    public MutableFst<?> getMutableFst() {
        return (MutableFst<?>) fst;
    }

    public void setStart(int state) {
        getMutableFst().setStart(state);
    }

    /**
     * @throws IllegalArgumentException if the weight belongs to another
     *                                  semiring.
     */
    public void setFinal(int state, Weight weight) {
        setFinal(getMutableFst(), state, weight);
    }

    private static <W extends Weight> void setFinal(MutableFst<W> fst, int state, Weight weight) {
        fst.setFinal(state, fst.weightType().cast(weight));
    }

    public int addState() {
        return getMutableFst().addState();
    }

    public void addArc(int state, int ilabel, int olabel, Weight weight, int nextState) {
        addArc(getMutableFst(), state, ilabel, olabel, weight, nextState);
    }

    private static <W extends Weight> void addArc(MutableFst<W> fst, int state, int ilabel, int olabel,
            Weight weight, int nextState) {
        fst.addArc(state, new Arc<>(ilabel, olabel, fst.weightType().cast(weight), nextState));
    }

    public void deleteStates(Collection<Integer> states) {
        getMutableFst().deleteStates(states);
    }

    public void deleteStates() {
        getMutableFst().deleteStates();
    }

    public void deleteArcs(int state) {
        getMutableFst().deleteArcs(state);
    }

    public void setProperties(long props, long mask) {
        getMutableFst().setProperties(props, mask);
    }

    public void setInputSymbols(SymbolTable symbols) {
        getMutableFst().setInputSymbols(symbols);
    }

    public void setOutputSymbols(SymbolTable symbols) {
        getMutableFst().setOutputSymbols(symbols);
    }
}
