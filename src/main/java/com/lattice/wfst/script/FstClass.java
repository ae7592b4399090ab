package com.lattice.wfst.script;

import com.lattice.wfst.algo.PropertyComputer;
import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.MutableFst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.config.FstConfig;
import com.lattice.wfst.impl.VectorFst;
import com.lattice.wfst.io.FstError;
import com.lattice.wfst.io.FstFiles;
import com.lattice.wfst.io.FstFormatException;
import com.lattice.wfst.io.FstHeader;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstReader;
import com.lattice.wfst.io.FstRegistry;
import com.lattice.wfst.util.FstExplain;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Type-erased handle over exactly one FST of any encoding and arc type.
 *
 * <p>
 * Callers that do not know the weight type at compile time use this class;
 * every query is forwarded to the wrapped FST. Reads return null on failure,
 * after logging the cause.
 */
@Log4j2
public class FstClass {
    protected final Fst<?> fst;
    protected final FstConfig config;

    public FstClass(Fst<?> fst) {
        this(fst, FstConfig.defaults());
    }

    public FstClass(Fst<?> fst, FstConfig config) {
        if (fst == null)
            throw new IllegalArgumentException("fst must not be null");
        this.fst = fst;
        this.config = config;
    }

    // ── Reading ─────────────────────────────────────────────────────

    /** Reads from a file, or standard input if {@code path} is empty. */
    public static FstClass read(String path) {
        return read(path, FstConfig.defaults());
    }

    public static FstClass read(String path, FstConfig config) {
        return read(path, config, FstRegistry.defaultRegistry());
    }

    public static FstClass read(String path, FstConfig config, FstRegistry registry) {
        return read(path, null, config, registry);
    }

    /**
     * Reads a file whose encoding must be {@code fstType}, or any encoding if
     * it is null. A file of another encoding is logged as
     * {@link FstError#TYPE_MISMATCH} and yields null.
     */
    public static FstClass read(String path, String fstType, FstConfig config, FstRegistry registry) {
        String source = FstFiles.sourceName(path);
        try (FstInput in = FstFiles.openInput(path)) {
            return read(in, source, fstType, config, registry);
        } catch (NoSuchFileException e) {
            log.error("FstClass.read: Can't open file: {}", path);
        } catch (IOException e) {
            log.error("FstClass.read: I/O error on {}: {}", source, e.getMessage());
        }
        return null;
    }

    /** Reads from a stream the caller keeps ownership of. */
    public static FstClass read(InputStream stream, String source, FstConfig config, FstRegistry registry) {
        try (FstInput in = FstInput.borrow(stream)) {
            return read(in, source, null, config, registry);
        } catch (IOException e) {
            log.error("FstClass.read: Failed to close {}: {}", source, e.getMessage());
            return null;
        }
    }

    private static FstClass read(FstInput in, String source, String fstType, FstConfig config,
            FstRegistry registry) {
        try {
            FstHeader hdr = FstHeader.read(in, source, false);
            FstReadOptions opts = new FstReadOptions(source, hdr, config);
            Fst<?> fst = fstType == null
                    ? FstReader.read(in, opts, registry)
                    : FstReader.read(in, opts, registry, fstType);
            return wrap(fst, config);
        } catch (FstFormatException e) {
            log.error("FstClass.read: {}", e.getMessage());
        } catch (IOException e) {
            log.error("FstClass.read: Read failed: {}: {}", source, e.getMessage());
        }
        return null;
    }

    /** Wraps an FST in the most specific handle class. */
    public static FstClass wrap(Fst<?> fst, FstConfig config) {
        if (fst instanceof MutableFst<?> m)
            return VectorFst.TYPE.equals(fst.type()) ? new VectorFstClass(m, config) : new MutableFstClass(m, config);
        return new FstClass(fst, config);
    }

    // ── Contract ────────────────────────────────────────────────────

    public int start() {
        return fst.start();
    }

    public int numStates() {
        return fst.numStates();
    }

    public int numArcs(int state) {
        return fst.numArcs(state);
    }

    public int numInputEpsilons(int state) {
        return fst.numInputEpsilons(state);
    }

    public int numOutputEpsilons(int state) {
        return fst.numOutputEpsilons(state);
    }

    public List<? extends Arc<?>> arcs(int state) {
        return fst.arcs(state);
    }

    /** The final weight of a state, or empty if it is not final. */
    public Optional<Weight> finalWeight(int state) {
        return finalWeight(fst, state);
    }

    private static <W extends Weight> Optional<Weight> finalWeight(Fst<W> fst, int state) {
        W w = fst.finalWeight(state);
        return fst.weightType().isZero(w) ? Optional.empty() : Optional.of(w);
    }

    /**
     * Returns the properties in {@code mask}, computing unknown ones if
     * {@code test}. With {@code fst_verify_properties} set, known properties
     * are checked against the structure and a mismatch is logged.
     */
    public long properties(long mask, boolean test) {
        if (test && config.isVerifyProperties())
            return PropertyComputer.testProperties(fst, mask, true);
        return fst.properties(mask, test);
    }

    public String fstType() {
        return fst.type();
    }

    public String arcType() {
        return fst.arcType();
    }

    /** Semiring name, e.g. "tropical". */
    public String weightType() {
        return fst.weightType().name();
    }

    public FstConfig getConfig() {
        return config;
    }

    public Fst<?> getFst() {
        return fst;
    }

    /**
     * Typed access to the wrapped FST.
     *
     * @throws IllegalArgumentException if the arc type differs.
     */
    @SuppressWarnings("unchecked")
    public <W extends Weight> Fst<W> getFst(WeightType<W> weightType) {
        if (!weightType.arcType().equals(fst.arcType()))
            throw new IllegalArgumentException(
                    FstError.TYPE_MISMATCH + ": FST has arc type " + fst.arcType() + ", not " + weightType.arcType());
        return (Fst<W>) fst;
    }

    // ── Writing ─────────────────────────────────────────────────────

    /** Writes to a file, or standard output if {@code path} is empty. */
    public boolean write(String path) {
        return FstFiles.write(fst, path, config);
    }

    public boolean write(OutputStream stream, String source) {
        return FstFiles.write(fst, stream, source, config);
    }

    public String explain() {
        return FstExplain.explain(this);
    }

    @Override
    public String toString() {
        return "FstClass[" + fst + "]";
    }
}
