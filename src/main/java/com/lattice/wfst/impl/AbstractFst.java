package com.lattice.wfst.impl;

import com.lattice.wfst.algo.PropertyComputer;
import com.lattice.wfst.api.Arc;
import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.io.FstError;
import com.lattice.wfst.io.FstFormatException;
import com.lattice.wfst.io.FstHeader;
import com.lattice.wfst.io.FstInput;
import com.lattice.wfst.io.FstOutput;
import com.lattice.wfst.io.FstReadOptions;
import com.lattice.wfst.io.FstWriteOptions;
import com.lattice.wfst.props.Properties;
import com.lattice.wfst.props.PropertySet;

import java.io.IOException;

/**
 * Shared state of every concrete encoding: its type name, weight type,
 * property cache and symbol tables, plus the header and symbol table framing
 * used by all binary bodies.
 */
public abstract class AbstractFst<W extends Weight> implements Fst<W> {
    protected final String type;
    protected final WeightType<W> weightType;
    protected final PropertySet properties;
    protected SymbolTable isymbols;
    protected SymbolTable osymbols;

    protected AbstractFst(String type, WeightType<W> weightType, long props) {
        this.type = type;
        this.weightType = weightType;
        this.properties = new PropertySet(props);
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public WeightType<W> weightType() {
        return weightType;
    }

    @Override
    public SymbolTable inputSymbols() {
        return isymbols;
    }

    @Override
    public SymbolTable outputSymbols() {
        return osymbols;
    }

    @Override
    public long properties(long mask, boolean test) {
        if (test) {
            long unknown = mask & Properties.TRINARY_PROPERTIES & ~properties.knownMask();
            if (unknown != 0) {
                long computed = PropertyComputer.compute(this);
                properties.set(computed, Properties.TRINARY_PROPERTIES & ~properties.knownMask());
            }
        }
        return properties.get(mask);
    }

    /** Live property cache; encodings adjust it as they change. */
    public PropertySet propertySet() {
        return properties;
    }

    protected final boolean isWeighted(W weight) {
        return !weightType.isZero(weight) && !weightType.isOne(weight);
    }

    @Override
    public String toString() {
        return type + "(" + arcType() + ", states=" + numStates() + ", start=" + start() + ")";
    }

    // ── Header framing ──────────────────────────────────────────────

    /**
     * Returns the header of the FST being read, consuming it from the stream
     * unless the options already carry it.
     *
     * @throws FstFormatException {@link FstError#TYPE_MISMATCH} if the header
     *                            names another encoding or arc type,
     *                            {@link FstError#READ_FAILED} if its version is
     *                            older than {@code minVersion}.
     */
    protected static FstHeader readHeader(FstInput in, FstReadOptions opts, String expectedType,
            WeightType<?> weightType, int minVersion) throws IOException {
        FstHeader hdr = opts.getHeader() != null
                ? opts.getHeader()
                : FstHeader.read(in, opts.getSource(), false);
        if (!expectedType.equals(hdr.getFstType()))
            throw new FstFormatException(FstError.TYPE_MISMATCH,
                    "FST not of type \"" + expectedType + "\": " + opts.getSource());
        if (!weightType.arcType().equals(hdr.getArcType()))
            throw new FstFormatException(FstError.TYPE_MISMATCH,
                    "Arc not of type \"" + weightType.arcType() + "\": " + opts.getSource());
        if (hdr.getVersion() < minVersion)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Obsolete " + expectedType + " FST version " + hdr.getVersion() + ": " + opts.getSource());
        return hdr;
    }

    /**
     * Adopts the header's stored properties and reads the symbol tables that
     * follow it. Tables supplied in the options replace the stored ones.
     */
    protected void readFraming(FstInput in, FstReadOptions opts, FstHeader hdr) throws IOException {
        properties.set(hdr.getProperties(), Properties.COPY_PROPERTIES);
        if (hdr.hasFlag(FstHeader.HAS_ISYMBOLS)) {
            SymbolTable table = SymbolTable.read(in, opts.getSource());
            if (opts.isReadInputSymbols())
                isymbols = table;
        }
        if (hdr.hasFlag(FstHeader.HAS_OSYMBOLS)) {
            SymbolTable table = SymbolTable.read(in, opts.getSource());
            if (opts.isReadOutputSymbols())
                osymbols = table;
        }
        if (opts.getInputSymbols() != null)
            isymbols = opts.getInputSymbols().copy();
        if (opts.getOutputSymbols() != null)
            osymbols = opts.getOutputSymbols().copy();
    }

    /** Writes the header and symbol tables if the options ask for them. */
    protected void writeFraming(FstOutput out, FstWriteOptions opts, int version, int extraFlags)
            throws IOException {
        if (!opts.isWriteHeader())
            return;
        boolean writeIsymbols = isymbols != null && opts.isWriteInputSymbols();
        boolean writeOsymbols = osymbols != null && opts.isWriteOutputSymbols();
        int flags = extraFlags;
        if (writeIsymbols)
            flags |= FstHeader.HAS_ISYMBOLS;
        if (writeOsymbols)
            flags |= FstHeader.HAS_OSYMBOLS;
        FstHeader hdr = new FstHeader()
                .setFstType(type)
                .setArcType(arcType())
                .setVersion(version)
                .setFlags(flags)
                .setProperties(properties.get(Properties.COPY_PROPERTIES) | binaryProperties())
                .setStart(start())
                .setNumStates(numStates())
                .setNumArcs(numArcsTotal());
        hdr.write(out, opts.getSource());
        if (writeIsymbols)
            isymbols.write(out);
        if (writeOsymbols)
            osymbols.write(out);
    }

    /** The binary properties every instance of this encoding has. */
    protected abstract long binaryProperties();

    // ── Arc records ─────────────────────────────────────────────────

    protected static <W extends Weight> void writeArc(FstOutput out, WeightType<W> wt, Arc<W> arc)
            throws IOException {
        out.writeInt(arc.ilabel());
        out.writeInt(arc.olabel());
        wt.write(arc.weight(), out);
        out.writeInt(arc.nextState());
    }

    protected static <W extends Weight> Arc<W> readArc(FstInput in, WeightType<W> wt, long numStates,
            String source) throws IOException {
        int ilabel = in.readInt();
        int olabel = in.readInt();
        W weight = wt.read(in);
        int next = in.readInt();
        if (next < 0 || next >= numStates)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Arc destination " + next + " out of range in " + source);
        return new Arc<>(ilabel, olabel, weight, next);
    }

    /** Size in bytes of one arc record for a weight type. */
    protected static int arcRecordSize(WeightType<?> wt) {
        return 3 * Integer.BYTES + wt.byteSize();
    }

    protected static void checkCount(long count, String what, String source) throws FstFormatException {
        if (count < 0 || count > Integer.MAX_VALUE)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Invalid " + what + " count " + count + " in " + source);
    }
}
