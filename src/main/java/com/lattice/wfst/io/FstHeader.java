package com.lattice.wfst.io;

import java.io.IOException;

import lombok.Data;
import lombok.experimental.Accessors;
import lombok.extern.log4j.Log4j2;

/**
 * Versioned binary preamble of a persisted FST.
 *
 * <p>
 * Layout, in order: magic number (int32), fst type (string), arc type
 * (string), version (int32), flags (int32), properties (uint64), start state
 * (int64, -1 if none), number of states (int64), number of arcs (int64).
 *
 * <p>
 * The magic number is checked before any other field is trusted.
 */
@Data
@Accessors(chain = true)
@Log4j2
public final class FstHeader {
    public static final int MAGIC_NUMBER = 2125659606;

    // Flag bits
    public static final int HAS_ISYMBOLS = 0x1;
    public static final int HAS_OSYMBOLS = 0x2;
    public static final int IS_ALIGNED = 0x4;

    private String fstType = "";
    private String arcType = "";
    private int version;
    private int flags;
    private long properties;
    private long start = -1;
    private long numStates;
    private long numArcs;

    /**
     * Reads and validates a header.
     *
     * @param in     The stream, positioned at the magic number.
     * @param source Label of the stream used in diagnostics.
     * @param rewind If true, the stream is returned to its starting position
     *               whether the read succeeds or fails.
     * @return The parsed header.
     * @throws FstFormatException {@link FstError#HEADER_INVALID} on a magic
     *                            number mismatch, {@link FstError#READ_FAILED}
     *                            if the stream ends early, faults, or a count
     *                            is corrupt. Nothing is logged here; callers
     *                            report the failure.
     */
    public static FstHeader read(FstInput in, String source, boolean rewind) throws IOException {
        if (rewind)
            in.mark();
        try {
            int magic = in.readInt();
            if (magic != MAGIC_NUMBER)
                throw new FstFormatException(FstError.HEADER_INVALID,
                        "Bad FST header: " + source + ". Magic number not matched. Got: " + magic);
            FstHeader hdr = new FstHeader();
            hdr.fstType = in.readString();
            hdr.arcType = in.readString();
            hdr.version = in.readInt();
            hdr.flags = in.readInt();
            hdr.properties = in.readLong();
            hdr.start = in.readLong();
            hdr.numStates = in.readLong();
            hdr.numArcs = in.readLong();
            hdr.validate(source);
            if (rewind)
                in.reset();
            return hdr;
        } catch (IOException e) {
            if (rewind)
                in.reset();
            if (e instanceof FstFormatException)
                throw e;
            throw new FstFormatException(FstError.READ_FAILED, "Read failed: " + source + ": " + e.getMessage(), e);
        }
    }

    private void validate(String source) throws FstFormatException {
        if (numStates < 0 || numArcs < 0)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Negative counts in header of " + source + ": " + debugString());
        if (start < -1 || (start >= 0 && start >= numStates))
            throw new FstFormatException(FstError.READ_FAILED,
                    "Start state out of range in header of " + source + ": " + debugString());
    }

    /**
     * Writes the magic number followed by every field.
     *
     * @return true; stream faults are thrown.
     */
    public boolean write(FstOutput out, String source) throws IOException {
        out.writeInt(MAGIC_NUMBER);
        out.writeString(fstType);
        out.writeString(arcType);
        out.writeInt(version);
        out.writeInt(flags);
        out.writeLong(properties);
        out.writeLong(start);
        out.writeLong(numStates);
        out.writeLong(numArcs);
        log.trace("Wrote header for {}: {}", source, this);
        return true;
    }

    public boolean hasFlag(int flag) {
        return (flags & flag) != 0;
    }

    /** Field-labeled rendering for diagnostics; not a parse format. */
    public String debugString() {
        return "fsttype: \"" + fstType + "\" arctype: \"" + arcType
                + "\" version: \"" + version + "\" flags: \"" + flags
                + "\" properties: \"" + Long.toUnsignedString(properties) + "\" start: \"" + start
                + "\" numstates: \"" + numStates + "\" numarcs: \"" + numArcs + "\"";
    }
}
