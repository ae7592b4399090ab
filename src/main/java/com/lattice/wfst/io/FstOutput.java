package com.lattice.wfst.io;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian writer with position tracking, the counterpart of
 * {@link FstInput}. Every primitive has a fixed width so files are portable
 * across platforms.
 */
public final class FstOutput implements Closeable, Flushable {
    private final OutputStream out;
    private final boolean owned;
    private final byte[] scratch = new byte[8];
    private long position;

    public FstOutput(OutputStream out) {
        this(out, true);
    }

    private FstOutput(OutputStream out, boolean owned) {
        this.out = out instanceof BufferedOutputStream ? out : new BufferedOutputStream(out);
        this.owned = owned;
    }

    /** Writes to a stream owned by someone else, e.g. standard output; {@link #close()} only flushes. */
    public static FstOutput borrow(OutputStream out) {
        return new FstOutput(out, false);
    }

    public long position() {
        return position;
    }

    public void writeByte(byte b) throws IOException {
        out.write(b);
        position++;
    }

    public void writeBytes(byte[] src, int offset, int len) throws IOException {
        out.write(src, offset, len);
        position += len;
    }

    public void writeInt(int v) throws IOException {
        scratch[0] = (byte) v;
        scratch[1] = (byte) (v >> 8);
        scratch[2] = (byte) (v >> 16);
        scratch[3] = (byte) (v >> 24);
        writeBytes(scratch, 0, 4);
    }

    public void writeLong(long v) throws IOException {
        for (int i = 0; i < 8; i++)
            scratch[i] = (byte) (v >> (i * 8));
        writeBytes(scratch, 0, 8);
    }

    public void writeFloat(float v) throws IOException {
        writeInt(Float.floatToRawIntBits(v));
    }

    public void writeDouble(double v) throws IOException {
        writeLong(Double.doubleToRawLongBits(v));
    }

    public void writeString(String s) throws IOException {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        writeInt(bytes.length);
        writeBytes(bytes, 0, bytes.length);
    }

    /** Pads with zero bytes up to the next multiple of {@code alignment}. */
    public void align(int alignment) throws IOException {
        long rem = position % alignment;
        if (rem != 0) {
            for (long i = rem; i < alignment; i++)
                writeByte((byte) 0);
        }
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (owned)
            out.close();
        else
            out.flush();
    }
}
