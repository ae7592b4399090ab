package com.lattice.wfst.io;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Little-endian reader over a byte stream with position tracking.
 *
 * <p>
 * The stream always supports {@link #mark()}/{@link #reset()} so a header can
 * be peeked and re-read. When opened on a file, the underlying channel is kept
 * so that constant encodings can memory-map sections instead of copying them.
 *
 * <p>
 * A short read is reported as {@link FstError#READ_FAILED}.
 */
public final class FstInput implements Closeable {
    private static final int MAX_STRING_BYTES = 1 << 24;
    // Must cover the largest header: magic, two strings, two ints and four longs.
    private static final int MARK_LIMIT = 2 * (4 + MAX_STRING_BYTES) + 4 + 2 * 4 + 4 * 8;

    private final InputStream in;
    private final FileChannel channel;
    private final boolean owned;
    private final byte[] scratch = new byte[8];
    private long position;
    private long markedPosition = -1;

    public FstInput(InputStream in) {
        this(in, null, true);
    }

    private FstInput(InputStream in, FileChannel channel, boolean owned) {
        this.in = in.markSupported() ? in : new BufferedInputStream(in);
        this.channel = channel;
        this.owned = owned;
    }

    /** Opens a file for reading; its channel is available for mapping. */
    public static FstInput open(Path path) throws IOException {
        FileInputStream fis = new FileInputStream(path.toFile());
        return new FstInput(new BufferedInputStream(fis), fis.getChannel(), true);
    }

    /** Reads from a stream owned by someone else, e.g. standard input; {@link #close()} leaves it open. */
    public static FstInput borrow(InputStream in) {
        return new FstInput(in, null, false);
    }

    public static FstInput wrap(byte[] bytes) {
        return new FstInput(new ByteArrayInputStream(bytes));
    }

    /** Number of bytes consumed since the stream was opened. */
    public long position() {
        return position;
    }

    /** Records the current position for a later {@link #reset()}. */
    public void mark() {
        in.mark(MARK_LIMIT);
        markedPosition = position;
    }

    /** Returns to the position recorded by the last {@link #mark()}. */
    public void reset() throws IOException {
        if (markedPosition < 0)
            throw new IOException("reset() without mark()");
        in.reset();
        position = markedPosition;
    }

    public byte readByte() throws IOException {
        int b = in.read();
        if (b < 0)
            throw eof(1);
        position++;
        return (byte) b;
    }

    public void readFully(byte[] dst, int offset, int len) throws IOException {
        int n = in.readNBytes(dst, offset, len);
        position += n;
        if (n < len)
            throw eof(len - n);
    }

    public int readInt() throws IOException {
        readFully(scratch, 0, 4);
        return (scratch[0] & 0xFF) | (scratch[1] & 0xFF) << 8
                | (scratch[2] & 0xFF) << 16 | (scratch[3] & 0xFF) << 24;
    }

    public long readLong() throws IOException {
        readFully(scratch, 0, 8);
        long v = 0;
        for (int i = 7; i >= 0; i--)
            v = (v << 8) | (scratch[i] & 0xFFL);
        return v;
    }

    public float readFloat() throws IOException {
        return Float.intBitsToFloat(readInt());
    }

    public double readDouble() throws IOException {
        return Double.longBitsToDouble(readLong());
    }

    /** Reads an int32 length followed by that many UTF-8 bytes. */
    public String readString() throws IOException {
        int len = readInt();
        if (len < 0 || len > MAX_STRING_BYTES)
            throw new FstFormatException(FstError.READ_FAILED,
                    "Invalid string length " + len + " at offset " + (position - 4));
        byte[] bytes = new byte[len];
        readFully(bytes, 0, len);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public void skip(long n) throws IOException {
        long remaining = n;
        while (remaining > 0) {
            long skipped = in.skip(remaining);
            if (skipped <= 0) {
                readByte();
                skipped = 1;
            } else {
                position += skipped;
            }
            remaining -= skipped;
        }
    }

    /** Skips the padding written by {@link FstOutput#align(int)}. */
    public void align(int alignment) throws IOException {
        long rem = position % alignment;
        if (rem != 0)
            skip(alignment - rem);
    }

    /** True if sections of this stream can be memory-mapped. */
    public boolean canMap() {
        return channel != null;
    }

    /**
     * Maps the next {@code size} bytes read-only and advances past them.
     *
     * @throws IllegalStateException if the stream is not file-backed.
     */
    public ByteBuffer map(long size) throws IOException {
        if (channel == null)
            throw new IllegalStateException("Stream is not backed by a file");
        if (position + size > channel.size())
            throw eof(position + size - channel.size());
        ByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, position, size);
        skip(size);
        return mapped.order(ByteOrder.LITTLE_ENDIAN);
    }

    /** Reads the next {@code size} bytes into a heap buffer. */
    public ByteBuffer copy(int size) throws IOException {
        byte[] bytes = new byte[size];
        readFully(bytes, 0, size);
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    private FstFormatException eof(long missing) {
        return new FstFormatException(FstError.READ_FAILED,
                "Unexpected end of stream at offset " + position + " (" + missing + " bytes missing)");
    }

    @Override
    public void close() throws IOException {
        if (owned)
            in.close();
    }
}
