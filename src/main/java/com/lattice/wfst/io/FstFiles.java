package com.lattice.wfst.io;

import com.lattice.wfst.api.Fst;
import com.lattice.wfst.config.FstConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/** Path conventions shared by readers, writers and tools: an empty path is a standard stream. */
@Log4j2
public final class FstFiles {
    public static final String STDIN_NAME = "standard input";
    public static final String STDOUT_NAME = "standard output";

    private FstFiles() {
    }

    public static String sourceName(String path) {
        return path == null || path.isEmpty() ? STDIN_NAME : path;
    }

    /** Opens a file for reading, or borrows standard input if {@code path} is empty. */
    public static FstInput openInput(String path) throws IOException {
        if (path == null || path.isEmpty())
            return FstInput.borrow(System.in);
        Path p = Path.of(path);
        if (!Files.isRegularFile(p))
            throw new NoSuchFileException(path);
        return FstInput.open(p);
    }

    /** Opens a file for writing, or borrows standard output if {@code path} is empty. */
    public static FstOutput openOutput(String path) throws IOException {
        if (path == null || path.isEmpty())
            return FstOutput.borrow(System.out);
        return new FstOutput(Files.newOutputStream(Path.of(path)));
    }

    /**
     * Writes an FST to a file or standard output. Failures are logged.
     *
     * @return false if the write failed.
     */
    public static boolean write(Fst<?> fst, String path, FstConfig config) {
        String target = path == null || path.isEmpty() ? STDOUT_NAME : path;
        try (FstOutput out = openOutput(path)) {
            fst.write(out, new FstWriteOptions(target, config));
            return true;
        } catch (IOException e) {
            log.error("Failed to write FST to {}: {}", target, e.getMessage());
            return false;
        }
    }

    /** Writes an FST to a stream the caller keeps ownership of. */
    public static boolean write(Fst<?> fst, OutputStream stream, String target, FstConfig config) {
        try (FstOutput out = FstOutput.borrow(stream)) {
            fst.write(out, new FstWriteOptions(target, config));
            return true;
        } catch (IOException e) {
            log.error("Failed to write FST to {}: {}", target, e.getMessage());
            return false;
        }
    }
}
