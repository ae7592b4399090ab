package com.lattice.wfst.io;

import com.lattice.wfst.api.Fst;
import com.lattice.wfst.api.Weight;
import com.lattice.wfst.api.WeightType;
import com.lattice.wfst.config.FstConfig;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

import lombok.extern.log4j.Log4j2;

/**
 * Reads a persisted FST of any registered encoding and arc type.
 *
 * <p>
 * The header is read first to pick the {@link FstFactory} and
 * {@link WeightType}; the factory then reads the body from the same stream.
 */
@Log4j2
public final class FstReader {

    private FstReader() {
    }

    /**
     * @throws FstFormatException {@link FstError#UNKNOWN_FST_TYPE} or
     *                            {@link FstError#UNKNOWN_ARC_TYPE} if the header
     *                            names something the registry lacks, or any
     *                            error raised while reading.
     */
    public static Fst<?> read(FstInput in, FstReadOptions options, FstRegistry registry) throws IOException {
        FstHeader hdr = peekHeader(in, options);
        return readBody(in, options, registry, hdr, registry.weightType(hdr.getArcType()));
    }

    /**
     * Reads an FST that must carry the given weight type.
     *
     * @throws FstFormatException {@link FstError#TYPE_MISMATCH} if the stored
     *                            arc type differs.
     */
    @SuppressWarnings("unchecked")
    public static <W extends Weight> Fst<W> read(FstInput in, FstReadOptions options, FstRegistry registry,
            WeightType<W> weightType) throws IOException {
        FstHeader hdr = peekHeader(in, options);
        if (!weightType.arcType().equals(hdr.getArcType()))
            throw new FstFormatException(FstError.TYPE_MISMATCH,
                    "Arc type \"" + hdr.getArcType() + "\" is not \"" + weightType.arcType() + "\": "
                            + options.getSource());
        return (Fst<W>) readBody(in, options, registry, hdr, weightType);
    }

    /**
     * Reads an FST that must be stored in the given encoding. The body is read
     * by that encoding's factory, whatever the header names.
     *
     * @throws FstFormatException {@link FstError#UNKNOWN_FST_TYPE} if
     *                            {@code fstType} is not registered,
     *                            {@link FstError#TYPE_MISMATCH} if the header
     *                            names another encoding.
     */
    public static Fst<?> read(FstInput in, FstReadOptions options, FstRegistry registry, String fstType)
            throws IOException {
        FstFactory factory = registry.factory(fstType);
        if (factory == null)
            throw new FstFormatException(FstError.UNKNOWN_FST_TYPE,
                    "Unknown FST type \"" + fstType + "\": " + options.getSource());
        FstHeader hdr = peekHeader(in, options);
        WeightType<?> weightType = registry.weightType(hdr.getArcType());
        if (weightType == null)
            throw new FstFormatException(FstError.UNKNOWN_ARC_TYPE,
                    "Unknown arc type \"" + hdr.getArcType() + "\" (FST type = \"" + hdr.getFstType()
                            + "\"): " + options.getSource());
        return factory.read(in, options, weightType);
    }

    /**
     * Reads from a file, or standard input if {@code path} is empty. Failures
     * are logged and yield null.
     */
    public static Fst<?> read(String path, FstConfig config, FstRegistry registry) {
        String source = FstFiles.sourceName(path);
        try (FstInput in = FstFiles.openInput(path)) {
            return read(in, new FstReadOptions(source, config), registry);
        } catch (NoSuchFileException e) {
            log.error("Can't open file {}", path);
        } catch (IOException e) {
            log.error("Failed to read FST from {}: {}", source, e.getMessage());
        }
        return null;
    }

    private static FstHeader peekHeader(FstInput in, FstReadOptions options) throws IOException {
        return options.getHeader() != null ? options.getHeader() : FstHeader.read(in, options.getSource(), true);
    }

    private static Fst<?> readBody(FstInput in, FstReadOptions options, FstRegistry registry, FstHeader hdr,
            WeightType<?> weightType) throws IOException {
        FstFactory factory = registry.factory(hdr.getFstType());
        if (factory == null)
            throw new FstFormatException(FstError.UNKNOWN_FST_TYPE,
                    "Unknown FST type \"" + hdr.getFstType() + "\" (arc type = \"" + hdr.getArcType()
                            + "\"): " + options.getSource());
        if (weightType == null)
            throw new FstFormatException(FstError.UNKNOWN_ARC_TYPE,
                    "Unknown arc type \"" + hdr.getArcType() + "\" (FST type = \"" + hdr.getFstType()
                            + "\"): " + options.getSource());
        log.debug("Reading {} from {}", hdr.debugString(), options.getSource());
        return factory.read(in, options, weightType);
    }
}
