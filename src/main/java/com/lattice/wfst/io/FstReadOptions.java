package com.lattice.wfst.io;

import com.lattice.wfst.api.SymbolTable;
import com.lattice.wfst.config.FstConfig;

import lombok.Getter;
import lombok.Setter;

/**
 * Policy for materializing one persisted FST.
 *
 * <p>
 * When {@link #getHeader()} is set the header has already been consumed from
 * the stream and encodings must not read it again. Symbol tables given here
 * replace the ones stored in the file.
 */
@Getter
@Setter
public final class FstReadOptions {
    private final String source;
    private FstHeader header;
    private SymbolTable inputSymbols;
    private SymbolTable outputSymbols;
    private boolean readInputSymbols = true;
    private boolean readOutputSymbols = true;
    private ReadMode mode;
    private final FstConfig config;

    /** Options for a stream whose header has already been read. */
    public FstReadOptions(String source, FstHeader header, FstConfig config) {
        this.source = source;
        this.header = header;
        this.config = config;
        this.mode = ReadMode.fromString(config.getReadMode());
    }

    /** Options for a stream positioned at its header. */
    public FstReadOptions(String source, FstConfig config) {
        this(source, null, config);
    }

    public FstReadOptions(String source) {
        this(source, FstConfig.defaults());
    }

    public String debugString() {
        return "source: \"" + source + "\" mode: \"" + (mode == ReadMode.COPY ? "READ" : "MAP")
                + "\" read_isymbols: \"" + readInputSymbols
                + "\" read_osymbols: \"" + readOutputSymbols
                + "\" header: \"" + (header != null ? "set" : "null")
                + "\" isymbols: \"" + (inputSymbols != null ? "set" : "null")
                + "\" osymbols: \"" + (outputSymbols != null ? "set" : "null") + "\"";
    }
}
