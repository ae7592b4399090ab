package com.lattice.wfst.io;

import com.lattice.wfst.config.FstConfig;

import lombok.Getter;
import lombok.Setter;

/** Controls what an encoding writes besides its body. */
@Getter
@Setter
public final class FstWriteOptions {
    private final String source;
    private boolean writeHeader = true;
    private boolean writeInputSymbols = true;
    private boolean writeOutputSymbols = true;
    private boolean align;

    public FstWriteOptions(String source, FstConfig config) {
        this.source = source;
        this.align = config.isAlign();
    }

    public FstWriteOptions(String source) {
        this(source, FstConfig.defaults());
    }
}
