package com.lattice.wfst.io;

import lombok.extern.log4j.Log4j2;

/** How a persisted FST body is materialized. */
@Log4j2
public enum ReadMode {
    /** Copy the body into heap memory. */
    COPY,
    /** Memory-map the body where the encoding and the stream allow it. */
    MEMORY_MAP;

    /**
     * Parses the {@code fst_read_mode} setting: "read" or "map".
     *
     * <p>
     * Any other value is logged and treated as "read" so that existing
     * deployments with a misspelt setting keep working.
     */
    public static ReadMode fromString(String mode) {
        if ("read".equals(mode))
            return COPY;
        if ("map".equals(mode))
            return MEMORY_MAP;
        log.error("Unknown file read mode {}", mode);
        return COPY;
    }
}
