package com.lattice.wfst.io;

/** Recoverable failure kinds reported while reading, converting or sorting FSTs. */
public enum FstError {
    /** Magic number mismatch; the stream does not start with an FST header. */
    HEADER_INVALID,
    /** Stream exhausted or corrupt inside a header, symbol table or body. */
    READ_FAILED,
    /** Encoding name not present in the registry. */
    UNKNOWN_FST_TYPE,
    /** Arc type name not present in the weight registry. */
    UNKNOWN_ARC_TYPE,
    /** A specific encoding or arc type was expected and another one was found. */
    TYPE_MISMATCH
}
