package com.lattice.wfst.io;

import java.io.IOException;

/**
 * Signals a recoverable failure while materializing or converting an FST.
 * Callers at operation boundaries log it and surface a null result.
 */
public class FstFormatException extends IOException {
    private final FstError error;

    public FstFormatException(FstError error, String message) {
        super(message);
        this.error = error;
    }

    public FstFormatException(FstError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public FstError error() {
        return error;
    }

    @Override
    public String getMessage() {
        return error + ": " + super.getMessage();
    }
}
