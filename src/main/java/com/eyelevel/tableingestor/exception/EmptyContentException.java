package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

/**
 * Thrown when a file yields no header or no text to load.
 */
public class EmptyContentException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 3390581170249715260L;

    public EmptyContentException(String message) {
        super(ErrorCode.EMPTY_CONTENT, message);
    }

    public EmptyContentException(String message, Throwable cause) {
        super(ErrorCode.EMPTY_CONTENT, message, cause);
    }
}
