package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

/**
 * Thrown when an upload is neither CSV, PDF nor a supported image.
 */
public class UnsupportedFileTypeException extends IngestionException {
    @Serial
    private static final long serialVersionUID = -4146823766536414925L;

    public UnsupportedFileTypeException(String message) {
        super(ErrorCode.UNSUPPORTED_FILE_TYPE, message);
    }

    public UnsupportedFileTypeException(String message, Throwable cause) {
        super(ErrorCode.UNSUPPORTED_FILE_TYPE, message, cause);
    }
}
