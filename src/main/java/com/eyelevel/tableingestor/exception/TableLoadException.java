package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

/**
 * Thrown when rows cannot be written for a non-transient reason. The load transaction is rolled
 * back, so no partial rows remain.
 */
public class TableLoadException extends IngestionException {
    @Serial
    private static final long serialVersionUID = -8105433460924913126L;

    public TableLoadException(String message, Throwable cause) {
        super(ErrorCode.LOAD_FAILED, message, cause);
    }
}
