package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

/**
 * Thrown for store or object storage failures that are worth retrying, such as lost connections
 * or lock timeouts.
 */
public class TransientStoreException extends IngestionException {
    @Serial
    private static final long serialVersionUID = -3018726457129982043L;

    public TransientStoreException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_STORE_ERROR, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
