package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

/**
 * Thrown when a target table exists with columns that differ from the synthesized schema.
 */
public class SchemaConflictException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 6120387744129081537L;

    public SchemaConflictException(String message) {
        super(ErrorCode.SCHEMA_CONFLICT, message);
    }

    public SchemaConflictException(String message, Throwable cause) {
        super(ErrorCode.SCHEMA_CONFLICT, message, cause);
    }
}
