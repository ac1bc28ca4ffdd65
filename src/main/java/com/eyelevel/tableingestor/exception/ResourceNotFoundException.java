package com.eyelevel.tableingestor.exception;

import java.io.Serial;

/**
 * Thrown by the read side when a requested job or table does not exist (HTTP 404).
 */
public class ResourceNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6650184913300751285L;

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
