package com.eyelevel.tableingestor.exception;

import java.io.Serial;

/**
 * Thrown when an upload would replace an existing object and overwrite was not requested (HTTP 409).
 */
public class ObjectAlreadyExistsException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8806113927540318844L;

    public ObjectAlreadyExistsException(String message) {
        super(message);
    }
}
