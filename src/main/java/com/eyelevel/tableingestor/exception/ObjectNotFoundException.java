package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

public class ObjectNotFoundException extends IngestionException {
    @Serial
    private static final long serialVersionUID = -1894476520937148812L;

    public ObjectNotFoundException(String message) {
        super(ErrorCode.OBJECT_NOT_FOUND, message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(ErrorCode.OBJECT_NOT_FOUND, message, cause);
    }
}
