package com.eyelevel.tableingestor.exception.json;

import java.io.Serial;

/**
 * Raised by the JSON helpers when an upload event message, a registry column list or a request
 * payload cannot be read or written.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7719304268115503842L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
