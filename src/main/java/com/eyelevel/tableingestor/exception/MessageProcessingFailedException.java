package com.eyelevel.tableingestor.exception;

import java.io.Serial;

/**
 * Thrown by the SQS consumer when an upload event cannot be handed to the pipeline, so the
 * message is left on the queue for redelivery.
 * NOTE: This is an internal exception and should NOT be handled by the GlobalExceptionHandler.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
