package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;
import lombok.Getter;

import java.io.Serial;

/**
 * Base exception for failures inside the ingestion pipeline. Every instance carries the
 * {@link ErrorCode} recorded on the failed job.
 */
@Getter
public class IngestionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2871106504521365839L;

    private final ErrorCode errorCode;

    public IngestionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IngestionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Whether retrying the failed operation may succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
