package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;
import lombok.Getter;

import java.io.Serial;
import java.time.Duration;

/**
 * Thrown when a pipeline stage exceeds its configured time budget.
 */
@Getter
public class StageTimeoutException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 5528817040036118227L;

    private final String stage;

    public StageTimeoutException(String stage, Duration budget, Throwable cause) {
        super(ErrorCode.TIMEOUT_EXCEEDED, String.format("Stage %s exceeded its budget of %d ms", stage,
                budget.toMillis()), cause);
        this.stage = stage;
    }
}
