package com.eyelevel.tableingestor.exception;

import com.eyelevel.tableingestor.model.ErrorCode;

import java.io.Serial;

/**
 * Thrown when a document cannot be opened or rendered at all. Single page failures are warnings, not exceptions.
 */
public class OcrExtractionException extends IngestionException {
    @Serial
    private static final long serialVersionUID = 7713508224305519604L;

    public OcrExtractionException(String message) {
        super(ErrorCode.OCR_DOCUMENT_FAILURE, message);
    }

    public OcrExtractionException(String message, Throwable cause) {
        super(ErrorCode.OCR_DOCUMENT_FAILURE, message, cause);
    }
}
