package com.eyelevel.tableingestor.model;

/**
 * Error and warning codes attached to jobs. Row- and page-local codes only ever appear as warnings.
 */
public enum ErrorCode {
    UNSUPPORTED_FILE_TYPE,
    MALFORMED_CSV_ROW,
    OCR_PAGE_FAILURE,
    OCR_PAGES_TRUNCATED,
    OCR_DOCUMENT_FAILURE,
    SCHEMA_CONFLICT,
    TRANSIENT_STORE_ERROR,
    TIMEOUT_EXCEEDED,
    OBJECT_NOT_FOUND,
    EMPTY_CONTENT,
    ALREADY_LOADED,
    LOAD_FAILED,
    INTERNAL_ERROR
}
