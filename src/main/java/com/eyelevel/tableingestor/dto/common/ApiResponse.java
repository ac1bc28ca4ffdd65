package com.eyelevel.tableingestor.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope returned by every ingestion and table endpoint, for successful calls and for errors
 * mapped by the exception handler alike.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /** Human-readable outcome, e.g. "Ingestion job accepted." */
    private final String displayMessage;

    /** Payload: a job status, a table listing, rows, or an error detail string. */
    private final T response;

    private final Boolean showMessage;

    /** Mirrors the HTTP status of the enclosing response. */
    private final Integer statusCode;
}
