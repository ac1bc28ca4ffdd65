package com.eyelevel.tableingestor.exception.handler;

import com.eyelevel.tableingestor.dto.common.ApiResponse;
import com.eyelevel.tableingestor.exception.IngestionException;
import com.eyelevel.tableingestor.exception.ObjectAlreadyExistsException;
import com.eyelevel.tableingestor.exception.ResourceNotFoundException;
import com.eyelevel.tableingestor.exception.json.JsonParsingException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the REST surface. It converts exceptions thrown from
 * controllers into the standard {@link ApiResponse} envelope with the matching HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles pipeline errors surfaced synchronously to a caller, e.g. an upload of an unsupported
     * file. (400 Bad Request)
     */
    @ExceptionHandler({IngestionException.class, JsonParsingException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body.",
                "The request body is missing or could not be parsed.");
    }

    /**
     * Handles missing required request parameters and multipart parts. (400 Bad Request)
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ApiResponse<Object>> handleMissingParameter(Exception ex) {
        log.warn("Handling missing request parameter: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Required parameter is missing.", ex.getMessage());
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String path = violation.getPropertyPath().toString();
                    return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1),
                            violation.getMessage());
                })
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid input provided.", errorMessage);
    }

    /**
     * Handles type mismatch errors for path variables or request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST, "Invalid parameter type provided.", errorMessage);
    }

    /**
     * Handles unknown jobs and tables. (404 Not Found)
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed.", errorMessage);
    }

    /**
     * Handles uploads that would silently replace an existing object. (409 Conflict)
     */
    @ExceptionHandler(ObjectAlreadyExistsException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(ObjectAlreadyExistsException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName());
    }

    private ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, String displayMessage, String detail) {
        ApiResponse<Object> response = ApiResponse.builder()
                .displayMessage(displayMessage)
                .response(detail)
                .showMessage(true)
                .statusCode(status.value())
                .build();
        return new ResponseEntity<>(response, status);
    }
}
