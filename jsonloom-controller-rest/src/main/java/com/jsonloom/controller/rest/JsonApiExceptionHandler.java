package com.jsonloom.controller.rest;

import com.jsonloom.core.configuration.JsonApiOptions;
import com.jsonloom.core.errors.ErrorDocument;
import com.jsonloom.core.errors.ErrorObject;
import com.jsonloom.core.errors.ErrorSource;
import com.jsonloom.core.errors.InvalidRequestBodyException;
import com.jsonloom.core.errors.JsonApiException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders failures of the JSON:API endpoints as error documents. Client errors are logged at warn,
 * everything else at error and reported as a generic 500.
 */
@RestControllerAdvice(assignableTypes = {ResourceController.class, AtomicOperationsController.class})
public class JsonApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(JsonApiExceptionHandler.class);

    private final JsonApiOptions options;

    public JsonApiExceptionHandler(JsonApiOptions options) {
        this.options = options;
    }

    @ExceptionHandler(JsonApiException.class)
    public ResponseEntity<ErrorDocument> handleJsonApiException(JsonApiException ex, HttpServletRequest request) {
        return respond(new ErrorDocument(ex.getErrors()), ex, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorDocument> handleUnreadableBody(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        InvalidRequestBodyException invalidBody = new InvalidRequestBodyException(
                null, "The request body is missing or is not a valid JSON:API document.", null, ex);
        return respond(new ErrorDocument(invalidBody.getErrors()), ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorDocument> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ErrorObject> errors = new ArrayList<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            ErrorObject error = new ErrorObject(422, "Input validation failed.", fieldError.getDefaultMessage());
            error.setSource(ErrorSource.forPointer(toPointer(fieldError.getField())));
            errors.add(error);
        }
        if (errors.isEmpty()) {
            errors.add(new ErrorObject(422, "Input validation failed.", null));
        }
        return respond(new ErrorDocument(errors), ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorDocument> handleUnexpected(Exception ex, HttpServletRequest request) {
        ErrorObject error;
        if (ex instanceof ErrorResponse errorResponse) {
            int status = errorResponse.getStatusCode().value();
            HttpStatus resolved = HttpStatus.resolve(status);
            error = new ErrorObject(
                    status, resolved != null ? resolved.getReasonPhrase() : null, errorResponse.getBody().getDetail());
        } else {
            error = new ErrorObject(500, "An unhandled error occurred while processing this request.", ex.getMessage());
        }
        if (options.isIncludeExceptionStackTraceInErrors()) {
            error.getMeta().put("stackTrace", Arrays.stream(ex.getStackTrace()).map(String::valueOf).toList());
        }
        return respond(new ErrorDocument(List.of(error)), ex, request);
    }

    private ResponseEntity<ErrorDocument> respond(ErrorDocument document, Exception ex, HttpServletRequest request) {
        int status = document.getErrorStatus();
        String path = request != null ? request.getRequestURI() : "<unknown>";
        if (status >= 500) {
            log.error("Request failed with status {} (path={})", status, path, ex);
        } else {
            log.warn("Request failed with status {}: {} (path={})", status, ex.getMessage(), path);
        }
        return ResponseEntity.status(status).contentType(JsonApiMediaTypes.JSON_API).body(document);
    }

    /** Maps a bean property path such as {@code operations[0].ref.type} to a pointer into the body. */
    static String toPointer(String propertyPath) {
        String pointer = "/" + propertyPath.replace('.', '/');
        if (pointer.startsWith("/operations")) {
            pointer = "/atomic:operations" + pointer.substring("/operations".length());
        }
        return pointer;
    }
}
