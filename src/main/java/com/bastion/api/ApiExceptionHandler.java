package com.bastion.api;

import com.bastion.domain.ResourceNotFoundException;
import com.bastion.indicator.DuplicateIndicatorException;
import com.bastion.indicator.NoteAccessDeniedException;
import com.bastion.indicator.WhitelistedIndicatorException;
import com.bastion.ingestion.FetchInProgressException;
import com.bastion.ingestion.SourceInactiveException;
import com.bastion.ingestion.SourcePausedException;
import com.bastion.security.MissingIdentityException;
import com.bastion.whitelist.DuplicateWhitelistEntryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.concurrent.RejectedExecutionException;

/**
 * Maps exceptions thrown by controllers to HTTP status codes and the
 * {@link ApiError} body.
 *
 * Error codes:
 * - NOT_FOUND: unknown id
 * - SOURCE_PAUSED, SOURCE_INACTIVE, FETCH_IN_PROGRESS: fetch not admitted
 * - WHITELISTED: manual indicator covered by the whitelist
 * - DUPLICATE: indicator or whitelist value already exists
 * - ACCESS_DENIED: note missing or written by another user
 * - UNAUTHENTICATED: action needs a user id
 * - INVALID_ARGUMENT: validation failures and malformed requests
 * - BUSY: ingestion pool saturated
 * - INTERNAL_ERROR: everything else
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception ex) {
        if (ex instanceof ResourceNotFoundException) {
            return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex);
        }
        if (ex instanceof SourcePausedException) {
            return error(HttpStatus.CONFLICT, "SOURCE_PAUSED", ex);
        }
        if (ex instanceof SourceInactiveException) {
            return error(HttpStatus.CONFLICT, "SOURCE_INACTIVE", ex);
        }
        if (ex instanceof FetchInProgressException) {
            return error(HttpStatus.CONFLICT, "FETCH_IN_PROGRESS", ex);
        }
        if (ex instanceof WhitelistedIndicatorException) {
            return error(HttpStatus.BAD_REQUEST, "WHITELISTED", ex);
        }
        if (ex instanceof DuplicateIndicatorException || ex instanceof DuplicateWhitelistEntryException) {
            return error(HttpStatus.CONFLICT, "DUPLICATE", ex);
        }
        if (ex instanceof NoteAccessDeniedException) {
            return error(HttpStatus.FORBIDDEN, "ACCESS_DENIED", ex);
        }
        if (ex instanceof MissingIdentityException) {
            return error(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", ex);
        }
        if (ex instanceof MethodArgumentNotValidException) {
            FieldError field = ((MethodArgumentNotValidException) ex).getBindingResult().getFieldError();
            String message = field != null ? field.getDefaultMessage() : "Validation failed";
            return ResponseEntity.badRequest().body(new ApiError(message, "INVALID_ARGUMENT"));
        }
        if (ex instanceof IllegalArgumentException
                || ex instanceof MethodArgumentTypeMismatchException
                || ex instanceof MissingServletRequestParameterException) {
            return error(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex);
        }
        if (ex instanceof HttpMessageNotReadableException) {
            return ResponseEntity.badRequest().body(new ApiError("Malformed request body", "INVALID_ARGUMENT"));
        }
        if (ex instanceof RejectedExecutionException) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError("Ingestion workers are busy, try again later", "BUSY"));
        }
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            return ResponseEntity.status(status).body(new ApiError(formatMessage(ex), codeFor(status)));
        }

        log.error("Unhandled exception in API request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError("An internal error occurred while processing your request", "INTERNAL_ERROR"));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, Exception ex) {
        log.debug("Request failed with {}: {}", code, ex.getMessage());
        return ResponseEntity.status(status).body(new ApiError(formatMessage(ex), code));
    }

    private static String codeFor(HttpStatusCode status) {
        if (status.value() == 404) {
            return "NOT_FOUND";
        }
        return status.is4xxClientError() ? "INVALID_ARGUMENT" : "INTERNAL_ERROR";
    }

    /**
     * First line of the message, or the exception type when there is none.
     */
    private static String formatMessage(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isEmpty()) {
            return "An error occurred: " + ex.getClass().getSimpleName();
        }
        return message.split("\n")[0].trim();
    }
}
