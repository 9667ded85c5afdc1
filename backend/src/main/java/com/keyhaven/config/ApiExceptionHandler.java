package com.keyhaven.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.keyhaven.error.AuthenticationFailureException;
import com.keyhaven.error.ConnectivityException;
import com.keyhaven.error.InvalidStateException;
import com.keyhaven.error.KeyCustodyException;
import com.keyhaven.error.NotAuthorizedException;
import com.keyhaven.error.NotFoundException;
import com.keyhaven.error.UnsupportedPlatformException;

/** Maps the key custody error taxonomy to HTTP statuses with a {@code {error, message}} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorResponse(String error, String message) {}

    @ExceptionHandler(KeyCustodyException.class)
    public ResponseEntity<ErrorResponse> handleKeyCustody(KeyCustodyException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", status.value(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode(e), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", e.getMessage()));
    }

    static HttpStatus statusOf(KeyCustodyException e) {
        if (e instanceof AuthenticationFailureException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof InvalidStateException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof NotAuthorizedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof UnsupportedPlatformException) {
            return HttpStatus.NOT_IMPLEMENTED;
        }
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ConnectivityException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String errorCode(KeyCustodyException e) {
        if (e instanceof AuthenticationFailureException) {
            return "authentication_failure";
        }
        if (e instanceof InvalidStateException) {
            return "invalid_state";
        }
        if (e instanceof NotAuthorizedException) {
            return "not_authorized";
        }
        if (e instanceof UnsupportedPlatformException) {
            return "unsupported_operation";
        }
        if (e instanceof NotFoundException) {
            return "not_found";
        }
        if (e instanceof ConnectivityException) {
            return "connectivity_failure";
        }
        return "internal_error";
    }
}
