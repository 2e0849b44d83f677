package com.phillippitts.peercall.presentation.exception;

import com.phillippitts.peercall.exception.CallControlException;
import com.phillippitts.peercall.exception.ErrorKind;
import com.phillippitts.peercall.exception.PeerCallException;
import com.phillippitts.peercall.exception.SignalingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts call-layer exceptions to HTTP responses by {@link ErrorKind}.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Transient error - relay unreachable or not acknowledging (HTTP 503).
     */
    @ExceptionHandler(SignalingException.class)
    ResponseEntity<ApiError> handleSignaling(SignalingException ex) {
        LOG.warn("Signaling failure: kind={}, event={}", ex.getKind(), ex.getEventName());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getKind(),
                "Signaling service temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Call intent refused. Status depends on the kind; the relay's error is passed through.
     */
    @ExceptionHandler(CallControlException.class)
    ResponseEntity<ApiError> handleCallControl(CallControlException ex) {
        LOG.warn("Call intent refused: kind={}, peer={}, reason={}", ex.getKind(), ex.getPeerId(), ex.getMessage());
        String details = ex.getRemoteError() != null ? ex.getRemoteError() : ex.getMessage();
        return respond(statusFor(ex.getKind()), ex.getKind(), "Call request refused", details);
    }

    @ExceptionHandler(PeerCallException.class)
    ResponseEntity<ApiError> handlePeerCall(PeerCallException ex) {
        LOG.warn("Call layer error: kind={}", ex.getKind(), ex);
        return respond(statusFor(ex.getKind()), ex.getKind(), "Call request failed", ex.getMessage());
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid request: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case OFFLINE, ACK_TIMEOUT -> HttpStatus.SERVICE_UNAVAILABLE;
            case NOT_AUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case ROOM_FULL, INVALID_STATE -> HttpStatus.CONFLICT;
            case CALL_INITIATE_FAILED -> HttpStatus.BAD_GATEWAY;
            case SUPPRESSED_EVENT -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, ErrorKind kind, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(kind.name(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
