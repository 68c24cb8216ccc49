package com.example.spontaneous.shared.exception;

import com.example.spontaneous.shared.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidBroadcastInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidBroadcastInputException ex, ServerWebExchange exchange) {
        log.warn("Invalid input: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), exchange);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException ex, ServerWebExchange exchange) {
        log.warn("Unauthenticated request on path '{}'", exchange.getRequest().getPath());
        return buildResponse(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbidden(ForbiddenOperationException ex, ServerWebExchange exchange) {
        log.warn("Forbidden operation: {}", ex.getMessage());
        return buildResponse(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("ResourceNotFoundException: {}", ex.getMessage());
        return buildResponse(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler({JoinRequestAlreadyExistsException.class, JoinRequestAlreadyDecidedException.class})
    public ResponseEntity<ErrorResponse> handleConflict(BroadcastException ex, ServerWebExchange exchange) {
        log.warn("Conflict: {}", ex.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), exchange);
    }

    @ExceptionHandler(BroadcastExpiredException.class)
    public ResponseEntity<ErrorResponse> handleExpired(BroadcastExpiredException ex, ServerWebExchange exchange) {
        log.info("Rejected operation on expired broadcast: {}", ex.getMessage());
        return buildResponse(HttpStatus.GONE, "Gone", ex.getMessage(), exchange);
    }

    @ExceptionHandler({QueryTimeoutException.class, TransactionTimedOutException.class, DataAccessResourceFailureException.class})
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(Exception ex, ServerWebExchange exchange) {
        log.error("Store unavailable on path {}: {}", exchange.getRequest().getPath(), ex.getMessage());
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "The broadcast store is temporarily unavailable. Please try again later.", exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }
        return buildResponse(ex.getStatusCode(), ex.getStatusCode().toString(), ex.getReason(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatusCode status, String error, String message, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(ZoneOffset.UTC),
                status.value(),
                error,
                message,
                exchange.getRequest().getPath().toString()
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
