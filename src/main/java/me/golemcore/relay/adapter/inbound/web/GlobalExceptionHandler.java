package me.golemcore.relay.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.relay.domain.exception.AuthenticationException;
import me.golemcore.relay.domain.exception.DocumentStoreException;
import me.golemcore.relay.domain.exception.EncodingException;
import me.golemcore.relay.domain.exception.OperationTimeoutException;
import me.golemcore.relay.domain.exception.StoreOperationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletionException;

/**
 * Centralized exception handler for the relay controllers. Store failures are
 * reported as gateway errors; their details stay in the log.
 */
@ControllerAdvice(basePackages = "me.golemcore.relay.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CompletionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCompletion(CompletionException ex) {
        Throwable cause = DocumentStoreException.unwrap(ex);
        if (cause instanceof DocumentStoreException storeException) {
            return handleStore(storeException);
        }
        if (cause instanceof IllegalArgumentException illegalArgument) {
            return handleIllegalArgument(illegalArgument);
        }
        return handleGeneric(ex);
    }

    @ExceptionHandler(DocumentStoreException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStore(DocumentStoreException ex) {
        if (ex instanceof OperationTimeoutException) {
            log.warn("[API] Upstream timeout: {}", ex.getMessage());
            return respond(HttpStatus.GATEWAY_TIMEOUT, "Document store timed out");
        }
        if (ex instanceof AuthenticationException) {
            log.error("[API] Authentication with document store failed: {}", ex.getMessage());
            return respond(HttpStatus.BAD_GATEWAY, "Authentication with document store failed");
        }
        if (ex instanceof StoreOperationException storeOperation) {
            log.error("[API] Document store error (HTTP {}): {}", storeOperation.getStatus(), ex.getMessage());
            return respond(HttpStatus.BAD_GATEWAY, "Document store request failed");
        }
        if (ex instanceof EncodingException) {
            log.warn("[API] Unencodable record: {}", ex.getMessage());
            return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
        log.error("[API] Document store failure", ex);
        return respond(HttpStatus.BAD_GATEWAY, "Document store request failed");
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("[API] Unreadable request body: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Request body must be a JSON object");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
