package me.golemcore.timeseries.adapter.inbound.web;

import me.golemcore.timeseries.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps failures of the inbound adapters to {@link ApiErrorResponse} bodies
 * with the HTTP status of their RPC code.
 */
@ControllerAdvice(basePackages = "me.golemcore.timeseries.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RpcException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleRpc(RpcException ex) {
        if (ex.getCode() == RpcStatusCode.INTERNAL) {
            log.error("[API] {}: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[API] {}: {}", ex.getCode(), ex.getMessage());
        }
        return Mono.just(error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler({ ServerWebInputException.class, DecodingException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleBadInput(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(RpcStatusCode.INVALID_ARGUMENT, "malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(RpcStatusCode.INTERNAL, "Internal server error"));
    }

    private static ResponseEntity<ApiErrorResponse> error(RpcStatusCode code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(code.getHttpStatus())
                .code(code.name())
                .message(message)
                .build();
        return ResponseEntity.status(code.getHttpStatus()).body(body);
    }
}
