package me.golemcore.timeseries.adapter.inbound.web;

import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebInputException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapRpcCodeToHttpStatus() {
        StepVerifier.create(handler.handleRpc(new RpcException(RpcStatusCode.DEADLINE_EXCEEDED,
                "deadline exceeded")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.GATEWAY_TIMEOUT, response.getStatusCode());
                    assertEquals(504, response.getBody().getStatus());
                    assertEquals("DEADLINE_EXCEEDED", response.getBody().getCode());
                    assertEquals("deadline exceeded", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldUseNonStandardStatusForCancelledCalls() {
        StepVerifier.create(handler.handleRpc(new RpcException(RpcStatusCode.CANCELLED, "call cancelled")))
                .assertNext(response -> assertEquals(499, response.getStatusCode().value()))
                .verifyComplete();
    }

    @Test
    void shouldMapBadInputToInvalidArgument() {
        StepVerifier.create(handler.handleBadInput(new ServerWebInputException("Failed to read HTTP message")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("INVALID_ARGUMENT", response.getBody().getCode());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("INTERNAL", response.getBody().getCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
