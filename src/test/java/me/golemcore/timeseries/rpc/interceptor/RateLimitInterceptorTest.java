package me.golemcore.timeseries.rpc.interceptor;

import me.golemcore.timeseries.domain.model.RateLimitResult;
import me.golemcore.timeseries.ratelimit.RateLimiter;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcHandler;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RateLimitInterceptorTest {

    private RateLimiter rateLimiter;
    private RpcHandler next;
    private RateLimitInterceptor interceptor;

    @BeforeEach
    void setUp() {
        rateLimiter = mock(RateLimiter.class);
        next = mock(RpcHandler.class);
        interceptor = new RateLimitInterceptor(rateLimiter);
    }

    @Test
    void shouldPassAdmittedCallDownstream() {
        when(rateLimiter.tryConsume()).thenReturn(RateLimitResult.allowed(4));
        when(next.handle(any(), any())).thenReturn("ok");

        Object response = interceptor.intercept(CallContext.create("/svc/Method"), "req", next);

        assertEquals("ok", response);
        verify(next).handle(any(), eq("req"));
    }

    @Test
    void shouldRejectWithResourceExhaustedWithoutCallingDownstream() {
        when(rateLimiter.tryConsume())
                .thenReturn(RateLimitResult.denied(Duration.ofMillis(200), "rate limit exceeded"));

        RpcException ex = assertThrows(RpcException.class,
                () -> interceptor.intercept(CallContext.create("/svc/Method"), "req", next));

        assertEquals(RpcStatusCode.RESOURCE_EXHAUSTED, ex.getCode());
        assertEquals("rate limit exceeded", ex.getMessage());
        verifyNoInteractions(next);
    }
}
