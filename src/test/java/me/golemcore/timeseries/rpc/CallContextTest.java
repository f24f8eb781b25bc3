package me.golemcore.timeseries.rpc;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CallContextTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void shouldHaveNoDeadlineByDefault() {
        CallContext context = CallContext.create("/svc/Method", clock);

        assertTrue(context.getDeadline().isEmpty());
        assertTrue(context.remaining().isEmpty());
        assertEquals(Duration.ofSeconds(30), context.boundedBy(Duration.ofSeconds(30)));
        assertFalse(context.isExpired());
    }

    @Test
    void shouldKeepShorterDeadline() {
        CallContext context = CallContext.create("/svc/Method", clock)
                .withTimeout(Duration.ofSeconds(5))
                .withTimeout(Duration.ofMinutes(2));

        assertEquals(NOW.plusSeconds(5), context.getDeadline().orElseThrow());
        assertEquals(Duration.ofSeconds(5), context.boundedBy(Duration.ofSeconds(30)));
        assertEquals(Duration.ofSeconds(1), context.boundedBy(Duration.ofSeconds(1)));
    }

    @Test
    void shouldReportExpiredDeadline() {
        CallContext context = CallContext.create("/svc/Method", clock).withTimeout(Duration.ZERO);

        assertTrue(context.isExpired());
        assertEquals(Duration.ZERO, context.remaining().orElseThrow());
        RpcException ex = assertThrows(RpcException.class, context::checkActive);
        assertEquals(RpcStatusCode.DEADLINE_EXCEEDED, ex.getCode());
    }

    @Test
    void shouldShareCancellationWithDerivedContexts() {
        CallContext parent = CallContext.create("/svc/Method", clock);
        CallContext child = parent.withRequestId("req-1").withTimeout(Duration.ofSeconds(1));
        AtomicInteger hookRuns = new AtomicInteger();
        child.onCancel(hookRuns::incrementAndGet);

        parent.cancel();
        parent.cancel();

        assertTrue(child.isCancelled());
        assertEquals(1, hookRuns.get());
        RpcException ex = assertThrows(RpcException.class, child::checkActive);
        assertEquals(RpcStatusCode.CANCELLED, ex.getCode());
        assertEquals("req-1", child.getRequestId());
        assertNull(parent.getRequestId());
    }

    @Test
    void shouldNotRunDeregisteredHook() {
        CallContext context = CallContext.create("/svc/Method", clock);
        AtomicInteger hookRuns = new AtomicInteger();
        Runnable deregister = context.onCancel(hookRuns::incrementAndGet);

        deregister.run();
        context.cancel();

        assertEquals(0, hookRuns.get());
    }

    @Test
    void shouldRunHookImmediatelyWhenAlreadyCancelled() {
        CallContext context = CallContext.create("/svc/Method", clock);
        context.cancel();
        AtomicInteger hookRuns = new AtomicInteger();

        context.onCancel(hookRuns::incrementAndGet);

        assertEquals(1, hookRuns.get());
    }
}
