package me.golemcore.timeseries.ingestion;

import me.golemcore.timeseries.rpc.CallContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IngestionSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private SeriesFetcher fetcher;
    private IngestionScheduler scheduler;

    @BeforeEach
    void setUp() {
        fetcher = mock(SeriesFetcher.class);
        scheduler = new IngestionScheduler(fetcher, Duration.ofMinutes(5), Duration.ofMinutes(2),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void shouldFetchLastIntervalWithTwoMinuteDeadline() {
        scheduler.fireOnce();

        ArgumentCaptor<CallContext> context = ArgumentCaptor.forClass(CallContext.class);
        verify(fetcher).fetchData(context.capture(), eq(NOW.minus(Duration.ofMinutes(5))), eq(NOW));
        assertEquals(NOW.plus(Duration.ofMinutes(2)), context.getValue().getDeadline().orElseThrow());
    }

    @Test
    void shouldSwallowAndLogFetchFailures() {
        when(fetcher.fetchData(any(), any(), any())).thenThrow(new UpstreamStatusException(502));

        assertDoesNotThrow(scheduler::fireOnce);
    }

    @Test
    void shouldRejectSecondStart() {
        scheduler.start();

        assertTrue(scheduler.isRunning());
        assertThrows(IllegalStateException.class, scheduler::start);
    }

    @Test
    void shouldStopIdempotently() {
        scheduler.start();
        scheduler.stop();
        scheduler.stop();

        assertFalse(scheduler.isRunning());
    }

    @Test
    void shouldSkipTickWhilePreviousFiringRuns() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(fetcher.fetchData(any(), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return 0;
        });
        scheduler.start();

        scheduler.tick();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        scheduler.tick();
        release.countDown();

        verify(fetcher, timeout(1000).times(1)).fetchData(any(), any(), any());
    }

    @Test
    void shouldRunAgainAfterPreviousFiringCompletes() {
        scheduler.start();

        scheduler.tick();
        verify(fetcher, timeout(1000).times(1)).fetchData(any(), any(), any());
        // executing flag is cleared right after the fetch returns
        verify(fetcher, after(200).times(1)).fetchData(any(), any(), any());

        scheduler.tick();
        verify(fetcher, timeout(1000).times(2)).fetchData(any(), any(), any());
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new IngestionScheduler(fetcher, Duration.ZERO,
                Duration.ofMinutes(2), Clock.systemUTC()));
    }
}
