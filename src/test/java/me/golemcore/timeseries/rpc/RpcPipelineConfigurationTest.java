package me.golemcore.timeseries.rpc;

import me.golemcore.timeseries.cache.CacheKeyGenerator;
import me.golemcore.timeseries.cache.LruResponseCache;
import me.golemcore.timeseries.domain.model.RateLimitResult;
import me.golemcore.timeseries.domain.model.TimeSeriesQuery;
import me.golemcore.timeseries.domain.model.TimeSeriesResponse;
import me.golemcore.timeseries.domain.service.RequestValidator;
import me.golemcore.timeseries.domain.service.TimeSeriesQueryService;
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.ratelimit.RateLimiter;
import me.golemcore.timeseries.rpc.interceptor.MetricsInterceptor;
import me.golemcore.timeseries.testsupport.InMemoryTimeSeriesStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RpcPipelineConfigurationTest {

    private final RpcPipelineConfiguration configuration = new RpcPipelineConfiguration();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private InMemoryTimeSeriesStore store;
    private RateLimiter rateLimiter;
    private LruResponseCache<Object> cache;
    private RpcHandler pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
        rateLimiter = mock(RateLimiter.class);
        cache = configuration.responseCache(new TimeSeriesProperties());
        TimeSeriesQueryService service = new TimeSeriesQueryService(new RequestValidator(), store);
        pipeline = configuration.queryTimeSeriesPipeline(service, rateLimiter, meterRegistry, cache,
                new CacheKeyGenerator());
    }

    @Test
    void shouldCacheSuccessfulResponse() {
        when(rateLimiter.tryConsume()).thenReturn(RateLimitResult.allowed(5));

        Object first = pipeline.handle(CallContext.create(RpcMethods.QUERY_TIME_SERIES), validQuery());
        Object second = pipeline.handle(CallContext.create(RpcMethods.QUERY_TIME_SERIES), validQuery());

        assertInstanceOf(TimeSeriesResponse.class, first);
        assertSame(first, second);
        assertEquals(1, store.getQueryCount());
        assertEquals(2.0, meterRegistry.get(MetricsInterceptor.REQUESTS_METRIC).counter().count());
    }

    @Test
    void shouldNotCountOrCacheRejectedCalls() {
        when(rateLimiter.tryConsume()).thenReturn(RateLimitResult.denied(Duration.ofMillis(200),
                "rate limit exceeded"));

        RpcException ex = assertThrows(RpcException.class,
                () -> pipeline.handle(CallContext.create(RpcMethods.QUERY_TIME_SERIES), validQuery()));

        assertEquals(RpcStatusCode.RESOURCE_EXHAUSTED, ex.getCode());
        assertEquals(0, cache.size());
        assertEquals(0, store.getQueryCount());
        assertNull(meterRegistry.find(MetricsInterceptor.REQUESTS_METRIC).counter());
    }

    @Test
    void shouldCreateWorkerSchedulerOfConfiguredSize() {
        TimeSeriesProperties properties = new TimeSeriesProperties();
        properties.getServer().setWorkerThreads(2);

        Scheduler scheduler = configuration.rpcWorkerScheduler(properties);
        try {
            String threadName = Mono.fromCallable(() -> Thread.currentThread().getName())
                    .subscribeOn(scheduler)
                    .block(Duration.ofSeconds(5));
            assertNotNull(threadName);
            assertTrue(threadName.startsWith("rpc-worker-"));
        } finally {
            scheduler.dispose();
        }
    }

    private static TimeSeriesQuery validQuery() {
        return TimeSeriesQuery.builder()
                .start(Instant.parse("2024-01-01T00:00:00Z"))
                .end(Instant.parse("2024-01-02T00:00:00Z"))
                .window("1h")
                .aggregation("AVG")
                .build();
    }
}
