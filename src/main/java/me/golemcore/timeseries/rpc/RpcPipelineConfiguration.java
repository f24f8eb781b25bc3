package me.golemcore.timeseries.rpc;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.timeseries.cache.CacheKeyGenerator;
import me.golemcore.timeseries.cache.LruResponseCache;
import me.golemcore.timeseries.domain.service.TimeSeriesQueryService;
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.ratelimit.RateLimiter;
import me.golemcore.timeseries.rpc.interceptor.CachingInterceptor;
import me.golemcore.timeseries.rpc.interceptor.LoggingInterceptor;
import me.golemcore.timeseries.rpc.interceptor.MetricsInterceptor;
import me.golemcore.timeseries.rpc.interceptor.RateLimitInterceptor;
import me.golemcore.timeseries.rpc.interceptor.RequestIdInterceptor;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the fixed request pipeline and the worker pool it runs on.
 *
 * <p>
 * Order, outermost first:
 *
 * <pre>
 * RequestId → RateLimit → Logging → Metrics → Caching → TimeSeriesQueryService
 * </pre>
 *
 * Rejected calls therefore carry a request id but are neither logged as
 * completed calls, counted in metrics nor cached.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class RpcPipelineConfiguration {

    public static final String QUERY_PIPELINE = "queryTimeSeriesPipeline";
    public static final String WORKER_SCHEDULER = "rpcWorkerScheduler";

    @Bean
    public LruResponseCache<Object> responseCache(TimeSeriesProperties properties) {
        return new LruResponseCache<>(properties.getCache().getCapacity());
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator() {
        return new CacheKeyGenerator();
    }

    @Bean(name = QUERY_PIPELINE)
    public RpcHandler queryTimeSeriesPipeline(TimeSeriesQueryService queryService, RateLimiter rateLimiter,
            MeterRegistry meterRegistry, LruResponseCache<Object> responseCache,
            CacheKeyGenerator cacheKeyGenerator) {
        InterceptorChain chain = InterceptorChain.builder()
                .add(new RequestIdInterceptor())
                .add(new RateLimitInterceptor(rateLimiter))
                .add(new LoggingInterceptor())
                .add(new MetricsInterceptor(meterRegistry))
                .add(new CachingInterceptor(responseCache, cacheKeyGenerator))
                .build();
        log.info("[RPC] Pipeline built with {} interceptors, cache capacity {}",
                chain.getInterceptors().size(), responseCache.getCapacity());
        return chain.wrap(queryService);
    }

    @Bean(name = WORKER_SCHEDULER, destroyMethod = "dispose")
    public Scheduler rpcWorkerScheduler(TimeSeriesProperties properties) {
        int threads = properties.getServer().getWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "rpc-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ExecutorService executor = Executors.newFixedThreadPool(threads, factory);
        log.info("[RPC] Worker pool started with {} threads", threads);
        return Schedulers.fromExecutorService(executor, "rpc-worker");
    }
}
