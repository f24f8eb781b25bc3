package me.golemcore.timeseries.ingestion;

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

import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.rpc.CallContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically fetches the most recent interval of data from upstream.
 *
 * <p>
 * A single-thread ticker fires at a fixed rate of
 * {@code timeseries.ingestion.interval}; each tick hands the fetch to a
 * separate worker thread so a slow fetch never delays the ticker. A firing
 * covers {@code [now - interval, now)} and runs under its own context with a
 * {@code timeseries.ingestion.fetch-timeout} deadline. A tick that arrives
 * while the previous firing is still running is skipped.
 *
 * <p>
 * Errors of a firing are logged and never stop the schedule. {@link #stop()}
 * cancels future firings and lets an in-flight one finish.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class IngestionScheduler {

    static final String INGESTION_METHOD = "/ingestion/FetchRecent";
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final SeriesFetcher fetcher;
    private final Duration interval;
    private final Duration fetchTimeout;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService ticker;
    private ExecutorService worker;
    private ScheduledFuture<?> tickTask;
    private volatile boolean running;

    @Autowired
    public IngestionScheduler(SeriesFetcher fetcher, TimeSeriesProperties properties) {
        this(fetcher, properties.getIngestion().getInterval(), properties.getIngestion().getFetchTimeout(),
                Clock.systemUTC());
    }

    IngestionScheduler(SeriesFetcher fetcher, Duration interval, Duration fetchTimeout, Clock clock) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("ingestion interval must be positive: " + interval);
        }
        this.fetcher = fetcher;
        this.interval = interval;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
    }

    /**
     * Start ticking. The first firing happens one interval from now.
     *
     * @throws IllegalStateException
     *             if already running
     */
    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("ingestion scheduler is already running");
        }

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ingestion-ticker");
            t.setDaemon(true);
            return t;
        });
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ingestion-worker");
            t.setDaemon(true);
            return t;
        });

        long periodMillis = interval.toMillis();
        tickTask = ticker.scheduleAtFixedRate(this::tick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("[Scheduler] Started with interval {}", interval);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        shutdownExecutor(ticker);
        worker.shutdown();
        log.info("[Scheduler] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Hand one firing to the worker unless the previous one is still running.
     */
    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.warn("[Scheduler] Previous fetch still running, skipping this tick");
            return;
        }
        try {
            worker.execute(() -> {
                try {
                    fireOnce();
                } finally {
                    executing.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            executing.set(false);
            log.debug("[Scheduler] Tick after stop ignored");
        }
    }

    /**
     * Fetch the last interval. Never throws.
     */
    void fireOnce() {
        Instant end = clock.instant();
        Instant start = end.minus(interval);
        CallContext context = CallContext.create(INGESTION_METHOD, clock).withTimeout(fetchTimeout);
        try {
            int stored = fetcher.fetchData(context, start, end);
            log.debug("[Scheduler] Periodic fetch [{}, {}) stored {} points", start, end, stored);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Periodic fetch [{}, {}) failed: {}", start, end, e.getMessage(), e);
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
