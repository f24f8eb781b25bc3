package me.golemcore.timeseries.lifecycle;

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

import me.golemcore.timeseries.domain.service.HealthStatusRegistry;
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.ingestion.IngestionScheduler;
import me.golemcore.timeseries.ingestion.SeriesFetcher;
import me.golemcore.timeseries.port.outbound.TimeSeriesStorePort;
import me.golemcore.timeseries.rpc.CallContext;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the startup and shutdown sequence of the background machinery.
 *
 * <p>
 * Runs in a lifecycle phase below the web server, so it starts before the
 * server accepts requests and stops after the server has drained them.
 *
 * <pre>
 * start:   verify store → backfill (own thread) + scheduler start → RUNNING
 * closing: SHUTTING_DOWN, health NOT_SERVING
 *          (web server drains in-flight requests)
 * stop:    scheduler stop, backfill cancelled
 * destroy: store closed → STOPPED
 * </pre>
 *
 * A fatal error at any point marks health NOT_SERVING and exits the process
 * with status 1.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ServiceLifecycleCoordinator implements SmartLifecycle {

    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;
    static final int FATAL_EXIT_CODE = 1;
    static final String BOOTSTRAP_METHOD = "/ingestion/Bootstrap";

    private final TimeSeriesStorePort store;
    private final SeriesFetcher fetcher;
    private final IngestionScheduler scheduler;
    private final HealthStatusRegistry healthRegistry;
    private final ProcessExitService exitService;
    private final boolean ingestionEnabled;
    private final Executor bootstrapExecutor;

    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.STARTING);
    private final AtomicBoolean fatalReported = new AtomicBoolean(false);
    private final CallContext rootContext = CallContext.create(BOOTSTRAP_METHOD);
    private volatile boolean running;

    @Autowired
    public ServiceLifecycleCoordinator(TimeSeriesStorePort store, SeriesFetcher fetcher,
            IngestionScheduler scheduler, HealthStatusRegistry healthRegistry, ProcessExitService exitService,
            TimeSeriesProperties properties) {
        this(store, fetcher, scheduler, healthRegistry, exitService, properties.getIngestion().isEnabled(),
                task -> {
                    Thread thread = new Thread(task, "ingestion-bootstrap");
                    thread.setDaemon(true);
                    thread.start();
                });
    }

    ServiceLifecycleCoordinator(TimeSeriesStorePort store, SeriesFetcher fetcher, IngestionScheduler scheduler,
            HealthStatusRegistry healthRegistry, ProcessExitService exitService, boolean ingestionEnabled,
            Executor bootstrapExecutor) {
        this.store = store;
        this.fetcher = fetcher;
        this.scheduler = scheduler;
        this.healthRegistry = healthRegistry;
        this.exitService = exitService;
        this.ingestionEnabled = ingestionEnabled;
        this.bootstrapExecutor = bootstrapExecutor;
    }

    @Override
    public void start() {
        running = true;
        try {
            store.verifyConnection();
        } catch (RuntimeException e) {
            reportFatal("store is unreachable", e);
            return;
        }
        log.info("[Lifecycle] Store connection verified");

        if (!ingestionEnabled) {
            log.info("[Lifecycle] Ingestion disabled, serving queries only");
            transition(LifecycleState.STARTING, LifecycleState.RUNNING);
            return;
        }

        transition(LifecycleState.STARTING, LifecycleState.BOOTSTRAP_PENDING);
        bootstrapExecutor.execute(this::runBootstrap);

        try {
            scheduler.start();
        } catch (RuntimeException e) {
            reportFatal("scheduler failed to start", e);
        }
    }

    @Override
    public void stop() {
        rootContext.cancel();
        scheduler.stop();
        running = false;
        log.info("[Lifecycle] Background work stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        enterShuttingDown();
    }

    @PreDestroy
    public void close() {
        try {
            store.close();
        } catch (RuntimeException e) {
            log.error("[Lifecycle] Failed to close store: {}", e.getMessage(), e);
        }
        state.set(LifecycleState.STOPPED);
        log.info("[Lifecycle] Stopped");
    }

    /**
     * Report an unrecoverable error: stop serving and exit with status 1. Only
     * the first report takes effect.
     */
    public void reportFatal(String reason, Throwable cause) {
        if (!fatalReported.compareAndSet(false, true)) {
            log.warn("[Lifecycle] Additional fatal error ignored: {}: {}", reason, cause.getMessage());
            return;
        }
        log.error("[Lifecycle] Fatal error, shutting down: {}: {}", reason, cause.getMessage(), cause);
        enterShuttingDown();
        exitService.exit(FATAL_EXIT_CODE);
    }

    public LifecycleState getState() {
        return state.get();
    }

    private void runBootstrap() {
        try {
            fetcher.bootstrapHistoricalData(rootContext);
            if (transition(LifecycleState.BOOTSTRAP_PENDING, LifecycleState.RUNNING)) {
                log.info("[Lifecycle] Historical data loaded, service running");
            }
        } catch (RuntimeException e) {
            if (rootContext.isCancelled()) {
                log.info("[Lifecycle] Bootstrap interrupted by shutdown");
                return;
            }
            reportFatal("failed to bootstrap historical data", e);
        }
    }

    private void enterShuttingDown() {
        LifecycleState previous = state.getAndUpdate(current -> current == LifecycleState.STOPPED
                ? current
                : LifecycleState.SHUTTING_DOWN);
        if (previous != LifecycleState.SHUTTING_DOWN && previous != LifecycleState.STOPPED) {
            log.info("[Lifecycle] Shutting down (was {})", previous);
            healthRegistry.shutdown();
        }
    }

    private boolean transition(LifecycleState from, LifecycleState to) {
        boolean changed = state.compareAndSet(from, to);
        if (changed) {
            log.debug("[Lifecycle] {} -> {}", from, to);
        }
        return changed;
    }
}
