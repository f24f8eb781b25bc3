package me.golemcore.timeseries.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Centralized configuration properties for the service, bound from
 * application.properties.
 *
 * <p>
 * All settings are organized under the {@code timeseries.*} prefix:
 * <ul>
 * <li>{@link ServerProperties} - request worker pool</li>
 * <li>{@link CacheProperties} - response cache capacity</li>
 * <li>{@link RateLimitProperties} - global token bucket</li>
 * <li>{@link UpstreamProperties} - upstream series endpoint</li>
 * <li>{@link IngestionProperties} - backfill and periodic fetch</li>
 * <li>{@link StoreProperties} - store query behaviour</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * <p>
 * Loaded once at startup; changes require a restart.
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "timeseries")
@Data
public class TimeSeriesProperties {

    private ServerProperties server = new ServerProperties();
    private CacheProperties cache = new CacheProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private UpstreamProperties upstream = new UpstreamProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private StoreProperties store = new StoreProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ServerProperties {
        /** Size of the fixed pool that executes the RPC chain. */
        private int workerThreads = 16;
    }

    @Data
    public static class CacheProperties {
        private int capacity = 1000;
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private double requestsPerSecond = 5.0;
        private int burst = 10;
    }

    @Data
    public static class UpstreamProperties {
        private String url = "http://localhost:9090/series";
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String userAgent = "TimeSeries-Client/1.0";
    }

    // ==================== INGESTION ====================

    @Data
    public static class IngestionProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);

        /** Deadline of a single periodic fetch, independent of the interval. */
        private Duration fetchTimeout = Duration.ofMinutes(2);

        private int backfillYears = 2;

        /** Window of the single retry when the full backfill fails. */
        private Duration fallbackWindow = Duration.ofHours(24);
    }

    @Data
    public static class StoreProperties {
        /** Applied when the caller supplied no deadline. */
        private Duration queryTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
