package me.golemcore.timeseries;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the time-series query service.
 *
 * <p>
 * The service answers aggregated range queries over time-stamped numeric
 * measurements and keeps its TimescaleDB store populated from an upstream HTTP
 * source.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound            → TimeSeriesController, HealthController (WebFlux)
 * RPC pipeline       → RequestId → RateLimit → Logging → Metrics → Caching → handler
 * Domain             → RequestValidator, TimeSeriesQueryService
 * Background         → SeriesFetcher, IngestionScheduler, ServiceLifecycleCoordinator
 * Outbound           → TimescaleTimeSeriesRepository (JDBC), OkHttp upstream client
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All service configuration lives in {@code application.properties} under the
 * {@code timeseries.*} prefix, plus the standard {@code server.*} and
 * {@code spring.datasource.*} keys.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TimeSeriesApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeSeriesApplication.class, args);
    }

}
