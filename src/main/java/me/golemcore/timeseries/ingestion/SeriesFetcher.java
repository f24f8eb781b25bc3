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

import me.golemcore.timeseries.domain.model.TimeSeriesPoint;
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.port.outbound.TimeSeriesStorePort;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Pulls raw points for a time range from the upstream HTTP endpoint and writes
 * them to the store in one transaction.
 *
 * <p>
 * Request format:
 *
 * <pre>
 * GET {upstream-url}?start=2024-01-01T00:00:00&amp;end=2024-01-01T00:05:00
 * Accept: *&#47;*
 * User-Agent: {user-agent}
 * </pre>
 *
 * Timestamps are formatted in UTC without a zone designator. The call timeout
 * is the shorter of {@code timeseries.upstream.request-timeout} and the
 * caller's remaining deadline; cancelling the caller's context cancels the
 * HTTP call.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SeriesFetcher {

    static final DateTimeFormatter QUERY_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final TimeSeriesProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TimeSeriesStorePort store;
    private final Clock clock;

    @Autowired
    public SeriesFetcher(TimeSeriesProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            TimeSeriesStorePort store) {
        this(properties, httpClient, objectMapper, store, Clock.systemUTC());
    }

    SeriesFetcher(TimeSeriesProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            TimeSeriesStorePort store, Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Fetch {@code [start, end)} from upstream and insert every returned point.
     * An empty result is a success that inserts nothing.
     *
     * @return number of points inserted
     * @throws UpstreamStatusException
     *             on a non-success HTTP status
     * @throws UpstreamException
     *             on transport or decoding failure
     * @throws me.golemcore.timeseries.port.outbound.StoreException
     *             when the batch insert fails; nothing is inserted
     */
    public int fetchData(CallContext context, Instant start, Instant end) {
        context.checkActive();
        TimeSeriesProperties.UpstreamProperties upstream = properties.getUpstream();

        Request request = new Request.Builder()
                .url(buildUrl(upstream.getUrl(), start, end))
                .get()
                .header("Accept", "*/*")
                .header("User-Agent", upstream.getUserAgent())
                .build();

        Call call = httpClient.newCall(request);
        Duration timeout = context.boundedBy(upstream.getRequestTimeout());
        call.timeout().timeout(Math.max(timeout.toMillis(), 1), TimeUnit.MILLISECONDS);

        String payload;
        Runnable deregister = context.onCancel(call::cancel);
        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new UpstreamStatusException(response.code());
            }
            ResponseBody body = response.body();
            payload = body != null ? body.string() : "";
        } catch (IOException e) {
            if (context.isCancelled()) {
                throw new RpcException(RpcStatusCode.CANCELLED, "call cancelled", e);
            }
            throw new UpstreamException("failed to fetch data: " + e.getMessage(), e);
        } finally {
            deregister.run();
        }

        List<TimeSeriesPoint> points = decode(payload).toPoints();
        if (points.isEmpty()) {
            log.info("[Ingestion] No data returned for [{}, {})", start, end);
            return 0;
        }

        store.batchInsert(context, points);
        log.info("[Ingestion] Stored {} points for [{}, {})", points.size(), start, end);
        return points.size();
    }

    /**
     * Backfill the configured history, falling back once to the short window.
     *
     * @throws BootstrapException
     *             when the fallback fails as well
     */
    public void bootstrapHistoricalData(CallContext context) {
        Instant now = clock.instant();
        Instant historyStart = ZonedDateTime.ofInstant(now, ZoneOffset.UTC)
                .minusYears(properties.getIngestion().getBackfillYears())
                .toInstant();

        log.info("[Ingestion] Bootstrapping historical data from {} to {}", historyStart, now);
        try {
            fetchData(context, historyStart, now);
            return;
        } catch (RuntimeException e) {
            log.warn("[Ingestion] Historical backfill [{}, {}) failed: {}", historyStart, now, e.getMessage(), e);
        }

        Instant fallbackStart = now.minus(properties.getIngestion().getFallbackWindow());
        log.info("[Ingestion] Falling back to recent data from {} to {}", fallbackStart, now);
        try {
            fetchData(context, fallbackStart, now);
        } catch (RuntimeException e) {
            throw new BootstrapException("failed to fetch recent data: " + e.getMessage(), e);
        }
    }

    private static HttpUrl buildUrl(String baseUrl, Instant start, Instant end) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new UpstreamException("invalid upstream url: " + baseUrl);
        }
        return base.newBuilder()
                .addQueryParameter("start", QUERY_TIME_FORMAT.format(start))
                .addQueryParameter("end", QUERY_TIME_FORMAT.format(end))
                .build();
    }

    private UpstreamSeriesResponse decode(String payload) {
        try {
            return objectMapper.readValue(payload, UpstreamSeriesResponse.class);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("failed to decode response", e);
        }
    }
}
