package me.golemcore.timeseries.adapter.outbound.timescale;

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

import me.golemcore.timeseries.domain.model.AggregatedPoint;
import me.golemcore.timeseries.domain.model.AggregationType;
import me.golemcore.timeseries.domain.model.BucketWidth;
import me.golemcore.timeseries.domain.model.TimeSeriesPoint;
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.port.outbound.StoreException;
import me.golemcore.timeseries.port.outbound.TimeSeriesStorePort;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * TimescaleDB implementation of {@link TimeSeriesStorePort} on top of
 * Spring's {@link JdbcTemplate} and the shared Hikari pool.
 *
 * <p>
 * Aggregation runs in the database:
 *
 * <pre>
 * SELECT time_bucket('1 hour', time) AS bucket, AVG(value) AS value
 * FROM time_series_data
 * WHERE time &gt;= ? AND time &lt; ?
 * GROUP BY bucket ORDER BY bucket
 * </pre>
 *
 * The interval literal and the aggregate function come from the
 * {@link BucketWidth} and {@link AggregationType} enums, never from caller
 * input.
 *
 * <p>
 * Every statement gets a query timeout bounded by the caller's deadline and
 * is cancelled through {@link java.sql.Statement#cancel()} when the caller's
 * context is cancelled.
 *
 * @since 1.0
 */
@Repository
@Slf4j
public class TimescaleTimeSeriesRepository implements TimeSeriesStorePort {

    static final String TABLE = "time_series_data";
    static final String INSERT_SQL = "INSERT INTO " + TABLE + " (time, value) VALUES (?, ?)";
    static final String PING_SQL = "SELECT 1";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final DataSource dataSource;
    private final Duration defaultQueryTimeout;

    public TimescaleTimeSeriesRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
            DataSource dataSource, TimeSeriesProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.dataSource = dataSource;
        this.defaultQueryTimeout = properties.getStore().getQueryTimeout();
    }

    static String buildAggregateSql(BucketWidth bucketWidth, AggregationType aggregation) {
        return "SELECT time_bucket('" + bucketWidth.getSqlInterval() + "', time) AS bucket, "
                + aggregation.name() + "(value) AS value "
                + "FROM " + TABLE + " "
                + "WHERE time >= ? AND time < ? "
                + "GROUP BY bucket ORDER BY bucket";
    }

    @Override
    public List<AggregatedPoint> query(CallContext context, Instant start, Instant end, BucketWidth bucketWidth,
            AggregationType aggregation) {
        context.checkActive();
        String sql = buildAggregateSql(bucketWidth, aggregation);
        try {
            List<AggregatedPoint> points = jdbcTemplate.execute(sql, (PreparedStatement ps) -> {
                ps.setObject(1, toTimestamp(start));
                ps.setObject(2, toTimestamp(end));
                return runCancellable(context, ps, () -> {
                    List<AggregatedPoint> rows = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(new AggregatedPoint(rs.getTimestamp("bucket").toInstant(),
                                    rs.getDouble("value")));
                        }
                    }
                    return rows;
                });
            });
            log.debug("[Store] {} {} buckets in [{}, {}): {} rows", aggregation, bucketWidth.getCode(), start, end,
                    points == null ? 0 : points.size());
            return points == null ? List.of() : points;
        } catch (DataAccessException e) {
            throw translate(context, "failed to query data", e);
        }
    }

    @Override
    public void batchInsert(CallContext context, List<TimeSeriesPoint> points) {
        if (points.isEmpty()) {
            return;
        }
        context.checkActive();
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.execute(INSERT_SQL,
                    (PreparedStatement ps) -> runCancellable(context, ps, () -> {
                        for (TimeSeriesPoint point : points) {
                            ps.setObject(1, toTimestamp(point.timestamp()));
                            ps.setDouble(2, point.value());
                            ps.addBatch();
                        }
                        return ps.executeBatch();
                    })));
            log.debug("[Store] Inserted {} points", points.size());
        } catch (DataAccessException e) {
            throw translate(context, "failed to insert batch of " + points.size() + " points", e);
        }
    }

    @Override
    public void insert(TimeSeriesPoint point) {
        try {
            jdbcTemplate.update(INSERT_SQL, toTimestamp(point.timestamp()), point.value());
        } catch (DataAccessException e) {
            throw new StoreException("failed to insert point: " + rootMessage(e), e);
        }
    }

    @Override
    public void verifyConnection() {
        try {
            jdbcTemplate.queryForObject(PING_SQL, Integer.class);
        } catch (DataAccessException e) {
            throw new StoreException("database is unreachable: " + rootMessage(e), e);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari && !hikari.isClosed()) {
            hikari.close();
            log.info("[Store] Connection pool closed");
        }
    }

    private <T> T runCancellable(CallContext context, PreparedStatement ps, SqlWork<T> work) throws SQLException {
        ps.setQueryTimeout(toTimeoutSeconds(context.boundedBy(defaultQueryTimeout)));
        Runnable deregister = context.onCancel(() -> cancelQuietly(ps));
        try {
            return work.run();
        } finally {
            deregister.run();
        }
    }

    private RuntimeException translate(CallContext context, String operation, DataAccessException e) {
        if (context.isCancelled()) {
            return new RpcException(RpcStatusCode.CANCELLED, "call cancelled", e);
        }
        if (context.isExpired()) {
            return new RpcException(RpcStatusCode.DEADLINE_EXCEEDED, "deadline exceeded", e);
        }
        return new StoreException(operation + ": " + rootMessage(e), e);
    }

    private static void cancelQuietly(PreparedStatement ps) {
        try {
            ps.cancel();
        } catch (SQLException e) {
            log.warn("[Store] Failed to cancel statement: {}", e.getMessage());
        }
    }

    static int toTimeoutSeconds(Duration timeout) {
        long millis = Math.max(timeout.toMillis(), 1);
        return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static String rootMessage(DataAccessException e) {
        return e.getMostSpecificCause().getMessage();
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }
}
