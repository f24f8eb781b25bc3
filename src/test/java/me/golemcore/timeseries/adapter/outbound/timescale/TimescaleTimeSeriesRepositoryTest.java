package me.golemcore.timeseries.adapter.outbound.timescale;

import me.golemcore.timeseries.domain.model.AggregatedPoint;
import me.golemcore.timeseries.domain.model.AggregationType;
import me.golemcore.timeseries.domain.model.BucketWidth;
import me.golemcore.timeseries.domain.model.TimeSeriesPoint;
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import me.golemcore.timeseries.port.outbound.StoreException;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TimescaleTimeSeriesRepositoryTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T00:00:00Z");

    private JdbcTemplate jdbcTemplate;
    private TransactionTemplate transactionTemplate;
    private HikariDataSource dataSource;
    private PreparedStatement statement;
    private TimescaleTimeSeriesRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        transactionTemplate = mock(TransactionTemplate.class);
        dataSource = mock(HikariDataSource.class);
        statement = mock(PreparedStatement.class);
        repository = new TimescaleTimeSeriesRepository(jdbcTemplate, transactionTemplate, dataSource,
                new TimeSeriesProperties());

        when(jdbcTemplate.execute(anyString(), any(PreparedStatementCallback.class))).thenAnswer(invocation -> {
            PreparedStatementCallback<Object> callback = invocation.getArgument(1);
            try {
                return callback.doInPreparedStatement(statement);
            } catch (SQLException e) {
                throw new UncategorizedSQLException("statement", invocation.getArgument(0), e);
            }
        });
        doAnswer(invocation -> {
            Consumer<TransactionStatus> action = invocation.getArgument(0);
            action.accept(mock(TransactionStatus.class));
            return null;
        }).when(transactionTemplate).executeWithoutResult(any());
    }

    @Test
    void shouldBuildBucketedAggregateSql() {
        String sql = TimescaleTimeSeriesRepository.buildAggregateSql(BucketWidth.ONE_HOUR, AggregationType.AVG);

        assertEquals("SELECT time_bucket('1 hour', time) AS bucket, AVG(value) AS value "
                + "FROM time_series_data WHERE time >= ? AND time < ? GROUP BY bucket ORDER BY bucket", sql);
        assertTrue(TimescaleTimeSeriesRepository.buildAggregateSql(BucketWidth.FIVE_MINUTES, AggregationType.SUM)
                .contains("time_bucket('5 minutes', time) AS bucket, SUM(value)"));
    }

    @Test
    void shouldMapRowsInStoreOrder() throws SQLException {
        ResultSet rows = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(rows);
        when(rows.next()).thenReturn(true, true, false);
        when(rows.getTimestamp("bucket")).thenReturn(Timestamp.from(START),
                Timestamp.from(START.plus(Duration.ofHours(1))));
        when(rows.getDouble("value")).thenReturn(1.5, 2.5);

        List<AggregatedPoint> points = repository.query(CallContext.create("/svc/Query"), START, END,
                BucketWidth.ONE_HOUR, AggregationType.AVG);

        assertEquals(List.of(new AggregatedPoint(START, 1.5),
                new AggregatedPoint(START.plus(Duration.ofHours(1)), 2.5)), points);
        verify(statement).setQueryTimeout(30);
    }

    @Test
    void shouldBoundQueryTimeoutByCallerDeadline() throws SQLException {
        when(statement.executeQuery()).thenReturn(mock(ResultSet.class));

        repository.query(CallContext.withTimeout("/svc/Query", Duration.ofSeconds(3)), START, END,
                BucketWidth.ONE_MINUTE, AggregationType.MIN);

        verify(statement).setQueryTimeout(intThat(seconds -> seconds >= 1 && seconds <= 3));
    }

    @Test
    void shouldCancelRunningStatementWhenCallIsCancelled() throws SQLException {
        CallContext context = CallContext.create("/svc/Query");
        when(statement.executeQuery()).thenAnswer(invocation -> {
            context.cancel();
            throw new SQLException("canceling statement due to user request");
        });

        RpcException ex = assertThrows(RpcException.class,
                () -> repository.query(context, START, END, BucketWidth.ONE_HOUR, AggregationType.MAX));

        assertEquals(RpcStatusCode.CANCELLED, ex.getCode());
        verify(statement).cancel();
    }

    @Test
    void shouldWrapQueryFailure() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("connection refused"));

        StoreException ex = assertThrows(StoreException.class, () -> repository.query(
                CallContext.create("/svc/Query"), START, END, BucketWidth.ONE_DAY, AggregationType.SUM));

        assertEquals("failed to query data: connection refused", ex.getMessage());
    }

    @Test
    void shouldInsertBatchInOneTransaction() throws SQLException {
        when(statement.executeBatch()).thenReturn(new int[] { 1, 1 });

        repository.batchInsert(CallContext.create("/ingestion/Test"),
                List.of(new TimeSeriesPoint(START, 1.0), new TimeSeriesPoint(END, 2.0)));

        verify(transactionTemplate).executeWithoutResult(any());
        verify(statement, times(2)).addBatch();
        verify(statement).executeBatch();
        verify(statement).setDouble(2, 2.0);
    }

    @Test
    void shouldSkipEmptyBatch() {
        repository.batchInsert(CallContext.create("/ingestion/Test"), List.of());

        verifyNoInteractions(transactionTemplate);
    }

    @Test
    void shouldReportUnreachableDatabase() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new CannotGetJdbcConnectionException("no connection", new SQLException("refused")));

        StoreException ex = assertThrows(StoreException.class, repository::verifyConnection);

        assertEquals("database is unreachable: refused", ex.getMessage());
    }

    @Test
    void shouldClosePoolOnce() {
        when(dataSource.isClosed()).thenReturn(false, true);

        repository.close();
        repository.close();

        verify(dataSource, times(1)).close();
    }
}
