package me.golemcore.timeseries.adapter.inbound.web.controller;

import me.golemcore.timeseries.adapter.inbound.web.dto.QueryTimeSeriesRequest;
import me.golemcore.timeseries.domain.model.TimeSeriesResponse;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcHandler;
import me.golemcore.timeseries.rpc.RpcMethods;
import me.golemcore.timeseries.rpc.RpcPipelineConfiguration;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Inbound adapter for {@code timeseries.TimeSeriesService}. Each call runs
 * the blocking interceptor pipeline on the RPC worker pool.
 *
 * <p>
 * An optional {@value #TIMEOUT_HEADER} header (ISO-8601 duration such as
 * {@code PT5S}, or plain milliseconds) sets the call deadline. If the client
 * goes away the call context is cancelled, which aborts a running store
 * query.
 */
@RestController
@Slf4j
public class TimeSeriesController {

    public static final String TIMEOUT_HEADER = "X-Request-Timeout";

    private final RpcHandler pipeline;
    private final Scheduler workerScheduler;

    public TimeSeriesController(@Qualifier(RpcPipelineConfiguration.QUERY_PIPELINE) RpcHandler pipeline,
            @Qualifier(RpcPipelineConfiguration.WORKER_SCHEDULER) Scheduler workerScheduler) {
        this.pipeline = pipeline;
        this.workerScheduler = workerScheduler;
    }

    @PostMapping(value = RpcMethods.QUERY_TIME_SERIES, consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TimeSeriesResponse> queryTimeSeries(@RequestBody QueryTimeSeriesRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) String timeout) {
        CallContext base = CallContext.create(RpcMethods.QUERY_TIME_SERIES);
        CallContext context = timeout == null || timeout.isBlank() ? base : base.withTimeout(parseTimeout(timeout));

        return Mono.fromCallable(() -> (TimeSeriesResponse) pipeline.handle(context, request.toQuery()))
                .subscribeOn(workerScheduler)
                .doOnCancel(() -> {
                    log.debug("[RPC] Client cancelled {}", context.getMethod());
                    context.cancel();
                });
    }

    static Duration parseTimeout(String value) {
        String trimmed = value.trim();
        Duration timeout;
        try {
            timeout = trimmed.startsWith("P") || trimmed.startsWith("p")
                    ? Duration.parse(trimmed)
                    : Duration.ofMillis(Long.parseLong(trimmed));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new RpcException(RpcStatusCode.INVALID_ARGUMENT, "invalid " + TIMEOUT_HEADER + ": " + value, e);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new RpcException(RpcStatusCode.INVALID_ARGUMENT, "invalid " + TIMEOUT_HEADER + ": " + value);
        }
        return timeout;
    }
}
