package me.golemcore.timeseries.domain.service;

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
import me.golemcore.timeseries.domain.model.TimeSeriesQuery;
import me.golemcore.timeseries.domain.model.TimeSeriesResponse;
import me.golemcore.timeseries.port.outbound.StoreException;
import me.golemcore.timeseries.port.outbound.TimeSeriesStorePort;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcHandler;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Query handler: validates a {@link TimeSeriesQuery}, reads the aggregated
 * buckets from the store and shapes the response.
 *
 * <p>
 * Error mapping:
 * <ul>
 * <li>validation failure → {@link RpcStatusCode#INVALID_ARGUMENT} with the
 * validator message verbatim</li>
 * <li>{@link StoreException} → {@link RpcStatusCode#INTERNAL},
 * {@code "query failed: <operation>"}</li>
 * </ul>
 *
 * <p>
 * Holds no mutable state; serves any number of concurrent calls.
 *
 * @since 1.0
 * @see RequestValidator
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimeSeriesQueryService implements RpcHandler {

    private final RequestValidator validator;
    private final TimeSeriesStorePort store;

    @Override
    public Object handle(CallContext context, Object request) {
        if (!(request instanceof TimeSeriesQuery query)) {
            throw new RpcException(RpcStatusCode.INTERNAL,
                    "unexpected request type: " + (request == null ? "null" : request.getClass().getSimpleName()));
        }
        return queryTimeSeries(context, query);
    }

    public TimeSeriesResponse queryTimeSeries(CallContext context, TimeSeriesQuery query) {
        try {
            validator.validate(query);
        } catch (QueryValidationException e) {
            throw new RpcException(RpcStatusCode.INVALID_ARGUMENT, e.getMessage(), e);
        }

        BucketWidth bucketWidth = BucketWidth.fromCode(query.getWindow()).orElseThrow();
        AggregationType aggregation = AggregationType.fromCode(query.getAggregation()).orElseThrow();

        List<AggregatedPoint> rows;
        try {
            rows = store.query(context, query.getStart(), query.getEnd(), bucketWidth, aggregation);
        } catch (StoreException e) {
            log.error("[Query] Store query failed: start={}, end={}, window={}, aggregation={}: {}",
                    query.getStart(), query.getEnd(), query.getWindow(), query.getAggregation(),
                    e.getMessage(), e);
            throw new RpcException(RpcStatusCode.INTERNAL, "query failed: " + e.getMessage(), e);
        }

        return TimeSeriesResponse.builder()
                .data(new ArrayList<>(rows))
                .build();
    }
}
