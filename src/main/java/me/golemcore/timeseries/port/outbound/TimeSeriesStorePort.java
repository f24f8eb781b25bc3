package me.golemcore.timeseries.port.outbound;

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
import me.golemcore.timeseries.rpc.CallContext;

import java.time.Instant;
import java.util.List;

/**
 * Port for the time-series store. Bucketing and aggregation are computed by
 * the store itself.
 *
 * <p>
 * Implementations honour the deadline and cancellation of the supplied
 * {@link CallContext}. Failures are reported as {@link StoreException}, except
 * cancellation and deadline expiry which surface as
 * {@link me.golemcore.timeseries.rpc.RpcException}.
 */
public interface TimeSeriesStorePort {

    /**
     * Aggregate the points in {@code [start, end)} per bucket.
     *
     * @return one point per non-empty bucket, ascending by bucket start
     */
    List<AggregatedPoint> query(CallContext context, Instant start, Instant end, BucketWidth bucketWidth,
            AggregationType aggregation);

    /**
     * Insert all points in one transaction. Either every point becomes visible
     * or none does.
     */
    void batchInsert(CallContext context, List<TimeSeriesPoint> points);

    /**
     * Insert a single point.
     */
    void insert(TimeSeriesPoint point);

    /**
     * Check that the store is reachable.
     */
    void verifyConnection();

    /**
     * Release the connection pool.
     */
    void close();
}
