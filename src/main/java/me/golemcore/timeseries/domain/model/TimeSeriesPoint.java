package me.golemcore.timeseries.domain.model;

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

import java.time.Instant;
import java.util.Objects;

/**
 * A single raw measurement as received from the upstream source.
 *
 * <p>
 * Points have no identity beyond their timestamp and value. Two points with
 * the same timestamp may coexist in the store.
 *
 * @since 1.0
 */
public record TimeSeriesPoint(Instant timestamp, double value) {

    public TimeSeriesPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static TimeSeriesPoint ofEpochSecond(long epochSecond, double value) {
        return new TimeSeriesPoint(Instant.ofEpochSecond(epochSecond), value);
    }
}
