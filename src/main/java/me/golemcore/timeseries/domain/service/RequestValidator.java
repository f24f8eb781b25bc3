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

import me.golemcore.timeseries.domain.model.AggregationType;
import me.golemcore.timeseries.domain.model.BucketWidth;
import me.golemcore.timeseries.domain.model.TimeSeriesQuery;
import me.golemcore.timeseries.domain.model.ValidationError;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Checks a query's time range, window and aggregation against policy.
 *
 * <p>
 * Rules are applied in order and the first failure wins:
 * <ol>
 * <li>both timestamps set (not null, not the Unix epoch)</li>
 * <li>start strictly before end</li>
 * <li>range no longer than {@link #MAX_TIME_RANGE}</li>
 * <li>window is one of {@code 1m, 5m, 1h, 1d}</li>
 * <li>aggregation is one of {@code MIN, MAX, AVG, SUM}</li>
 * </ol>
 *
 * <p>
 * Messages are matched by callers and must not change. Stateless and safe to
 * share.
 *
 * @since 1.0
 */
@Component
public class RequestValidator {

    public static final Duration MAX_TIME_RANGE = Duration.ofDays(2 * 365);

    static final String MISSING_TIMESTAMP = "missing timestamp";
    static final String INVALID_RANGE = "start time must be before end time";
    static final String RANGE_TOO_LARGE = "time range exceeds maximum allowed";
    static final String INVALID_WINDOW = "invalid window: ";
    static final String INVALID_AGGREGATION = "invalid aggregation";

    public void validate(TimeSeriesQuery query) {
        validate(query.getStart(), query.getEnd(), query.getWindow(), query.getAggregation());
    }

    public void validate(Instant start, Instant end, String window, String aggregation) {
        if (isUnset(start) || isUnset(end)) {
            throw new QueryValidationException(ValidationError.MISSING_TIMESTAMP, MISSING_TIMESTAMP);
        }

        if (!start.isBefore(end)) {
            throw new QueryValidationException(ValidationError.INVALID_RANGE, INVALID_RANGE);
        }

        if (Duration.between(start, end).compareTo(MAX_TIME_RANGE) > 0) {
            throw new QueryValidationException(ValidationError.RANGE_TOO_LARGE, RANGE_TOO_LARGE);
        }

        if (window == null || window.isEmpty()) {
            throw new QueryValidationException(ValidationError.INVALID_BUCKET_WIDTH, INVALID_WINDOW);
        }
        if (BucketWidth.fromCode(window).isEmpty()) {
            throw new QueryValidationException(ValidationError.INVALID_BUCKET_WIDTH, INVALID_WINDOW + window);
        }

        // no trailing colon when empty
        if (aggregation == null || aggregation.isEmpty()) {
            throw new QueryValidationException(ValidationError.INVALID_AGGREGATION, INVALID_AGGREGATION);
        }
        if (AggregationType.fromCode(aggregation).isEmpty()) {
            throw new QueryValidationException(ValidationError.INVALID_AGGREGATION,
                    INVALID_AGGREGATION + ": " + aggregation);
        }
    }

    private boolean isUnset(Instant timestamp) {
        return timestamp == null || Instant.EPOCH.equals(timestamp);
    }
}
