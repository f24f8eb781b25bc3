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

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Supported bucket widths ("windows") of an aggregation query.
 *
 * <p>
 * Each constant carries the wire code callers use, the bucket duration and
 * the PostgreSQL interval literal passed to {@code time_bucket}.
 *
 * @since 1.0
 */
public enum BucketWidth {

    ONE_MINUTE("1m", Duration.ofMinutes(1), "1 minute"),
    FIVE_MINUTES("5m", Duration.ofMinutes(5), "5 minutes"),
    ONE_HOUR("1h", Duration.ofHours(1), "1 hour"),
    ONE_DAY("1d", Duration.ofDays(1), "1 day");

    private final String code;
    private final Duration duration;
    private final String sqlInterval;

    BucketWidth(String code, Duration duration, String sqlInterval) {
        this.code = code;
        this.duration = duration;
        this.sqlInterval = sqlInterval;
    }

    public String getCode() {
        return code;
    }

    public Duration getDuration() {
        return duration;
    }

    public String getSqlInterval() {
        return sqlInterval;
    }

    /**
     * Strict, case-sensitive lookup by wire code.
     */
    public static Optional<BucketWidth> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(width -> width.code.equals(code))
                .findFirst();
    }
}
