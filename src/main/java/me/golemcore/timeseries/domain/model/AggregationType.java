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

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregation functions applied to the points of a bucket. The constant name is
 * the wire code and also the SQL aggregate function.
 *
 * @since 1.0
 */
public enum AggregationType {

    MIN, MAX, AVG, SUM;

    /**
     * Strict, case-sensitive lookup by wire code.
     */
    public static Optional<AggregationType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equals(code))
                .findFirst();
    }
}
