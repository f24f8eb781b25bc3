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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Payload of the upstream series endpoint:
 * {@code {"result":[{"time":<unix seconds>,"value":<double>}]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record UpstreamSeriesResponse(List<Sample> result) {

    List<TimeSeriesPoint> toPoints() {
        if (result == null) {
            return List.of();
        }
        return result.stream()
                .map(sample -> TimeSeriesPoint.ofEpochSecond(sample.time(), sample.value()))
                .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Sample(long time, double value) {
    }
}
