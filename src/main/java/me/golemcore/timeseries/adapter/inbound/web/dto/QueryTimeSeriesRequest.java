package me.golemcore.timeseries.adapter.inbound.web.dto;

import me.golemcore.timeseries.domain.model.TimeSeriesQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON body of {@code QueryTimeSeries}. Absent fields stay null and are
 * reported by the validator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryTimeSeriesRequest {
    private Instant start;
    private Instant end;
    private String window;
    private String aggregation;

    public TimeSeriesQuery toQuery() {
        return TimeSeriesQuery.builder()
                .start(start)
                .end(end)
                .window(window)
                .aggregation(aggregation)
                .build();
    }
}
