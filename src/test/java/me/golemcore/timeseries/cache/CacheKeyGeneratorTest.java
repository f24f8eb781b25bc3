package me.golemcore.timeseries.cache;

import me.golemcore.timeseries.domain.model.TimeSeriesQuery;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyGeneratorTest {

    private static final String METHOD = "/timeseries.TimeSeriesService/QueryTimeSeries";

    private final CacheKeyGenerator generator = new CacheKeyGenerator();

    @Test
    void shouldPrefixKeyWithMethod() {
        TimeSeriesQuery query = query("1h", "AVG");

        String key = generator.generate(METHOD, query);

        assertTrue(key.startsWith(METHOD + ":{"));
        assertTrue(key.contains("\"start\":\"2024-01-01T00:00:00Z\""));
    }

    @Test
    void shouldProduceEqualKeysForEqualRequests() {
        assertEquals(generator.generate(METHOD, query("1h", "AVG")), generator.generate(METHOD, query("1h", "AVG")));
        assertNotEquals(generator.generate(METHOD, query("1h", "AVG")),
                generator.generate(METHOD, query("1h", "MAX")));
        assertNotEquals(generator.generate(METHOD, query("1h", "AVG")),
                generator.generate("/other/Method", query("1h", "AVG")));
    }

    @Test
    void shouldIgnoreMapInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("window", "1h");
        first.put("aggregation", "AVG");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("aggregation", "AVG");
        second.put("window", "1h");

        assertEquals(generator.generate(METHOD, first), generator.generate(METHOD, second));
    }

    private static TimeSeriesQuery query(String window, String aggregation) {
        return TimeSeriesQuery.builder()
                .start(Instant.parse("2024-01-01T00:00:00Z"))
                .end(Instant.parse("2024-01-02T00:00:00Z"))
                .window(window)
                .aggregation(aggregation)
                .build();
    }
}
