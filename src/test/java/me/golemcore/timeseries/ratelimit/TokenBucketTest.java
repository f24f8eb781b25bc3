package me.golemcore.timeseries.ratelimit;

import me.golemcore.timeseries.domain.model.BucketState;
import me.golemcore.timeseries.domain.model.RateLimitResult;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000L);

    @Test
    void tryConsume_allowsBurstThenDenies() {
        TokenBucket bucket = new TokenBucket(5.0, 10, nanos::get);

        for (int i = 0; i < 10; i++) {
            RateLimitResult result = bucket.tryConsume();
            assertTrue(result.isAllowed(), "Request " + (i + 1) + " should be allowed");
            assertEquals(9 - i, result.getRemainingTokens());
        }

        RateLimitResult denied = bucket.tryConsume();
        assertFalse(denied.isAllowed());
        assertEquals("rate limit exceeded", denied.getReason());
        assertTrue(denied.getWaitTime().toMillis() >= 199 && denied.getWaitTime().toMillis() <= 200);
    }

    @Test
    void tryConsume_refillsContinuously() {
        TokenBucket bucket = new TokenBucket(5.0, 10, nanos::get);
        for (int i = 0; i < 10; i++) {
            bucket.tryConsume();
        }
        assertFalse(bucket.tryConsume().isAllowed());

        nanos.addAndGet(Duration.ofMillis(100).toNanos());
        assertFalse(bucket.tryConsume().isAllowed());

        nanos.addAndGet(Duration.ofMillis(100).toNanos());
        assertTrue(bucket.tryConsume().isAllowed());
        assertFalse(bucket.tryConsume().isAllowed());
    }

    @Test
    void tryConsume_neverRefillsAboveCapacity() {
        TokenBucket bucket = new TokenBucket(5.0, 10, nanos::get);

        nanos.addAndGet(Duration.ofHours(1).toNanos());

        BucketState state = bucket.getState();
        assertEquals(10.0, state.getTokens(), 1e-9);
        assertEquals(10, state.getCapacity());
    }

    @Test
    void tryConsume_usesRecordedRefillTime() {
        TokenBucket bucket = new TokenBucket(5.0, 1, nanos::get);
        assertTrue(bucket.tryConsume().isAllowed());
        assertFalse(bucket.tryConsume().isAllowed());

        long lastRefill = (long) ReflectionTestUtils.getField(bucket, "lastRefillNanos");
        ReflectionTestUtils.setField(bucket, "lastRefillNanos", lastRefill - Duration.ofMillis(250).toNanos());

        assertTrue(bucket.tryConsume().isAllowed());
    }

    @Test
    void constructor_rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new TokenBucket(5.0, 0));
    }
}
