package me.golemcore.timeseries.ratelimit;

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

import me.golemcore.timeseries.domain.model.BucketState;
import me.golemcore.timeseries.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket with a sustained rate and a burst capacity.
 *
 * <p>
 * The bucket:
 * <ul>
 * <li>Starts full with {@code burst} tokens</li>
 * <li>Refills continuously at {@code ratePerSecond}, never above
 * {@code burst}</li>
 * <li>Consumes one token per admitted request</li>
 * <li>Denies requests when fewer than one token is available, returning the
 * wait time until the next token</li>
 * </ul>
 *
 * <p>
 * Refill is calculated lazily on each call from the time elapsed since the last
 * refill. All state changes happen under the bucket's monitor.
 *
 * @since 1.0
 */
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double ratePerSecond;
    private final long capacity;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(double ratePerSecond, long capacity) {
        this(ratePerSecond, capacity, System::nanoTime);
    }

    public TokenBucket(double ratePerSecond, long capacity, LongSupplier nanoClock) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("rate must be positive: " + ratePerSecond);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("burst must be at least 1: " + capacity);
        }
        this.ratePerSecond = ratePerSecond;
        this.capacity = capacity;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (tokens >= 1d) {
            tokens -= 1d;
            return RateLimitResult.allowed((long) Math.floor(tokens));
        }

        return RateLimitResult.denied(calculateWaitTime(), "rate limit exceeded");
    }

    /**
     * Get current state of the bucket.
     */
    public synchronized BucketState getState() {
        refill();
        return BucketState.builder()
                .tokens(tokens)
                .capacity(capacity)
                .refillRatePerSecond(ratePerSecond)
                .lastRefillNanos(lastRefillNanos)
                .build();
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsedNanos = now - lastRefillNanos;

        if (elapsedNanos <= 0) {
            return;
        }

        tokens = Math.min(capacity, tokens + elapsedNanos * ratePerSecond / NANOS_PER_SECOND);
        lastRefillNanos = now;
    }

    private Duration calculateWaitTime() {
        double missing = 1d - tokens;
        long nanos = (long) Math.ceil(missing / ratePerSecond * NANOS_PER_SECOND);
        return Duration.ofNanos(nanos);
    }
}
