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
import me.golemcore.timeseries.infrastructure.config.TimeSeriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.LongSupplier;

/**
 * Process-wide token bucket rate limiter for the query RPC.
 *
 * <p>
 * Configured from {@code timeseries.rate-limit.*}:
 * <ul>
 * <li>{@code requests-per-second} - sustained rate (default 5.0)</li>
 * <li>{@code burst} - bucket capacity (default 10)</li>
 * <li>{@code enabled} - when false every request is admitted</li>
 * </ul>
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private final boolean enabled;
    private final TokenBucket bucket;

    @Autowired
    public TokenBucketRateLimiter(TimeSeriesProperties properties) {
        this(properties.getRateLimit(), System::nanoTime);
    }

    TokenBucketRateLimiter(TimeSeriesProperties.RateLimitProperties rateLimit, LongSupplier nanoClock) {
        this.enabled = rateLimit.isEnabled();
        this.bucket = new TokenBucket(rateLimit.getRequestsPerSecond(), rateLimit.getBurst(), nanoClock);
        log.info("[RateLimit] {} rate={}/s burst={}", enabled ? "Enabled" : "Disabled",
                rateLimit.getRequestsPerSecond(), rateLimit.getBurst());
    }

    @Override
    public RateLimitResult tryConsume() {
        if (!enabled) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Rate limit exceeded, next token in {}", result.getWaitTime());
        }
        return result;
    }

    @Override
    public BucketState getBucketState() {
        return bucket.getState();
    }
}
