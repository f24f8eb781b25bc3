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

/**
 * Admission gate for incoming RPCs using the token bucket algorithm.
 *
 * <p>
 * A single instance is shared by every request of the process; there are no
 * per-client buckets.
 *
 * @since 1.0
 * @see TokenBucketRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and consume one token.
     */
    RateLimitResult tryConsume();

    /**
     * Convenience form of {@link #tryConsume()}.
     */
    default boolean allow() {
        return tryConsume().isAllowed();
    }

    /**
     * Get current bucket state.
     */
    BucketState getBucketState();
}
