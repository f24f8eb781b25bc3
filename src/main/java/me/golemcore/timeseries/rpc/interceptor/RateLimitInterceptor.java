package me.golemcore.timeseries.rpc.interceptor;

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

import me.golemcore.timeseries.domain.model.RateLimitResult;
import me.golemcore.timeseries.ratelimit.RateLimiter;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcHandler;
import me.golemcore.timeseries.rpc.RpcInterceptor;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rejects a call with {@link RpcStatusCode#RESOURCE_EXHAUSTED} when the shared
 * {@link RateLimiter} has no token left. Rejected calls never reach the later
 * stages.
 *
 * @since 1.0
 */
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements RpcInterceptor {

    static final String RATE_LIMIT_EXCEEDED = "rate limit exceeded";

    private final RateLimiter rateLimiter;

    @Override
    public Object intercept(CallContext context, Object request, RpcHandler next) {
        RateLimitResult result = rateLimiter.tryConsume();
        if (!result.isAllowed()) {
            log.warn("[RPC] Rejected {} request_id={}: {}", context.getMethod(), context.getRequestId(),
                    RATE_LIMIT_EXCEEDED);
            throw new RpcException(RpcStatusCode.RESOURCE_EXHAUSTED, RATE_LIMIT_EXCEEDED);
        }
        return next.handle(context, request);
    }
}
