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

import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcHandler;
import me.golemcore.timeseries.rpc.RpcInterceptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Logs one line per admitted call with request id, method, duration and error.
 *
 * @since 1.0
 */
@Slf4j
public class LoggingInterceptor implements RpcInterceptor {

    @Override
    public Object intercept(CallContext context, Object request, RpcHandler next) {
        long startNanos = System.nanoTime();
        RuntimeException failure = null;
        try {
            return next.handle(context, request);
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            if (failure == null) {
                log.info("[RPC] request_id: {} method: {} duration: {}ms error: none",
                        context.getRequestId(), context.getMethod(), duration.toMillis());
            } else {
                log.warn("[RPC] request_id: {} method: {} duration: {}ms error: {}",
                        context.getRequestId(), context.getMethod(), duration.toMillis(), failure.toString());
            }
        }
    }
}
