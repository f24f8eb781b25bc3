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
import me.golemcore.timeseries.rpc.RpcMethods;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Records a request counter and a latency timer per method. Both are recorded
 * after the downstream call returns, whether it succeeded or not.
 *
 * @since 1.0
 */
public class MetricsInterceptor implements RpcInterceptor {

    public static final String REQUESTS_METRIC = "rpc.requests";
    public static final String DURATION_METRIC = "rpc.request.duration";

    private final MeterRegistry meterRegistry;

    public MetricsInterceptor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Object intercept(CallContext context, Object request, RpcHandler next) {
        long startNanos = System.nanoTime();
        try {
            return next.handle(context, request);
        } finally {
            String method = RpcMethods.shortName(context.getMethod());

            Counter.builder(REQUESTS_METRIC)
                    .tag("method", method)
                    .description("Total number of RPC requests handled")
                    .register(meterRegistry)
                    .increment();

            Timer.builder(DURATION_METRIC)
                    .tag("method", method)
                    .description("RPC request duration")
                    .publishPercentileHistogram()
                    .register(meterRegistry)
                    .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }
}
