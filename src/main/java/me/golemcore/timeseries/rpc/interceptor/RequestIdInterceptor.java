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
import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * First stage of the chain: assigns a request id to the call.
 *
 * <p>
 * The id is stored in the derived {@link CallContext} and in the SLF4J MDC
 * under {@value #MDC_KEY} while the rest of the chain runs, so every log line
 * of the call can be correlated.
 *
 * @since 1.0
 */
public class RequestIdInterceptor implements RpcInterceptor {

    public static final String MDC_KEY = "requestId";

    private final Supplier<String> idGenerator;

    public RequestIdInterceptor() {
        this(() -> UUID.randomUUID().toString());
    }

    public RequestIdInterceptor(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public Object intercept(CallContext context, Object request, RpcHandler next) {
        String requestId = idGenerator.get();
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, requestId);
        try {
            return next.handle(context.withRequestId(requestId), request);
        } finally {
            if (previous != null) {
                MDC.put(MDC_KEY, previous);
            } else {
                MDC.remove(MDC_KEY);
            }
        }
    }
}
