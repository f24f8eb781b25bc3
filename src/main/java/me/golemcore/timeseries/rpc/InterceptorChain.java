package me.golemcore.timeseries.rpc;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered composition of {@link RpcInterceptor}s around a terminal
 * {@link RpcHandler}.
 *
 * <p>
 * Interceptors run in the order they were added: the first one added sees the
 * call first and its outcome last. The builder folds the list right to left,
 * so each interceptor receives the remainder of the chain as an opaque
 * {@link RpcHandler}.
 *
 * <pre>{@code
 * RpcHandler entry = InterceptorChain.builder()
 *         .add(requestIdInterceptor)
 *         .add(rateLimitInterceptor)
 *         .build(handler);
 * }</pre>
 *
 * @since 1.0
 */
public final class InterceptorChain {

    private final List<RpcInterceptor> interceptors;

    private InterceptorChain(List<RpcInterceptor> interceptors) {
        this.interceptors = Collections.unmodifiableList(new ArrayList<>(interceptors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<RpcInterceptor> getInterceptors() {
        return interceptors;
    }

    /**
     * Wrap the terminal handler with every interceptor of this chain.
     */
    public RpcHandler wrap(RpcHandler handler) {
        Objects.requireNonNull(handler, "handler");
        RpcHandler chain = handler;
        for (int i = interceptors.size() - 1; i >= 0; i--) {
            RpcInterceptor interceptor = interceptors.get(i);
            RpcHandler next = chain;
            chain = (context, request) -> interceptor.intercept(context, request, next);
        }
        return chain;
    }

    public static final class Builder {

        private final List<RpcInterceptor> interceptors = new ArrayList<>();

        private Builder() {
        }

        public Builder add(RpcInterceptor interceptor) {
            interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public InterceptorChain build() {
            return new InterceptorChain(interceptors);
        }

        public RpcHandler build(RpcHandler handler) {
            return build().wrap(handler);
        }
    }
}
