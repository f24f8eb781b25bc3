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

import me.golemcore.timeseries.cache.CacheKeyGenerator;
import me.golemcore.timeseries.cache.LruResponseCache;
import me.golemcore.timeseries.rpc.CallContext;
import me.golemcore.timeseries.rpc.RpcHandler;
import me.golemcore.timeseries.rpc.RpcInterceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Serves repeated requests from an {@link LruResponseCache}.
 *
 * <p>
 * On a hit the cached response is returned and the handler is not invoked. On
 * a miss the handler runs and its response is cached only if it returned
 * normally; failures propagate and leave no entry behind.
 *
 * @since 1.0
 */
@Slf4j
public class CachingInterceptor implements RpcInterceptor {

    private final LruResponseCache<Object> cache;
    private final CacheKeyGenerator keyGenerator;

    public CachingInterceptor(LruResponseCache<Object> cache, CacheKeyGenerator keyGenerator) {
        this.cache = cache;
        this.keyGenerator = keyGenerator;
    }

    @Override
    public Object intercept(CallContext context, Object request, RpcHandler next) {
        String key = keyGenerator.generate(context.getMethod(), request);

        Optional<Object> cached = cache.lookup(key);
        if (cached.isPresent()) {
            log.debug("[Cache] Hit for request_id={}", context.getRequestId());
            return cached.get();
        }

        Object response = next.handle(context, request);
        if (response != null) {
            cache.insert(key, response);
        }
        return response;
    }

    public LruResponseCache<Object> getCache() {
        return cache;
    }

    public CacheKeyGenerator getKeyGenerator() {
        return keyGenerator;
    }
}
