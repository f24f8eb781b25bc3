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

/**
 * Cross-cutting stage wrapped around a unary call.
 *
 * <p>
 * An interceptor may short-circuit (return or throw without calling
 * {@code next}), pass through with a derived {@link CallContext}, or observe
 * the outcome after {@code next} returns.
 *
 * @since 1.0
 * @see InterceptorChain
 */
@FunctionalInterface
public interface RpcInterceptor {

    Object intercept(CallContext context, Object request, RpcHandler next);
}
