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
 * A unary call: the business handler itself, or the rest of an interceptor
 * chain as seen by one interceptor.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface RpcHandler {

    /**
     * Handle one request.
     *
     * @throws RpcException
     *             on any failure that should reach the caller as a status
     */
    Object handle(CallContext context, Object request);
}
