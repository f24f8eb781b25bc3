package me.golemcore.timeseries.domain.service;

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

import me.golemcore.timeseries.domain.model.ServingStatus;
import me.golemcore.timeseries.rpc.RpcException;
import me.golemcore.timeseries.rpc.RpcMethods;
import me.golemcore.timeseries.rpc.RpcStatusCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serving status per service name, backing the health check protocol.
 *
 * <p>
 * The empty name stands for the whole server. Both it and
 * {@link RpcMethods#TIME_SERIES_SERVICE} start as
 * {@link ServingStatus#SERVING}; the lifecycle coordinator flips them to
 * {@link ServingStatus#NOT_SERVING} on shutdown.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class HealthStatusRegistry {

    public static final String SERVER = "";

    private final Map<String, ServingStatus> statuses = new ConcurrentHashMap<>();

    public HealthStatusRegistry() {
        statuses.put(SERVER, ServingStatus.SERVING);
        statuses.put(RpcMethods.TIME_SERIES_SERVICE, ServingStatus.SERVING);
    }

    /**
     * @throws RpcException
     *             {@link RpcStatusCode#NOT_FOUND} for an unregistered service
     */
    public ServingStatus check(String service) {
        ServingStatus status = statuses.get(service == null ? SERVER : service);
        if (status == null) {
            throw new RpcException(RpcStatusCode.NOT_FOUND, "unknown service");
        }
        return status;
    }

    /**
     * Streaming status updates are not offered.
     *
     * @throws RpcException
     *             always, {@link RpcStatusCode#UNIMPLEMENTED}
     */
    public ServingStatus watch(String service) {
        throw new RpcException(RpcStatusCode.UNIMPLEMENTED, "watching is not supported");
    }

    public void setServingStatus(String service, ServingStatus status) {
        ServingStatus previous = statuses.put(service, status);
        if (previous != status) {
            log.info("[Health] Service '{}' is now {}", service, status);
        }
    }

    /**
     * Mark every registered service as not serving.
     */
    public void shutdown() {
        statuses.replaceAll((service, status) -> ServingStatus.NOT_SERVING);
        log.info("[Health] All services marked NOT_SERVING");
    }
}
