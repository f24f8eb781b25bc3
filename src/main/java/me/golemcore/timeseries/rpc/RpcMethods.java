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
 * Fully qualified names of the RPC service and its methods.
 *
 * @since 1.0
 */
public final class RpcMethods {

    public static final String TIME_SERIES_SERVICE = "timeseries.TimeSeriesService";
    public static final String QUERY_TIME_SERIES = "/" + TIME_SERIES_SERVICE + "/QueryTimeSeries";

    private RpcMethods() {
    }

    /**
     * Last path segment of a full method name, e.g. {@code QueryTimeSeries}.
     */
    public static String shortName(String fullMethod) {
        if (fullMethod == null) {
            return "unknown";
        }
        int slash = fullMethod.lastIndexOf('/');
        return slash >= 0 ? fullMethod.substring(slash + 1) : fullMethod;
    }
}
