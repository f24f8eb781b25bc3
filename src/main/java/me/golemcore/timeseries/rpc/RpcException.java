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
 * Structured status error returned to RPC callers.
 *
 * <p>
 * The message is part of the contract for {@link RpcStatusCode#INVALID_ARGUMENT}
 * (callers match on it), so it is passed through unchanged.
 *
 * @since 1.0
 */
public class RpcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RpcStatusCode code;

    public RpcException(RpcStatusCode code, String message) {
        super(message);
        this.code = code;
    }

    public RpcException(RpcStatusCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public RpcStatusCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "RpcException{code=" + code + ", message=" + getMessage() + "}";
    }
}
