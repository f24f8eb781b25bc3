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

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-call context carried through the interceptor chain and into blocking
 * store and HTTP calls.
 *
 * <p>
 * Holds the full method name, the request id assigned by
 * {@link me.golemcore.timeseries.rpc.interceptor.RequestIdInterceptor}, an
 * optional deadline and a cancellation signal. Derived contexts
 * ({@link #withRequestId(String)}, {@link #withTimeout(Duration)}) are
 * immutable copies that share the cancellation signal of their parent, so
 * cancelling any of them cancels the whole call.
 *
 * <p>
 * Blocking operations register a cancel hook with {@link #onCancel(Runnable)}
 * (e.g. {@code Statement::cancel}, {@code Call::cancel}) and deregister it when
 * they finish.
 *
 * @since 1.0
 */
@Slf4j
public final class CallContext {

    private final String method;
    private final String requestId;
    private final Instant deadline;
    private final Clock clock;
    private final Cancellation cancellation;

    private CallContext(String method, String requestId, Instant deadline, Clock clock, Cancellation cancellation) {
        this.method = method;
        this.requestId = requestId;
        this.deadline = deadline;
        this.clock = clock;
        this.cancellation = cancellation;
    }

    public static CallContext create(String method) {
        return create(method, Clock.systemUTC());
    }

    public static CallContext create(String method, Clock clock) {
        return new CallContext(method, null, null, clock, new Cancellation());
    }

    /**
     * Fresh context whose deadline is {@code timeout} from now.
     */
    public static CallContext withTimeout(String method, Duration timeout) {
        return create(method).withTimeout(timeout);
    }

    public CallContext withRequestId(String id) {
        return new CallContext(method, id, deadline, clock, cancellation);
    }

    /**
     * Derive a context bounded by the shorter of the current deadline and
     * {@code timeout} from now.
     */
    public CallContext withTimeout(Duration timeout) {
        Instant candidate = clock.instant().plus(timeout);
        Instant effective = deadline == null || candidate.isBefore(deadline) ? candidate : deadline;
        return new CallContext(method, requestId, effective, clock, cancellation);
    }

    public String getMethod() {
        return method;
    }

    public String getRequestId() {
        return requestId;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, never negative; empty when unbounded.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * The shorter of {@code limit} and the remaining deadline.
     */
    public Duration boundedBy(Duration limit) {
        return remaining()
                .filter(left -> left.compareTo(limit) < 0)
                .orElse(limit);
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancellation.cancelled.get();
    }

    public void cancel() {
        cancellation.cancel();
    }

    /**
     * Register a hook run once when the call is cancelled. Runs immediately if
     * the call is already cancelled.
     *
     * @return handle that deregisters the hook
     */
    public Runnable onCancel(Runnable hook) {
        cancellation.hooks.add(hook);
        if (cancellation.cancelled.get() && cancellation.hooks.remove(hook)) {
            runHook(hook);
        }
        return () -> cancellation.hooks.remove(hook);
    }

    /**
     * Throw if the call can no longer make progress.
     *
     * @throws RpcException
     *             {@link RpcStatusCode#CANCELLED} or
     *             {@link RpcStatusCode#DEADLINE_EXCEEDED}
     */
    public void checkActive() {
        if (isCancelled()) {
            throw new RpcException(RpcStatusCode.CANCELLED, "call cancelled");
        }
        if (isExpired()) {
            throw new RpcException(RpcStatusCode.DEADLINE_EXCEEDED, "deadline exceeded");
        }
    }

    @Override
    public String toString() {
        return "CallContext{method=" + method + ", requestId=" + requestId + ", deadline=" + deadline + "}";
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("[RPC] Cancel hook failed: {}", e.getMessage(), e);
        }
    }

    private static final class Cancellation {

        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final List<Runnable> hooks = new CopyOnWriteArrayList<>();

        private void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            for (Runnable hook : hooks) {
                if (hooks.remove(hook)) {
                    runHook(hook);
                }
            }
        }
    }
}
