/*
 * Copyright 2016 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.resilience.circuitbreaker;

import java.time.Duration;
import java.util.concurrent.Executor;

import com.linecorp.resilience.common.Backoff;
import com.linecorp.resilience.common.Clock;

/**
 * Stores configurations of circuit breaker. Use {@link CircuitBreakerConfigBuilder} to build one.
 */
public final class CircuitBreakerConfig {

    private static final CircuitBreakerConfig DEFAULT = new CircuitBreakerConfigBuilder().build();

    /**
     * Returns the {@link CircuitBreakerConfig} with the default values.
     */
    public static CircuitBreakerConfig ofDefault() {
        return DEFAULT;
    }

    private final int failureThreshold;

    private final int successThreshold;

    private final Duration openTimeout;

    private final Duration halfOpenTimeout;

    private final Duration callTimeout;

    private final int maxRetries;

    private final Backoff backoff;

    private final OutcomeFilter failureFilter;

    private final OutcomeFilter successFilter;

    private final Clock clock;

    private final Executor blockingTaskExecutor;

    CircuitBreakerConfig(int failureThreshold, int successThreshold, Duration openTimeout,
                         Duration halfOpenTimeout, Duration callTimeout, int maxRetries, Backoff backoff,
                         OutcomeFilter failureFilter, OutcomeFilter successFilter, Clock clock,
                         Executor blockingTaskExecutor) {
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openTimeout = openTimeout;
        this.halfOpenTimeout = halfOpenTimeout;
        this.callTimeout = callTimeout;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.failureFilter = failureFilter;
        this.successFilter = successFilter;
        this.clock = clock;
        this.blockingTaskExecutor = blockingTaskExecutor;
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public int successThreshold() {
        return successThreshold;
    }

    public Duration openTimeout() {
        return openTimeout;
    }

    /**
     * Returns the upper bound of the call timeout while {@link CircuitState#HALF_OPEN}.
     * {@link Duration#ZERO} means the trial calls are bounded by the call timeout only.
     */
    public Duration halfOpenTimeout() {
        return halfOpenTimeout;
    }

    /**
     * Returns the default timeout of a guarded call. {@link Duration#ZERO} disables it.
     */
    public Duration callTimeout() {
        return callTimeout;
    }

    /**
     * Returns the number of retries a caller layering retries above the circuit breaker should make.
     * The circuit breaker never retries by itself.
     */
    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Returns the {@link Backoff} between the retries made above the circuit breaker.
     */
    public Backoff backoff() {
        return backoff;
    }

    public OutcomeFilter failureFilter() {
        return failureFilter;
    }

    public OutcomeFilter successFilter() {
        return successFilter;
    }

    public Clock clock() {
        return clock;
    }

    public Executor blockingTaskExecutor() {
        return blockingTaskExecutor;
    }

    /**
     * Returns a new {@link CircuitBreakerConfigBuilder} initialized with the values of this config.
     */
    public CircuitBreakerConfigBuilder toBuilder() {
        return new CircuitBreakerConfigBuilder()
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .openTimeout(openTimeout)
                .halfOpenTimeout(halfOpenTimeout)
                .callTimeout(callTimeout)
                .maxRetries(maxRetries)
                .retryDelay(backoff.baseDelay())
                .backoffMultiplier(backoff.multiplier())
                .maxBackoffDelay(backoff.maxDelay())
                .failureFilter(failureFilter)
                .successFilter(successFilter)
                .clock(clock)
                .blockingTaskExecutor(blockingTaskExecutor);
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{" +
               "failureThreshold=" + failureThreshold +
               ", successThreshold=" + successThreshold +
               ", openTimeout=" + openTimeout +
               ", halfOpenTimeout=" + halfOpenTimeout +
               ", callTimeout=" + callTimeout +
               ", maxRetries=" + maxRetries +
               ", backoff=" + backoff +
               '}';
    }
}
