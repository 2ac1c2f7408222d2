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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.Executor;

import com.linecorp.resilience.common.Backoff;
import com.linecorp.resilience.common.Clock;
import com.linecorp.resilience.common.CommonPools;

/**
 * Builds a {@link CircuitBreakerConfig} instance using builder pattern.
 */
public final class CircuitBreakerConfigBuilder {

    private static final int DEFAULT_FAILURE_THRESHOLD = 5;

    private static final int DEFAULT_SUCCESS_THRESHOLD = 3;

    private static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(30);

    private static final Duration DEFAULT_HALF_OPEN_TIMEOUT = Duration.ofSeconds(10);

    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);

    private static final int DEFAULT_MAX_RETRIES = 3;

    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private static final Duration DEFAULT_MAX_BACKOFF_DELAY = Duration.ofSeconds(30);

    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;

    private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;

    private Duration openTimeout = DEFAULT_OPEN_TIMEOUT;

    private Duration halfOpenTimeout = DEFAULT_HALF_OPEN_TIMEOUT;

    private Duration callTimeout = DEFAULT_CALL_TIMEOUT;

    private int maxRetries = DEFAULT_MAX_RETRIES;

    private Duration retryDelay = DEFAULT_RETRY_DELAY;

    private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;

    private Duration maxBackoffDelay = DEFAULT_MAX_BACKOFF_DELAY;

    private OutcomeFilter failureFilter = OutcomeFilter.FAILED;

    private OutcomeFilter successFilter = OutcomeFilter.SUCCEEDED;

    private Clock clock = Clock.SYSTEM;

    private Executor blockingTaskExecutor = CommonPools.blockingTaskExecutor();

    /**
     * Sets the number of consecutive failures in {@link CircuitState#CLOSED} which trips the circuit.
     */
    public CircuitBreakerConfigBuilder failureThreshold(int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        return this;
    }

    /**
     * Sets the number of consecutive successes in {@link CircuitState#HALF_OPEN} which closes the circuit.
     */
    public CircuitBreakerConfigBuilder successThreshold(int successThreshold) {
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be > 0: " + successThreshold);
        }
        this.successThreshold = successThreshold;
        return this;
    }

    /**
     * Sets the duration of {@link CircuitState#OPEN} state.
     */
    public CircuitBreakerConfigBuilder openTimeout(Duration openTimeout) {
        requireNonNull(openTimeout, "openTimeout");
        if (openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException("openTimeout must be greater than zero");
        }
        this.openTimeout = openTimeout;
        return this;
    }

    /**
     * Sets the upper bound of the timeout of a trial call in {@link CircuitState#HALF_OPEN} state.
     * {@link Duration#ZERO} leaves the trial calls bounded by the call timeout only.
     */
    public CircuitBreakerConfigBuilder halfOpenTimeout(Duration halfOpenTimeout) {
        requireNonNull(halfOpenTimeout, "halfOpenTimeout");
        if (halfOpenTimeout.isNegative()) {
            throw new IllegalArgumentException("halfOpenTimeout must not be negative");
        }
        this.halfOpenTimeout = halfOpenTimeout;
        return this;
    }

    /**
     * Sets the default timeout of a guarded call. {@link Duration#ZERO} disables the timeout and
     * runs the guarded operation in the calling thread.
     */
    public CircuitBreakerConfigBuilder callTimeout(Duration callTimeout) {
        requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must not be negative");
        }
        this.callTimeout = callTimeout;
        return this;
    }

    public CircuitBreakerConfigBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public CircuitBreakerConfigBuilder retryDelay(Duration retryDelay) {
        requireNonNull(retryDelay, "retryDelay");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        this.retryDelay = retryDelay;
        return this;
    }

    public CircuitBreakerConfigBuilder backoffMultiplier(double backoffMultiplier) {
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0: " + backoffMultiplier);
        }
        this.backoffMultiplier = backoffMultiplier;
        return this;
    }

    public CircuitBreakerConfigBuilder maxBackoffDelay(Duration maxBackoffDelay) {
        requireNonNull(maxBackoffDelay, "maxBackoffDelay");
        if (maxBackoffDelay.isNegative()) {
            throw new IllegalArgumentException("maxBackoffDelay must not be negative");
        }
        this.maxBackoffDelay = maxBackoffDelay;
        return this;
    }

    /**
     * Sets the {@link OutcomeFilter} that decides whether an outcome is a failure.
     */
    public CircuitBreakerConfigBuilder failureFilter(OutcomeFilter failureFilter) {
        this.failureFilter = requireNonNull(failureFilter, "failureFilter");
        return this;
    }

    /**
     * Sets the {@link OutcomeFilter} that decides whether an outcome which is not a failure is a success.
     */
    public CircuitBreakerConfigBuilder successFilter(OutcomeFilter successFilter) {
        this.successFilter = requireNonNull(successFilter, "successFilter");
        return this;
    }

    /**
     * Sets the {@link Clock} to be used inside circuit breaker.
     */
    public CircuitBreakerConfigBuilder clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Sets the {@link Executor} which runs the calls bounded by a timeout and the asynchronous calls.
     */
    public CircuitBreakerConfigBuilder blockingTaskExecutor(Executor blockingTaskExecutor) {
        this.blockingTaskExecutor = requireNonNull(blockingTaskExecutor, "blockingTaskExecutor");
        return this;
    }

    /**
     * Builds a {@link CircuitBreakerConfig} instance.
     */
    public CircuitBreakerConfig build() {
        if (maxBackoffDelay.compareTo(retryDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxBackoffDelay must be greater than or equal to retryDelay");
        }
        return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout, halfOpenTimeout,
                                        callTimeout, maxRetries,
                                        new Backoff(retryDelay, backoffMultiplier, maxBackoffDelay),
                                        failureFilter, successFilter, clock, blockingTaskExecutor);
    }
}
