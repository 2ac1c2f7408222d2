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

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counts the events of a single {@link CircuitBreaker} and publishes them to a {@link MeterRegistry}.
 *
 * <p>The meters are tagged with {@code name=<circuit name>}:
 * <ul>
 *   <li>{@code resilience.circuitbreaker.requests}</li>
 *   <li>{@code resilience.circuitbreaker.successes}</li>
 *   <li>{@code resilience.circuitbreaker.failures}</li>
 *   <li>{@code resilience.circuitbreaker.rejections}</li>
 *   <li>{@code resilience.circuitbreaker.state.changes}</li>
 *   <li>{@code resilience.circuitbreaker.state} (gauge, 0=CLOSED, 1=OPEN, 2=HALF_OPEN)</li>
 * </ul>
 *
 * <p>Micrometer counters cannot be decremented, so {@link #reset()} only clears the local counts
 * returned by {@link #count()}.
 */
public final class CircuitBreakerMetrics implements AutoCloseable {

    static final String PREFIX = "resilience.circuitbreaker.";

    private final MeterRegistry registry;

    private final LongAdder requests = new LongAdder();

    private final LongAdder successes = new LongAdder();

    private final LongAdder failures = new LongAdder();

    private final LongAdder rejections = new LongAdder();

    private final LongAdder stateChanges = new LongAdder();

    private final AtomicInteger state = new AtomicInteger(stateValue(CircuitState.CLOSED));

    private final Counter requestCounter;

    private final Counter successCounter;

    private final Counter failureCounter;

    private final Counter rejectionCounter;

    private final Counter stateChangeCounter;

    private final Gauge stateGauge;

    CircuitBreakerMetrics(String circuitName, MeterRegistry registry) {
        requireNonNull(circuitName, "circuitName");
        this.registry = requireNonNull(registry, "registry");
        requestCounter = counter(registry, "requests", circuitName);
        successCounter = counter(registry, "successes", circuitName);
        failureCounter = counter(registry, "failures", circuitName);
        rejectionCounter = counter(registry, "rejections", circuitName);
        stateChangeCounter = counter(registry, "state.changes", circuitName);
        stateGauge = Gauge.builder(PREFIX + "state", state, AtomicInteger::get)
                          .description("The current state of the circuit (0=CLOSED, 1=OPEN, 2=HALF_OPEN)")
                          .tag("name", circuitName)
                          .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String suffix, String circuitName) {
        return Counter.builder(PREFIX + suffix)
                      .tag("name", circuitName)
                      .register(registry);
    }

    static int stateValue(CircuitState state) {
        switch (state) {
            case OPEN:
                return 1;
            case HALF_OPEN:
                return 2;
            default:
                return 0;
        }
    }

    void onRequest() {
        requests.increment();
        requestCounter.increment();
    }

    void onSuccess() {
        successes.increment();
        successCounter.increment();
    }

    void onFailure() {
        failures.increment();
        failureCounter.increment();
    }

    void onRejected() {
        rejections.increment();
        rejectionCounter.increment();
    }

    void onStateChange(CircuitState newState) {
        stateChanges.increment();
        stateChangeCounter.increment();
        state.set(stateValue(newState));
    }

    /**
     * Returns the events counted since creation or the last {@link #reset()}.
     */
    public EventCount count() {
        return new EventCount(requests.sum(), successes.sum(), failures.sum(), rejections.sum(),
                              stateChanges.sum());
    }

    /**
     * Clears the local counts. The state gauge keeps reporting the current state.
     */
    public void reset() {
        requests.reset();
        successes.reset();
        failures.reset();
        rejections.reset();
        stateChanges.reset();
    }

    /**
     * Removes the meters of this circuit from the {@link MeterRegistry}.
     */
    @Override
    public void close() {
        final List<Meter> meters = Arrays.asList(requestCounter, successCounter, failureCounter,
                                                 rejectionCounter, stateChangeCounter, stateGauge);
        meters.forEach(registry::remove);
    }
}
