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

/**
 * An immutable snapshot of the state and the counters of a {@link CircuitBreaker}.
 *
 * <p>Timestamps are in milliseconds since the epoch, and {@code 0} means the event has not happened yet.
 * The rates are percentages of {@link #requestCount()} and are {@code 0} while no request has been made.
 */
public final class CircuitBreakerStats {

    private final String name;

    private final CircuitState state;

    private final long requestCount;

    private final long failureCount;

    private final long successCount;

    private final long rejectedCount;

    private final long totalFailureCount;

    private final long totalSuccessCount;

    private final long lastFailureTimeMillis;

    private final long lastRequestTimeMillis;

    private final long stateChangeTimeMillis;

    CircuitBreakerStats(String name, CircuitState state, long requestCount, long failureCount,
                        long successCount, long rejectedCount, long totalFailureCount,
                        long totalSuccessCount, long lastFailureTimeMillis, long lastRequestTimeMillis,
                        long stateChangeTimeMillis) {
        this.name = requireNonNull(name, "name");
        this.state = requireNonNull(state, "state");
        this.requestCount = requestCount;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.rejectedCount = rejectedCount;
        this.totalFailureCount = totalFailureCount;
        this.totalSuccessCount = totalSuccessCount;
        this.lastFailureTimeMillis = lastFailureTimeMillis;
        this.lastRequestTimeMillis = lastRequestTimeMillis;
        this.stateChangeTimeMillis = stateChangeTimeMillis;
    }

    public String name() {
        return name;
    }

    public CircuitState state() {
        return state;
    }

    /**
     * Returns the number of calls which were admitted and invoked. Rejected calls are not included.
     */
    public long requestCount() {
        return requestCount;
    }

    /**
     * Returns the number of failures counted towards the current state transition. It is reset on a
     * success while {@link CircuitState#CLOSED} and whenever the circuit moves to
     * {@link CircuitState#HALF_OPEN} or {@link CircuitState#CLOSED}.
     */
    public long failureCount() {
        return failureCount;
    }

    /**
     * Returns the number of successes counted towards the current state transition.
     */
    public long successCount() {
        return successCount;
    }

    public long rejectedCount() {
        return rejectedCount;
    }

    public long totalFailureCount() {
        return totalFailureCount;
    }

    public long totalSuccessCount() {
        return totalSuccessCount;
    }

    public long lastFailureTimeMillis() {
        return lastFailureTimeMillis;
    }

    public long lastRequestTimeMillis() {
        return lastRequestTimeMillis;
    }

    public long stateChangeTimeMillis() {
        return stateChangeTimeMillis;
    }

    public double failureRate() {
        return EventCount.percentage(totalFailureCount, requestCount);
    }

    public double successRate() {
        return EventCount.percentage(totalSuccessCount, requestCount);
    }

    @Override
    public String toString() {
        return "CircuitBreakerStats{" +
               "name=" + name +
               ", state=" + state +
               ", requestCount=" + requestCount +
               ", failureCount=" + failureCount +
               ", successCount=" + successCount +
               ", rejectedCount=" + rejectedCount +
               ", failureRate=" + failureRate() +
               ", successRate=" + successRate() +
               ", lastFailureTimeMillis=" + lastFailureTimeMillis +
               ", lastRequestTimeMillis=" + lastRequestTimeMillis +
               ", stateChangeTimeMillis=" + stateChangeTimeMillis +
               '}';
    }
}
