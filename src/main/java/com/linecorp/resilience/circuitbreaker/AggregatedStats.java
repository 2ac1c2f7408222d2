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

/**
 * The sum of the {@link CircuitBreakerMetrics} of all circuits held by a {@link CircuitBreakerManager}.
 * The rates are the averages of the per-circuit rates, and {@code 0} when the manager is empty.
 */
public final class AggregatedStats {

    private final int circuitCount;

    private final long totalRequests;

    private final long totalSuccesses;

    private final long totalFailures;

    private final long totalRejections;

    private final long totalStateChanges;

    private final double averageFailureRate;

    private final double averageSuccessRate;

    AggregatedStats(int circuitCount, long totalRequests, long totalSuccesses, long totalFailures,
                    long totalRejections, long totalStateChanges, double averageFailureRate,
                    double averageSuccessRate) {
        this.circuitCount = circuitCount;
        this.totalRequests = totalRequests;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
        this.totalRejections = totalRejections;
        this.totalStateChanges = totalStateChanges;
        this.averageFailureRate = averageFailureRate;
        this.averageSuccessRate = averageSuccessRate;
    }

    public int circuitCount() {
        return circuitCount;
    }

    public long totalRequests() {
        return totalRequests;
    }

    public long totalSuccesses() {
        return totalSuccesses;
    }

    public long totalFailures() {
        return totalFailures;
    }

    public long totalRejections() {
        return totalRejections;
    }

    public long totalStateChanges() {
        return totalStateChanges;
    }

    public double averageFailureRate() {
        return averageFailureRate;
    }

    public double averageSuccessRate() {
        return averageSuccessRate;
    }

    @Override
    public String toString() {
        return "AggregatedStats{" +
               "circuitCount=" + circuitCount +
               ", totalRequests=" + totalRequests +
               ", totalSuccesses=" + totalSuccesses +
               ", totalFailures=" + totalFailures +
               ", totalRejections=" + totalRejections +
               ", totalStateChanges=" + totalStateChanges +
               ", averageFailureRate=" + averageFailureRate +
               ", averageSuccessRate=" + averageSuccessRate +
               '}';
    }
}
