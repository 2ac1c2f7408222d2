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

package com.linecorp.resilience.metrics;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An immutable view of a {@link MetricsCollector} at a point in time.
 */
public final class MetricsSnapshot {

    /**
     * The health of a client judged by its success rate.
     */
    public enum HealthStatus {
        /**
         * At least 95% of the requests succeeded, or no request has been made.
         */
        HEALTHY,
        /**
         * At least 80% of the requests succeeded.
         */
        DEGRADED,
        /**
         * Less than 80% of the requests succeeded.
         */
        UNHEALTHY
    }

    private final long totalRequests;
    private final long successfulRequests;
    private final long failedRequests;
    private final long totalResponseTimeMillis;
    private final long minResponseTimeMillis;
    private final long maxResponseTimeMillis;
    private final Map<Integer, Long> statusCodes;
    private final Map<String, Long> methods;
    private final Map<String, Long> errors;
    private final long totalRetries;
    private final Map<Integer, Long> retryCounts;
    private final long circuitBreakerTrips;
    private final long circuitBreakerResets;
    private final long rateLimitHits;
    private final long uptimeMillis;
    private final long lastRequestTimeMillis;

    MetricsSnapshot(long totalRequests, long successfulRequests, long failedRequests,
                    long totalResponseTimeMillis, long minResponseTimeMillis, long maxResponseTimeMillis,
                    Map<Integer, Long> statusCodes, Map<String, Long> methods, Map<String, Long> errors,
                    long totalRetries, Map<Integer, Long> retryCounts, long circuitBreakerTrips,
                    long circuitBreakerResets, long rateLimitHits, long uptimeMillis,
                    long lastRequestTimeMillis) {
        this.totalRequests = totalRequests;
        this.successfulRequests = successfulRequests;
        this.failedRequests = failedRequests;
        this.totalResponseTimeMillis = totalResponseTimeMillis;
        this.minResponseTimeMillis = minResponseTimeMillis;
        this.maxResponseTimeMillis = maxResponseTimeMillis;
        this.statusCodes = Collections.unmodifiableMap(new HashMap<>(statusCodes));
        this.methods = Collections.unmodifiableMap(new HashMap<>(methods));
        this.errors = Collections.unmodifiableMap(new HashMap<>(errors));
        this.totalRetries = totalRetries;
        this.retryCounts = Collections.unmodifiableMap(new HashMap<>(retryCounts));
        this.circuitBreakerTrips = circuitBreakerTrips;
        this.circuitBreakerResets = circuitBreakerResets;
        this.rateLimitHits = rateLimitHits;
        this.uptimeMillis = uptimeMillis;
        this.lastRequestTimeMillis = lastRequestTimeMillis;
    }

    public long totalRequests() {
        return totalRequests;
    }

    public long successfulRequests() {
        return successfulRequests;
    }

    public long failedRequests() {
        return failedRequests;
    }

    /**
     * Returns the percentage of successful requests, or {@code 0} if no request has been made.
     */
    public double successRate() {
        return percentage(successfulRequests, totalRequests);
    }

    /**
     * Returns the percentage of failed requests, or {@code 0} if no request has been made.
     */
    public double failureRate() {
        return percentage(failedRequests, totalRequests);
    }

    public Duration minResponseTime() {
        return Duration.ofMillis(minResponseTimeMillis);
    }

    public Duration maxResponseTime() {
        return Duration.ofMillis(maxResponseTimeMillis);
    }

    public Duration averageResponseTime() {
        if (totalRequests == 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(totalResponseTimeMillis / totalRequests);
    }

    /**
     * Returns the number of requests per status code.
     */
    public Map<Integer, Long> statusCodes() {
        return statusCodes;
    }

    /**
     * Returns the number of requests per HTTP method.
     */
    public Map<String, Long> methods() {
        return methods;
    }

    /**
     * Returns the number of errors per type.
     */
    public Map<String, Long> errors() {
        return errors;
    }

    public long totalRetries() {
        return totalRetries;
    }

    /**
     * Returns how many times each retry number was reached.
     */
    public Map<Integer, Long> retryCounts() {
        return retryCounts;
    }

    public long circuitBreakerTrips() {
        return circuitBreakerTrips;
    }

    public long circuitBreakerResets() {
        return circuitBreakerResets;
    }

    public long rateLimitHits() {
        return rateLimitHits;
    }

    public Duration uptime() {
        return Duration.ofMillis(uptimeMillis);
    }

    public long lastRequestTimeMillis() {
        return lastRequestTimeMillis;
    }

    public double requestsPerSecond() {
        if (uptimeMillis == 0) {
            return 0.0;
        }
        return totalRequests * 1000.0 / uptimeMillis;
    }

    public HealthStatus healthStatus() {
        if (totalRequests == 0) {
            return HealthStatus.HEALTHY;
        }
        final double successRate = successRate();
        if (successRate >= 95) {
            return HealthStatus.HEALTHY;
        }
        if (successRate >= 80) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.UNHEALTHY;
    }

    private static double percentage(long count, long total) {
        if (total == 0) {
            return 0.0;
        }
        return count / (double) total * 100.0;
    }

    @Override
    public String toString() {
        return "MetricsSnapshot{" +
               "totalRequests=" + totalRequests +
               ", successfulRequests=" + successfulRequests +
               ", failedRequests=" + failedRequests +
               ", averageResponseTime=" + averageResponseTime() +
               ", totalRetries=" + totalRetries +
               ", circuitBreakerTrips=" + circuitBreakerTrips +
               ", rateLimitHits=" + rateLimitHits +
               ", uptime=" + uptime() +
               '}';
    }
}
