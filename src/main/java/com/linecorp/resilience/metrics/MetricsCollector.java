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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.linecorp.resilience.common.Clock;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Accumulates the counts and the timings of an HTTP client.
 *
 * <p>Every event is published to a {@link MeterRegistry} under the {@code resilience.http.} prefix and
 * also kept locally, so that {@link #snapshot()} can report it regardless of the registry in use.
 * {@link #reset()} clears the local values only. A request is successful when its status is 2xx or 3xx.
 */
public final class MetricsCollector {

    static final String PREFIX = "resilience.http.";

    private final MeterRegistry registry;

    private final Clock clock;

    private final Timer requestTimer;

    private final Counter retryCounter;

    private final Counter tripCounter;

    private final Counter resetCounter;

    private final Counter rateLimitCounter;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private long totalRequests;

    private long successfulRequests;

    private long failedRequests;

    private long totalResponseTimeMillis;

    private long minResponseTimeMillis = -1;

    private long maxResponseTimeMillis;

    private final Map<Integer, Long> statusCodes = new HashMap<>();

    private final Map<String, Long> methods = new HashMap<>();

    private final Map<String, Long> errors = new HashMap<>();

    private long totalRetries;

    private final Map<Integer, Long> retryCounts = new HashMap<>();

    private long circuitBreakerTrips;

    private long circuitBreakerResets;

    private long rateLimitHits;

    private long startTimeMillis;

    private long lastRequestTimeMillis;

    public MetricsCollector() {
        this(new SimpleMeterRegistry(), Clock.SYSTEM);
    }

    public MetricsCollector(MeterRegistry registry, Clock clock) {
        this.registry = requireNonNull(registry, "registry");
        this.clock = requireNonNull(clock, "clock");
        requestTimer = Timer.builder(PREFIX + "requests").register(registry);
        retryCounter = Counter.builder(PREFIX + "retries").register(registry);
        tripCounter = Counter.builder(PREFIX + "circuitbreaker.trips").register(registry);
        resetCounter = Counter.builder(PREFIX + "circuitbreaker.resets").register(registry);
        rateLimitCounter = Counter.builder(PREFIX + "ratelimit.hits").register(registry);
        startTimeMillis = clock.currentMillis();
    }

    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Records a completed request.
     */
    public void recordRequest(String method, int statusCode, Duration duration) {
        requireNonNull(method, "method");
        requireNonNull(duration, "duration");
        final long millis = duration.toMillis();
        final boolean success = statusCode >= 200 && statusCode < 400;

        requestTimer.record(millis, TimeUnit.MILLISECONDS);
        Counter.builder(PREFIX + "responses")
               .tag("method", method)
               .tag("status", String.valueOf(statusCode))
               .tag("outcome", success ? "success" : "failure")
               .register(registry)
               .increment();

        lock.writeLock().lock();
        try {
            totalRequests++;
            lastRequestTimeMillis = clock.currentMillis();
            methods.merge(method, 1L, Long::sum);
            statusCodes.merge(statusCode, 1L, Long::sum);
            if (success) {
                successfulRequests++;
            } else {
                failedRequests++;
            }
            totalResponseTimeMillis += millis;
            if (minResponseTimeMillis < 0 || millis < minResponseTimeMillis) {
                minResponseTimeMillis = millis;
            }
            if (millis > maxResponseTimeMillis) {
                maxResponseTimeMillis = millis;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a retry. {@code retryNumber} is the one-based index of the retry.
     */
    public void recordRetry(int retryNumber) {
        retryCounter.increment();
        lock.writeLock().lock();
        try {
            totalRetries++;
            retryCounts.merge(retryNumber, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records an error by its type, usually the simple name of the exception class.
     */
    public void recordError(String errorType) {
        requireNonNull(errorType, "errorType");
        Counter.builder(PREFIX + "errors")
               .tag("type", errorType)
               .register(registry)
               .increment();
        lock.writeLock().lock();
        try {
            errors.merge(errorType, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordCircuitBreakerTrip() {
        tripCounter.increment();
        lock.writeLock().lock();
        try {
            circuitBreakerTrips++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordCircuitBreakerReset() {
        resetCounter.increment();
        lock.writeLock().lock();
        try {
            circuitBreakerResets++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a request refused by a rate limiter.
     */
    public void recordRateLimitHit() {
        rateLimitCounter.increment();
        lock.writeLock().lock();
        try {
            rateLimitHits++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public MetricsSnapshot snapshot() {
        lock.readLock().lock();
        try {
            final long now = clock.currentMillis();
            return new MetricsSnapshot(totalRequests, successfulRequests, failedRequests,
                                       totalResponseTimeMillis, Math.max(0, minResponseTimeMillis),
                                       maxResponseTimeMillis, statusCodes, methods, errors, totalRetries,
                                       retryCounts, circuitBreakerTrips, circuitBreakerResets, rateLimitHits,
                                       Math.max(0, now - startTimeMillis), lastRequestTimeMillis);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears the local values and restarts the uptime.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            totalRequests = 0;
            successfulRequests = 0;
            failedRequests = 0;
            totalResponseTimeMillis = 0;
            minResponseTimeMillis = -1;
            maxResponseTimeMillis = 0;
            statusCodes.clear();
            methods.clear();
            errors.clear();
            totalRetries = 0;
            retryCounts.clear();
            circuitBreakerTrips = 0;
            circuitBreakerResets = 0;
            rateLimitHits = 0;
            startTimeMillis = clock.currentMillis();
            lastRequestTimeMillis = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
