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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * A registry of named {@link CircuitBreaker}s.
 *
 * <p>Names are unique. A circuit lives until it is {@linkplain #remove(String) removed}. When monitoring is
 * enabled, a single background task reports the circuits which are not {@link CircuitState#CLOSED} every
 * {@link CircuitBreakerManagerConfig#monitoringInterval()}. {@link #close()} stops it.
 */
public final class CircuitBreakerManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final CircuitBreakerManagerConfig config;

    private final Map<String, CircuitBreaker> circuits = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final DefaultEventExecutor monitorExecutor;

    private final ScheduledFuture<?> monitorFuture;

    /**
     * Creates a new manager with the default {@link CircuitBreakerManagerConfig}.
     */
    public CircuitBreakerManager() {
        this(new CircuitBreakerManagerConfigBuilder().build());
    }

    public CircuitBreakerManager(CircuitBreakerManagerConfig config) {
        this.config = requireNonNull(config, "config");
        if (config.monitoringEnabled()) {
            monitorExecutor = new DefaultEventExecutor(
                    new DefaultThreadFactory("circuit-breaker-monitor", true));
            final long intervalMillis = config.monitoringInterval().toMillis();
            monitorFuture = monitorExecutor.scheduleAtFixedRate(this::monitor, intervalMillis,
                                                                intervalMillis, TimeUnit.MILLISECONDS);
        } else {
            monitorExecutor = null;
            monitorFuture = null;
        }
    }

    public CircuitBreakerManagerConfig config() {
        return config;
    }

    /**
     * Creates a circuit with {@link CircuitBreakerManagerConfig#defaultConfig()}.
     *
     * @throws IllegalArgumentException if a circuit with the same name already exists
     */
    public CircuitBreaker create(String name) {
        return create(name, config.defaultConfig());
    }

    /**
     * Creates a circuit with the specified {@link CircuitBreakerConfig}.
     *
     * @throws IllegalArgumentException if the name is empty or a circuit with the same name already exists
     */
    public CircuitBreaker create(String name, CircuitBreakerConfig circuitConfig) {
        requireNonNull(name, "name");
        requireNonNull(circuitConfig, "circuitConfig");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        lock.writeLock().lock();
        try {
            if (circuits.containsKey(name)) {
                throw new IllegalArgumentException("circuit breaker " + name + " already exists");
            }
            final CircuitBreaker circuitBreaker =
                    new CircuitBreaker(name, circuitConfig, config.meterRegistry());
            circuits.put(name, circuitBreaker);
            return circuitBreaker;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<CircuitBreaker> get(String name) {
        requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(circuits.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes the circuit and unregisters its meters.
     *
     * @throws NoSuchElementException if no circuit has the name
     */
    public void remove(String name) {
        requireNonNull(name, "name");
        final CircuitBreaker removed;
        lock.writeLock().lock();
        try {
            removed = circuits.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw notFound(name);
        }
        removed.metrics().close();
        logger.info("name:{} removed", name);
    }

    public <T> T execute(String name, Callable<T> operation) throws Exception {
        return require(name).execute(operation);
    }

    public <T> Future<T> executeAsync(String name, Callable<T> operation) {
        return require(name).executeAsync(operation);
    }

    /**
     * Returns the names of all circuits in alphabetical order.
     */
    public List<String> names() {
        final List<String> names;
        lock.readLock().lock();
        try {
            names = new ArrayList<>(circuits.keySet());
        } finally {
            lock.readLock().unlock();
        }
        Collections.sort(names);
        return names;
    }

    public CircuitBreakerStats stats(String name) {
        return require(name).stats();
    }

    /**
     * Returns the stats of all circuits keyed by their names.
     */
    public Map<String, CircuitBreakerStats> allStats() {
        final Map<String, CircuitBreakerStats> stats = new HashMap<>();
        for (CircuitBreaker circuitBreaker : snapshot()) {
            stats.put(circuitBreaker.name(), circuitBreaker.stats());
        }
        return Collections.unmodifiableMap(stats);
    }

    public AggregatedStats aggregatedStats() {
        final List<CircuitBreaker> snapshot = snapshot();
        long requests = 0;
        long successes = 0;
        long failures = 0;
        long rejections = 0;
        long stateChanges = 0;
        double failureRateSum = 0;
        double successRateSum = 0;
        for (CircuitBreaker circuitBreaker : snapshot) {
            final EventCount count = circuitBreaker.metrics().count();
            requests += count.request();
            successes += count.success();
            failures += count.failure();
            rejections += count.rejected();
            stateChanges += count.stateChange();
            failureRateSum += count.failureRate();
            successRateSum += count.successRate();
        }
        final int size = snapshot.size();
        return new AggregatedStats(size, requests, successes, failures, rejections, stateChanges,
                                   size == 0 ? 0 : failureRateSum / size,
                                   size == 0 ? 0 : successRateSum / size);
    }

    public ManagerStats managerStats() {
        int closed = 0;
        int open = 0;
        int halfOpen = 0;
        final List<CircuitBreaker> snapshot = snapshot();
        for (CircuitBreaker circuitBreaker : snapshot) {
            switch (circuitBreaker.state()) {
                case OPEN:
                    open++;
                    break;
                case HALF_OPEN:
                    halfOpen++;
                    break;
                default:
                    closed++;
            }
        }
        return new ManagerStats(snapshot.size(), closed, open, halfOpen, config.monitoringEnabled(),
                                config.monitoringInterval());
    }

    public void reset(String name) {
        require(name).reset();
    }

    /**
     * Resets every circuit together with its {@link CircuitBreakerMetrics}.
     */
    public void resetAll() {
        for (CircuitBreaker circuitBreaker : snapshot()) {
            circuitBreaker.reset();
            circuitBreaker.metrics().reset();
        }
    }

    public void forceOpen(String name) {
        require(name).forceOpen();
    }

    public void forceClose(String name) {
        require(name).forceClose();
    }

    /**
     * Returns the stats of the circuits which are not {@link CircuitState#CLOSED}, ordered by name.
     */
    public List<CircuitBreakerStats> unhealthyCircuits() {
        final List<CircuitBreakerStats> unhealthy = new ArrayList<>();
        for (CircuitBreaker circuitBreaker : snapshot()) {
            final CircuitBreakerStats stats = circuitBreaker.stats();
            if (stats.state() != CircuitState.CLOSED) {
                unhealthy.add(stats);
            }
        }
        unhealthy.sort((a, b) -> a.name().compareTo(b.name()));
        return unhealthy;
    }

    private void monitor() {
        final List<CircuitBreakerStats> unhealthy = unhealthyCircuits();
        for (CircuitBreakerStats stats : unhealthy) {
            if (stats.state() == CircuitState.OPEN) {
                logger.warn("name:{} is OPEN (failures: {}, failureRate: {}%)",
                            stats.name(), stats.totalFailureCount(), stats.failureRate());
            } else {
                logger.info("name:{} is HALF_OPEN (successes: {})", stats.name(), stats.successCount());
            }
        }

        final Consumer<List<CircuitBreakerStats>> listener = config.monitorListener();
        if (listener != null) {
            try {
                listener.accept(Collections.unmodifiableList(unhealthy));
            } catch (Exception e) {
                logger.warn("Unexpected exception from the monitor listener:", e);
            }
        }
    }

    /**
     * Returns whether the background monitor is scheduled.
     */
    public boolean isMonitoring() {
        return monitorFuture != null && !monitorFuture.isDone();
    }

    /**
     * Stops the background monitor. The circuits remain usable.
     */
    @Override
    public void close() {
        if (monitorFuture != null) {
            monitorFuture.cancel(false);
            monitorExecutor.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private CircuitBreaker require(String name) {
        return get(name).orElseThrow(() -> notFound(name));
    }

    private List<CircuitBreaker> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(circuits.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static NoSuchElementException notFound(String name) {
        return new NoSuchElementException("circuit breaker " + name + " not found");
    }

    @Override
    public String toString() {
        return "CircuitBreakerManager{" +
               "circuits=" + names() +
               ", monitoringInterval=" + (config.monitoringEnabled() ? config.monitoringInterval()
                                                                     : Duration.ZERO) +
               '}';
    }
}
