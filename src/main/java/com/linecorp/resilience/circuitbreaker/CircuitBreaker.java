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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.resilience.common.Clock;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * A blocking implementation of circuit breaker pattern which guards a fallible operation.
 *
 * <p>The circuit starts {@link CircuitState#CLOSED}. It trips to {@link CircuitState#OPEN} once
 * {@link CircuitBreakerConfig#failureThreshold()} consecutive failures are recorded, and rejects every call
 * with a {@link FailFastException} until {@link CircuitBreakerConfig#openTimeout()} has elapsed since it
 * opened or since the last failure, whichever is later. The first call after that moves the circuit to
 * {@link CircuitState#HALF_OPEN} and is invoked as a trial. {@link CircuitBreakerConfig#successThreshold()}
 * successes close the circuit again, and any failure reopens it.
 *
 * <p>The transition out of {@link CircuitState#OPEN} is evaluated when a call arrives. No timer runs in
 * the background.
 *
 * <p>All state and counters are guarded by a single {@link ReentrantReadWriteLock}. The guarded operation
 * itself runs outside the lock, so concurrent calls interleave freely.
 */
public final class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;

    private final CircuitBreakerConfig config;

    private final Clock clock;

    private final CircuitBreakerMetrics metrics;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private CircuitState state = CircuitState.CLOSED;

    private long failureCount;

    private long successCount;

    private long requestCount;

    private long rejectedCount;

    private long totalFailureCount;

    private long totalSuccessCount;

    private long lastFailureTimeMillis;

    private long lastRequestTimeMillis;

    private long stateChangeTimeMillis;

    /**
     * Creates a new {@link CircuitBreaker} with the specified name and {@link CircuitBreakerConfig}.
     * Its meters are registered to a new {@link SimpleMeterRegistry}.
     */
    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, new SimpleMeterRegistry());
    }

    /**
     * Creates a new {@link CircuitBreaker} whose meters are registered to the specified
     * {@link MeterRegistry}.
     */
    public CircuitBreaker(String name, CircuitBreakerConfig config, MeterRegistry meterRegistry) {
        this.name = requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.config = requireNonNull(config, "config");
        clock = config.clock();
        metrics = new CircuitBreakerMetrics(name, requireNonNull(meterRegistry, "meterRegistry"));
        stateChangeTimeMillis = clock.currentMillis();
        logStateTransition(CircuitState.CLOSED, 0, 0);
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    public CircuitBreakerMetrics metrics() {
        return metrics;
    }

    /**
     * Invokes the operation bounded by {@link CircuitBreakerConfig#callTimeout()}.
     *
     * @see #execute(Callable, Duration)
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        return execute(operation, config.callTimeout());
    }

    /**
     * Invokes the operation if the circuit allows it and records its outcome.
     *
     * <p>A positive {@code timeout} runs the operation on {@link CircuitBreakerConfig#blockingTaskExecutor()}
     * and waits at most that long for it. {@link Duration#ZERO} runs it in the calling thread without a
     * deadline. A trial call made while {@link CircuitState#HALF_OPEN} is further bounded by
     * {@link CircuitBreakerConfig#halfOpenTimeout()} when that is positive.
     *
     * @return the value returned by the operation
     * @throws FailFastException if the circuit is {@link CircuitState#OPEN}. The operation is not invoked.
     * @throws TimeoutException if the operation did not complete in time. It is recorded as a failure.
     * @throws InterruptedException if the calling thread was interrupted while waiting. The outcome is
     *                              not recorded.
     * @throws Exception the exception raised by the operation, unchanged
     */
    public <T> T execute(Callable<T> operation, Duration timeout) throws Exception {
        requireNonNull(operation, "operation");
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }

        final CircuitState admittedState = admit();
        final long timeoutMillis = effectiveTimeoutMillis(admittedState, timeout);

        final T result;
        try {
            result = invoke(operation, timeoutMillis);
        } catch (InterruptedException e) {
            throw e;
        } catch (Throwable cause) {
            onOutcome(null, cause);
            throw cause;
        }
        onOutcome(result, null);
        return result;
    }

    /**
     * Invokes the operation bounded by {@link CircuitBreakerConfig#callTimeout()} on
     * {@link CircuitBreakerConfig#blockingTaskExecutor()}.
     *
     * @see #executeAsync(Callable, Duration)
     */
    public <T> Future<T> executeAsync(Callable<T> operation) {
        return executeAsync(operation, config.callTimeout());
    }

    /**
     * Invokes the operation on {@link CircuitBreakerConfig#blockingTaskExecutor()} with the same semantics
     * as {@link #execute(Callable, Duration)}. A rejection fails the returned {@link Future} with a
     * {@link FailFastException}.
     *
     * <p>The operation runs in the task which admitted it, and its deadline is enforced by a timer on
     * {@link GlobalEventExecutor}. When the deadline passes first, the {@link Future} fails with a
     * {@link TimeoutException} which is recorded as a failure, and the later outcome of the operation is
     * ignored.
     *
     * <p>Cancelling the returned {@link Future} only abandons the wait. An admitted operation keeps
     * running and its outcome is still recorded.
     */
    public <T> Future<T> executeAsync(Callable<T> operation, Duration timeout) {
        requireNonNull(operation, "operation");
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        final Promise<T> promise = GlobalEventExecutor.INSTANCE.newPromise();
        try {
            config.blockingTaskExecutor().execute(() -> invokeAsync(operation, timeout, promise));
        } catch (Exception e) {
            promise.tryFailure(e);
        }
        return promise;
    }

    private <T> void invokeAsync(Callable<T> operation, Duration timeout, Promise<T> promise) {
        final CircuitState admittedState;
        try {
            admittedState = admit();
        } catch (FailFastException e) {
            promise.tryFailure(e);
            return;
        }

        final long timeoutMillis = effectiveTimeoutMillis(admittedState, timeout);
        final AtomicBoolean completed = new AtomicBoolean();
        ScheduledFuture<?> timeoutFuture = null;
        if (timeoutMillis > 0) {
            timeoutFuture = GlobalEventExecutor.INSTANCE.schedule(() -> {
                if (completed.compareAndSet(false, true)) {
                    final TimeoutException cause = newTimeoutException(timeoutMillis);
                    onOutcome(null, cause);
                    promise.tryFailure(cause);
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
        }

        T result = null;
        Throwable cause = null;
        try {
            result = operation.call();
        } catch (Throwable t) {
            cause = t;
        }
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
        }

        if (!completed.compareAndSet(false, true)) {
            logger.debug("name:{} ignored the outcome of a call which timed out", name, cause);
            return;
        }
        if (cause == null) {
            onOutcome(result, null);
            promise.trySuccess(result);
        } else {
            if (!(cause instanceof InterruptedException)) {
                onOutcome(null, cause);
            }
            promise.tryFailure(cause);
        }
    }

    /**
     * Decides whether a call should be allowed or refused according to the current circuit state, and
     * returns the state in which the call was admitted.
     */
    private CircuitState admit() {
        lock.writeLock().lock();
        try {
            final long now = clock.currentMillis();
            if (state == CircuitState.OPEN) {
                final long openedAt = Math.max(stateChangeTimeMillis, lastFailureTimeMillis);
                if (now - openedAt < config.openTimeout().toMillis()) {
                    rejectedCount++;
                    metrics.onRejected();
                    if (logger.isDebugEnabled()) {
                        logger.debug("name:{} rejected a call; retry after {}ms", name,
                                     config.openTimeout().toMillis() - (now - openedAt));
                    }
                    throw new FailFastException(name, state);
                }
                // changes to HALF_OPEN if OPEN state has timed out
                transitionTo(CircuitState.HALF_OPEN, now);
            }
            requestCount++;
            lastRequestTimeMillis = now;
            metrics.onRequest();
            return state;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private long effectiveTimeoutMillis(CircuitState admittedState, Duration timeout) {
        long timeoutMillis = timeout.toMillis();
        if (admittedState == CircuitState.HALF_OPEN) {
            final long halfOpenMillis = config.halfOpenTimeout().toMillis();
            if (halfOpenMillis > 0 && (timeoutMillis == 0 || halfOpenMillis < timeoutMillis)) {
                timeoutMillis = halfOpenMillis;
            }
        }
        return timeoutMillis;
    }

    private <T> T invoke(Callable<T> operation, long timeoutMillis) throws Exception {
        if (timeoutMillis <= 0) {
            return operation.call();
        }

        final FutureTask<T> task = new FutureTask<>(operation);
        config.blockingTaskExecutor().execute(task);
        try {
            return task.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw newTimeoutException(timeoutMillis);
        } catch (InterruptedException e) {
            task.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private TimeoutException newTimeoutException(long timeoutMillis) {
        return new TimeoutException("circuit breaker " + name + " timed out a call after " +
                                    timeoutMillis + "ms");
    }

    private void onOutcome(Object result, Throwable cause) {
        final boolean failure = config.failureFilter().matches(result, cause);
        final boolean success = !failure && config.successFilter().matches(result, cause);
        if (failure) {
            if (cause != null) {
                logger.debug("name:{} recorded a failure", name, cause);
            }
            onFailure();
        } else if (success) {
            onSuccess();
        }
    }

    private void onSuccess() {
        lock.writeLock().lock();
        try {
            totalSuccessCount++;
            successCount++;
            metrics.onSuccess();
            if (state == CircuitState.CLOSED) {
                failureCount = 0;
            } else if (state == CircuitState.HALF_OPEN && successCount >= config.successThreshold()) {
                // changes to CLOSED once enough trial calls succeed during HALF_OPEN
                transitionTo(CircuitState.CLOSED, clock.currentMillis());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void onFailure() {
        lock.writeLock().lock();
        try {
            final long now = clock.currentMillis();
            failureCount++;
            totalFailureCount++;
            lastFailureTimeMillis = now;
            metrics.onFailure();
            if (state == CircuitState.CLOSED && failureCount >= config.failureThreshold()) {
                transitionTo(CircuitState.OPEN, now);
            } else if (state == CircuitState.HALF_OPEN) {
                // returns to OPEN if a trial call fails
                transitionTo(CircuitState.OPEN, now);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Trips the circuit regardless of the counters.
     */
    public void forceOpen() {
        lock.writeLock().lock();
        try {
            transitionTo(CircuitState.OPEN, clock.currentMillis());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Closes the circuit and clears the failure and success counters.
     */
    public void forceClose() {
        lock.writeLock().lock();
        try {
            transitionTo(CircuitState.CLOSED, clock.currentMillis());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Closes the circuit and clears all counters and timestamps. The {@link CircuitBreakerMetrics} are
     * left untouched.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            final long now = clock.currentMillis();
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED, now);
            }
            failureCount = 0;
            successCount = 0;
            requestCount = 0;
            rejectedCount = 0;
            totalFailureCount = 0;
            totalSuccessCount = 0;
            lastFailureTimeMillis = 0;
            lastRequestTimeMillis = 0;
            stateChangeTimeMillis = now;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("name:{} reset", name);
    }

    /**
     * Must be called while holding the write lock.
     */
    private void transitionTo(CircuitState newState, long now) {
        state = newState;
        stateChangeTimeMillis = now;
        if (newState != CircuitState.OPEN) {
            failureCount = 0;
            successCount = 0;
        }
        metrics.onStateChange(newState);
        logStateTransition(newState, totalFailureCount, requestCount);
    }

    private void logStateTransition(CircuitState circuitState, long failures, long total) {
        if (logger.isInfoEnabled()) {
            final int capacity = name.length() + circuitState.name().length() + 32;
            final StringBuilder builder = new StringBuilder(capacity);
            builder.append("name:");
            builder.append(name);
            builder.append(" state:");
            builder.append(circuitState.name());
            if (total == 0) {
                builder.append(" fail:- total:-");
            } else {
                builder.append(" fail:");
                builder.append(failures);
                builder.append(" total:");
                builder.append(total);
            }
            logger.info(builder.toString());
        }
    }

    /**
     * Returns the current {@link CircuitState}. An {@link CircuitState#OPEN} circuit whose timeout has
     * elapsed is still reported as {@link CircuitState#OPEN} until the next call arrives.
     */
    public CircuitState state() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CircuitBreakerStats stats() {
        lock.readLock().lock();
        try {
            return new CircuitBreakerStats(name, state, requestCount, failureCount, successCount,
                                           rejectedCount, totalFailureCount, totalSuccessCount,
                                           lastFailureTimeMillis, lastRequestTimeMillis,
                                           stateChangeTimeMillis);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
               "name=" + name +
               ", state=" + state() +
               '}';
    }
}
