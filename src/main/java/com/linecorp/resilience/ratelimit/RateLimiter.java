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

package com.linecorp.resilience.ratelimit;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.resilience.common.Clock;

/**
 * A token-bucket admission gate.
 *
 * <p>The bucket holds at most {@code burst} tokens and starts full. Tokens are added lazily on every access,
 * {@code requestsPerSecond} per elapsed second, and every admitted call consumes one. Refilling and
 * consuming happen in one critical section.
 *
 * <p>{@link #acquire()} waits at most once, for one token interval ({@code 1000 / requestsPerSecond} ms, rounded up),
 * and fails with a {@link RateLimitExceededException} if the bucket is still empty afterwards. Callers who
 * need to block until admitted must loop.
 */
public final class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final int requestsPerSecond;

    private final int burst;

    private final Clock clock;

    private final long intervalMillis;

    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;

    private long lastRefillMillis;

    public RateLimiter(int requestsPerSecond, int burst) {
        this(requestsPerSecond, burst, Clock.SYSTEM);
    }

    /**
     * Creates a new instance.
     *
     * @throws IllegalArgumentException if {@code requestsPerSecond} or {@code burst} is not positive
     */
    public RateLimiter(int requestsPerSecond, int burst, Clock clock) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0: " + requestsPerSecond);
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be > 0: " + burst);
        }
        this.requestsPerSecond = requestsPerSecond;
        this.burst = burst;
        this.clock = requireNonNull(clock, "clock");
        // rounded up so that one interval always refills a whole token
        intervalMillis = (999 + requestsPerSecond) / requestsPerSecond;
        tokens = burst;
        lastRefillMillis = clock.currentMillis();
    }

    public int requestsPerSecond() {
        return requestsPerSecond;
    }

    public int burst() {
        return burst;
    }

    /**
     * Consumes a token, waiting up to one token interval for it.
     *
     * @throws RateLimitExceededException if no token became available during the wait
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        acquire0(intervalMillis);
    }

    /**
     * Consumes a token, waiting up to one token interval or {@code maxWait}, whichever is shorter.
     *
     * @throws RateLimitExceededException if no token became available during the wait
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    public void acquire(Duration maxWait) throws InterruptedException {
        requireNonNull(maxWait, "maxWait");
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative: " + maxWait);
        }
        acquire0(Math.min(intervalMillis, maxWait.toMillis()));
    }

    private void acquire0(long waitMillis) throws InterruptedException {
        if (tryAcquire()) {
            return;
        }
        // the lock is not held while sleeping
        if (waitMillis > 0) {
            Thread.sleep(waitMillis);
        }
        if (tryAcquire()) {
            return;
        }
        logger.debug("rate limit exceeded (rps: {}, burst: {}, waited: {}ms)",
                     requestsPerSecond, burst, waitMillis);
        throw new RateLimitExceededException(requestsPerSecond, burst);
    }

    /**
     * Consumes a token if one is available, without waiting.
     *
     * @return {@code true} if a token was consumed
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of tokens currently in the bucket, which may be fractional.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the fraction of the bucket which is consumed, between {@code 0.0} and {@code 1.0}.
     */
    public double utilization() {
        lock.lock();
        try {
            refill();
            return (burst - tokens) / burst;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns how long a caller would wait for the next token, or {@link Duration#ZERO} if one is available.
     */
    public Duration estimatedWait() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1) {
                return Duration.ZERO;
            }
            return Duration.ofMillis((long) Math.ceil((1 - tokens) * 1000 / requestsPerSecond));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refills the bucket to {@code burst}.
     */
    public void reset() {
        lock.lock();
        try {
            tokens = burst;
            lastRefillMillis = clock.currentMillis();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Must be called while holding the lock.
     */
    private void refill() {
        final long now = clock.currentMillis();
        final long elapsedMillis = now - lastRefillMillis;
        if (elapsedMillis <= 0) {
            return;
        }
        tokens = Math.min(burst, tokens + elapsedMillis / 1000.0 * requestsPerSecond);
        lastRefillMillis = now;
    }

    @Override
    public String toString() {
        return "RateLimiter{" +
               "requestsPerSecond=" + requestsPerSecond +
               ", burst=" + burst +
               ", availableTokens=" + availableTokens() +
               '}';
    }
}
