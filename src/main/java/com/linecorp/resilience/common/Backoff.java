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

package com.linecorp.resilience.common;

import static java.util.Objects.requireNonNull;

import java.time.Duration;

/**
 * An exponential backoff which computes the delay before a retry as
 * {@code min(baseDelay * multiplier^attempt, maxDelay)}, where {@code attempt} is the zero-based index of
 * the attempt that has just failed.
 *
 * <pre>
 * baseDelay=1s, multiplier=2.0, maxDelay=30s
 *   attempt 0: 1s
 *   attempt 1: 2s
 *   attempt 2: 4s
 *   attempt 5: 30s (32s capped)
 * </pre>
 */
public final class Backoff {

    private final Duration baseDelay;

    private final double multiplier;

    private final Duration maxDelay;

    /**
     * Creates a new instance.
     *
     * @throws IllegalArgumentException if {@code baseDelay} is negative, {@code multiplier} is less than
     *                                  {@code 1.0} or {@code maxDelay} is less than {@code baseDelay}
     */
    public Backoff(Duration baseDelay, double multiplier, Duration maxDelay) {
        this.baseDelay = requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0: " + baseDelay);
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay (baseDelay: " + baseDelay + ", maxDelay: " + maxDelay + ')');
        }
        this.multiplier = multiplier;
    }

    /**
     * Returns the delay to wait after the attempt of the specified zero-based index has failed.
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        }
        final double delayMillis = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        if (delayMillis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) delayMillis);
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "Backoff{" +
               "baseDelay=" + baseDelay +
               ", multiplier=" + multiplier +
               ", maxDelay=" + maxDelay +
               '}';
    }
}
