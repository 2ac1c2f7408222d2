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
import java.util.List;
import java.util.function.Consumer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Builds a {@link CircuitBreakerManagerConfig} instance using builder pattern.
 */
public final class CircuitBreakerManagerConfigBuilder {

    private static final Duration DEFAULT_MONITORING_INTERVAL = Duration.ofSeconds(30);

    private CircuitBreakerConfig defaultConfig = CircuitBreakerConfig.ofDefault();

    private boolean monitoringEnabled = true;

    private Duration monitoringInterval = DEFAULT_MONITORING_INTERVAL;

    private Consumer<List<CircuitBreakerStats>> monitorListener;

    private MeterRegistry meterRegistry;

    public CircuitBreakerManagerConfigBuilder defaultConfig(CircuitBreakerConfig defaultConfig) {
        this.defaultConfig = requireNonNull(defaultConfig, "defaultConfig");
        return this;
    }

    public CircuitBreakerManagerConfigBuilder monitoringEnabled(boolean monitoringEnabled) {
        this.monitoringEnabled = monitoringEnabled;
        return this;
    }

    /**
     * Sets the interval between two runs of the background monitor.
     */
    public CircuitBreakerManagerConfigBuilder monitoringInterval(Duration monitoringInterval) {
        requireNonNull(monitoringInterval, "monitoringInterval");
        if (monitoringInterval.isNegative() || monitoringInterval.isZero()) {
            throw new IllegalArgumentException("monitoringInterval must be greater than zero");
        }
        this.monitoringInterval = monitoringInterval;
        return this;
    }

    /**
     * Sets the listener notified of the stats of every circuit which is not {@link CircuitState#CLOSED}
     * on each run of the monitor. The list is empty when all circuits are healthy.
     */
    public CircuitBreakerManagerConfigBuilder monitorListener(
            Consumer<List<CircuitBreakerStats>> monitorListener) {
        this.monitorListener = requireNonNull(monitorListener, "monitorListener");
        return this;
    }

    /**
     * Sets the {@link MeterRegistry} shared by the circuits of the manager. A new
     * {@link SimpleMeterRegistry} is used if unspecified.
     */
    public CircuitBreakerManagerConfigBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    public CircuitBreakerManagerConfig build() {
        return new CircuitBreakerManagerConfig(
                defaultConfig, monitoringEnabled, monitoringInterval, monitorListener,
                meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
    }
}
