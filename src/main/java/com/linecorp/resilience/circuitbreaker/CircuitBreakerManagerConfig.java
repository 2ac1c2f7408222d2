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

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Stores configurations of {@link CircuitBreakerManager}.
 * Use {@link CircuitBreakerManagerConfigBuilder} to build one.
 */
public final class CircuitBreakerManagerConfig {

    private final CircuitBreakerConfig defaultConfig;

    private final boolean monitoringEnabled;

    private final Duration monitoringInterval;

    private final Consumer<List<CircuitBreakerStats>> monitorListener;

    private final MeterRegistry meterRegistry;

    CircuitBreakerManagerConfig(CircuitBreakerConfig defaultConfig, boolean monitoringEnabled,
                                Duration monitoringInterval,
                                Consumer<List<CircuitBreakerStats>> monitorListener,
                                MeterRegistry meterRegistry) {
        this.defaultConfig = defaultConfig;
        this.monitoringEnabled = monitoringEnabled;
        this.monitoringInterval = monitoringInterval;
        this.monitorListener = monitorListener;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns the {@link CircuitBreakerConfig} of the circuits created without an explicit one.
     */
    public CircuitBreakerConfig defaultConfig() {
        return defaultConfig;
    }

    public boolean monitoringEnabled() {
        return monitoringEnabled;
    }

    public Duration monitoringInterval() {
        return monitoringInterval;
    }

    /**
     * Returns the listener notified of the unhealthy circuits on every monitor tick, or {@code null}.
     */
    public Consumer<List<CircuitBreakerStats>> monitorListener() {
        return monitorListener;
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    @Override
    public String toString() {
        return "CircuitBreakerManagerConfig{" +
               "defaultConfig=" + defaultConfig +
               ", monitoringEnabled=" + monitoringEnabled +
               ", monitoringInterval=" + monitoringInterval +
               '}';
    }
}
