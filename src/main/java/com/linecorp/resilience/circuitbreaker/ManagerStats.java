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

/**
 * A snapshot of a {@link CircuitBreakerManager}: how many circuits it holds in each state and how it is
 * monitored.
 */
public final class ManagerStats {

    private final int totalCircuits;

    private final int closedCircuits;

    private final int openCircuits;

    private final int halfOpenCircuits;

    private final boolean monitoringEnabled;

    private final Duration monitoringInterval;

    ManagerStats(int totalCircuits, int closedCircuits, int openCircuits, int halfOpenCircuits,
                 boolean monitoringEnabled, Duration monitoringInterval) {
        this.totalCircuits = totalCircuits;
        this.closedCircuits = closedCircuits;
        this.openCircuits = openCircuits;
        this.halfOpenCircuits = halfOpenCircuits;
        this.monitoringEnabled = monitoringEnabled;
        this.monitoringInterval = monitoringInterval;
    }

    public int totalCircuits() {
        return totalCircuits;
    }

    public int closedCircuits() {
        return closedCircuits;
    }

    public int openCircuits() {
        return openCircuits;
    }

    public int halfOpenCircuits() {
        return halfOpenCircuits;
    }

    public boolean monitoringEnabled() {
        return monitoringEnabled;
    }

    public Duration monitoringInterval() {
        return monitoringInterval;
    }

    @Override
    public String toString() {
        return "ManagerStats{" +
               "totalCircuits=" + totalCircuits +
               ", closedCircuits=" + closedCircuits +
               ", openCircuits=" + openCircuits +
               ", halfOpenCircuits=" + halfOpenCircuits +
               ", monitoringEnabled=" + monitoringEnabled +
               ", monitoringInterval=" + monitoringInterval +
               '}';
    }
}
