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

package com.linecorp.resilience.client;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import com.linecorp.resilience.circuitbreaker.CircuitBreakerConfig;
import com.linecorp.resilience.common.Backoff;
import com.linecorp.resilience.common.Clock;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Stores configurations of {@link ResilientHttpClient}. Use {@link ResilientHttpClientConfigBuilder} to
 * build one.
 */
public final class ResilientHttpClientConfig {

    private final String baseUrl;
    private final Duration timeout;
    private final String userAgent;
    private final int maxRetries;
    private final Backoff backoff;
    private final Set<Integer> retryableStatuses;
    private final TransportOptions transportOptions;
    private final AuthScheme authScheme;
    private final String username;
    private final String password;
    private final String token;
    private final String apiKey;
    private final String apiKeyHeader;
    private final Map<String, String> defaultHeaders;
    private final String circuitBreakerName;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final boolean rateLimitEnabled;
    private final int rateLimitRequestsPerSecond;
    private final int rateLimitBurst;
    private final boolean loggingEnabled;
    private final boolean verboseLogging;
    private final boolean logRequestBody;
    private final boolean logResponseBody;
    private final boolean metricsEnabled;
    private final MeterRegistry meterRegistry;
    private final boolean correlationIdEnabled;
    private final String correlationIdHeader;
    private final Clock clock;
    private final Executor blockingTaskExecutor;

    ResilientHttpClientConfig(String baseUrl, Duration timeout, String userAgent, int maxRetries,
                              Backoff backoff, Set<Integer> retryableStatuses,
                              TransportOptions transportOptions, AuthScheme authScheme, String username,
                              String password, String token, String apiKey, String apiKeyHeader,
                              Map<String, String> defaultHeaders, String circuitBreakerName,
                              CircuitBreakerConfig circuitBreakerConfig,
                              boolean rateLimitEnabled, int rateLimitRequestsPerSecond, int rateLimitBurst,
                              boolean loggingEnabled, boolean verboseLogging, boolean logRequestBody,
                              boolean logResponseBody, boolean metricsEnabled, MeterRegistry meterRegistry,
                              boolean correlationIdEnabled, String correlationIdHeader, Clock clock,
                              Executor blockingTaskExecutor) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.retryableStatuses = retryableStatuses;
        this.transportOptions = transportOptions;
        this.authScheme = authScheme;
        this.username = username;
        this.password = password;
        this.token = token;
        this.apiKey = apiKey;
        this.apiKeyHeader = apiKeyHeader;
        this.defaultHeaders = defaultHeaders;
        this.circuitBreakerName = circuitBreakerName;
        this.circuitBreakerConfig = circuitBreakerConfig;
        this.rateLimitEnabled = rateLimitEnabled;
        this.rateLimitRequestsPerSecond = rateLimitRequestsPerSecond;
        this.rateLimitBurst = rateLimitBurst;
        this.loggingEnabled = loggingEnabled;
        this.verboseLogging = verboseLogging;
        this.logRequestBody = logRequestBody;
        this.logResponseBody = logResponseBody;
        this.metricsEnabled = metricsEnabled;
        this.meterRegistry = meterRegistry;
        this.correlationIdEnabled = correlationIdEnabled;
        this.correlationIdHeader = correlationIdHeader;
        this.clock = clock;
        this.blockingTaskExecutor = blockingTaskExecutor;
    }

    /**
     * Returns the URL that relative request URLs are resolved against, or an empty string.
     */
    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Returns the deadline of each attempt of a request which has no timeout of its own.
     */
    public Duration timeout() {
        return timeout;
    }

    public String userAgent() {
        return userAgent;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Backoff backoff() {
        return backoff;
    }

    /**
     * Returns the response statuses which trigger a retry.
     */
    public Set<Integer> retryableStatuses() {
        return retryableStatuses;
    }

    public TransportOptions transportOptions() {
        return transportOptions;
    }

    public AuthScheme authScheme() {
        return authScheme;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public String token() {
        return token;
    }

    public String apiKey() {
        return apiKey;
    }

    public String apiKeyHeader() {
        return apiKeyHeader;
    }

    public Map<String, String> defaultHeaders() {
        return defaultHeaders;
    }

    /**
     * Returns the name of the circuit breaker the client creates for itself. It tags the circuit's meters.
     */
    public String circuitBreakerName() {
        return circuitBreakerName;
    }

    /**
     * Returns the {@link CircuitBreakerConfig} of the client's circuit breaker, or {@code null} if circuit
     * breaking is disabled.
     */
    public CircuitBreakerConfig circuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    public boolean circuitBreakerEnabled() {
        return circuitBreakerConfig != null;
    }

    public boolean rateLimitEnabled() {
        return rateLimitEnabled;
    }

    public int rateLimitRequestsPerSecond() {
        return rateLimitRequestsPerSecond;
    }

    public int rateLimitBurst() {
        return rateLimitBurst;
    }

    public boolean loggingEnabled() {
        return loggingEnabled;
    }

    public boolean verboseLogging() {
        return verboseLogging;
    }

    public boolean logRequestBody() {
        return logRequestBody;
    }

    public boolean logResponseBody() {
        return logResponseBody;
    }

    public boolean metricsEnabled() {
        return metricsEnabled;
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public boolean correlationIdEnabled() {
        return correlationIdEnabled;
    }

    public String correlationIdHeader() {
        return correlationIdHeader;
    }

    public Clock clock() {
        return clock;
    }

    public Executor blockingTaskExecutor() {
        return blockingTaskExecutor;
    }

    @Override
    public String toString() {
        return "ResilientHttpClientConfig{" +
               "baseUrl=" + baseUrl +
               ", timeout=" + timeout +
               ", maxRetries=" + maxRetries +
               ", backoff=" + backoff +
               ", retryableStatuses=" + retryableStatuses +
               ", authScheme=" + authScheme +
               ", circuitBreakerName=" + circuitBreakerName +
               ", circuitBreakerConfig=" + circuitBreakerConfig +
               ", rateLimitEnabled=" + rateLimitEnabled +
               ", rateLimitRequestsPerSecond=" + rateLimitRequestsPerSecond +
               ", rateLimitBurst=" + rateLimitBurst +
               ", metricsEnabled=" + metricsEnabled +
               ", correlationIdEnabled=" + correlationIdEnabled +
               '}';
    }
}
