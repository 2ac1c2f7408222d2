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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import com.linecorp.resilience.circuitbreaker.CircuitBreakerConfig;
import com.linecorp.resilience.circuitbreaker.CircuitBreakerConfigBuilder;
import com.linecorp.resilience.circuitbreaker.OutcomeFilter;
import com.linecorp.resilience.common.Backoff;
import com.linecorp.resilience.common.Clock;
import com.linecorp.resilience.common.CommonPools;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Builds a {@link ResilientHttpClientConfig} instance using builder pattern.
 */
public final class ResilientHttpClientConfigBuilder {

    /**
     * Counts a thrown exception or a 5xx response as a failure of the circuit.
     */
    static final OutcomeFilter HTTP_FAILURE_FILTER =
            (result, cause) -> cause != null ||
                               result instanceof ClientResponse && ((ClientResponse) result).statusCode() >= 500;

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final String DEFAULT_USER_AGENT = "Resilient-HTTP-Client/1.0";

    private static final int DEFAULT_MAX_RETRIES = 3;

    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    private static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(30);

    private static final Set<Integer> DEFAULT_RETRYABLE_STATUSES =
            Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(429, 500, 502, 503, 504)));

    private static final int DEFAULT_FAILURE_THRESHOLD = 5;

    private static final int DEFAULT_SUCCESS_THRESHOLD = 3;

    private static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);

    private static final int DEFAULT_RATE_LIMIT_RPS = 100;

    private static final int DEFAULT_RATE_LIMIT_BURST = 10;

    private static final String DEFAULT_CIRCUIT_BREAKER_NAME = "http-client";

    private static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

    private static final String DEFAULT_CORRELATION_ID_HEADER = "X-Correlation-ID";

    private String baseUrl = "";
    private Duration timeout = DEFAULT_TIMEOUT;
    private String userAgent = DEFAULT_USER_AGENT;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Duration retryDelay = DEFAULT_RETRY_DELAY;
    private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
    private Duration maxRetryDelay = DEFAULT_MAX_RETRY_DELAY;
    private Set<Integer> retryableStatuses = DEFAULT_RETRYABLE_STATUSES;
    private TransportOptions transportOptions = TransportOptions.ofDefault();
    private AuthScheme authScheme = AuthScheme.NONE;
    private String username;
    private String password;
    private String token;
    private String apiKey;
    private String apiKeyHeader = DEFAULT_API_KEY_HEADER;
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
    private boolean circuitBreakerEnabled = true;
    private String circuitBreakerName = DEFAULT_CIRCUIT_BREAKER_NAME;
    private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
    private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
    private Duration openTimeout = DEFAULT_OPEN_TIMEOUT;
    private boolean rateLimitEnabled;
    private int rateLimitRequestsPerSecond = DEFAULT_RATE_LIMIT_RPS;
    private int rateLimitBurst = DEFAULT_RATE_LIMIT_BURST;
    private boolean loggingEnabled = true;
    private boolean verboseLogging;
    private boolean logRequestBody;
    private boolean logResponseBody;
    private boolean metricsEnabled = true;
    private MeterRegistry meterRegistry;
    private boolean correlationIdEnabled = true;
    private String correlationIdHeader = DEFAULT_CORRELATION_ID_HEADER;
    private Clock clock = Clock.SYSTEM;
    private Executor blockingTaskExecutor = CommonPools.blockingTaskExecutor();

    /**
     * Sets the URL that relative request URLs are resolved against.
     */
    public ResilientHttpClientConfigBuilder baseUrl(String baseUrl) {
        this.baseUrl = requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    /**
     * Sets the deadline of each attempt of a request which has no timeout of its own.
     */
    public ResilientHttpClientConfigBuilder timeout(Duration timeout) {
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be greater than zero");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Sets the {@code User-Agent} header. An empty string omits it.
     */
    public ResilientHttpClientConfigBuilder userAgent(String userAgent) {
        this.userAgent = requireNonNull(userAgent, "userAgent");
        return this;
    }

    public ResilientHttpClientConfigBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public ResilientHttpClientConfigBuilder retryDelay(Duration retryDelay) {
        requireNonNull(retryDelay, "retryDelay");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        this.retryDelay = retryDelay;
        return this;
    }

    public ResilientHttpClientConfigBuilder backoffMultiplier(double backoffMultiplier) {
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0: " + backoffMultiplier);
        }
        this.backoffMultiplier = backoffMultiplier;
        return this;
    }

    public ResilientHttpClientConfigBuilder maxRetryDelay(Duration maxRetryDelay) {
        requireNonNull(maxRetryDelay, "maxRetryDelay");
        if (maxRetryDelay.isNegative()) {
            throw new IllegalArgumentException("maxRetryDelay must not be negative");
        }
        this.maxRetryDelay = maxRetryDelay;
        return this;
    }

    /**
     * Sets the response statuses which trigger a retry.
     */
    public ResilientHttpClientConfigBuilder retryableStatuses(Integer... statuses) {
        requireNonNull(statuses, "statuses");
        final Set<Integer> set = new LinkedHashSet<>();
        for (Integer status : statuses) {
            requireNonNull(status, "statuses contains null");
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("invalid HTTP status: " + status);
            }
            set.add(status);
        }
        retryableStatuses = Collections.unmodifiableSet(set);
        return this;
    }

    public ResilientHttpClientConfigBuilder transportOptions(TransportOptions transportOptions) {
        this.transportOptions = requireNonNull(transportOptions, "transportOptions");
        return this;
    }

    /**
     * Authenticates with {@code Authorization: Basic}.
     */
    public ResilientHttpClientConfigBuilder basicAuth(String username, String password) {
        this.username = requireNonNull(username, "username");
        this.password = requireNonNull(password, "password");
        authScheme = AuthScheme.BASIC;
        return this;
    }

    /**
     * Authenticates with {@code Authorization: Bearer}.
     */
    public ResilientHttpClientConfigBuilder bearerToken(String token) {
        this.token = requireNonNull(token, "token");
        authScheme = AuthScheme.BEARER;
        return this;
    }

    /**
     * Authenticates with an API key sent in the {@code X-API-Key} header.
     */
    public ResilientHttpClientConfigBuilder apiKey(String apiKey) {
        return apiKey(DEFAULT_API_KEY_HEADER, apiKey);
    }

    /**
     * Authenticates with an API key sent in the specified header.
     */
    public ResilientHttpClientConfigBuilder apiKey(String header, String apiKey) {
        apiKeyHeader = requireNonNull(header, "header");
        this.apiKey = requireNonNull(apiKey, "apiKey");
        authScheme = AuthScheme.API_KEY;
        return this;
    }

    public ResilientHttpClientConfigBuilder defaultHeader(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("header name must not be empty");
        }
        defaultHeaders.put(name, value);
        return this;
    }

    public ResilientHttpClientConfigBuilder circuitBreakerEnabled(boolean circuitBreakerEnabled) {
        this.circuitBreakerEnabled = circuitBreakerEnabled;
        return this;
    }

    /**
     * Sets the name of the client's own circuit breaker. Clients sharing a {@link MeterRegistry} need
     * distinct names to keep their circuit meters apart.
     */
    public ResilientHttpClientConfigBuilder circuitBreakerName(String circuitBreakerName) {
        requireNonNull(circuitBreakerName, "circuitBreakerName");
        if (circuitBreakerName.isEmpty()) {
            throw new IllegalArgumentException("circuitBreakerName must not be empty");
        }
        this.circuitBreakerName = circuitBreakerName;
        return this;
    }

    public ResilientHttpClientConfigBuilder failureThreshold(int failureThreshold) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        return this;
    }

    public ResilientHttpClientConfigBuilder successThreshold(int successThreshold) {
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be > 0: " + successThreshold);
        }
        this.successThreshold = successThreshold;
        return this;
    }

    public ResilientHttpClientConfigBuilder openTimeout(Duration openTimeout) {
        requireNonNull(openTimeout, "openTimeout");
        if (openTimeout.isNegative() || openTimeout.isZero()) {
            throw new IllegalArgumentException("openTimeout must be greater than zero");
        }
        this.openTimeout = openTimeout;
        return this;
    }

    public ResilientHttpClientConfigBuilder rateLimitEnabled(boolean rateLimitEnabled) {
        this.rateLimitEnabled = rateLimitEnabled;
        return this;
    }

    /**
     * Sets the sustained rate and the burst of the client's rate limiter.
     */
    public ResilientHttpClientConfigBuilder rateLimit(int requestsPerSecond, int burst) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0: " + requestsPerSecond);
        }
        if (burst <= 0) {
            throw new IllegalArgumentException("burst must be > 0: " + burst);
        }
        rateLimitRequestsPerSecond = requestsPerSecond;
        rateLimitBurst = burst;
        return this;
    }

    public ResilientHttpClientConfigBuilder loggingEnabled(boolean loggingEnabled) {
        this.loggingEnabled = loggingEnabled;
        return this;
    }

    /**
     * Adds the request headers to the completion log line.
     */
    public ResilientHttpClientConfigBuilder verboseLogging(boolean verboseLogging) {
        this.verboseLogging = verboseLogging;
        return this;
    }

    /**
     * Adds the request body to the completion log line when verbose logging is on.
     */
    public ResilientHttpClientConfigBuilder logRequestBody(boolean logRequestBody) {
        this.logRequestBody = logRequestBody;
        return this;
    }

    /**
     * Adds the response body to the completion log line when verbose logging is on.
     */
    public ResilientHttpClientConfigBuilder logResponseBody(boolean logResponseBody) {
        this.logResponseBody = logResponseBody;
        return this;
    }

    public ResilientHttpClientConfigBuilder metricsEnabled(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
        return this;
    }

    /**
     * Sets the {@link MeterRegistry} of the client's metrics and circuit breaker. A new
     * {@link SimpleMeterRegistry} is used if unspecified.
     */
    public ResilientHttpClientConfigBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    public ResilientHttpClientConfigBuilder correlationIdEnabled(boolean correlationIdEnabled) {
        this.correlationIdEnabled = correlationIdEnabled;
        return this;
    }

    public ResilientHttpClientConfigBuilder correlationIdHeader(String correlationIdHeader) {
        requireNonNull(correlationIdHeader, "correlationIdHeader");
        if (correlationIdHeader.isEmpty()) {
            throw new IllegalArgumentException("correlationIdHeader must not be empty");
        }
        this.correlationIdHeader = correlationIdHeader;
        return this;
    }

    /**
     * Sets the {@link Clock} shared by the circuit breaker, the rate limiter and the metrics.
     */
    public ResilientHttpClientConfigBuilder clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Sets the {@link Executor} which runs {@link ResilientHttpClient#executeAsync(ClientRequest)}.
     */
    public ResilientHttpClientConfigBuilder blockingTaskExecutor(Executor blockingTaskExecutor) {
        this.blockingTaskExecutor = requireNonNull(blockingTaskExecutor, "blockingTaskExecutor");
        return this;
    }

    public ResilientHttpClientConfig build() {
        if (maxRetryDelay.compareTo(retryDelay) < 0) {
            throw new IllegalArgumentException("maxRetryDelay must be greater than or equal to retryDelay");
        }
        if (authScheme == AuthScheme.BASIC && username.isEmpty()) {
            throw new IllegalArgumentException("username must not be empty");
        }
        if (authScheme == AuthScheme.BEARER && token.isEmpty()) {
            throw new IllegalArgumentException("token must not be empty");
        }
        if (authScheme == AuthScheme.API_KEY && (apiKey.isEmpty() || apiKeyHeader.isEmpty())) {
            throw new IllegalArgumentException("apiKey and its header must not be empty");
        }

        // the client bounds every attempt by itself, so the circuit breaker runs it without a deadline
        final CircuitBreakerConfig circuitBreakerConfig;
        if (circuitBreakerEnabled) {
            circuitBreakerConfig = new CircuitBreakerConfigBuilder()
                    .failureThreshold(failureThreshold)
                    .successThreshold(successThreshold)
                    .openTimeout(openTimeout)
                    .halfOpenTimeout(Duration.ZERO)
                    .callTimeout(Duration.ZERO)
                    .maxRetries(maxRetries)
                    .retryDelay(retryDelay)
                    .backoffMultiplier(backoffMultiplier)
                    .maxBackoffDelay(maxRetryDelay)
                    .failureFilter(HTTP_FAILURE_FILTER)
                    .successFilter(OutcomeFilter.SUCCEEDED)
                    .clock(clock)
                    .blockingTaskExecutor(blockingTaskExecutor)
                    .build();
        } else {
            circuitBreakerConfig = null;
        }

        return new ResilientHttpClientConfig(
                baseUrl, timeout, userAgent, maxRetries,
                new Backoff(retryDelay, backoffMultiplier, maxRetryDelay), retryableStatuses,
                transportOptions, authScheme, username, password, token, apiKey, apiKeyHeader,
                Collections.unmodifiableMap(new LinkedHashMap<>(defaultHeaders)), circuitBreakerName,
                circuitBreakerConfig,
                rateLimitEnabled, rateLimitRequestsPerSecond, rateLimitBurst, loggingEnabled,
                verboseLogging, logRequestBody, logResponseBody, metricsEnabled,
                meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(),
                correlationIdEnabled, correlationIdHeader, clock, blockingTaskExecutor);
    }
}
