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

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.linecorp.resilience.circuitbreaker.CircuitBreaker;
import com.linecorp.resilience.circuitbreaker.CircuitState;
import com.linecorp.resilience.circuitbreaker.FailFastException;
import com.linecorp.resilience.metrics.MetricsCollector;
import com.linecorp.resilience.ratelimit.RateLimitExceededException;
import com.linecorp.resilience.ratelimit.RateLimiter;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;

/**
 * An HTTP client which composes a {@link RateLimiter}, a {@link CircuitBreaker} and a retry policy around
 * an {@link HttpTransport}.
 *
 * <p>A request goes through the following steps:
 * <ol>
 *   <li>A correlation ID is assigned unless the request has one.</li>
 *   <li>The rate limiter admits the request or fails it with a {@link RateLimitExceededException}.
 *       The circuit breaker is not consulted for a refused request.</li>
 *   <li>The circuit breaker admits the request or fails it with a {@link FailFastException}.</li>
 *   <li>The request is sent and retried after a backoff while the transport fails or the status is
 *       {@linkplain ResilientHttpClientConfig#retryableStatuses() retryable}, up to
 *       {@code max(request retries, maxRetries)} times. An attempt exceeding its deadline is retried like
 *       any other transport failure.</li>
 *   <li>The outcome is reported to the circuit breaker and to the {@link MetricsCollector}, and logged.</li>
 * </ol>
 *
 * <p>After the retries are exhausted, the last response is returned or the last exception is rethrown.
 */
public final class ResilientHttpClient {

    private static final Logger logger = LoggerFactory.getLogger(ResilientHttpClient.class);

    static final String MDC_CORRELATION_ID = "correlationId";

    private final ResilientHttpClientConfig config;

    private final HttpTransport transport;

    private final CircuitBreaker circuitBreaker;

    private final RateLimiter rateLimiter;

    private final MetricsCollector metrics;

    private final CorrelationIdGenerator correlationIdGenerator = new CorrelationIdGenerator();

    private final RequestBodyEncoder bodyEncoder;

    /**
     * Creates a new client which sends its requests with a {@link JdkHttpTransport}.
     */
    public ResilientHttpClient(ResilientHttpClientConfig config) {
        this(config, new JdkHttpTransport(requireNonNull(config, "config").transportOptions()));
    }

    public ResilientHttpClient(ResilientHttpClientConfig config, HttpTransport transport) {
        this(config, transport, new ObjectMapper());
    }

    /**
     * Creates a new client which encodes its JSON bodies with the specified {@link ObjectMapper}.
     */
    public ResilientHttpClient(ResilientHttpClientConfig config, HttpTransport transport,
                               ObjectMapper objectMapper) {
        this(config, transport, objectMapper, newCircuitBreaker(config));
    }

    /**
     * Creates a new client guarded by the specified {@link CircuitBreaker}, such as one obtained from a
     * {@link com.linecorp.resilience.circuitbreaker.CircuitBreakerManager}. The circuit breaker settings of
     * {@code config} are ignored.
     */
    public ResilientHttpClient(ResilientHttpClientConfig config, HttpTransport transport,
                               CircuitBreaker circuitBreaker) {
        this(config, transport, new ObjectMapper(), requireNonNull(circuitBreaker, "circuitBreaker"));
    }

    private ResilientHttpClient(ResilientHttpClientConfig config, HttpTransport transport,
                                ObjectMapper objectMapper, CircuitBreaker circuitBreaker) {
        this.config = requireNonNull(config, "config");
        this.transport = requireNonNull(transport, "transport");
        bodyEncoder = new RequestBodyEncoder(requireNonNull(objectMapper, "objectMapper"));
        this.circuitBreaker = circuitBreaker;
        rateLimiter = config.rateLimitEnabled() ?
                      new RateLimiter(config.rateLimitRequestsPerSecond(), config.rateLimitBurst(),
                                      config.clock()) : null;
        metrics = config.metricsEnabled() ? new MetricsCollector(config.meterRegistry(), config.clock())
                                          : null;
    }

    private static CircuitBreaker newCircuitBreaker(ResilientHttpClientConfig config) {
        requireNonNull(config, "config");
        if (!config.circuitBreakerEnabled()) {
            return null;
        }
        return new CircuitBreaker(config.circuitBreakerName(), config.circuitBreakerConfig(),
                                  config.meterRegistry());
    }

    public ResilientHttpClientConfig config() {
        return config;
    }

    public Optional<CircuitBreaker> circuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }

    public Optional<RateLimiter> rateLimiter() {
        return Optional.ofNullable(rateLimiter);
    }

    public Optional<MetricsCollector> metrics() {
        return Optional.ofNullable(metrics);
    }

    public CorrelationIdGenerator correlationIdGenerator() {
        return correlationIdGenerator;
    }

    public ClientResponse get(String url) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.GET, url).build());
    }

    public ClientResponse post(String url, Object body) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.POST, url).body(body).build());
    }

    public ClientResponse put(String url, Object body) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.PUT, url).body(body).build());
    }

    public ClientResponse patch(String url, Object body) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.PATCH, url).body(body).build());
    }

    public ClientResponse delete(String url) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.DELETE, url).build());
    }

    public ClientResponse head(String url) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.HEAD, url).build());
    }

    public ClientResponse options(String url) throws Exception {
        return execute(new ClientRequestBuilder(HttpMethod.OPTIONS, url).build());
    }

    /**
     * Sends the request on {@link ResilientHttpClientConfig#blockingTaskExecutor()}. Cancelling the
     * returned {@link Future} does not abort the request.
     */
    public Future<ClientResponse> executeAsync(ClientRequest request) {
        requireNonNull(request, "request");
        final Promise<ClientResponse> promise = GlobalEventExecutor.INSTANCE.newPromise();
        try {
            config.blockingTaskExecutor().execute(() -> {
                try {
                    promise.trySuccess(execute(request));
                } catch (Throwable t) {
                    promise.tryFailure(t);
                }
            });
        } catch (Exception e) {
            promise.tryFailure(e);
        }
        return promise;
    }

    /**
     * Sends the request.
     *
     * @return the final response, which may carry a retryable status if the retries were exhausted
     * @throws RateLimitExceededException if the rate limiter refused the request
     * @throws FailFastException if the circuit breaker refused the request
     * @throws TimeoutException if the last attempt exceeded its deadline
     * @throws CancellationException if the calling thread was interrupted. The interrupt flag is restored.
     * @throws IllegalArgumentException if the URL is malformed or the body cannot be encoded
     * @throws Exception the exception of the last attempt, unchanged
     */
    public ClientResponse execute(ClientRequest request) throws Exception {
        requireNonNull(request, "request");
        final long startNanos = System.nanoTime();
        final ClientRequest req = assignCorrelationId(request);
        final String correlationId = req.correlationId();
        if (correlationId != null) {
            MDC.put(MDC_CORRELATION_ID, correlationId);
        }
        try {
            final PreparedRequest prepared = prepare(req);
            if (rateLimiter != null) {
                acquirePermit(prepared.timeout);
            }

            final ClientResponse response;
            if (circuitBreaker != null) {
                final CircuitState before = circuitBreaker.state();
                try {
                    response = circuitBreaker.execute(() -> executeWithRetries(req, prepared, startNanos),
                                                      Duration.ZERO);
                } finally {
                    recordStateChange(before, circuitBreaker.state());
                }
            } else {
                response = executeWithRetries(req, prepared, startNanos);
            }

            if (metrics != null) {
                metrics.recordRequest(req.method().name(), response.statusCode(), response.duration());
            }
            logCompletion(req, prepared, response);
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordError(e);
            final CancellationException cancelled =
                    new CancellationException("interrupted while executing " + req.method() + ' ' + req.url());
            cancelled.initCause(e);
            throw cancelled;
        } catch (Exception e) {
            recordError(e);
            if (loggingEnabled()) {
                logger.warn("HTTP request failed: method={}, url={}, duration={}ms, correlationId={}, cause={}",
                            req.method(), req.url(), elapsed(startNanos).toMillis(), correlationId,
                            e.toString());
            }
            throw e;
        } finally {
            if (correlationId != null) {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }

    private ClientRequest assignCorrelationId(ClientRequest request) {
        if (request.correlationId() != null || !config.correlationIdEnabled()) {
            return request;
        }
        return request.withCorrelationId(correlationIdGenerator.generate());
    }

    private void acquirePermit(Duration maxWait) throws InterruptedException {
        try {
            rateLimiter.acquire(maxWait);
        } catch (RateLimitExceededException e) {
            if (metrics != null) {
                metrics.recordRateLimitHit();
            }
            throw e;
        }
    }

    private ClientResponse executeWithRetries(ClientRequest req, PreparedRequest prepared, long startNanos)
            throws Exception {
        final int maxRetries = Math.max(req.retries(), config.maxRetries());
        for (int attempt = 0;; attempt++) {
            TransportResponse response = null;
            Exception cause = null;
            try {
                response = sendOnce(prepared);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                cause = e;
            }

            final boolean retryable = cause != null ||
                                      config.retryableStatuses().contains(response.statusCode());
            if (!retryable || attempt >= maxRetries) {
                if (cause != null) {
                    throw cause;
                }
                return new ClientResponse(response, req, elapsed(startNanos), attempt, req.correlationId());
            }

            final Duration delay = config.backoff().delay(attempt);
            if (logger.isDebugEnabled()) {
                logger.debug("Retrying {} {} in {}ms (retry {}/{}, reason: {})", req.method(), prepared.uri,
                             delay.toMillis(), attempt + 1, maxRetries,
                             cause != null ? cause.toString() : "status " + response.statusCode());
            }
            if (metrics != null) {
                metrics.recordRetry(attempt + 1);
            }
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
        }
    }

    private TransportResponse sendOnce(PreparedRequest prepared) throws Exception {
        final TransportRequest transportRequest =
                new TransportRequest(prepared.method, prepared.uri, prepared.headers, prepared.body,
                                     prepared.timeout);
        final CompletableFuture<TransportResponse> future = transport.send(transportRequest);
        final long timeoutMillis = prepared.timeout.toMillis();
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException(prepared.method + " " + prepared.uri + " timed out after " +
                                       timeoutMillis + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                final TimeoutException timeout = new TimeoutException(
                        prepared.method + " " + prepared.uri + " timed out after " + timeoutMillis + "ms");
                timeout.initCause(cause);
                throw timeout;
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private PreparedRequest prepare(ClientRequest req) {
        final Duration timeout = req.timeout() != null ? req.timeout() : config.timeout();
        return new PreparedRequest(req.method(), buildUri(req), buildHeaders(req),
                                   bodyEncoder.encode(req.body()), timeout);
    }

    private URI buildUri(ClientRequest req) {
        String url = req.url();
        final String baseUrl = config.baseUrl();
        if (!baseUrl.isEmpty() && !isAbsolute(url)) {
            url = stripTrailingSlash(baseUrl) + '/' + stripLeadingSlash(url);
        }

        if (!req.queryParams().isEmpty()) {
            final StringBuilder builder = new StringBuilder(url);
            String separator = url.indexOf('?') >= 0 ? "&" : "?";
            for (Entry<String, Object> e : req.queryParams().entrySet()) {
                builder.append(separator)
                       .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                       .append('=')
                       .append(URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8));
                separator = "&";
            }
            url = builder.toString();
        }

        final URI uri = URI.create(url);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("URL must be absolute: " + url);
        }
        return uri;
    }

    private static boolean isAbsolute(String url) {
        return url.startsWith("http://") || url.startsWith("https://");
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String stripLeadingSlash(String s) {
        return s.startsWith("/") ? s.substring(1) : s;
    }

    private Map<String, String> buildHeaders(ClientRequest req) {
        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(config.defaultHeaders());
        if (!config.userAgent().isEmpty()) {
            headers.put("User-Agent", config.userAgent());
        }
        headers.putAll(req.headers());
        final String contentType = RequestBodyEncoder.contentType(req.body());
        if (contentType != null) {
            headers.putIfAbsent("Content-Type", contentType);
        }
        if (config.correlationIdEnabled() && req.correlationId() != null) {
            headers.put(config.correlationIdHeader(), req.correlationId());
        }

        switch (config.authScheme()) {
            case BASIC:
                final String credentials = config.username() + ':' + config.password();
                headers.put("Authorization", "Basic " + Base64.getEncoder().encodeToString(
                        credentials.getBytes(StandardCharsets.UTF_8)));
                break;
            case BEARER:
                headers.put("Authorization", "Bearer " + config.token());
                break;
            case API_KEY:
                headers.put(config.apiKeyHeader(), config.apiKey());
                break;
            default:
                break;
        }
        return new LinkedHashMap<>(headers);
    }

    private void recordStateChange(CircuitState before, CircuitState after) {
        if (metrics == null || before == after) {
            return;
        }
        if (after == CircuitState.OPEN) {
            metrics.recordCircuitBreakerTrip();
        } else if (after == CircuitState.CLOSED) {
            metrics.recordCircuitBreakerReset();
        }
    }

    private void recordError(Exception e) {
        if (metrics != null) {
            metrics.recordError(e.getClass().getSimpleName());
        }
    }

    private boolean loggingEnabled() {
        return config.loggingEnabled() && logger.isInfoEnabled();
    }

    private void logCompletion(ClientRequest req, PreparedRequest prepared, ClientResponse response) {
        if (!loggingEnabled()) {
            return;
        }
        final StringBuilder builder = new StringBuilder(128);
        builder.append("HTTP request completed: method=").append(req.method())
               .append(", url=").append(prepared.uri)
               .append(", status=").append(response.statusCode())
               .append(", duration=").append(response.duration().toMillis()).append("ms")
               .append(", retries=").append(response.retryCount());
        if (req.correlationId() != null) {
            builder.append(", correlationId=").append(req.correlationId());
        }
        if (config.verboseLogging()) {
            builder.append(", headers=").append(req.headers());
            if (config.logRequestBody() && prepared.body.length > 0) {
                builder.append(", requestBody=").append(new String(prepared.body, StandardCharsets.UTF_8));
            }
            if (config.logResponseBody() && response.body().length > 0) {
                builder.append(", responseBody=").append(response.bodyAsString());
            }
        }
        logger.info(builder.toString());
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * The parts of a request resolved once and shared by all attempts.
     */
    private static final class PreparedRequest {
        private final HttpMethod method;
        private final URI uri;
        private final Map<String, String> headers;
        private final byte[] body;
        private final Duration timeout;

        PreparedRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body,
                        Duration timeout) {
            this.method = method;
            this.uri = uri;
            this.headers = headers;
            this.body = body;
            this.timeout = timeout;
        }
    }

    @Override
    public String toString() {
        return "ResilientHttpClient{" +
               "config=" + config +
               ", transport=" + transport +
               '}';
    }
}
