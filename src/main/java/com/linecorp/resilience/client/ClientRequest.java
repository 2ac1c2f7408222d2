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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable request given to {@link ResilientHttpClient}. Use {@link ClientRequestBuilder} to build one.
 *
 * <p>The URL may be absolute or relative to {@link ResilientHttpClientConfig#baseUrl()}. Header names are
 * unique regardless of their case.
 */
public final class ClientRequest {

    private final HttpMethod method;

    private final String url;

    private final Map<String, String> headers;

    private final Map<String, Object> queryParams;

    private final Object body;

    private final Duration timeout;

    private final int retries;

    private final String correlationId;

    ClientRequest(HttpMethod method, String url, Map<String, String> headers,
                  Map<String, Object> queryParams, Object body, Duration timeout, int retries,
                  String correlationId) {
        this.method = method;
        this.url = url;
        final Map<String, String> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headerCopy.putAll(headers);
        this.headers = Collections.unmodifiableMap(headerCopy);
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        this.body = body;
        this.timeout = timeout;
        this.retries = retries;
        this.correlationId = correlationId;
    }

    public HttpMethod method() {
        return method;
    }

    public String url() {
        return url;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Map<String, Object> queryParams() {
        return queryParams;
    }

    /**
     * Returns the body, which is a {@code byte[]}, a {@link String}, an object to be encoded as JSON, or
     * {@code null}.
     */
    public Object body() {
        return body;
    }

    /**
     * Returns the timeout of this request, or {@code null} to use
     * {@link ResilientHttpClientConfig#timeout()}.
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the number of retries requested for this request. The client uses the greater of this value
     * and {@link ResilientHttpClientConfig#maxRetries()}.
     */
    public int retries() {
        return retries;
    }

    /**
     * Returns the correlation ID, or {@code null} to let the client generate one.
     */
    public String correlationId() {
        return correlationId;
    }

    /**
     * Returns a copy of this request carrying the specified correlation ID.
     */
    ClientRequest withCorrelationId(String correlationId) {
        return new ClientRequest(method, url, headers, queryParams, body, timeout, retries, correlationId);
    }

    @Override
    public String toString() {
        return "ClientRequest{" +
               "method=" + method +
               ", url=" + url +
               ", headers=" + headers.keySet() +
               ", queryParams=" + queryParams +
               ", timeout=" + timeout +
               ", retries=" + retries +
               ", correlationId=" + correlationId +
               '}';
    }
}
