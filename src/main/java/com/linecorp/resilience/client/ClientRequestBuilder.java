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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a {@link ClientRequest} instance using builder pattern.
 */
public final class ClientRequestBuilder {

    private final HttpMethod method;

    private final String url;

    private final Map<String, String> headers = new LinkedHashMap<>();

    private final Map<String, Object> queryParams = new LinkedHashMap<>();

    private Object body;

    private Duration timeout;

    private int retries;

    private String correlationId;

    /**
     * Creates a new builder of a request with the specified method and URL.
     */
    public ClientRequestBuilder(HttpMethod method, String url) {
        this.method = requireNonNull(method, "method");
        this.url = requireNonNull(url, "url");
    }

    public ClientRequestBuilder header(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("header name must not be empty");
        }
        headers.put(name, value);
        return this;
    }

    public ClientRequestBuilder headers(Map<String, String> headers) {
        requireNonNull(headers, "headers").forEach(this::header);
        return this;
    }

    /**
     * Adds a query parameter. The value is converted with {@link String#valueOf(Object)} and URL-encoded.
     */
    public ClientRequestBuilder queryParam(String name, Object value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        queryParams.put(name, value);
        return this;
    }

    public ClientRequestBuilder queryParams(Map<String, ?> queryParams) {
        requireNonNull(queryParams, "queryParams").forEach(this::queryParam);
        return this;
    }

    /**
     * Sets the body. A {@code byte[]} or a {@link String} is sent as is, and anything else is encoded as JSON.
     */
    public ClientRequestBuilder body(Object body) {
        this.body = requireNonNull(body, "body");
        return this;
    }

    public ClientRequestBuilder contentType(String contentType) {
        return header("Content-Type", contentType);
    }

    public ClientRequestBuilder accept(String accept) {
        return header("Accept", accept);
    }

    /**
     * Overrides {@link ResilientHttpClientConfig#timeout()} for this request.
     */
    public ClientRequestBuilder timeout(Duration timeout) {
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be greater than zero");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Requests at least this many retries. The client uses the greater of this value and
     * {@link ResilientHttpClientConfig#maxRetries()}.
     */
    public ClientRequestBuilder retries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0: " + retries);
        }
        this.retries = retries;
        return this;
    }

    public ClientRequestBuilder correlationId(String correlationId) {
        this.correlationId = requireNonNull(correlationId, "correlationId");
        return this;
    }

    public ClientRequest build() {
        return new ClientRequest(method, url, headers, queryParams, body, timeout, retries, correlationId);
    }
}
