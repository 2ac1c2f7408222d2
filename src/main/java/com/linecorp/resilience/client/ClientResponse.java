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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The final response of a {@link ClientRequest}, after all retries.
 */
public final class ClientResponse {

    private final int statusCode;

    private final Map<String, List<String>> headers;

    private final byte[] body;

    private final ClientRequest request;

    private final Duration duration;

    private final int retryCount;

    private final String correlationId;

    ClientResponse(TransportResponse response, ClientRequest request, Duration duration, int retryCount,
                   String correlationId) {
        statusCode = response.statusCode();
        headers = response.headers();
        body = response.body();
        this.request = requireNonNull(request, "request");
        this.duration = requireNonNull(duration, "duration");
        this.retryCount = retryCount;
        this.correlationId = correlationId;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Returns the response headers. Lookups ignore the case of the name.
     */
    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * Returns the first value of the header, or {@code null}.
     */
    public String header(String name) {
        final List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public byte[] body() {
        return body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public ClientRequest request() {
        return request;
    }

    /**
     * Returns the time spent on the request including retries and backoff.
     */
    public Duration duration() {
        return duration;
    }

    /**
     * Returns the number of retries made before this response was received.
     */
    public int retryCount() {
        return retryCount;
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * Returns {@code true} if the status is 2xx.
     */
    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "ClientResponse{" +
               "statusCode=" + statusCode +
               ", bodyLength=" + body.length +
               ", duration=" + duration +
               ", retryCount=" + retryCount +
               ", correlationId=" + correlationId +
               '}';
    }
}
