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
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fully resolved outbound request handed to an {@link HttpTransport}.
 */
public final class TransportRequest {

    private static final byte[] EMPTY = new byte[0];

    private final HttpMethod method;

    private final URI uri;

    private final Map<String, String> headers;

    private final byte[] body;

    private final Duration timeout;

    public TransportRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body,
                            Duration timeout) {
        this.method = requireNonNull(method, "method");
        this.uri = requireNonNull(uri, "uri");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(headers, "headers")));
        this.body = body != null ? body : EMPTY;
        this.timeout = requireNonNull(timeout, "timeout");
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, String> headers() {
        return headers;
    }

    /**
     * Returns the encoded body, which is empty when the request has none.
     */
    public byte[] body() {
        return body;
    }

    /**
     * Returns the time left for the whole request when this exchange started.
     */
    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "TransportRequest{" +
               "method=" + method +
               ", uri=" + uri +
               ", headers=" + headers +
               ", bodyLength=" + body.length +
               ", timeout=" + timeout +
               '}';
    }
}
