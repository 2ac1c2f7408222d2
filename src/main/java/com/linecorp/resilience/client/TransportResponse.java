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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The status, headers and body received by an {@link HttpTransport}.
 */
public final class TransportResponse {

    private final int statusCode;

    private final Map<String, List<String>> headers;

    private final byte[] body;

    public TransportResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {
        this.statusCode = statusCode;
        final Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(requireNonNull(headers, "headers"));
        this.headers = Collections.unmodifiableMap(copy);
        this.body = requireNonNull(body, "body");
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

    public byte[] body() {
        return body;
    }

    @Override
    public String toString() {
        return "TransportResponse{" +
               "statusCode=" + statusCode +
               ", headers=" + headers +
               ", bodyLength=" + body.length +
               '}';
    }
}
