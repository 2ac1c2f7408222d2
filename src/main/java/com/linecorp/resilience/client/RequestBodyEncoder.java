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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes the body of a {@link ClientRequest}. A {@code byte[]} and a {@link String} pass through, and
 * any other object is serialized as JSON.
 */
final class RequestBodyEncoder {

    static final String JSON_CONTENT_TYPE = "application/json";

    static final String BINARY_CONTENT_TYPE = "application/octet-stream";

    private final ObjectMapper objectMapper;

    RequestBodyEncoder(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Returns the encoded body, or an empty array if {@code body} is {@code null}.
     *
     * @throws IllegalArgumentException if the body cannot be serialized as JSON
     */
    byte[] encode(Object body) {
        if (body == null) {
            return new byte[0];
        }
        if (body instanceof byte[]) {
            return (byte[]) body;
        }
        if (body instanceof String) {
            return ((String) body).getBytes(StandardCharsets.UTF_8);
        }
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to encode the request body as JSON: " +
                                               body.getClass().getName(), e);
        }
    }

    /**
     * Returns the default Content-Type of {@code body}, or {@code null} if it is {@code null}.
     * A {@link String} is assumed to hold JSON already.
     */
    static String contentType(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof byte[]) {
            return BINARY_CONTENT_TYPE;
        }
        return JSON_CONTENT_TYPE;
    }
}
