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

/**
 * How {@link ResilientHttpClient} authenticates its requests.
 */
public enum AuthScheme {
    /**
     * No authentication header is added.
     */
    NONE,
    /**
     * {@code Authorization: Basic base64(username:password)}.
     */
    BASIC,
    /**
     * {@code Authorization: Bearer <token>}.
     */
    BEARER,
    /**
     * The API key is sent in a configurable header, {@code X-API-Key} by default.
     */
    API_KEY
}
