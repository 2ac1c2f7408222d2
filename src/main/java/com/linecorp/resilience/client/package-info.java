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

/**
 * An HTTP client which retries with backoff behind a rate limiter and a circuit breaker.
 *
 * <h1>Usage</h1>
 * <pre>{@code
 * ResilientHttpClientConfig config = new ResilientHttpClientConfigBuilder()
 *                                        .baseUrl("https://api.example.com")
 *                                        .bearerToken(token)
 *                                        .maxRetries(2)
 *                                        .rateLimitEnabled(true)
 *                                        .rateLimit(50, 5)
 *                                        .build();
 *
 * ResilientHttpClient client = new ResilientHttpClient(config);
 *
 * try {
 *     ClientResponse res = client.get("/users/42");
 * } catch (FailFastException | RateLimitExceededException e) {
 *     // fallback code
 * } catch (Exception e) {
 *     // error handling
 * }
 * }</pre>
 *
 * <p>{@link com.linecorp.resilience.client.ResilientHttpClientManager} keeps named clients whose circuits
 * live in a {@link com.linecorp.resilience.circuitbreaker.CircuitBreakerManager}.
 */
package com.linecorp.resilience.client;
