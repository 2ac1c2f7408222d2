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
 * Provides a failure detection and fallback mechanism based of
 * <a href="http://martinfowler.com/bliki/CircuitBreaker.html">circuit breaker pattern</a>.
 *
 * <h1>Usage</h1>
 * <h3>Blocking Example</h3>
 * <pre>{@code
 * CircuitBreakerConfig config = new CircuitBreakerConfigBuilder()
 *                                    .failureThreshold(3)
 *                                    .openTimeout(Duration.ofSeconds(10))
 *                                    .build();
 *
 * CircuitBreaker circuitBreaker = new CircuitBreaker("hello", config);
 *
 * try {
 *     String greeting = circuitBreaker.execute(() -> helloClient.hello("line"));
 * } catch (FailFastException e) {
 *     // fallback code
 * } catch (Exception e) {
 *     // error handling
 * }
 * }</pre>
 *
 * <h3>Async Example</h3>
 * <pre>{@code
 * CircuitBreakerManager manager = new CircuitBreakerManager();
 * manager.create("hello", config);
 *
 * manager.executeAsync("hello", () -> helloClient.hello("line")).addListener(future -> {
 *     if (future.isSuccess()) {
 *         // response handling
 *     } else if (future.cause() instanceof FailFastException) {
 *         // fallback code
 *     } else {
 *         // error handling
 *     }
 * });
 * }</pre>
 */
package com.linecorp.resilience.circuitbreaker;
