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

package com.linecorp.resilience.circuitbreaker;

/**
 * Classifies the outcome of a guarded call. A {@link CircuitBreaker} holds two of them,
 * one deciding whether an outcome is a failure and one deciding whether it is a success.
 * An outcome matching neither is counted as a request but does not move the circuit.
 */
@FunctionalInterface
public interface OutcomeFilter {

    /**
     * Matches an outcome which raised an exception.
     */
    OutcomeFilter FAILED = (result, cause) -> cause != null;

    /**
     * Matches an outcome which completed without an exception.
     */
    OutcomeFilter SUCCEEDED = (result, cause) -> cause == null;

    /**
     * Returns {@code true} if this filter matches the outcome.
     *
     * @param result the value returned by the operation, or {@code null} if it raised an exception
     * @param cause the exception raised by the operation, or {@code null} if it completed normally
     */
    boolean matches(Object result, Throwable cause);
}
