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

import static java.util.Objects.requireNonNull;

/**
 * A {@link RuntimeException} raised when a {@link CircuitBreaker} refuses a call because its circuit is
 * {@link CircuitState#OPEN}. The guarded operation was not invoked.
 */
public final class FailFastException extends RuntimeException {

    private static final long serialVersionUID = -946827349873835165L;

    private final String circuitName;

    private final CircuitState state;

    /**
     * Creates a new instance with the name and the state of the circuit which refused the call.
     */
    public FailFastException(String circuitName, CircuitState state) {
        super("circuit breaker " + requireNonNull(circuitName, "circuitName") + " is " +
              requireNonNull(state, "state"));
        this.circuitName = circuitName;
        this.state = state;
    }

    public String circuitName() {
        return circuitName;
    }

    public CircuitState state() {
        return state;
    }
}
