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
 * The state of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /**
     * Initial state. All calls are passed to the guarded operation.
     */
    CLOSED,
    /**
     * The circuit is tripped. All calls fail immediately without invoking the guarded operation.
     */
    OPEN,
    /**
     * Trial calls are passed to the guarded operation to probe whether it has recovered.
     * A failure returns the circuit to {@link #OPEN}, and enough consecutive successes close it.
     */
    HALF_OPEN
}
