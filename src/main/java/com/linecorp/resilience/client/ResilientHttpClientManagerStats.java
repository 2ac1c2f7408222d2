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
 * How many clients of a {@link ResilientHttpClientManager} have their circuit in each state.
 */
public final class ResilientHttpClientManagerStats {

    private final int totalClients;

    private final int closedClients;

    private final int openClients;

    private final int halfOpenClients;

    ResilientHttpClientManagerStats(int totalClients, int closedClients, int openClients,
                                    int halfOpenClients) {
        this.totalClients = totalClients;
        this.closedClients = closedClients;
        this.openClients = openClients;
        this.halfOpenClients = halfOpenClients;
    }

    public int totalClients() {
        return totalClients;
    }

    public int closedClients() {
        return closedClients;
    }

    public int openClients() {
        return openClients;
    }

    public int halfOpenClients() {
        return halfOpenClients;
    }

    @Override
    public String toString() {
        return "ResilientHttpClientManagerStats{" +
               "totalClients=" + totalClients +
               ", closedClients=" + closedClients +
               ", openClients=" + openClients +
               ", halfOpenClients=" + halfOpenClients +
               '}';
    }
}
