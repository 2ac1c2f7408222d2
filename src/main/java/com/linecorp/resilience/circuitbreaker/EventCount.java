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
 * An immutable object that stores the count of events observed by a {@link CircuitBreakerMetrics}.
 */
public final class EventCount {

    static final EventCount ZERO = new EventCount(0, 0, 0, 0, 0);

    private final long request;

    private final long success;

    private final long failure;

    private final long rejected;

    private final long stateChange;

    EventCount(long request, long success, long failure, long rejected, long stateChange) {
        this.request = request;
        this.success = success;
        this.failure = failure;
        this.rejected = rejected;
        this.stateChange = stateChange;
        assert 0 <= request;
        assert 0 <= success;
        assert 0 <= failure;
        assert 0 <= rejected;
        assert 0 <= stateChange;
    }

    /**
     * Returns the number of calls which were admitted and invoked.
     */
    public long request() {
        return request;
    }

    public long success() {
        return success;
    }

    public long failure() {
        return failure;
    }

    /**
     * Returns the number of calls refused without being invoked.
     */
    public long rejected() {
        return rejected;
    }

    public long stateChange() {
        return stateChange;
    }

    /**
     * Returns the percentage of failed requests, or {@code 0} if no request has been made.
     */
    public double failureRate() {
        return percentage(failure, request);
    }

    /**
     * Returns the percentage of successful requests, or {@code 0} if no request has been made.
     */
    public double successRate() {
        return percentage(success, request);
    }

    static double percentage(long count, long total) {
        if (total == 0) {
            return 0.0;
        }
        return count / (double) total * 100.0;
    }

    @Override
    public String toString() {
        return "EventCount{" +
               "request=" + request +
               ", success=" + success +
               ", failure=" + failure +
               ", rejected=" + rejected +
               ", stateChange=" + stateChange +
               '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final EventCount that = (EventCount) o;
        return request == that.request && success == that.success && failure == that.failure &&
               rejected == that.rejected && stateChange == that.stateChange;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(request);
        result = 31 * result + Long.hashCode(success);
        result = 31 * result + Long.hashCode(failure);
        result = 31 * result + Long.hashCode(rejected);
        result = 31 * result + Long.hashCode(stateChange);
        return result;
    }
}
