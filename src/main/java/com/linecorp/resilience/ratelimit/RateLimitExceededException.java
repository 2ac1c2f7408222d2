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

package com.linecorp.resilience.ratelimit;

/**
 * A {@link RuntimeException} raised when a {@link RateLimiter} has no token left after its single bounded
 * wait. The caller may retry later.
 */
public final class RateLimitExceededException extends RuntimeException {

    private static final long serialVersionUID = 5321049361487206113L;

    private final int requestsPerSecond;

    private final int burst;

    public RateLimitExceededException(int requestsPerSecond, int burst) {
        super("rate limit exceeded (rps: " + requestsPerSecond + ", burst: " + burst + ')');
        this.requestsPerSecond = requestsPerSecond;
        this.burst = burst;
    }

    public int requestsPerSecond() {
        return requestsPerSecond;
    }

    public int burst() {
        return burst;
    }
}
