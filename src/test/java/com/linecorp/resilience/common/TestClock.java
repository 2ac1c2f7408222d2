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

package com.linecorp.resilience.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Clock} which only moves when told to.
 */
public final class TestClock implements Clock {

    private final AtomicLong currentMillis;

    public TestClock() {
        this(1_000_000L);
    }

    public TestClock(long startMillis) {
        currentMillis = new AtomicLong(startMillis);
    }

    @Override
    public long currentMillis() {
        return currentMillis.get();
    }

    public void forward(Duration duration) {
        currentMillis.addAndGet(duration.toMillis());
    }
}
