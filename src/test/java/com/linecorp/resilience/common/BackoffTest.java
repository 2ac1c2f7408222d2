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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import java.time.Duration;

import org.junit.Test;

public class BackoffTest {

    private static void throwsException(Runnable runnable) {
        try {
            runnable.run();
            fail();
        } catch (IllegalArgumentException | NullPointerException e) {
        }
    }

    @Test
    public void testExponentialDelay() {
        Backoff backoff = new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
        assertThat(backoff.delay(0), is(Duration.ofSeconds(1)));
        assertThat(backoff.delay(1), is(Duration.ofSeconds(2)));
        assertThat(backoff.delay(2), is(Duration.ofSeconds(4)));
        assertThat(backoff.delay(4), is(Duration.ofSeconds(16)));
    }

    @Test
    public void testDelayIsCapped() {
        Backoff backoff = new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
        assertThat(backoff.delay(5), is(Duration.ofSeconds(30)));
        assertThat(backoff.delay(1000), is(Duration.ofSeconds(30)));
    }

    @Test
    public void testConstantDelay() {
        Backoff backoff = new Backoff(Duration.ofMillis(100), 1.0, Duration.ofMillis(100));
        assertThat(backoff.delay(0), is(Duration.ofMillis(100)));
        assertThat(backoff.delay(7), is(Duration.ofMillis(100)));
    }

    @Test
    public void testInvalidArguments() {
        throwsException(() -> new Backoff(null, 2.0, Duration.ofSeconds(1)));
        throwsException(() -> new Backoff(Duration.ofMillis(-1), 2.0, Duration.ofSeconds(1)));
        throwsException(() -> new Backoff(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(1)));
        throwsException(() -> new Backoff(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(1)));
        throwsException(() -> new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(2)).delay(-1));
    }
}
