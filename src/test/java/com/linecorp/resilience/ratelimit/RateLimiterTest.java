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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import com.linecorp.resilience.common.TestClock;

public class RateLimiterTest {

    private static void throwsException(Runnable runnable) {
        try {
            runnable.run();
            fail();
        } catch (IllegalArgumentException | NullPointerException e) {
        }
    }

    @Test
    public void testInvalidArguments() {
        throwsException(() -> new RateLimiter(0, 1));
        throwsException(() -> new RateLimiter(1, 0));
        throwsException(() -> new RateLimiter(-1, -1));
        throwsException(() -> new RateLimiter(1, 1, null));
    }

    @Test
    public void testBurstIsAvailableImmediately() {
        RateLimiter limiter = new RateLimiter(10, 3, new TestClock());
        assertThat(limiter.availableTokens(), is(3.0));
        assertThat(limiter.tryAcquire(), is(true));
        assertThat(limiter.tryAcquire(), is(true));
        assertThat(limiter.tryAcquire(), is(true));
        assertThat(limiter.tryAcquire(), is(false));
    }

    @Test
    public void testSecondAcquireWaitsForOneInterval() throws Exception {
        RateLimiter limiter = new RateLimiter(10, 1);

        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMillis, is(greaterThanOrEqualTo(90L)));
    }

    @Test
    public void testInterruptedWhileWaiting() throws Exception {
        RateLimiter limiter = new RateLimiter(1, 1, new TestClock());
        assertThat(limiter.tryAcquire(), is(true));

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            started.countDown();
            try {
                limiter.acquire();
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        waiter.start();
        assertThat(started.await(10, TimeUnit.SECONDS), is(true));
        Thread.sleep(50);

        long start = System.nanoTime();
        waiter.interrupt();
        waiter.join(5000);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(waiter.isAlive(), is(false));
        assertThat(thrown.get(), is(instanceOf(InterruptedException.class)));
        assertThat(elapsedMillis, is(lessThan(900L)));
        assertThat(limiter.availableTokens(), is(0.0));
    }

    @Test
    public void testWaitRefillsWholeTokenForUnevenRate() throws Exception {
        RateLimiter limiter = new RateLimiter(3, 1);

        limiter.acquire();
        limiter.acquire();
    }

    @Test
    public void testRateLimitExceeded() throws Exception {
        TestClock clock = new TestClock();
        RateLimiter limiter = new RateLimiter(1000, 1, clock);

        limiter.acquire();
        try {
            limiter.acquire();
            fail();
        } catch (RateLimitExceededException e) {
            assertThat(e.requestsPerSecond(), is(1000));
            assertThat(e.burst(), is(1));
        }

        clock.forward(Duration.ofMillis(2));
        limiter.acquire();
    }

    @Test
    public void testAcquireWithZeroWaitDoesNotSleep() throws Exception {
        RateLimiter limiter = new RateLimiter(1, 1, new TestClock());
        limiter.acquire(Duration.ZERO);

        long start = System.nanoTime();
        try {
            limiter.acquire(Duration.ZERO);
            fail();
        } catch (RateLimitExceededException e) {
            // expected
        }
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 500, is(true));
    }

    @Test
    public void testRefill() {
        TestClock clock = new TestClock();
        RateLimiter limiter = new RateLimiter(10, 5, clock);
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.tryAcquire(), is(true));
        }
        assertThat(limiter.availableTokens(), is(0.0));

        clock.forward(Duration.ofMillis(250));
        assertThat(limiter.availableTokens(), is(closeTo(2.5, 0.0001)));
        assertThat(limiter.tryAcquire(), is(true));
        assertThat(limiter.tryAcquire(), is(true));
        assertThat(limiter.tryAcquire(), is(false));
    }

    @Test
    public void testTokensNeverExceedBurst() {
        TestClock clock = new TestClock();
        RateLimiter limiter = new RateLimiter(100, 4, clock);
        limiter.tryAcquire();

        clock.forward(Duration.ofHours(1));
        assertThat(limiter.availableTokens(), is(4.0));
        assertThat(limiter.utilization(), is(0.0));
    }

    @Test
    public void testUtilizationAndEstimatedWait() {
        TestClock clock = new TestClock();
        RateLimiter limiter = new RateLimiter(4, 4, clock);
        assertThat(limiter.estimatedWait(), is(Duration.ZERO));

        for (int i = 0; i < 4; i++) {
            limiter.tryAcquire();
        }
        assertThat(limiter.utilization(), is(1.0));
        assertThat(limiter.estimatedWait(), is(Duration.ofMillis(250)));

        clock.forward(Duration.ofMillis(125));
        assertThat(limiter.utilization(), is(closeTo(0.875, 0.0001)));
        assertThat(limiter.estimatedWait(), is(Duration.ofMillis(125)));
    }

    @Test
    public void testReset() {
        RateLimiter limiter = new RateLimiter(1, 2, new TestClock());
        limiter.tryAcquire();
        limiter.tryAcquire();
        assertThat(limiter.tryAcquire(), is(false));

        limiter.reset();
        assertThat(limiter.availableTokens(), is(2.0));
        assertThat(limiter.requestsPerSecond(), is(1));
        assertThat(limiter.burst(), is(2));
    }
}
