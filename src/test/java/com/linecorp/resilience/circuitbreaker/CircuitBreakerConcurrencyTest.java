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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.netty.util.concurrent.Future;

public class CircuitBreakerConcurrencyTest {

    private static final int threadCount = 16;

    private ExecutorService executor;

    @Before
    public void setUp() {
        executor = Executors.newFixedThreadPool(threadCount);
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    private static CircuitBreaker create(int failureThreshold) {
        return new CircuitBreaker("concurrent", new CircuitBreakerConfigBuilder()
                .failureThreshold(failureThreshold)
                .callTimeout(Duration.ZERO)
                .build());
    }

    @Test
    public void testConcurrentFailuresAreAllCounted() throws Exception {
        CircuitBreaker cb = create(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.execute(() -> {
                try {
                    startLatch.await();
                    cb.execute(() -> {
                        throw new IllegalStateException("fail");
                    });
                } catch (Exception expected) {
                    // every call fails
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertThat(doneLatch.await(10, TimeUnit.SECONDS), is(true));

        CircuitBreakerStats stats = cb.stats();
        assertThat(stats.state(), is(CircuitState.OPEN));
        assertThat(stats.requestCount(), is((long) threadCount));
        assertThat(stats.totalFailureCount(), is((long) threadCount));
    }

    @Test
    public void testCountersStayConsistentUnderContention() throws Exception {
        CircuitBreaker cb = create(Integer.MAX_VALUE);
        int iterations = 500;
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();
        CountDownLatch doneLatch = new CountDownLatch(threadCount);

        for (int i = 0; i < threadCount; i++) {
            final int threadIndex = i;
            executor.execute(() -> {
                try {
                    for (int j = 0; j < iterations; j++) {
                        final int value = j;
                        final boolean fail = (threadIndex + j) % 3 == 0;
                        try {
                            cb.execute(() -> {
                                if (fail) {
                                    throw new IllegalStateException();
                                }
                                return value;
                            });
                            successes.incrementAndGet();
                        } catch (IllegalStateException e) {
                            failures.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        assertThat(doneLatch.await(30, TimeUnit.SECONDS), is(true));

        CircuitBreakerStats stats = cb.stats();
        assertThat(stats.state(), is(CircuitState.CLOSED));
        assertThat(stats.requestCount(), is((long) threadCount * iterations));
        assertThat(stats.totalSuccessCount(), is((long) successes.get()));
        assertThat(stats.totalFailureCount(), is((long) failures.get()));
        assertThat(cb.metrics().count().request(), is(stats.requestCount()));
    }

    @Test
    public void testQueuedAsyncCallsDoNotTimeOut() throws Exception {
        CircuitBreaker cb = new CircuitBreaker("queued", new CircuitBreakerConfigBuilder()
                .failureThreshold(5)
                .callTimeout(Duration.ofMillis(200))
                .blockingTaskExecutor(executor)
                .build());
        int calls = 400;

        List<Future<String>> futures = new ArrayList<>(calls);
        for (int i = 0; i < calls; i++) {
            futures.add(cb.executeAsync(() -> {
                Thread.sleep(10);
                return "ok";
            }));
        }
        for (Future<String> f : futures) {
            assertThat(f.get(30, TimeUnit.SECONDS), is("ok"));
        }

        CircuitBreakerStats stats = cb.stats();
        assertThat(stats.state(), is(CircuitState.CLOSED));
        assertThat(stats.totalSuccessCount(), is((long) calls));
        assertThat(stats.totalFailureCount(), is(0L));
    }
}
