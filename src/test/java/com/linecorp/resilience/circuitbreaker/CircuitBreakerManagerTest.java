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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.After;
import org.junit.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class CircuitBreakerManagerTest {

    private static final CircuitBreakerConfig config = new CircuitBreakerConfigBuilder()
            .failureThreshold(1)
            .successThreshold(1)
            .callTimeout(Duration.ZERO)
            .build();

    private CircuitBreakerManager manager;

    private static CircuitBreakerManager newManager() {
        return new CircuitBreakerManager(new CircuitBreakerManagerConfigBuilder()
                                                 .defaultConfig(config)
                                                 .monitoringEnabled(false)
                                                 .build());
    }

    @After
    public void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    private static void failCall(CircuitBreakerManager manager, String name) throws Exception {
        try {
            manager.execute(name, () -> {
                throw new IOException();
            });
            fail();
        } catch (IOException e) {
            // expected
        }
    }

    @Test
    public void testCreateAndGet() throws Exception {
        manager = newManager();
        CircuitBreaker cb = manager.create("payments");

        assertThat(manager.get("payments").get(), is(cb));
        assertThat(manager.get("unknown").isPresent(), is(false));
        assertThat(cb.config(), is(config));
        assertThat(manager.execute("payments", () -> 42), is(42));
    }

    @Test
    public void testDuplicateName() throws Exception {
        manager = newManager();
        CircuitBreaker original = manager.create("payments");
        failCall(manager, "payments");

        try {
            manager.create("payments", CircuitBreakerConfig.ofDefault());
            fail();
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), is("circuit breaker payments already exists"));
        }

        assertThat(manager.get("payments").get(), is(original));
        assertThat(original.config(), is(config));
        assertThat(original.state(), is(CircuitState.OPEN));
        assertThat(manager.names().size(), is(1));
    }

    @Test
    public void testEmptyName() {
        manager = newManager();
        try {
            manager.create("");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testNotFound() throws Exception {
        manager = newManager();
        try {
            manager.execute("missing", () -> 1);
            fail();
        } catch (NoSuchElementException e) {
            assertThat(e.getMessage(), is("circuit breaker missing not found"));
        }
        try {
            manager.remove("missing");
            fail();
        } catch (NoSuchElementException e) {
            // expected
        }
        try {
            manager.stats("missing");
            fail();
        } catch (NoSuchElementException e) {
            // expected
        }
    }

    @Test
    public void testRemove() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        manager = new CircuitBreakerManager(new CircuitBreakerManagerConfigBuilder()
                                                    .monitoringEnabled(false)
                                                    .meterRegistry(registry)
                                                    .build());
        manager.create("payments");
        assertThat(registry.find("resilience.circuitbreaker.requests").tag("name", "payments")
                           .counter() != null, is(true));

        manager.remove("payments");
        assertThat(manager.get("payments").isPresent(), is(false));
        assertThat(registry.find("resilience.circuitbreaker.requests").tag("name", "payments")
                           .counter() == null, is(true));

        // the name can be reused
        manager.create("payments");
    }

    @Test
    public void testNamesAndStats() throws Exception {
        manager = newManager();
        manager.create("search");
        manager.create("accounts");
        manager.create("payments");
        manager.execute("accounts", () -> "ok");
        failCall(manager, "payments");

        assertThat(manager.names(), contains("accounts", "payments", "search"));

        Map<String, CircuitBreakerStats> allStats = manager.allStats();
        assertThat(allStats.size(), is(3));
        assertThat(allStats.get("accounts").totalSuccessCount(), is(1L));
        assertThat(allStats.get("payments").state(), is(CircuitState.OPEN));

        List<CircuitBreakerStats> unhealthy = manager.unhealthyCircuits();
        assertThat(unhealthy.size(), is(1));
        assertThat(unhealthy.get(0).name(), is("payments"));

        ManagerStats managerStats = manager.managerStats();
        assertThat(managerStats.totalCircuits(), is(3));
        assertThat(managerStats.closedCircuits(), is(2));
        assertThat(managerStats.openCircuits(), is(1));
        assertThat(managerStats.halfOpenCircuits(), is(0));
        assertThat(managerStats.monitoringEnabled(), is(false));
    }

    @Test
    public void testAggregatedStats() throws Exception {
        manager = newManager();
        assertThat(manager.aggregatedStats().circuitCount(), is(0));
        assertThat(manager.aggregatedStats().averageFailureRate(), is(0.0));

        manager.create("a");
        manager.create("b");
        manager.execute("a", () -> "ok");
        failCall(manager, "b");
        try {
            manager.execute("b", () -> "ok");
            fail();
        } catch (FailFastException e) {
            // expected
        }

        AggregatedStats stats = manager.aggregatedStats();
        assertThat(stats.circuitCount(), is(2));
        assertThat(stats.totalRequests(), is(2L));
        assertThat(stats.totalSuccesses(), is(1L));
        assertThat(stats.totalFailures(), is(1L));
        assertThat(stats.totalRejections(), is(1L));
        assertThat(stats.totalStateChanges(), is(1L));
        assertThat(stats.averageFailureRate(), is(50.0));
        assertThat(stats.averageSuccessRate(), is(50.0));
    }

    @Test
    public void testAdministrativeOperations() throws Exception {
        manager = newManager();
        manager.create("a");
        manager.create("b");

        manager.forceOpen("a");
        manager.forceOpen("b");
        assertThat(manager.managerStats().openCircuits(), is(2));

        manager.forceClose("a");
        assertThat(manager.stats("a").state(), is(CircuitState.CLOSED));

        manager.reset("b");
        assertThat(manager.stats("b").state(), is(CircuitState.CLOSED));

        manager.execute("a", () -> "ok");
        manager.resetAll();
        assertThat(manager.stats("a").requestCount(), is(0L));
        assertThat(manager.aggregatedStats().totalRequests(), is(0L));
    }

    @Test
    public void testMonitor() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<List<CircuitBreakerStats>> reported = new AtomicReference<>();
        manager = new CircuitBreakerManager(new CircuitBreakerManagerConfigBuilder()
                                                    .defaultConfig(config)
                                                    .monitoringInterval(Duration.ofMillis(50))
                                                    .monitorListener(unhealthy -> {
                                                        if (!unhealthy.isEmpty()) {
                                                            reported.set(unhealthy);
                                                            latch.countDown();
                                                        }
                                                    })
                                                    .build());
        assertThat(manager.isMonitoring(), is(true));

        manager.create("healthy");
        manager.create("broken");
        manager.forceOpen("broken");

        assertThat(latch.await(10, TimeUnit.SECONDS), is(true));
        assertThat(reported.get().size(), is(1));
        assertThat(reported.get().get(0).name(), is("broken"));

        manager.close();
        assertThat(manager.isMonitoring(), is(false));
    }

    @Test
    public void testMonitoringDisabled() {
        manager = newManager();
        assertThat(manager.isMonitoring(), is(false));
    }

    @Test
    public void testMonitoringIntervalWithInvalidArgument() {
        try {
            new CircuitBreakerManagerConfigBuilder().monitoringInterval(Duration.ZERO);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
