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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.linecorp.resilience.circuitbreaker.CircuitBreakerManager;
import com.linecorp.resilience.circuitbreaker.CircuitBreakerManagerConfigBuilder;
import com.linecorp.resilience.circuitbreaker.CircuitBreakerStats;
import com.linecorp.resilience.circuitbreaker.CircuitState;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class ResilientHttpClientManagerTest {

    private SimpleMeterRegistry registry;

    private CircuitBreakerManager circuitBreakers;

    private ResilientHttpClientManager clients;

    @Before
    public void setUp() {
        registry = new SimpleMeterRegistry();
        circuitBreakers = new CircuitBreakerManager(new CircuitBreakerManagerConfigBuilder()
                                                            .monitoringEnabled(false)
                                                            .meterRegistry(registry)
                                                            .build());
        clients = new ResilientHttpClientManager(circuitBreakers);
    }

    @After
    public void tearDown() {
        circuitBreakers.close();
    }

    private static ResilientHttpClientConfig config(int failureThreshold) {
        return new ResilientHttpClientConfigBuilder()
                .baseUrl("http://example.com/")
                .maxRetries(0)
                .failureThreshold(failureThreshold)
                .openTimeout(Duration.ofMinutes(1))
                .build();
    }

    @Test
    public void testCreateRegistersCircuit() throws Exception {
        ResilientHttpClient client = clients.create("users", config(2), FakeTransport.ofStatus(200));

        assertThat(client.circuitBreaker().get(), is(sameInstance(circuitBreakers.get("users").get())));
        assertThat(clients.get("users").get(), is(sameInstance(client)));
        assertThat(registry.get("resilience.circuitbreaker.requests").tag("name", "users").counter().count(),
                   is(0.0));

        client.get("/u/1");
        assertThat(circuitBreakers.stats("users").totalSuccessCount(), is(1L));
    }

    @Test
    public void testDuplicateName() {
        clients.create("users", config(2), FakeTransport.ofStatus(200));
        try {
            clients.create("users", config(2), FakeTransport.ofStatus(200));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }

        circuitBreakers.create("orders");
        try {
            clients.create("orders", config(2), FakeTransport.ofStatus(200));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertThat(clients.names(), contains("users"));
    }

    @Test
    public void testRequiresCircuitBreaking() {
        try {
            clients.create("plain", new ResilientHttpClientConfigBuilder().circuitBreakerEnabled(false).build(),
                           FakeTransport.ofStatus(200));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertThat(circuitBreakers.names().isEmpty(), is(true));
    }

    @Test
    public void testRemove() {
        clients.create("users", config(2), FakeTransport.ofStatus(200));
        clients.remove("users");

        assertThat(clients.get("users").isPresent(), is(false));
        assertThat(circuitBreakers.get("users").isPresent(), is(false));
        assertThat(registry.find("resilience.circuitbreaker.requests").tag("name", "users").counter(),
                   is(nullValue()));
        try {
            clients.remove("users");
            fail();
        } catch (NoSuchElementException e) {
            // expected
        }
    }

    @Test
    public void testRemoveAfterCircuitWasRemovedDirectly() {
        clients.create("users", config(2), FakeTransport.ofStatus(200));
        circuitBreakers.remove("users");
        circuitBreakers.create("users");

        clients.remove("users");

        assertThat(clients.names().isEmpty(), is(true));
        assertThat(circuitBreakers.get("users").isPresent(), is(true));
    }

    @Test
    public void testStatsAndReset() throws Exception {
        ResilientHttpClient failing = clients.create("failing", config(2), FakeTransport.ofStatus(503));
        clients.create("healthy", config(2), FakeTransport.ofStatus(200)).get("/ok");
        clients.create("idle", config(2), FakeTransport.ofStatus(200));

        failing.get("/a");
        failing.get("/b");
        assertThat(failing.circuitBreaker().get().state(), is(CircuitState.OPEN));

        assertThat(clients.names(), contains("failing", "healthy", "idle"));
        Map<String, CircuitBreakerStats> stats = clients.allStats();
        assertThat(stats.size(), is(3));
        assertThat(stats.get("failing").state(), is(CircuitState.OPEN));
        assertThat(stats.get("healthy").totalSuccessCount(), is(1L));

        ResilientHttpClientManagerStats managerStats = clients.managerStats();
        assertThat(managerStats.totalClients(), is(3));
        assertThat(managerStats.openClients(), is(1));
        assertThat(managerStats.closedClients(), is(2));
        assertThat(managerStats.halfOpenClients(), is(0));

        clients.resetAll();
        assertThat(failing.circuitBreaker().get().state(), is(CircuitState.CLOSED));
        assertThat(clients.managerStats().openClients(), is(0));
        assertThat(circuitBreakers.managerStats().openCircuits(), is(0));
    }
}
