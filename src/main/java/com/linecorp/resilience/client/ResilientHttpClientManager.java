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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.resilience.circuitbreaker.CircuitBreaker;
import com.linecorp.resilience.circuitbreaker.CircuitBreakerManager;
import com.linecorp.resilience.circuitbreaker.CircuitBreakerStats;

/**
 * A registry of named {@link ResilientHttpClient}s. Each client is guarded by a circuit of the same name
 * which is registered to the {@link CircuitBreakerManager} given at construction, so the circuit can also be
 * inspected and administered from there.
 */
public final class ResilientHttpClientManager {

    private static final Logger logger = LoggerFactory.getLogger(ResilientHttpClientManager.class);

    private final CircuitBreakerManager circuitBreakers;

    private final Map<String, ResilientHttpClient> clients = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ResilientHttpClientManager(CircuitBreakerManager circuitBreakers) {
        this.circuitBreakers = requireNonNull(circuitBreakers, "circuitBreakers");
    }

    public CircuitBreakerManager circuitBreakers() {
        return circuitBreakers;
    }

    /**
     * Creates a client which sends its requests with a {@link JdkHttpTransport}.
     *
     * @see #create(String, ResilientHttpClientConfig, HttpTransport)
     */
    public ResilientHttpClient create(String name, ResilientHttpClientConfig config) {
        requireNonNull(config, "config");
        return create(name, config, new JdkHttpTransport(config.transportOptions()));
    }

    /**
     * Creates a client together with its circuit.
     *
     * @throws IllegalArgumentException if the name is empty, if circuit breaking is disabled in
     *                                  {@code config}, or if a client or a circuit with the same name
     *                                  already exists
     */
    public ResilientHttpClient create(String name, ResilientHttpClientConfig config, HttpTransport transport) {
        requireNonNull(name, "name");
        requireNonNull(config, "config");
        requireNonNull(transport, "transport");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        if (!config.circuitBreakerEnabled()) {
            throw new IllegalArgumentException("circuit breaking must be enabled for a managed client");
        }

        final ResilientHttpClient client;
        lock.writeLock().lock();
        try {
            if (clients.containsKey(name)) {
                throw new IllegalArgumentException("HTTP client " + name + " already exists");
            }
            final CircuitBreaker circuitBreaker = circuitBreakers.create(name, config.circuitBreakerConfig());
            client = new ResilientHttpClient(config, transport, circuitBreaker);
            clients.put(name, client);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("HTTP client created: name={}, timeout={}ms", name, config.timeout().toMillis());
        return client;
    }

    public Optional<ResilientHttpClient> get(String name) {
        requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(clients.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes the client and its circuit.
     *
     * @throws NoSuchElementException if no client has the name
     */
    public void remove(String name) {
        requireNonNull(name, "name");
        final ResilientHttpClient removed;
        lock.writeLock().lock();
        try {
            removed = clients.remove(name);
            if (removed == null) {
                throw new NoSuchElementException("HTTP client " + name + " not found");
            }
            // the circuit may have been removed from the circuit manager directly
            final Optional<CircuitBreaker> circuitBreaker = circuitBreakers.get(name);
            if (circuitBreaker.isPresent() && circuitBreaker.equals(removed.circuitBreaker())) {
                circuitBreakers.remove(name);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("HTTP client removed: name={}", name);
    }

    /**
     * Returns the names of all clients in alphabetical order.
     */
    public List<String> names() {
        final List<String> names;
        lock.readLock().lock();
        try {
            names = new ArrayList<>(clients.keySet());
        } finally {
            lock.readLock().unlock();
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Returns the stats of the circuit of every client keyed by the client name.
     */
    public Map<String, CircuitBreakerStats> allStats() {
        final Map<String, CircuitBreakerStats> stats = new HashMap<>();
        lock.readLock().lock();
        try {
            clients.forEach((name, client) -> stats.put(name, circuitBreakerOf(client).stats()));
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableMap(stats);
    }

    /**
     * Resets the circuit of every client.
     */
    public void resetAll() {
        final Map<String, ResilientHttpClient> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new HashMap<>(clients);
        } finally {
            lock.readLock().unlock();
        }
        snapshot.forEach((name, client) -> {
            circuitBreakerOf(client).reset();
            logger.info("HTTP client circuit breaker reset: name={}", name);
        });
    }

    public ResilientHttpClientManagerStats managerStats() {
        int closed = 0;
        int open = 0;
        int halfOpen = 0;
        final int total;
        lock.readLock().lock();
        try {
            total = clients.size();
            for (ResilientHttpClient client : clients.values()) {
                switch (circuitBreakerOf(client).state()) {
                    case OPEN:
                        open++;
                        break;
                    case HALF_OPEN:
                        halfOpen++;
                        break;
                    default:
                        closed++;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return new ResilientHttpClientManagerStats(total, closed, open, halfOpen);
    }

    private static CircuitBreaker circuitBreakerOf(ResilientHttpClient client) {
        return client.circuitBreaker().orElseThrow(IllegalStateException::new);
    }

    @Override
    public String toString() {
        return "ResilientHttpClientManager{" +
               "clients=" + names() +
               '}';
    }
}
