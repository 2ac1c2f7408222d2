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

import java.security.SecureRandom;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Generates the identifiers which link a request across logs, metrics and retries.
 *
 * <p>{@link #generate()} produces {@code <prefix>-<epochNanos>-<counter>-<16 hex digits>}, for example
 * {@code resilience-1700000000123456789-42-9f86d081884c7d65}.
 */
public final class CorrelationIdGenerator {

    static final String DEFAULT_PREFIX = "resilience";

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9-]{8,}");

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final String prefix;

    private final AtomicLong counter = new AtomicLong();

    private final SecureRandom random = new SecureRandom();

    public CorrelationIdGenerator() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Creates a new instance. An empty prefix omits the prefix part.
     */
    public CorrelationIdGenerator(String prefix) {
        this.prefix = requireNonNull(prefix, "prefix");
        if (!prefix.isEmpty() && !VALID.matcher(prefix + "-padding").matches()) {
            throw new IllegalArgumentException("prefix must consist of letters, digits and hyphens: " + prefix);
        }
    }

    public String prefix() {
        return prefix;
    }

    public String generate() {
        final StringBuilder builder = new StringBuilder(64);
        if (!prefix.isEmpty()) {
            builder.append(prefix).append('-');
        }
        builder.append(epochNanos()).append('-');
        builder.append(counter.incrementAndGet()).append('-');
        appendRandomHex(builder, 8);
        return builder.toString();
    }

    /**
     * Generates {@code <16 hex digits>-<counter>}.
     */
    public String generateShort() {
        final StringBuilder builder = new StringBuilder(32);
        appendRandomHex(builder, 8);
        builder.append('-').append(counter.incrementAndGet());
        return builder.toString();
    }

    /**
     * Generates a random (version 4) UUID.
     */
    public String generateUuid() {
        counter.incrementAndGet();
        return UUID.randomUUID().toString();
    }

    /**
     * Generates {@code <epochNanos>-<counter>}.
     */
    public String generateTimestamp() {
        return epochNanos() + "-" + counter.incrementAndGet();
    }

    /**
     * Returns the number of identifiers generated so far.
     */
    public long counter() {
        return counter.get();
    }

    public void resetCounter() {
        counter.set(0);
    }

    /**
     * Returns {@code true} if the identifier has at least eight characters, all of them letters, digits or
     * hyphens.
     */
    public static boolean isValid(String correlationId) {
        return correlationId != null && VALID.matcher(correlationId).matches();
    }

    private static long epochNanos() {
        final Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    private void appendRandomHex(StringBuilder builder, int numBytes) {
        final byte[] bytes = new byte[numBytes];
        random.nextBytes(bytes);
        for (byte b : bytes) {
            builder.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
        }
    }
}
