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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.Assert.fail;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

public class CorrelationIdGeneratorTest {

    @Test
    public void testGenerate() {
        CorrelationIdGenerator generator = new CorrelationIdGenerator();
        String id = generator.generate();

        assertThat(id, matchesPattern("resilience-[0-9]+-1-[0-9a-f]{16}"));
        assertThat(CorrelationIdGenerator.isValid(id), is(true));
        assertThat(generator.counter(), is(1L));
    }

    @Test
    public void testCustomAndEmptyPrefix() {
        assertThat(new CorrelationIdGenerator("orders").generate(), matchesPattern("orders-[0-9]+-1-[0-9a-f]{16}"));
        assertThat(new CorrelationIdGenerator("").generate(), matchesPattern("[0-9]+-1-[0-9a-f]{16}"));
        try {
            new CorrelationIdGenerator("bad prefix!");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testOtherFormats() {
        CorrelationIdGenerator generator = new CorrelationIdGenerator();

        assertThat(generator.generateShort(), matchesPattern("[0-9a-f]{16}-1"));
        assertThat(generator.generateUuid(),
                   matchesPattern("[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[0-9a-f]{4}-[0-9a-f]{12}"));
        assertThat(generator.generateTimestamp(), matchesPattern("[0-9]+-3"));
        assertThat(generator.counter(), is(3L));

        generator.resetCounter();
        assertThat(generator.counter(), is(0L));
    }

    @Test
    public void testUniqueness() {
        CorrelationIdGenerator generator = new CorrelationIdGenerator();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10000; i++) {
            ids.add(generator.generate());
        }
        assertThat(ids.size(), is(10000));
    }

    @Test
    public void testIsValid() {
        assertThat(CorrelationIdGenerator.isValid("abcd-1234"), is(true));
        assertThat(CorrelationIdGenerator.isValid("short"), is(false));
        assertThat(CorrelationIdGenerator.isValid("has space 123"), is(false));
        assertThat(CorrelationIdGenerator.isValid(""), is(false));
        assertThat(CorrelationIdGenerator.isValid(null), is(false));
    }
}
