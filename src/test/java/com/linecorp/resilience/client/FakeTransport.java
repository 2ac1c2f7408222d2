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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * An {@link HttpTransport} which answers with a function of the request and records every request sent.
 */
final class FakeTransport implements HttpTransport {

    static FakeTransport ofStatus(int statusCode) {
        return new FakeTransport(req -> CompletableFuture.completedFuture(response(statusCode, "")));
    }

    static TransportResponse response(int statusCode, String body) {
        return new TransportResponse(statusCode, Collections.emptyMap(),
                                     body.getBytes(StandardCharsets.UTF_8));
    }

    private final Function<TransportRequest, CompletableFuture<TransportResponse>> handler;

    private final List<TransportRequest> requests = new CopyOnWriteArrayList<>();

    FakeTransport(Function<TransportRequest, CompletableFuture<TransportResponse>> handler) {
        this.handler = handler;
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        requests.add(request);
        return handler.apply(request);
    }

    List<TransportRequest> requests() {
        return new ArrayList<>(requests);
    }

    TransportRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    int attempts() {
        return requests.size();
    }
}
