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
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

public class JdkHttpTransportTest {

    private static HttpServer server;

    private static String baseUrl;

    @BeforeClass
    public static void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", JdkHttpTransportTest::echo);
        server.createContext("/unavailable", exchange -> respond(exchange, 503, "try later"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterClass
    public static void stopServer() {
        server.stop(0);
    }

    private static void echo(HttpExchange exchange) throws IOException {
        final byte[] requestBody;
        try (InputStream in = exchange.getRequestBody()) {
            requestBody = in.readAllBytes();
        }
        exchange.getResponseHeaders().add("X-Method", exchange.getRequestMethod());
        final String tenant = exchange.getRequestHeaders().getFirst("X-Tenant");
        if (tenant != null) {
            exchange.getResponseHeaders().add("X-Tenant", tenant);
        }
        final String query = exchange.getRequestURI().getRawQuery();
        if (query != null) {
            exchange.getResponseHeaders().add("X-Query", query);
        }
        respond(exchange, 200, new String(requestBody, StandardCharsets.UTF_8));
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static TransportRequest request(HttpMethod method, String path, Map<String, String> headers,
                                            String body) {
        return new TransportRequest(method, URI.create(baseUrl + path), headers,
                                    body.getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(5));
    }

    @Test
    public void testGet() throws Exception {
        JdkHttpTransport transport = new JdkHttpTransport();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Tenant", "line");
        // managed by HttpClient and skipped
        headers.put("Host", "ignored.example.com");

        TransportResponse response =
                transport.send(request(HttpMethod.GET, "/echo?a=1", headers, "")).get(10, TimeUnit.SECONDS);

        assertThat(response.statusCode(), is(200));
        assertThat(response.headers().get("x-method").get(0), is("GET"));
        assertThat(response.headers().get("X-Tenant").get(0), is("line"));
        assertThat(response.headers().get("X-Query").get(0), is("a=1"));
        assertThat(response.body().length, is(0));
    }

    @Test
    public void testPostBody() throws Exception {
        JdkHttpTransport transport = new JdkHttpTransport();

        TransportResponse response = transport.send(
                request(HttpMethod.POST, "/echo", Collections.emptyMap(), "{\"name\":\"alice\"}"))
                                              .get(10, TimeUnit.SECONDS);

        assertThat(response.statusCode(), is(200));
        assertThat(response.headers().get("X-Method").get(0), is("POST"));
        assertThat(new String(response.body(), StandardCharsets.UTF_8), is("{\"name\":\"alice\"}"));
    }

    @Test
    public void testErrorStatusIsAResponse() throws Exception {
        JdkHttpTransport transport = new JdkHttpTransport();

        TransportResponse response = transport.send(
                request(HttpMethod.GET, "/unavailable", Collections.emptyMap(), "")).get(10, TimeUnit.SECONDS);

        assertThat(response.statusCode(), is(503));
        assertThat(new String(response.body(), StandardCharsets.UTF_8), is("try later"));
    }

    @Test
    public void testClientAgainstServer() throws Exception {
        ResilientHttpClient client = new ResilientHttpClient(
                new ResilientHttpClientConfigBuilder()
                        .baseUrl(baseUrl)
                        .maxRetries(1)
                        .retryDelay(Duration.ofMillis(1))
                        .maxRetryDelay(Duration.ofMillis(1))
                        .build());

        ClientResponse echoed = client.execute(new ClientRequestBuilder(HttpMethod.PUT, "/echo")
                                                       .queryParam("q", "a b")
                                                       .body("payload")
                                                       .build());
        assertThat(echoed.statusCode(), is(200));
        assertThat(echoed.bodyAsString(), is("payload"));
        assertThat(echoed.header("X-Query"), is("q=a+b"));

        ClientResponse unavailable = client.get("/unavailable");
        assertThat(unavailable.statusCode(), is(503));
        assertThat(unavailable.retryCount(), is(1));
    }

    @Test
    public void testInvalidTlsOptions() {
        try {
            new TransportOptionsBuilder().insecureSkipVerify(true).trustStore("/tmp/trust.p12", "pw").build();
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            new JdkHttpTransport(new TransportOptionsBuilder()
                                         .keyStore("/nonexistent/keystore.p12", "pw", "PKCS12")
                                         .build());
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testInsecureSkipVerify() {
        JdkHttpTransport transport =
                new JdkHttpTransport(new TransportOptionsBuilder().insecureSkipVerify(true).build());
        assertThat(transport.options().insecureSkipVerify(), is(true));
    }
}
