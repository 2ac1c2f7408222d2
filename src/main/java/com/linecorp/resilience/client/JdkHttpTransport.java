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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link HttpTransport} built on {@link HttpClient}.
 *
 * <p>{@link HttpClient} pools connections per JVM, so {@link TransportOptions#maxIdleConnections()} and
 * the related settings are only logged. Its hostname verification can only be turned off JVM-wide
 * ({@code -Djdk.internal.httpclient.disableHostnameVerification}), so
 * {@link TransportOptions#insecureSkipVerify()} disables the certificate chain check only.
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final Set<String> RESTRICTED_HEADERS = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("connection", "content-length", "expect", "host", "upgrade")));

    private final HttpClient httpClient;

    private final TransportOptions options;

    public JdkHttpTransport() {
        this(TransportOptions.ofDefault());
    }

    /**
     * Creates a new instance.
     *
     * @throws IllegalArgumentException if the key store or the trust store cannot be loaded
     */
    public JdkHttpTransport(TransportOptions options) {
        this.options = requireNonNull(options, "options");
        final HttpClient.Builder builder =
                HttpClient.newBuilder()
                          .version(options.httpVersion())
                          .connectTimeout(options.connectTimeout())
                          .followRedirects(options.followRedirects() ? HttpClient.Redirect.NORMAL
                                                                     : HttpClient.Redirect.NEVER);
        if (options.insecureSkipVerify() || options.keyStorePath() != null ||
            options.trustStorePath() != null) {
            builder.sslContext(newSslContext(options));
        }
        httpClient = builder.build();

        logger.info("Initialized HTTP transport: version={}, connectTimeout={}, followRedirects={}",
                    options.httpVersion(), options.connectTimeout(), options.followRedirects());
        logger.debug("Connection pool settings (JVM-wide in HttpClient): maxIdle={}, maxIdlePerHost={}, " +
                     "idleTimeout={}, keepAlive={}",
                     options.maxIdleConnections(), options.maxIdleConnectionsPerHost(),
                     options.idleConnectionTimeout(), options.keepAlive());
        if (options.insecureSkipVerify()) {
            logger.warn("TLS certificate verification is disabled");
        }
    }

    public TransportOptions options() {
        return options;
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        requireNonNull(request, "request");
        final HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (IllegalArgumentException e) {
            final CompletableFuture<TransportResponse> failed = new CompletableFuture<>();
            failed.completeExceptionally(e);
            return failed;
        }
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                         .thenApply(res -> new TransportResponse(res.statusCode(), res.headers().map(),
                                                                 res.body() != null ? res.body()
                                                                                    : new byte[0]));
    }

    private static HttpRequest toHttpRequest(TransportRequest request) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());
        if (!request.timeout().isZero() && !request.timeout().isNegative()) {
            builder.timeout(request.timeout());
        }
        request.headers().forEach((name, value) -> {
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                logger.debug("Skipping a header managed by HttpClient: {}", name);
            } else {
                builder.header(name, value);
            }
        });
        final byte[] body = request.body();
        final HttpRequest.BodyPublisher publisher =
                body.length == 0 ? HttpRequest.BodyPublishers.noBody()
                                 : HttpRequest.BodyPublishers.ofByteArray(body);
        return builder.method(request.method().name(), publisher).build();
    }

    private static SSLContext newSslContext(TransportOptions options) {
        try {
            KeyManager[] keyManagers = null;
            if (options.keyStorePath() != null) {
                final char[] password = options.keyStorePassword().toCharArray();
                final KeyStore keyStore = KeyStore.getInstance(options.keyStoreType());
                try (InputStream in = Files.newInputStream(Paths.get(options.keyStorePath()))) {
                    keyStore.load(in, password);
                }
                final KeyManagerFactory kmf =
                        KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                kmf.init(keyStore, password);
                keyManagers = kmf.getKeyManagers();
            }

            TrustManager[] trustManagers = null;
            if (options.insecureSkipVerify()) {
                trustManagers = new TrustManager[] { new TrustAllManager() };
            } else if (options.trustStorePath() != null) {
                final KeyStore trustStore = KeyStore.getInstance(
                        new File(options.trustStorePath()), options.trustStorePassword().toCharArray());
                final TrustManagerFactory tmf =
                        TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
                tmf.init(trustStore);
                trustManagers = tmf.getTrustManagers();
            }

            final SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(keyManagers, trustManagers, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalArgumentException("failed to configure TLS: " + e.getMessage(), e);
        }
    }

    private static final class TrustAllManager implements X509TrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }

    @Override
    public String toString() {
        return "JdkHttpTransport{" +
               "options=" + options +
               '}';
    }
}
