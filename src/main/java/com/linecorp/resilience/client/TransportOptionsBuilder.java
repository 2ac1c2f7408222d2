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

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds a {@link TransportOptions} instance using builder pattern.
 */
public final class TransportOptionsBuilder {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private static final int DEFAULT_MAX_IDLE_CONNECTIONS = 100;

    private static final int DEFAULT_MAX_IDLE_CONNECTIONS_PER_HOST = 10;

    private static final Duration DEFAULT_IDLE_CONNECTION_TIMEOUT = Duration.ofSeconds(90);

    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    private HttpClient.Version httpVersion = HttpClient.Version.HTTP_1_1;

    private boolean followRedirects = true;

    private int maxIdleConnections = DEFAULT_MAX_IDLE_CONNECTIONS;

    private int maxIdleConnectionsPerHost = DEFAULT_MAX_IDLE_CONNECTIONS_PER_HOST;

    private Duration idleConnectionTimeout = DEFAULT_IDLE_CONNECTION_TIMEOUT;

    private boolean keepAlive = true;

    private boolean insecureSkipVerify;

    private String keyStorePath;

    private String keyStorePassword = "";

    private String keyStoreType = "PKCS12";

    private String trustStorePath;

    private String trustStorePassword = "";

    public TransportOptionsBuilder connectTimeout(Duration connectTimeout) {
        requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be greater than zero");
        }
        this.connectTimeout = connectTimeout;
        return this;
    }

    public TransportOptionsBuilder httpVersion(HttpClient.Version httpVersion) {
        this.httpVersion = requireNonNull(httpVersion, "httpVersion");
        return this;
    }

    public TransportOptionsBuilder followRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
        return this;
    }

    public TransportOptionsBuilder maxIdleConnections(int maxIdleConnections) {
        if (maxIdleConnections < 0) {
            throw new IllegalArgumentException("maxIdleConnections must be >= 0: " + maxIdleConnections);
        }
        this.maxIdleConnections = maxIdleConnections;
        return this;
    }

    public TransportOptionsBuilder maxIdleConnectionsPerHost(int maxIdleConnectionsPerHost) {
        if (maxIdleConnectionsPerHost < 0) {
            throw new IllegalArgumentException(
                    "maxIdleConnectionsPerHost must be >= 0: " + maxIdleConnectionsPerHost);
        }
        this.maxIdleConnectionsPerHost = maxIdleConnectionsPerHost;
        return this;
    }

    public TransportOptionsBuilder idleConnectionTimeout(Duration idleConnectionTimeout) {
        requireNonNull(idleConnectionTimeout, "idleConnectionTimeout");
        if (idleConnectionTimeout.isNegative()) {
            throw new IllegalArgumentException("idleConnectionTimeout must not be negative");
        }
        this.idleConnectionTimeout = idleConnectionTimeout;
        return this;
    }

    public TransportOptionsBuilder keepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
        return this;
    }

    /**
     * Accepts any server certificate chain. Use only against test servers.
     */
    public TransportOptionsBuilder insecureSkipVerify(boolean insecureSkipVerify) {
        this.insecureSkipVerify = insecureSkipVerify;
        return this;
    }

    /**
     * Sets the key store which holds the client certificate and its private key.
     */
    public TransportOptionsBuilder keyStore(String path, String password, String type) {
        keyStorePath = requireNonNull(path, "path");
        keyStorePassword = requireNonNull(password, "password");
        keyStoreType = requireNonNull(type, "type");
        return this;
    }

    /**
     * Sets the trust store which holds the trusted CA certificates. Its type is inferred from the file.
     */
    public TransportOptionsBuilder trustStore(String path, String password) {
        trustStorePath = requireNonNull(path, "path");
        trustStorePassword = requireNonNull(password, "password");
        return this;
    }

    public TransportOptions build() {
        if (insecureSkipVerify && trustStorePath != null) {
            throw new IllegalArgumentException("insecureSkipVerify and trustStore are mutually exclusive");
        }
        return new TransportOptions(connectTimeout, httpVersion, followRedirects, maxIdleConnections,
                                    maxIdleConnectionsPerHost, idleConnectionTimeout, keepAlive,
                                    insecureSkipVerify, keyStorePath, keyStorePassword, keyStoreType,
                                    trustStorePath, trustStorePassword);
    }
}
