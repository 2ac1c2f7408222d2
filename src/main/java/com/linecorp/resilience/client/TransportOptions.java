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

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Stores the connection and TLS settings of a {@link JdkHttpTransport}.
 * Use {@link TransportOptionsBuilder} to build one.
 */
public final class TransportOptions {

    private static final TransportOptions DEFAULT = new TransportOptionsBuilder().build();

    public static TransportOptions ofDefault() {
        return DEFAULT;
    }

    private final Duration connectTimeout;

    private final HttpClient.Version httpVersion;

    private final boolean followRedirects;

    private final int maxIdleConnections;

    private final int maxIdleConnectionsPerHost;

    private final Duration idleConnectionTimeout;

    private final boolean keepAlive;

    private final boolean insecureSkipVerify;

    private final String keyStorePath;

    private final String keyStorePassword;

    private final String keyStoreType;

    private final String trustStorePath;

    private final String trustStorePassword;

    TransportOptions(Duration connectTimeout, HttpClient.Version httpVersion, boolean followRedirects,
                     int maxIdleConnections, int maxIdleConnectionsPerHost, Duration idleConnectionTimeout,
                     boolean keepAlive, boolean insecureSkipVerify, String keyStorePath,
                     String keyStorePassword, String keyStoreType, String trustStorePath,
                     String trustStorePassword) {
        this.connectTimeout = connectTimeout;
        this.httpVersion = httpVersion;
        this.followRedirects = followRedirects;
        this.maxIdleConnections = maxIdleConnections;
        this.maxIdleConnectionsPerHost = maxIdleConnectionsPerHost;
        this.idleConnectionTimeout = idleConnectionTimeout;
        this.keepAlive = keepAlive;
        this.insecureSkipVerify = insecureSkipVerify;
        this.keyStorePath = keyStorePath;
        this.keyStorePassword = keyStorePassword;
        this.keyStoreType = keyStoreType;
        this.trustStorePath = trustStorePath;
        this.trustStorePassword = trustStorePassword;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public HttpClient.Version httpVersion() {
        return httpVersion;
    }

    public boolean followRedirects() {
        return followRedirects;
    }

    /**
     * Returns the requested size of the idle connection pool. {@link HttpClient} sizes its pool per JVM,
     * so the value is only reported.
     */
    public int maxIdleConnections() {
        return maxIdleConnections;
    }

    public int maxIdleConnectionsPerHost() {
        return maxIdleConnectionsPerHost;
    }

    public Duration idleConnectionTimeout() {
        return idleConnectionTimeout;
    }

    public boolean keepAlive() {
        return keepAlive;
    }

    /**
     * Returns whether the server certificate chain is accepted without verification.
     */
    public boolean insecureSkipVerify() {
        return insecureSkipVerify;
    }

    /**
     * Returns the path of the key store holding the client certificate, or {@code null}.
     */
    public String keyStorePath() {
        return keyStorePath;
    }

    public String keyStorePassword() {
        return keyStorePassword;
    }

    public String keyStoreType() {
        return keyStoreType;
    }

    /**
     * Returns the path of the trust store holding the trusted CA certificates, or {@code null}.
     */
    public String trustStorePath() {
        return trustStorePath;
    }

    public String trustStorePassword() {
        return trustStorePassword;
    }

    @Override
    public String toString() {
        return "TransportOptions{" +
               "connectTimeout=" + connectTimeout +
               ", httpVersion=" + httpVersion +
               ", followRedirects=" + followRedirects +
               ", maxIdleConnections=" + maxIdleConnections +
               ", maxIdleConnectionsPerHost=" + maxIdleConnectionsPerHost +
               ", idleConnectionTimeout=" + idleConnectionTimeout +
               ", keepAlive=" + keepAlive +
               ", insecureSkipVerify=" + insecureSkipVerify +
               ", keyStorePath=" + keyStorePath +
               ", trustStorePath=" + trustStorePath +
               '}';
    }
}
