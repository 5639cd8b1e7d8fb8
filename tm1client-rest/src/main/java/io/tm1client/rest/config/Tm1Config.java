package io.tm1client.rest.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tm1client.rest.errors.Tm1ValidationException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Connection, credential and behavior settings for one TM1 client.
///
/// Instances are immutable; use [#builder()]. Empty strings and null mean "not set" for every
/// text field. Which of the credential fields are set decides the authentication mode, see
/// `io.tm1client.rest.auth.AuthMode#select`.
public record Tm1Config(
    // connection
    String address,
    int port,
    boolean ssl,
    String baseUrl,
    String tenant,
    String database,
    String instance,
    String workspaceProxyHost,
    // credentials
    String user,
    String password,
    boolean decodeBase64,
    String namespace,
    String camPassport,
    String sessionId,
    String accessToken,
    String applicationClientId,
    String applicationClientSecret,
    String apiKey,
    String iamUrl,
    boolean integratedLogin,
    // behavior
    Duration timeout,
    boolean asyncRequestsMode,
    boolean cancelAtTimeout,
    String sessionContext,
    String impersonate,
    boolean reconnectOnSessionTimeout,
    boolean reconnectOnRemoteDisconnect,
    boolean verify,
    int connectionPoolSize,
    boolean keepAlive,
    String proxy,
    Map<String, String> additionalHeaders
) {

    public static final String DEFAULT_SESSION_CONTEXT = "tm1client";
    public static final String DEFAULT_IAM_URL = "https://iam.cloud.ibm.com";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_CONNECTION_POOL_SIZE = 10;

    public Tm1Config {
        if (port < 0 || port > 65535) {
            throw new Tm1ValidationException("port out of range: " + port);
        }
        if (connectionPoolSize < 1) {
            throw new Tm1ValidationException("connection pool size must be positive: " + connectionPoolSize);
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new Tm1ValidationException("timeout must be positive: " + timeout);
        }
        additionalHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(
            additionalHeaders == null ? Map.of() : additionalHeaders));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder pre-filled with this configuration
    public Builder toBuilder() {
        return new Builder(this);
    }

    public String scheme() {
        return ssl ? "https" : "http";
    }

    /// @return the password, base64-decoded when [#decodeBase64()] is set
    public String effectivePassword() {
        if (!isSet(password)) {
            return "";
        }
        if (!decodeBase64) {
            return password;
        }
        try {
            return new String(Base64.getDecoder().decode(password), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new Tm1ValidationException("password is flagged as base64 but does not decode", e);
        }
    }

    /// @return the configured IAM endpoint, or the public IBM Cloud one
    public String effectiveIamUrl() {
        return isSet(iamUrl) ? iamUrl : DEFAULT_IAM_URL;
    }

    public static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        return "Tm1Config{address=" + address + ", port=" + port + ", ssl=" + ssl + ", baseUrl=" + baseUrl
            + ", tenant=" + tenant + ", database=" + database + ", instance=" + instance
            + ", user=" + user + ", namespace=" + namespace + ", asyncRequestsMode=" + asyncRequestsMode
            + ", timeout=" + timeout + "}";
    }

    public static final class Builder {
        private String address;
        private int port;
        private boolean ssl;
        private String baseUrl;
        private String tenant;
        private String database;
        private String instance;
        private String workspaceProxyHost;
        private String user;
        private String password;
        private boolean decodeBase64;
        private String namespace;
        private String camPassport;
        private String sessionId;
        private String accessToken;
        private String applicationClientId;
        private String applicationClientSecret;
        private String apiKey;
        private String iamUrl;
        private boolean integratedLogin;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean asyncRequestsMode;
        private boolean cancelAtTimeout;
        private String sessionContext = DEFAULT_SESSION_CONTEXT;
        private String impersonate;
        private boolean reconnectOnSessionTimeout;
        private boolean reconnectOnRemoteDisconnect;
        private boolean verify = true;
        private int connectionPoolSize = DEFAULT_CONNECTION_POOL_SIZE;
        private boolean keepAlive;
        private String proxy;
        private final Map<String, String> additionalHeaders = new LinkedHashMap<>();

        private Builder() {
        }

        private Builder(Tm1Config c) {
            this.address = c.address;
            this.port = c.port;
            this.ssl = c.ssl;
            this.baseUrl = c.baseUrl;
            this.tenant = c.tenant;
            this.database = c.database;
            this.instance = c.instance;
            this.workspaceProxyHost = c.workspaceProxyHost;
            this.user = c.user;
            this.password = c.password;
            this.decodeBase64 = c.decodeBase64;
            this.namespace = c.namespace;
            this.camPassport = c.camPassport;
            this.sessionId = c.sessionId;
            this.accessToken = c.accessToken;
            this.applicationClientId = c.applicationClientId;
            this.applicationClientSecret = c.applicationClientSecret;
            this.apiKey = c.apiKey;
            this.iamUrl = c.iamUrl;
            this.integratedLogin = c.integratedLogin;
            this.timeout = c.timeout;
            this.asyncRequestsMode = c.asyncRequestsMode;
            this.cancelAtTimeout = c.cancelAtTimeout;
            this.sessionContext = c.sessionContext;
            this.impersonate = c.impersonate;
            this.reconnectOnSessionTimeout = c.reconnectOnSessionTimeout;
            this.reconnectOnRemoteDisconnect = c.reconnectOnRemoteDisconnect;
            this.verify = c.verify;
            this.connectionPoolSize = c.connectionPoolSize;
            this.keepAlive = c.keepAlive;
            this.proxy = c.proxy;
            this.additionalHeaders.putAll(c.additionalHeaders);
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder instance(String instance) {
            this.instance = instance;
            return this;
        }

        public Builder workspaceProxyHost(String workspaceProxyHost) {
            this.workspaceProxyHost = workspaceProxyHost;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder decodeBase64(boolean decodeBase64) {
            this.decodeBase64 = decodeBase64;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder camPassport(String camPassport) {
            this.camPassport = camPassport;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder applicationClientId(String applicationClientId) {
            this.applicationClientId = applicationClientId;
            return this;
        }

        public Builder applicationClientSecret(String applicationClientSecret) {
            this.applicationClientSecret = applicationClientSecret;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder iamUrl(String iamUrl) {
            this.iamUrl = iamUrl;
            return this;
        }

        public Builder integratedLogin(boolean integratedLogin) {
            this.integratedLogin = integratedLogin;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder asyncRequestsMode(boolean asyncRequestsMode) {
            this.asyncRequestsMode = asyncRequestsMode;
            return this;
        }

        public Builder cancelAtTimeout(boolean cancelAtTimeout) {
            this.cancelAtTimeout = cancelAtTimeout;
            return this;
        }

        public Builder sessionContext(String sessionContext) {
            this.sessionContext = sessionContext;
            return this;
        }

        public Builder impersonate(String impersonate) {
            this.impersonate = impersonate;
            return this;
        }

        public Builder reconnectOnSessionTimeout(boolean reconnectOnSessionTimeout) {
            this.reconnectOnSessionTimeout = reconnectOnSessionTimeout;
            return this;
        }

        public Builder reconnectOnRemoteDisconnect(boolean reconnectOnRemoteDisconnect) {
            this.reconnectOnRemoteDisconnect = reconnectOnRemoteDisconnect;
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder connectionPoolSize(int connectionPoolSize) {
            this.connectionPoolSize = connectionPoolSize;
            return this;
        }

        public Builder keepAlive(boolean keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder proxy(String proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder header(String name, String value) {
            this.additionalHeaders.put(name, value);
            return this;
        }

        public Builder additionalHeaders(Map<String, String> headers) {
            this.additionalHeaders.putAll(headers);
            return this;
        }

        public Tm1Config build() {
            return new Tm1Config(address, port, ssl, baseUrl, tenant, database, instance, workspaceProxyHost,
                user, password, decodeBase64, namespace, camPassport, sessionId, accessToken,
                applicationClientId, applicationClientSecret, apiKey, iamUrl, integratedLogin,
                timeout, asyncRequestsMode, cancelAtTimeout, sessionContext, impersonate,
                reconnectOnSessionTimeout, reconnectOnRemoteDisconnect, verify, connectionPoolSize,
                keepAlive, proxy, additionalHeaders);
        }
    }
}
