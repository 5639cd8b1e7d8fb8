package io.tm1client.rest.auth;

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

import com.google.gson.JsonObject;
import io.tm1client.rest.errors.Tm1AuthException;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/// A one-time login exchange whose only product is the session cookie the server sets.
///
/// The exchange runs through the transport's own [OkHttpClient], so the cookie lands in the
/// shared cookie jar. It runs at most once until [#invalidate()] is called.
public class SessionLogin {
    private final static Logger logger = LogManager.getLogger(SessionLogin.class);

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final Request loginRequest;
    private boolean loggedIn;

    private SessionLogin(OkHttpClient httpClient, Request loginRequest) {
        this.httpClient = httpClient;
        this.loginRequest = loginRequest;
    }

    /// Service-to-service: Basic credentials of the application client against the paired
    /// `.../auth/v1/session` URL, with body `{"User": clientId}`.
    public static SessionLogin serviceToService(OkHttpClient httpClient, String authUrl, String clientId, String secret) {
        JsonObject body = new JsonObject();
        body.addProperty("User", clientId);
        Request request = new Request.Builder()
            .url(authUrl)
            .header("Authorization", Credentials.basic(clientId, secret, StandardCharsets.UTF_8))
            .header("Accept", "application/json")
            .post(RequestBody.create(body.toString(), JSON))
            .build();
        return new SessionLogin(httpClient, request);
    }

    /// Workspace proxy: form login at `{scheme}://{host}/login`.
    public static SessionLogin workspaceProxy(OkHttpClient httpClient, String loginUrl, String user, String password) {
        Request request = new Request.Builder()
            .url(loginUrl)
            .post(new FormBody.Builder()
                .add("username", user == null ? "" : user)
                .add("password", password == null ? "" : password)
                .build())
            .build();
        return new SessionLogin(httpClient, request);
    }

    /// Performs the login unless it already succeeded.
    public synchronized void ensureLoggedIn() {
        if (loggedIn) {
            return;
        }
        logger.debug("establishing session at {}", loginRequest.url());
        try (Response response = httpClient.newCall(loginRequest).execute()) {
            if (!response.isSuccessful()) {
                throw new Tm1AuthException("session login at " + loginRequest.url()
                    + " failed with status " + response.code());
            }
            loggedIn = true;
        } catch (IOException e) {
            throw new Tm1AuthException("session login at " + loginRequest.url() + " failed: " + e.getMessage(), e);
        }
    }

    /// Forces the next [#ensureLoggedIn()] to log in again.
    public synchronized void invalidate() {
        loggedIn = false;
    }

    /// @return a provider that logs in before the first request and adds no headers itself
    public AuthProvider asProvider() {
        return new AuthProvider.Custom(request -> ensureLoggedIn());
    }
}
