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

import io.tm1client.rest.errors.Tm1AuthException;
import okhttp3.Credentials;
import okhttp3.Request;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/// Decorates an outgoing request with credentials.
///
/// The set of variants is closed. Each one is a small value type whose only behavior is
/// [#apply(Request.Builder)]; a refusal to sign surfaces as [Tm1AuthException].
public sealed interface AuthProvider {

    /// Adds credentials to the request.
    ///
    /// @throws Tm1AuthException when the provider cannot sign the request
    void apply(Request.Builder request);

    /// `Authorization: Basic base64(user:password)`. An empty user sends no header.
    record Basic(String user, String password) implements AuthProvider {
        @Override
        public void apply(Request.Builder request) {
            if (user == null || user.isEmpty()) {
                return;
            }
            request.header("Authorization",
                Credentials.basic(user, password == null ? "" : password, StandardCharsets.UTF_8));
        }

        @Override
        public String toString() {
            return "Basic[user=" + user + "]";
        }
    }

    /// `Authorization: Bearer {token}`.
    record Bearer(String token) implements AuthProvider {
        @Override
        public void apply(Request.Builder request) {
            if (token == null || token.isEmpty()) {
                throw new Tm1AuthException("bearer token is empty");
            }
            request.header("Authorization", "Bearer " + token);
        }

        @Override
        public String toString() {
            return "Bearer[***]";
        }
    }

    /// `Authorization: CAMNamespace base64(user:password:namespace)`.
    record CamNamespace(String user, String password, String namespace) implements AuthProvider {
        @Override
        public void apply(Request.Builder request) {
            String raw = user + ":" + (password == null ? "" : password) + ":" + namespace;
            request.header("Authorization",
                "CAMNamespace " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)));
        }

        @Override
        public String toString() {
            return "CamNamespace[user=" + user + ", namespace=" + namespace + "]";
        }
    }

    /// `Authorization: CAMPassport {passport}`.
    record CamPassport(String passport) implements AuthProvider {
        @Override
        public void apply(Request.Builder request) {
            if (passport == null || passport.isEmpty()) {
                throw new Tm1AuthException("CAM passport is empty");
            }
            request.header("Authorization", "CAMPassport " + passport);
        }

        @Override
        public String toString() {
            return "CamPassport[***]";
        }
    }

    /// Reuses an existing session by sending its cookie.
    record SessionCookie(String cookieName, String sessionId) implements AuthProvider {
        @Override
        public void apply(Request.Builder request) {
            if (sessionId == null || sessionId.isEmpty()) {
                throw new Tm1AuthException("session id is empty");
            }
            request.header("Cookie", cookieName + "=" + sessionId);
        }

        @Override
        public String toString() {
            return "SessionCookie[" + cookieName + "]";
        }
    }

    /// Sets a fixed set of headers.
    record HeaderBag(Map<String, String> headers) implements AuthProvider {
        public HeaderBag {
            headers = new LinkedHashMap<>(headers);
        }

        @Override
        public void apply(Request.Builder request) {
            headers.forEach(request::header);
        }
    }

    /// Delegates to caller code, for credentials obtained out of band.
    record Custom(AuthFunction function) implements AuthProvider {
        @Override
        public void apply(Request.Builder request) {
            try {
                function.apply(request);
            } catch (Tm1AuthException e) {
                throw e;
            } catch (Exception e) {
                throw new Tm1AuthException("auth function failed: " + e.getMessage(), e);
            }
        }
    }

    @FunctionalInterface
    interface AuthFunction {
        void apply(Request.Builder request) throws Exception;
    }
}
