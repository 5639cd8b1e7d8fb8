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

import io.tm1client.rest.config.Tm1Config;
import io.tm1client.rest.config.Tm1Endpoints;
import io.tm1client.rest.errors.Tm1ValidationException;
import okhttp3.OkHttpClient;

/// The selected [AuthMode] together with the provider that implements it.
///
/// @param mode the mode chosen by [AuthMode#select(Tm1Config)]
/// @param provider decorates each request
/// @param sessionLogin the login exchange behind the provider, or null for header-only modes
public record Authentication(AuthMode mode, AuthProvider provider, SessionLogin sessionLogin) {

    public static final String SESSION_COOKIE = "TM1SessionId";
    public static final String API_KEY_USER = "apikey";

    public static Authentication create(Tm1Config config, Tm1Endpoints endpoints, OkHttpClient httpClient) {
        AuthMode mode = AuthMode.select(config);
        switch (mode) {
            case SESSION_REUSE:
                return headerOnly(mode, new AuthProvider.SessionCookie(SESSION_COOKIE, config.sessionId()));
            case BASIC_API_KEY:
                return headerOnly(mode, new AuthProvider.Basic(API_KEY_USER, config.apiKey()));
            case IBM_CLOUD_API_KEY: {
                IamTokenSource tokens = new IamTokenSource(httpClient, config.effectiveIamUrl(), config.apiKey());
                return headerOnly(mode, new AuthProvider.Custom(
                    request -> new AuthProvider.Bearer(tokens.accessToken()).apply(request)));
            }
            case SERVICE_TO_SERVICE: {
                if (endpoints.authUrl() == null) {
                    throw new Tm1ValidationException("service-to-service authentication needs an instance and database");
                }
                SessionLogin login = SessionLogin.serviceToService(httpClient, endpoints.authUrl(),
                    config.applicationClientId(), config.applicationClientSecret());
                return new Authentication(mode, login.asProvider(), login);
            }
            case WORKSPACE_PROXY: {
                SessionLogin login = SessionLogin.workspaceProxy(httpClient, endpoints.authUrl(),
                    config.user(), config.effectivePassword());
                return new Authentication(mode, login.asProvider(), login);
            }
            case ACCESS_TOKEN:
                return headerOnly(mode, new AuthProvider.Bearer(config.accessToken()));
            case CAM_PASSPORT:
                return headerOnly(mode, new AuthProvider.CamPassport(config.camPassport()));
            case CAM_WITH_NAMESPACE:
                return headerOnly(mode, new AuthProvider.CamNamespace(config.user(), config.effectivePassword(),
                    config.namespace()));
            case WINDOWS_INTEGRATED:
                throw new UnsupportedOperationException("Windows integrated authentication is not implemented");
            case BASIC:
            default:
                return headerOnly(mode, new AuthProvider.Basic(config.user(), config.effectivePassword()));
        }
    }

    /// Wraps a caller-supplied provider; the mode stays what the configuration selects.
    public static Authentication custom(AuthMode mode, AuthProvider provider) {
        return new Authentication(mode, provider, null);
    }

    private static Authentication headerOnly(AuthMode mode, AuthProvider provider) {
        return new Authentication(mode, provider, null);
    }

    /// Drops any established login so the next request authenticates again.
    public void invalidateSession() {
        if (sessionLogin != null) {
            sessionLogin.invalidate();
        }
    }
}
