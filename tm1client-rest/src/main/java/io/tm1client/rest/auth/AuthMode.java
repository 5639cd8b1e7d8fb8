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

import java.util.Locale;

import static io.tm1client.rest.config.Tm1Config.isSet;

/// How the client authenticates, chosen from the credential fields of a [Tm1Config].
public enum AuthMode {
    BASIC,
    WINDOWS_INTEGRATED,
    CAM_WITH_NAMESPACE,
    CAM_PASSPORT,
    SERVICE_TO_SERVICE,
    IBM_CLOUD_API_KEY,
    BASIC_API_KEY,
    ACCESS_TOKEN,
    WORKSPACE_PROXY,
    SESSION_REUSE;

    /// Host substring that marks a Planning Analytics SaaS endpoint.
    public static final String SAAS_HOST_MARKER = "planninganalytics.saas.ibm.com";

    /// Priority chain, first match wins:
    ///
    /// 1. session id: [#SESSION_REUSE]
    /// 2. API key and a SaaS host: [#BASIC_API_KEY]
    /// 3. API key and a tenant or IAM URL: [#IBM_CLOUD_API_KEY]
    /// 4. application client id and secret: [#SERVICE_TO_SERVICE]
    /// 5. workspace-proxy host: [#WORKSPACE_PROXY]
    /// 6. access token: [#ACCESS_TOKEN]
    /// 7. CAM passport: [#CAM_PASSPORT]
    /// 8. namespace: [#CAM_WITH_NAMESPACE]
    /// 9. integrated login: [#WINDOWS_INTEGRATED]
    /// 10. otherwise [#BASIC], which sends nothing when no user is set
    public static AuthMode select(Tm1Config config) {
        if (isSet(config.sessionId())) {
            return SESSION_REUSE;
        }
        if (isSet(config.apiKey()) && isSaasHost(config)) {
            return BASIC_API_KEY;
        }
        if (isSet(config.apiKey()) && (isSet(config.tenant()) || isSet(config.iamUrl()))) {
            return IBM_CLOUD_API_KEY;
        }
        if (isSet(config.applicationClientId()) && isSet(config.applicationClientSecret())) {
            return SERVICE_TO_SERVICE;
        }
        if (isSet(config.workspaceProxyHost())) {
            return WORKSPACE_PROXY;
        }
        if (isSet(config.accessToken())) {
            return ACCESS_TOKEN;
        }
        if (isSet(config.camPassport())) {
            return CAM_PASSPORT;
        }
        if (isSet(config.namespace())) {
            return CAM_WITH_NAMESPACE;
        }
        if (config.integratedLogin()) {
            return WINDOWS_INTEGRATED;
        }
        return BASIC;
    }

    private static boolean isSaasHost(Tm1Config config) {
        return contains(config.address()) || contains(config.baseUrl());
    }

    private static boolean contains(String value) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(SAAS_HOST_MARKER);
    }
}
