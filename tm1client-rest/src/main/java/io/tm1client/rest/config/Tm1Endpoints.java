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
import io.tm1client.rest.odata.ODataUrls;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

import static io.tm1client.rest.config.Tm1Config.isSet;

/// The base URL every endpoint is resolved against, and the paired login URL where the
/// topology has one.
///
/// @param topology how the URL was composed
/// @param shape the effective topology; equal to `topology` unless an explicit base URL was given
/// @param baseUrl absolute URL ending with a single `/`
/// @param authUrl absolute login or session URL, or null
public record Tm1Endpoints(DeploymentTopology topology, DeploymentTopology shape, String baseUrl, String authUrl) {

    private static final Pattern SAAS_PATH = Pattern.compile(".*/api/[^/]+/v0/tm1/[^/]+/?$");
    private static final Pattern PROXY_PATH = Pattern.compile(".*/tm1/[^/]+/api/v1/?$");
    private static final String DATABASES_SEGMENT = "/api/v1/Databases(";

    /// Composes the endpoints for a configuration. Precedence: explicit base URL, then tenant
    /// (SaaS), then instance (named instance), then workspace-proxy host, then address and port.
    public static Tm1Endpoints compose(Tm1Config config) {
        if (isSet(config.baseUrl())) {
            return fromExplicit(config.baseUrl().trim());
        }
        if (isSet(config.tenant())) {
            requireSet(config.address(), "address");
            requireSet(config.database(), "database");
            String base = "https://" + config.address() + "/api/" + config.tenant() + "/v0/tm1/"
                + ODataUrls.encode(config.database());
            return new Tm1Endpoints(DeploymentTopology.SAAS, DeploymentTopology.SAAS, withTrailingSlash(base), null);
        }
        if (isSet(config.instance())) {
            requireSet(config.address(), "address");
            requireSet(config.database(), "database");
            String root = hostRoot(config.scheme(), config.address(), config.port()) + "/" + config.instance();
            String base = root + "/api/v1/Databases('" + ODataUrls.escape(config.database()) + "')";
            return new Tm1Endpoints(DeploymentTopology.NAMED_INSTANCE, DeploymentTopology.NAMED_INSTANCE,
                withTrailingSlash(base), root + "/auth/v1/session");
        }
        if (isSet(config.workspaceProxyHost())) {
            requireSet(config.database(), "database");
            String host = config.scheme() + "://" + config.workspaceProxyHost();
            String base = host + "/tm1/" + ODataUrls.encode(config.database()) + "/api/v1";
            return new Tm1Endpoints(DeploymentTopology.WORKSPACE_PROXY, DeploymentTopology.WORKSPACE_PROXY,
                withTrailingSlash(base), host + "/login");
        }
        requireSet(config.address(), "address");
        String base = hostRoot(config.scheme(), config.address(), config.port()) + "/api/v1";
        return new Tm1Endpoints(DeploymentTopology.LEGACY, DeploymentTopology.LEGACY, withTrailingSlash(base), null);
    }

    static Tm1Endpoints fromExplicit(String baseUrl) {
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new Tm1ValidationException("invalid base URL: " + baseUrl, e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new Tm1ValidationException("base URL must be absolute: " + baseUrl);
        }
        String root = uri.getScheme() + "://" + uri.getRawAuthority();
        String path = stripTrailingSlashes(uri.getRawPath() == null ? "" : uri.getRawPath());

        int databases = path.indexOf(DATABASES_SEGMENT);
        if (databases >= 0) {
            String instanceRoot = root + path.substring(0, databases);
            return explicit(DeploymentTopology.NAMED_INSTANCE, root + path, instanceRoot + "/auth/v1/session");
        }
        if (SAAS_PATH.matcher(path).matches()) {
            return explicit(DeploymentTopology.SAAS, root + path, null);
        }
        if (PROXY_PATH.matcher(path).matches()) {
            return explicit(DeploymentTopology.WORKSPACE_PROXY, root + path, root + "/login");
        }
        if (!path.contains("/api/")) {
            path = path + "/api/v1";
        }
        return explicit(DeploymentTopology.LEGACY, root + path, null);
    }

    private static Tm1Endpoints explicit(DeploymentTopology shape, String base, String authUrl) {
        return new Tm1Endpoints(DeploymentTopology.EXPLICIT_BASE_URL, shape, withTrailingSlash(base), authUrl);
    }

    private static String hostRoot(String scheme, String address, int port) {
        return port > 0 ? scheme + "://" + address + ":" + port : scheme + "://" + address;
    }

    private static String withTrailingSlash(String url) {
        return stripTrailingSlashes(url) + "/";
    }

    private static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    private static void requireSet(String value, String field) {
        if (!isSet(value)) {
            throw new Tm1ValidationException(field + " must be set for this deployment topology");
        }
    }
}
