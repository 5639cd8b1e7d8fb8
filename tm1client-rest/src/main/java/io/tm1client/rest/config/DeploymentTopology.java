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

/// The deployment shapes a TM1 REST endpoint can take.
public enum DeploymentTopology {
    /// `{scheme}://{host}:{port}/api/v1`
    LEGACY,
    /// `https://{host}/api/{tenant}/v0/tm1/{database}`
    SAAS,
    /// `{scheme}://{host}:{port}/{instance}/api/v1/Databases('{database}')`, paired with `.../auth/v1/session`
    NAMED_INSTANCE,
    /// `{scheme}://{host}/tm1/{database}/api/v1`, paired with `{scheme}://{host}/login`
    WORKSPACE_PROXY,
    /// A caller-supplied base URL; the effective shape is inferred from its path
    EXPLICIT_BASE_URL
}
