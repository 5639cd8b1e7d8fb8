package io.tm1client.rest.version;

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

import io.tm1client.rest.errors.Tm1VersionUnsupportedException;

/// Raises [Tm1VersionUnsupportedException] before a gated request is sent.
public final class VersionGate {

    private VersionGate() {
    }

    public static void require(Tm1Feature feature, String version) {
        if (!feature.isSupportedBy(version)) {
            throw new Tm1VersionUnsupportedException(feature.description(), feature.requirement(), version);
        }
    }

    public static void requireAtLeast(String operation, String minimum, String version) {
        if (!Tm1Versions.geq(version, minimum)) {
            throw new Tm1VersionUnsupportedException(operation, ">= " + minimum, version);
        }
    }
}
