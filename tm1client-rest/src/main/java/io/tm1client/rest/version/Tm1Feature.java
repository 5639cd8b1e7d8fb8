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

/// Server capabilities that only exist on some TM1 versions.
///
/// Each feature carries an inclusive lower bound and an exclusive upper bound; either may be
/// absent. The bounds are the single source of truth for every version check in the client.
public enum Tm1Feature {

    JOBS("Jobs API", "12.0.0", null),
    THREADS("Threads API (threads removed in v12)", null, "12.0.0"),
    SAVE_DATA("SaveData", null, "12.0.0"),
    DELETE_PERSISTENT_FEEDERS("DeletePersistentFeeders", null, "12.0.0"),
    TRANSACTION_LOG_TAIL("Transaction log delta requests", null, "12.0.0"),
    MESSAGE_LOG_TAIL("Message log delta requests", null, "12.0.0"),
    AUDIT_LOG_TAIL("Audit log delta requests", "11.6.0", "12.0.0"),
    AUDIT_LOG("Audit log", "11.6.0", null),
    STORAGE_DIMENSION_ORDER("Storage dimension order", "11.4.0", null),
    CUBE_LOAD_UNLOAD("Cube load/unload", "11.6.0", null),
    FILES_CONTENT_ROOT("Contents('Files')", "12.0.0", null);

    private final String description;
    private final String minInclusive;
    private final String maxExclusive;

    Tm1Feature(String description, String minInclusive, String maxExclusive) {
        this.description = description;
        this.minInclusive = minInclusive;
        this.maxExclusive = maxExclusive;
    }

    public String description() {
        return description;
    }

    public boolean isSupportedBy(String version) {
        if (minInclusive != null && !Tm1Versions.geq(version, minInclusive)) {
            return false;
        }
        return maxExclusive == null || !Tm1Versions.geq(version, maxExclusive);
    }

    /// @return the bound in readable form, for example `>= 11.6.0 and < 12.0.0`
    public String requirement() {
        if (minInclusive != null && maxExclusive != null) {
            return ">= " + minInclusive + " and < " + maxExclusive;
        }
        return minInclusive != null ? ">= " + minInclusive : "< " + maxExclusive;
    }
}
