package io.tm1client.rest.errors;

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

/// A version-gated operation was invoked against a server outside its supported range.
public class Tm1VersionUnsupportedException extends Tm1Exception {

    private final String operation;
    private final String requirement;
    private final String actualVersion;

    public Tm1VersionUnsupportedException(String operation, String requirement, String actualVersion) {
        super(String.format("%s requires TM1 version %s, current version: %s",
            operation, requirement, actualVersion));
        this.operation = operation;
        this.requirement = requirement;
        this.actualVersion = actualVersion;
    }

    public String getOperation() {
        return operation;
    }

    /// @return the bound that was violated, for example `>= 12.0.0`
    public String getRequirement() {
        return requirement;
    }

    public String getActualVersion() {
        return actualVersion;
    }
}
