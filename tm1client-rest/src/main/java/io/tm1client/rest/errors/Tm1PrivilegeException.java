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

/// The active user lacks the role a privileged operation requires.
public class Tm1PrivilegeException extends Tm1Exception {

    private final String operation;
    private final String requiredPrivilege;
    private final String userType;

    public Tm1PrivilegeException(String operation, String requiredPrivilege, String userType) {
        super(String.format("%s requires %s privilege, active user type is %s",
            operation, requiredPrivilege, userType));
        this.operation = operation;
        this.requiredPrivilege = requiredPrivilege;
        this.userType = userType;
    }

    public String getOperation() {
        return operation;
    }

    public String getRequiredPrivilege() {
        return requiredPrivilege;
    }

    public String getUserType() {
        return userType;
    }
}
