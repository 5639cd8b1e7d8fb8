package io.tm1client.services.security;

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
import io.tm1client.rest.RestService;
import io.tm1client.rest.errors.Tm1PrivilegeException;
import io.tm1client.rest.errors.Tm1TransportException;

/// Looks up the active user and refuses operations it is not entitled to.
///
/// The user is read fresh on every check, since impersonation can change it between calls.
public class PrivilegeChecks {

    public static final String ACTIVE_USER_ENDPOINT = "/ActiveUser";

    private final RestService rest;

    public PrivilegeChecks(RestService rest) {
        this.rest = rest;
    }

    public ActiveUser activeUser() {
        JsonObject json = rest.json("GET", ACTIVE_USER_ENDPOINT, null, JsonObject.class);
        if (json == null) {
            throw new Tm1TransportException("empty response from " + ACTIVE_USER_ENDPOINT);
        }
        return ActiveUser.fromJson(json);
    }

    public ActiveUser requireAdmin(String operation) {
        ActiveUser user = activeUser();
        if (!user.hasAdminPrivilege()) {
            throw new Tm1PrivilegeException(operation, ActiveUser.TYPE_ADMIN, user.type());
        }
        return user;
    }

    public ActiveUser requireDataAdmin(String operation) {
        ActiveUser user = activeUser();
        if (!user.hasDataAdminPrivilege()) {
            throw new Tm1PrivilegeException(operation, ActiveUser.TYPE_DATA_ADMIN, user.type());
        }
        return user;
    }

    public ActiveUser requireOpsAdmin(String operation) {
        ActiveUser user = activeUser();
        if (!user.hasOpsAdminPrivilege()) {
            throw new Tm1PrivilegeException(operation, ActiveUser.TYPE_OPERATIONS_ADMIN, user.type());
        }
        return user;
    }
}
