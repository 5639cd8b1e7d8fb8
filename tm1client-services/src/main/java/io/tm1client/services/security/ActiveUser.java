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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// The user behind the current session, as reported by `GET /ActiveUser`.
///
/// Fields the client does not model are kept in [#extensions()] so that nothing the server sends
/// is lost.
///
/// @param name the user name
/// @param friendlyName the display name, may be null
/// @param type one of `User`, `SecurityAdmin`, `DataAdmin`, `OperationsAdmin`, `Admin`
/// @param dataAdmin the server's `IsDataAdmin` flag
/// @param securityAdmin the server's `IsSecurityAdmin` flag
/// @param opsAdmin the server's `IsOpsAdmin` flag
/// @param sandboxingDisabled the server's `SandboxingDisabled` flag
/// @param extensions every other top-level field, by name
public record ActiveUser(
    String name,
    String friendlyName,
    String type,
    boolean dataAdmin,
    boolean securityAdmin,
    boolean opsAdmin,
    boolean sandboxingDisabled,
    Map<String, JsonElement> extensions
) {

    public static final String TYPE_ADMIN = "Admin";
    public static final String TYPE_DATA_ADMIN = "DataAdmin";
    public static final String TYPE_SECURITY_ADMIN = "SecurityAdmin";
    public static final String TYPE_OPERATIONS_ADMIN = "OperationsAdmin";

    private static final Set<String> KNOWN = Set.of("Name", "FriendlyName", "Type", "IsDataAdmin",
        "IsSecurityAdmin", "IsOpsAdmin", "SandboxingDisabled");

    public ActiveUser {
        type = type == null ? "" : type.trim();
        extensions = extensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static ActiveUser fromJson(JsonObject json) {
        Map<String, JsonElement> extra = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            if (!KNOWN.contains(entry.getKey())) {
                extra.put(entry.getKey(), entry.getValue());
            }
        }
        return new ActiveUser(
            string(json, "Name"),
            string(json, "FriendlyName"),
            string(json, "Type"),
            flag(json, "IsDataAdmin"),
            flag(json, "IsSecurityAdmin"),
            flag(json, "IsOpsAdmin"),
            flag(json, "SandboxingDisabled"),
            extra);
    }

    public boolean hasAdminPrivilege() {
        return isType(TYPE_ADMIN);
    }

    public boolean hasDataAdminPrivilege() {
        return isType(TYPE_ADMIN) || isType(TYPE_DATA_ADMIN) || dataAdmin;
    }

    public boolean hasSecurityAdminPrivilege() {
        return isType(TYPE_ADMIN) || isType(TYPE_SECURITY_ADMIN) || securityAdmin;
    }

    public boolean hasOpsAdminPrivilege() {
        return isType(TYPE_ADMIN) || isType(TYPE_OPERATIONS_ADMIN) || opsAdmin;
    }

    private boolean isType(String expected) {
        return type.toLowerCase(Locale.ROOT).equals(expected.toLowerCase(Locale.ROOT));
    }

    private static String string(JsonObject json, String field) {
        JsonElement value = json.get(field);
        return value == null || value.isJsonNull() ? null : value.getAsString();
    }

    private static boolean flag(JsonObject json, String field) {
        JsonElement value = json.get(field);
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()
            && value.getAsBoolean();
    }
}
