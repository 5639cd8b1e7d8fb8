package io.tm1client.services.server;

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

import java.util.ArrayList;
import java.util.List;

/// Filters for [ServerService#getAuditLogEntries(AuditLogQuery)]. Null or empty fields, and a
/// `top` of 0 or less, are left out.
///
/// @param since an OData timestamp literal, for example `2025-01-01T00:00:00Z`
/// @param until an OData timestamp literal
public record AuditLogQuery(
    String user,
    String objectType,
    String objectName,
    String since,
    String until,
    int top
) {

    public static AuditLogQuery all() {
        return new AuditLogQuery(null, null, null, null, null, 0);
    }

    /// The `$filter` expression, empty when no field is set.
    public String filter() {
        List<String> terms = new ArrayList<>();
        addEquals(terms, "UserName", user);
        addEquals(terms, "ObjectType", objectType);
        addEquals(terms, "ObjectName", objectName);
        if (since != null && !since.isEmpty()) {
            terms.add("TimeStamp ge " + since);
        }
        if (until != null && !until.isEmpty()) {
            terms.add("TimeStamp le " + until);
        }
        return String.join(" and ", terms);
    }

    private static void addEquals(List<String> terms, String field, String value) {
        if (value != null && !value.isEmpty()) {
            terms.add(field + " eq '" + value.replace("'", "''") + "'");
        }
    }
}
