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

import io.tm1client.rest.version.Tm1Feature;

/// The server logs that support delta requests, with the function that starts tailing each.
public enum LogTail {

    TRANSACTION_LOG("/TailTransactionLog()", Tm1Feature.TRANSACTION_LOG_TAIL),
    MESSAGE_LOG("/TailMessageLog()", Tm1Feature.MESSAGE_LOG_TAIL),
    AUDIT_LOG("/TailAuditLog()", Tm1Feature.AUDIT_LOG_TAIL);

    private final String endpoint;
    private final Tm1Feature feature;

    LogTail(String endpoint, Tm1Feature feature) {
        this.endpoint = endpoint;
        this.feature = feature;
    }

    public String endpoint() {
        return endpoint;
    }

    public Tm1Feature feature() {
        return feature;
    }
}
