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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.tm1client.rest.RestService;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.rest.odata.ODataUrls;
import io.tm1client.rest.version.Tm1Feature;
import io.tm1client.rest.version.VersionGate;
import io.tm1client.services.ODataReplies;
import io.tm1client.services.process.ProcessService;
import io.tm1client.services.security.PrivilegeChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Server-wide information and maintenance, and delta tracking of the server logs.
///
/// A delta request is first initialized, which stores the server's `@odata.deltaLink`; every
/// later execution follows the stored link and returns only the entries added since. Delta
/// links are held per log and per service instance.
public class ServerService {
    private final static Logger logger = LogManager.getLogger(ServerService.class);

    public static final Set<String> MESSAGE_LEVELS = Set.of("FATAL", "ERROR", "WARN", "INFO", "DEBUG");

    private static final String API_ROOT = "/api/v1/";

    private final RestService rest;
    private final PrivilegeChecks privileges;
    private final ProcessService processes;
    private final Map<LogTail, String> deltaLinks = new EnumMap<>(LogTail.class);

    public ServerService(RestService rest, PrivilegeChecks privileges, ProcessService processes) {
        this.rest = rest;
        this.privileges = privileges;
        this.processes = processes;
    }

    public String productVersion() {
        return rest.getText("/Configuration/ProductVersion/$value").trim();
    }

    public String serverName() {
        return rest.getText("/Configuration/ServerName/$value").trim();
    }

    /// Starts tracking a log. Entries already in the log are skipped.
    ///
    /// @param filter an OData filter on the entries, or null
    public void initializeDeltaRequests(LogTail log, String filter) {
        VersionGate.require(log.feature(), rest.version());
        String endpoint = log.endpoint();
        if (filter != null && !filter.isBlank()) {
            endpoint += "?$filter=" + ODataUrls.encode(filter);
        }
        JsonObject reply = rest.json("GET", endpoint, null, JsonObject.class);
        store(log, reply);
    }

    /// @return the entries added since the previous call or the initialization
    /// @throws Tm1ValidationException when the log was not initialized
    public List<JsonObject> executeDeltaRequest(LogTail log) {
        String link;
        synchronized (deltaLinks) {
            link = deltaLinks.get(log);
        }
        if (link == null || link.isBlank()) {
            throw new Tm1ValidationException(log.name().toLowerCase(Locale.ROOT).replace('_', ' ')
                + " delta request is not initialized");
        }
        JsonObject reply = rest.json("GET", "/" + link, null, JsonObject.class);
        store(log, reply);
        List<JsonObject> entries = new ArrayList<>();
        for (JsonElement entry : ODataReplies.entries(reply)) {
            if (entry.isJsonObject()) {
                entries.add(entry.getAsJsonObject());
            }
        }
        logger.debug("{} delta returned {} entries", log, entries.size());
        return entries;
    }

    public void initializeTransactionLogDeltaRequests(String filter) {
        initializeDeltaRequests(LogTail.TRANSACTION_LOG, filter);
    }

    public List<JsonObject> executeTransactionLogDeltaRequest() {
        return executeDeltaRequest(LogTail.TRANSACTION_LOG);
    }

    public void initializeMessageLogDeltaRequests(String filter) {
        initializeDeltaRequests(LogTail.MESSAGE_LOG, filter);
    }

    public List<JsonObject> executeMessageLogDeltaRequest() {
        return executeDeltaRequest(LogTail.MESSAGE_LOG);
    }

    public void initializeAuditLogDeltaRequests(String filter) {
        initializeDeltaRequests(LogTail.AUDIT_LOG, filter);
    }

    public List<JsonObject> executeAuditLogDeltaRequest() {
        return executeDeltaRequest(LogTail.AUDIT_LOG);
    }

    /// Reads audit log entries with their details.
    public List<JsonObject> getAuditLogEntries(AuditLogQuery query) {
        VersionGate.require(Tm1Feature.AUDIT_LOG, rest.version());
        privileges.requireDataAdmin("read audit log");
        StringBuilder endpoint = new StringBuilder("/AuditLogEntries?$expand=AuditDetails");
        String filter = query.filter();
        if (!filter.isEmpty()) {
            endpoint.append("&$filter=").append(ODataUrls.encode(filter));
        }
        if (query.top() > 0) {
            endpoint.append("&$top=").append(query.top());
        }
        List<JsonObject> entries = new ArrayList<>();
        for (JsonElement entry : ODataReplies.entries(rest.json("GET", endpoint.toString(), null, JsonObject.class))) {
            entries.add(entry.getAsJsonObject());
        }
        return entries;
    }

    /// Writes a line to the server's message log through `LogOutput`.
    ///
    /// @param level one of [#MESSAGE_LEVELS], case-insensitive
    public void writeToMessageLog(String level, String message) {
        String normalized = level == null ? "" : level.trim().toUpperCase(Locale.ROOT);
        if (!MESSAGE_LEVELS.contains(normalized)) {
            throw new Tm1ValidationException("invalid message level: " + level);
        }
        privileges.requireDataAdmin("write to message log");
        processes.runOrFail("write to message log",
            "LogOutput('" + normalized + "', '" + ODataUrls.quote(message) + "');");
    }

    /// Persists all cubes with `SaveDataAll`.
    public void saveData() {
        VersionGate.require(Tm1Feature.SAVE_DATA, rest.version());
        privileges.requireDataAdmin("save data");
        processes.runOrFail("SaveDataAll", "SaveDataAll;");
    }

    public void deletePersistentFeeders() {
        VersionGate.require(Tm1Feature.DELETE_PERSISTENT_FEEDERS, rest.version());
        privileges.requireAdmin("delete persistent feeders");
        processes.runOrFail("DeleteAllPersistentFeeders", "DeleteAllPersistentFeeders;");
    }

    private void store(LogTail log, JsonObject reply) {
        String link = deltaLink(reply);
        synchronized (deltaLinks) {
            deltaLinks.put(log, link);
        }
    }

    /// The part of `@odata.deltaLink` after `/api/v1/`, or the whole link without a leading `/`.
    static String deltaLink(JsonObject reply) {
        JsonElement raw = reply == null ? null : reply.get("@odata.deltaLink");
        if (raw == null || !raw.isJsonPrimitive()) {
            return "";
        }
        String link = raw.getAsString().trim();
        int at = link.indexOf(API_ROOT);
        if (at >= 0) {
            link = link.substring(at + API_ROOT.length());
        }
        while (link.startsWith("/")) {
            link = link.substring(1);
        }
        return link;
    }
}
