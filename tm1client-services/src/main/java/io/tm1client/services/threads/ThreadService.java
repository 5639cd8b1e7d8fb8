package io.tm1client.services.threads;

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
import io.tm1client.rest.odata.ODataUrls;
import io.tm1client.rest.version.Tm1Feature;
import io.tm1client.rest.version.VersionGate;
import io.tm1client.services.ODataReplies;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Server threads on servers before v12.
public class ThreadService {
    private final static Logger logger = LogManager.getLogger(ThreadService.class);

    public static final String ACTIVE_FILTER = "Function ne 'GET /Threads' and State ne 'Idle'";

    private static final Set<String> OWN_FUNCTIONS = Set.of("GET /Threads", "GET /api/v1/Threads");

    private final RestService rest;

    public ThreadService(RestService rest) {
        this.rest = rest;
    }

    public List<JsonObject> getAll() {
        VersionGate.require(Tm1Feature.THREADS, rest.version());
        return threads("/Threads");
    }

    /// @return threads that are neither idle nor the listing request itself
    public List<JsonObject> getActive() {
        VersionGate.require(Tm1Feature.THREADS, rest.version());
        return threads("/Threads?$filter=" + ODataUrls.encode(ACTIVE_FILTER));
    }

    public void cancel(long threadId) {
        VersionGate.require(Tm1Feature.THREADS, rest.version());
        rest.execute("POST", ODataUrls.format("/Threads('{}')/tm1.CancelOperation", threadId), null);
    }

    /// Cancels every thread that is doing user work. Idle, system and pseudo threads are left
    /// alone, as is the thread serving the listing.
    ///
    /// @return the threads that were cancelled
    public List<JsonObject> cancelAllRunning() {
        List<JsonObject> cancelled = new ArrayList<>();
        for (JsonObject thread : getAll()) {
            if ("Idle".equals(text(thread, "State")) || "System".equals(text(thread, "Type"))
                || "Pseudo".equals(text(thread, "Name")) || OWN_FUNCTIONS.contains(text(thread, "Function"))) {
                continue;
            }
            JsonElement id = thread.get("ID");
            if (id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isNumber()) {
                continue;
            }
            cancel(id.getAsLong());
            cancelled.add(thread);
        }
        logger.debug("cancelled {} threads", cancelled.size());
        return cancelled;
    }

    private List<JsonObject> threads(String endpoint) {
        List<JsonObject> threads = new ArrayList<>();
        for (JsonElement entry : ODataReplies.entries(rest.json("GET", endpoint, null, JsonObject.class))) {
            threads.add(entry.getAsJsonObject());
        }
        return threads;
    }

    private static String text(JsonObject thread, String field) {
        JsonElement value = thread.get(field);
        return value == null || value.isJsonNull() ? "" : value.getAsString();
    }
}
