package io.tm1client.services.chores;

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
import io.tm1client.rest.errors.Tm1HttpException;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.odata.ODataUrls;
import io.tm1client.services.ODataReplies;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Chore lookup, creation, update and activation.
 * <p>
 * The server refuses most changes to an active chore, so {@link #update(Chore)} and
 * {@link #setLocalStartTime(String, OffsetDateTime)} run inside
 * {@link #withDeactivated(String, Boolean, Runnable)}: the chore is deactivated when it was
 * active, the change is applied, and the chore is activated again afterwards, also when the
 * change failed.
 */
public class ChoreService {
    private final static Logger logger = LogManager.getLogger(ChoreService.class);

    static final String TASKS_EXPAND = "*,Process($select=Name),Chore($select=Name)";
    static final String CHORE_EXPAND = "Tasks($expand=" + TASKS_EXPAND + ")";

    private final RestService rest;

    public ChoreService(RestService rest) {
        this.rest = rest;
    }

    public Chore get(String choreName) {
        Chore chore = rest.json("GET", entity(choreName) + "?$expand=" + CHORE_EXPAND, null, Chore.class);
        if (chore == null) {
            throw new Tm1TransportException("empty response for chore " + choreName);
        }
        return chore;
    }

    public List<Chore> getAll() {
        return chores("/Chores?$expand=" + CHORE_EXPAND);
    }

    public List<String> getAllNames() {
        return ODataReplies.names(rest.json("GET", "/Chores?$select=Name", null, JsonObject.class));
    }

    public boolean exists(String choreName) {
        try {
            rest.execute("GET", entity(choreName) + "?$select=Name", null);
            return true;
        } catch (Tm1HttpException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    /// Chores with a task running the process. Names compare without case or spaces.
    public List<Chore> searchForProcessName(String processName) {
        String normalized = processName.toLowerCase(Locale.ROOT).replace(" ", "");
        String filter = "Tasks/any(t: replace(tolower(t/Process/Name), ' ', '') eq '"
            + ODataUrls.quote(normalized) + "')";
        return chores("/Chores?$filter=" + ODataUrls.encode(filter) + "&$expand=" + CHORE_EXPAND);
    }

    /// Chores with a string parameter value containing `value`, ignoring case.
    public List<Chore> searchForParameterValue(String value) {
        String needle = value.toLowerCase(Locale.ROOT);
        String filter = "Tasks/any(t: t/Parameters/any(p: isof(p/Value, Edm.String) and contains(tolower(p/Value), '"
            + ODataUrls.quote(needle) + "')))";
        return chores("/Chores?$filter=" + ODataUrls.encode(filter) + "&$expand=" + CHORE_EXPAND);
    }

    /// Creates the chore, then sets its local start time when it is DST sensitive, then
    /// activates it when asked to.
    public void create(Chore chore) {
        rest.execute("POST", "/Chores", chore.createBody());
        if (chore.dstSensitive() && chore.hasStartTime()) {
            setLocalStartTime(chore.name(), ChoreStartTimes.parse(chore.startTime()));
        }
        if (chore.active()) {
            activate(chore.name());
        }
    }

    public void delete(String choreName) {
        rest.execute("DELETE", entity(choreName), null);
    }

    public void updateOrCreate(Chore chore) {
        if (exists(chore.name())) {
            update(chore);
        } else {
            create(chore);
        }
    }

    /// Brings the chore on the server in line with `chore`.
    ///
    /// Properties are patched first. Tasks are then compared position by position: missing
    /// positions are added, differing ones patched, and surplus ones deleted from the tail. The
    /// chore ends up active exactly when `chore.active()` is set.
    public void update(Chore chore) {
        String name = chore.name();
        withDeactivated(name, chore.active(), () -> {
            rest.execute("PATCH", entity(name), chore.propertiesBody());

            int oldCount = taskCount(name);
            List<ChoreTask> tasks = chore.tasks();
            for (int i = 0; i < tasks.size(); i++) {
                ChoreTask desired = tasks.get(i);
                if (i >= oldCount) {
                    rest.execute("POST", entity(name) + "/Tasks", desired.requestBody());
                    continue;
                }
                ChoreTask existing = task(name, i);
                if (!desired.matches(existing)) {
                    logger.debug("task {} of chore {} changed", i, name);
                    JsonObject body = desired.withStep(i).requestBody();
                    rest.execute("PATCH", entity(name) + "/Tasks(" + i + ")", body);
                }
            }
            // the server renumbers after each delete, so the tail index stays the same
            for (int j = tasks.size(); j < oldCount; j++) {
                rest.execute("DELETE", entity(name) + "/Tasks(" + tasks.size() + ")", null);
            }

            if (chore.dstSensitive() && chore.hasStartTime()) {
                postLocalStartTime(name, ChoreStartTimes.parse(chore.startTime()));
            }
        });
    }

    public void activate(String choreName) {
        rest.execute("POST", entity(choreName) + "/tm1.Activate", null);
    }

    public void deactivate(String choreName) {
        rest.execute("POST", entity(choreName) + "/tm1.Deactivate", null);
    }

    public void executeChore(String choreName) {
        rest.execute("POST", entity(choreName) + "/tm1.Execute", null);
    }

    /// Sets the start time in server local time, keeping the chore's active state.
    public void setLocalStartTime(String choreName, OffsetDateTime startTime) {
        withDeactivated(choreName, null, () -> postLocalStartTime(choreName, startTime));
    }

    /// Runs `body` with the chore deactivated.
    ///
    /// The chore is deactivated only when it is active now, and activated afterwards when
    /// `reactivate` is true, or when `reactivate` is null and it was active before. When `body`
    /// fails and activation fails too, the activation failure is attached to the body's failure
    /// as suppressed. When only activation fails, that failure is thrown.
    public void withDeactivated(String choreName, Boolean reactivate, Runnable body) {
        boolean wasActive = get(choreName).active();
        boolean activateAfter = reactivate != null ? reactivate : wasActive;
        if (wasActive) {
            deactivate(choreName);
        }
        Throwable failure = null;
        try {
            body.run();
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } finally {
            if (activateAfter) {
                try {
                    activate(choreName);
                } catch (RuntimeException e) {
                    if (failure == null) {
                        throw e;
                    }
                    logger.warn("reactivating chore {} failed after an earlier failure: {}", choreName,
                        e.getMessage());
                    failure.addSuppressed(e);
                }
            }
        }
    }

    private void postLocalStartTime(String choreName, OffsetDateTime startTime) {
        rest.execute("POST", entity(choreName) + "/tm1.SetServerLocalStartTime",
            ChoreStartTimes.localStartTimeBody(startTime));
    }

    private int taskCount(String choreName) {
        String text = rest.getText(entity(choreName) + "/Tasks/$count").trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new Tm1TransportException("task count of chore " + choreName + " is not a number: " + text, e);
        }
    }

    private ChoreTask task(String choreName, int step) {
        ChoreTask task = rest.json("GET", entity(choreName) + "/Tasks(" + step + ")?$expand=" + TASKS_EXPAND,
            null, ChoreTask.class);
        if (task == null) {
            throw new Tm1TransportException("empty response for task " + step + " of chore " + choreName);
        }
        return task;
    }

    private List<Chore> chores(String endpoint) {
        return ODataReplies.values(rest.json("GET", endpoint, null, JsonObject.class), Chore.class);
    }

    private static String entity(String choreName) {
        return ODataUrls.format("/Chores('{}')", choreName);
    }
}
