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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/// A scheduled sequence of process runs.
///
/// @param startTime RFC 3339 instant, see [ChoreStartTimes]
/// @param dstSensitive keep the local start time across daylight saving changes
/// @param executionMode `SingleCommit` or `MultipleCommit`
/// @param frequency `P{days}DT{hh}H{mm}M{ss}S`
public record Chore(
    @SerializedName("Name") String name,
    @SerializedName("StartTime") String startTime,
    @SerializedName("DSTSensitive") boolean dstSensitive,
    @SerializedName("Active") boolean active,
    @SerializedName("ExecutionMode") String executionMode,
    @SerializedName("Frequency") String frequency,
    @SerializedName("Tasks") List<ChoreTask> tasks
) {

    public static final String SINGLE_COMMIT = "SingleCommit";
    public static final String MULTIPLE_COMMIT = "MultipleCommit";

    public Chore {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public Chore withActive(boolean newActive) {
        return new Chore(name, startTime, dstSensitive, newActive, executionMode, frequency, tasks);
    }

    public boolean hasStartTime() {
        return startTime != null && !startTime.isEmpty();
    }

    /// The scalar properties sent by an update, without tasks.
    public JsonObject propertiesBody() {
        JsonObject body = new JsonObject();
        body.addProperty("Name", name);
        body.addProperty("StartTime", startTime);
        body.addProperty("DSTSensitive", dstSensitive);
        body.addProperty("Active", active);
        body.addProperty("ExecutionMode", executionMode);
        body.addProperty("Frequency", frequency);
        return body;
    }

    /// The entity sent by a create, tasks in request form with their steps.
    public JsonObject createBody() {
        JsonObject body = propertiesBody();
        JsonArray array = new JsonArray();
        for (int i = 0; i < tasks.size(); i++) {
            JsonObject task = tasks.get(i).requestBody();
            task.addProperty("Step", i);
            array.add(task);
        }
        body.add("Tasks", array);
        return body;
    }
}
