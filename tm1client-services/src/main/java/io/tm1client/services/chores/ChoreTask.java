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
import io.tm1client.rest.SHARED;
import io.tm1client.rest.odata.ODataUrls;

import java.util.List;

/// One step of a chore.
///
/// The server reports the process as an expanded `Process` object; requests refer to it with a
/// `Process@odata.bind` reference. [#processName()] reads either.
///
/// @param step the 0-based position within the chore
/// @param process the expanded process, present on tasks read from the server
/// @param processBinding `Processes('name')`, present on tasks built for a request
/// @param parameters process parameters in order
public record ChoreTask(
    @SerializedName("Step") int step,
    @SerializedName("Process") ProcessRef process,
    @SerializedName("Process@odata.bind") String processBinding,
    @SerializedName("Parameters") List<ChoreTaskParameter> parameters
) {

    private static final String BINDING_PREFIX = "Processes('";
    private static final String BINDING_SUFFIX = "')";

    public ChoreTask {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public static ChoreTask of(int step, String processName, List<ChoreTaskParameter> parameters) {
        return new ChoreTask(step, null, BINDING_PREFIX + ODataUrls.quote(processName) + BINDING_SUFFIX, parameters);
    }

    public String processName() {
        if (process != null && process.name() != null && !process.name().isEmpty()) {
            return process.name();
        }
        if (processBinding == null) {
            return "";
        }
        if (processBinding.startsWith(BINDING_PREFIX) && processBinding.endsWith(BINDING_SUFFIX)
            && processBinding.length() >= BINDING_PREFIX.length() + BINDING_SUFFIX.length()) {
            return processBinding.substring(BINDING_PREFIX.length(), processBinding.length() - BINDING_SUFFIX.length())
                .replace("''", "'");
        }
        return processBinding;
    }

    public ChoreTask withStep(int newStep) {
        return new ChoreTask(newStep, process, processBinding, parameters);
    }

    /// `{"Process@odata.bind": "Processes('name')", "Parameters": [...]}`
    public JsonObject requestBody() {
        JsonObject body = new JsonObject();
        body.addProperty("Process@odata.bind", BINDING_PREFIX + ODataUrls.quote(processName()) + BINDING_SUFFIX);
        JsonArray values = new JsonArray();
        for (ChoreTaskParameter parameter : parameters) {
            JsonObject value = new JsonObject();
            value.addProperty("Name", parameter.name());
            value.add("Value", SHARED.gson.toJsonTree(parameter.value()));
            values.add(value);
        }
        body.add("Parameters", values);
        return body;
    }

    /// Same process, same parameter names and the same parameter values by [ChoreTaskParameter#valueText()].
    /// The step is not compared.
    public boolean matches(ChoreTask other) {
        if (!processName().equals(other.processName()) || parameters.size() != other.parameters.size()) {
            return false;
        }
        for (int i = 0; i < parameters.size(); i++) {
            ChoreTaskParameter mine = parameters.get(i);
            ChoreTaskParameter theirs = other.parameters.get(i);
            if (!String.valueOf(mine.name()).equals(String.valueOf(theirs.name()))
                || !mine.valueText().equals(theirs.valueText())) {
                return false;
            }
        }
        return true;
    }

    public record ProcessRef(@SerializedName("Name") String name) {
    }
}
