package io.tm1client.services.process;

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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.tm1client.rest.RestService;
import io.tm1client.rest.SHARED;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.rest.odata.ODataUrls;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/// Runs TurboIntegrator code, either as an unbound process or as a named one.
public class ProcessService {
    private final static Logger logger = LogManager.getLogger(ProcessService.class);

    public static final String EXECUTE_UNBOUND_ENDPOINT = "/ExecuteProcessWithReturn?$expand=*";

    private final RestService rest;

    public ProcessService(RestService rest) {
        this.rest = rest;
    }

    /// Runs code that does not belong to any stored process.
    ///
    /// @param prolog the prolog procedure, may be empty
    /// @param epilog the epilog procedure, may be empty
    public ProcessExecuteResult executeTiCode(String prolog, String epilog) {
        JsonObject payload = new JsonObject();
        payload.add("Process", unboundProcess(prolog, epilog));
        logger.debug("executing unbound TI code");
        return decode(rest.json("POST", EXECUTE_UNBOUND_ENDPOINT, payload, JsonObject.class));
    }

    /// Runs a stored process with `tm1.ExecuteWithReturn`. Parameters are sent in map order.
    public ProcessExecuteResult executeWithReturn(String processName, Map<String, ?> parameters) {
        JsonArray values = new JsonArray();
        parameters.forEach((name, value) -> {
            JsonObject parameter = new JsonObject();
            parameter.addProperty("Name", name);
            parameter.add("Value", SHARED.gson.toJsonTree(value));
            values.add(parameter);
        });
        JsonObject payload = new JsonObject();
        payload.add("Parameters", values);
        String endpoint = ODataUrls.format("/Processes('{}')/tm1.ExecuteWithReturn?$expand=*", processName);
        return decode(rest.json("POST", endpoint, payload, JsonObject.class));
    }

    /// Runs unbound prolog code and raises [Tm1ValidationException] unless it completed
    /// successfully.
    public ProcessExecuteResult runOrFail(String operation, String prolog) {
        ProcessExecuteResult result = executeTiCode(prolog, "");
        if (!result.isSuccess()) {
            throw new Tm1ValidationException(operation + " did not complete successfully: status "
                + result.statusCode() + (result.errorLogFile() == null ? "" : ", see " + result.errorLogFile()));
        }
        return result;
    }

    static JsonObject unboundProcess(String prolog, String epilog) {
        JsonObject process = new JsonObject();
        process.addProperty("Name", "");
        process.addProperty("PrologProcedure", prolog == null ? "" : prolog);
        process.addProperty("MetadataProcedure", "");
        process.addProperty("DataProcedure", "");
        process.addProperty("EpilogProcedure", epilog == null ? "" : epilog);
        process.addProperty("HasSecurityAccess", false);
        process.add("Parameters", new JsonArray());
        process.add("Variables", new JsonArray());
        JsonObject dataSource = new JsonObject();
        dataSource.addProperty("Type", "None");
        process.add("DataSource", dataSource);
        return process;
    }

    private static ProcessExecuteResult decode(JsonObject reply) {
        if (reply == null) {
            throw new Tm1TransportException("process execution returned no result");
        }
        JsonElement status = reply.get("ProcessExecuteStatusCode");
        String errorLog = null;
        JsonElement errorLogFile = reply.get("ErrorLogFile");
        if (errorLogFile != null && errorLogFile.isJsonObject()) {
            JsonElement filename = errorLogFile.getAsJsonObject().get("Filename");
            if (filename != null && !filename.isJsonNull()) {
                errorLog = filename.getAsString();
            }
        }
        return new ProcessExecuteResult(status == null || status.isJsonNull() ? null : status.getAsString(), errorLog);
    }
}
