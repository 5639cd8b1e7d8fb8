package io.tm1client.services.cubes;

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
import io.tm1client.rest.errors.Tm1HttpException;
import io.tm1client.rest.odata.ODataUrls;
import io.tm1client.rest.version.Tm1Feature;
import io.tm1client.rest.version.VersionGate;
import io.tm1client.services.ODataReplies;
import io.tm1client.services.process.ProcessService;
import io.tm1client.services.security.PrivilegeChecks;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Cube lookups plus the version-gated storage and memory operations.
public class CubeService {
    private final static Logger logger = LogManager.getLogger(CubeService.class);

    /// Dimensions whose names start with this prefix are the sandbox dimension, not part of the
    /// addressable coordinates.
    public static final String SANDBOX_DIMENSION_PREFIX = "Sandboxes";

    private final RestService rest;
    private final PrivilegeChecks privileges;
    private final ProcessService processes;

    public CubeService(RestService rest, PrivilegeChecks privileges, ProcessService processes) {
        this.rest = rest;
        this.privileges = privileges;
        this.processes = processes;
    }

    /// @param skipControlCubes list only model cubes, via `ModelCubes()`
    public List<String> getAllNames(boolean skipControlCubes) {
        String endpoint = skipControlCubes ? "/ModelCubes()?$select=Name" : "/Cubes?$select=Name";
        return ODataReplies.names(rest.json("GET", endpoint, null, JsonObject.class));
    }

    /// @return the cube's dimensions in natural order, without the sandbox dimension
    public List<String> getDimensionNames(String cubeName) {
        String endpoint = ODataUrls.format("/Cubes('{}')/Dimensions?$select=Name", cubeName);
        List<String> names = new ArrayList<>();
        for (String name : ODataReplies.names(rest.json("GET", endpoint, null, JsonObject.class))) {
            if (!name.startsWith(SANDBOX_DIMENSION_PREFIX)) {
                names.add(name);
            }
        }
        return names;
    }

    public boolean exists(String cubeName) {
        try {
            rest.execute("GET", ODataUrls.format("/Cubes('{}')?$select=Name", cubeName), null);
            return true;
        } catch (Tm1HttpException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    public List<String> getStorageDimensionOrder(String cubeName) {
        VersionGate.require(Tm1Feature.STORAGE_DIMENSION_ORDER, rest.version());
        String endpoint = ODataUrls.format("/Cubes('{}')/tm1.DimensionsStorageOrder()?$select=Name", cubeName);
        return ODataReplies.names(rest.json("GET", endpoint, null, JsonObject.class));
    }

    /// Reorders how the cube is stored. The server answers with the relative change in memory
    /// use, in percent.
    public double updateStorageDimensionOrder(String cubeName, List<String> dimensions) {
        VersionGate.require(Tm1Feature.STORAGE_DIMENSION_ORDER, rest.version());
        privileges.requireDataAdmin("update storage dimension order");
        JsonArray bindings = new JsonArray();
        for (String dimension : dimensions) {
            bindings.add("Dimensions('" + ODataUrls.quote(dimension) + "')");
        }
        JsonObject payload = new JsonObject();
        payload.add("Dimensions@odata.bind", bindings);
        JsonObject reply = rest.json("POST", ODataUrls.format("/Cubes('{}')/tm1.ReorderDimensions", cubeName),
            payload, JsonObject.class);
        JsonElement value = reply == null ? null : reply.get("value");
        return value == null || value.isJsonNull() ? 0d : value.getAsDouble();
    }

    public void load(String cubeName) {
        VersionGate.require(Tm1Feature.CUBE_LOAD_UNLOAD, rest.version());
        privileges.requireOpsAdmin("load cube");
        logger.debug("loading cube {}", cubeName);
        rest.execute("POST", ODataUrls.format("/Cubes('{}')/tm1.Load", cubeName), null);
    }

    public void unload(String cubeName) {
        VersionGate.require(Tm1Feature.CUBE_LOAD_UNLOAD, rest.version());
        privileges.requireOpsAdmin("unload cube");
        logger.debug("unloading cube {}", cubeName);
        rest.execute("POST", ODataUrls.format("/Cubes('{}')/tm1.Unload", cubeName), null);
    }

    public void lock(String cubeName) {
        rest.execute("POST", ODataUrls.format("/Cubes('{}')/tm1.Lock", cubeName), null);
    }

    public void unlock(String cubeName) {
        rest.execute("POST", ODataUrls.format("/Cubes('{}')/tm1.Unlock", cubeName), null);
    }

    /// Writes the cube's pending changes to disk with `CubeSaveData`.
    public void saveData(String cubeName) {
        processes.runOrFail("save data of cube " + cubeName, "CubeSaveData('" + ODataUrls.quote(cubeName) + "');");
    }
}
