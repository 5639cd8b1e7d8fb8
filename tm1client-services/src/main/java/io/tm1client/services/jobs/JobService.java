package io.tm1client.services.jobs;

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

/// Running jobs on v12 servers, where they replace threads.
public class JobService {
    private final static Logger logger = LogManager.getLogger(JobService.class);

    private final RestService rest;

    public JobService(RestService rest) {
        this.rest = rest;
    }

    public List<JsonObject> getAll() {
        VersionGate.require(Tm1Feature.JOBS, rest.version());
        List<JsonObject> jobs = new ArrayList<>();
        for (JsonElement entry : ODataReplies.entries(rest.json("GET", "/Jobs", null, JsonObject.class))) {
            jobs.add(entry.getAsJsonObject());
        }
        return jobs;
    }

    public void cancel(String jobId) {
        VersionGate.require(Tm1Feature.JOBS, rest.version());
        rest.execute("POST", ODataUrls.format("/Jobs('{}')/tm1.Cancel", jobId), null);
    }

    /// Cancels every job listed at the time of the call. The first failure stops the sweep.
    ///
    /// @return the jobs that were cancelled
    public List<JsonObject> cancelAll() {
        List<JsonObject> cancelled = new ArrayList<>();
        for (JsonObject job : getAll()) {
            cancel(job.get("ID").getAsString());
            cancelled.add(job);
        }
        logger.debug("cancelled {} jobs", cancelled.size());
        return cancelled;
    }
}
