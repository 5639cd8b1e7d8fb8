package io.tm1client.services;

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

import io.tm1client.rest.RequestOption;
import io.tm1client.rest.RestOption;
import io.tm1client.rest.RestService;
import io.tm1client.rest.config.Tm1Config;
import io.tm1client.services.batch.BatchService;
import io.tm1client.services.cells.CellService;
import io.tm1client.services.chores.ChoreService;
import io.tm1client.services.cubes.CubeService;
import io.tm1client.services.files.FileService;
import io.tm1client.services.jobs.JobService;
import io.tm1client.services.process.ProcessService;
import io.tm1client.services.security.ActiveUser;
import io.tm1client.services.security.PrivilegeChecks;
import io.tm1client.services.server.ServerService;
import io.tm1client.services.threads.ThreadService;
import okhttp3.Response;

/// Entry point to one TM1 server: a [RestService] and every service built on it.
///
/// ```java
/// try (Tm1Service tm1 = Tm1Service.connect(Tm1Config.builder()
///         .address("localhost").port(8010).user("admin").password("apple").build())) {
///     Map<String, Map<String, CellProperty>> cells =
///         tm1.cells().executeMdx("SELECT {[Year].[2025]} ON 0 FROM [Sales]", List.of(), null);
/// }
/// ```
///
/// Nothing is sent until the first call. Closing the service logs out unless the configuration
/// keeps the session alive.
public class Tm1Service implements AutoCloseable {

    private final RestService rest;
    private final PrivilegeChecks privileges;
    private final ProcessService processes;
    private final BatchService batch;
    private final CubeService cubes;
    private final CellService cells;
    private final ChoreService chores;
    private final ServerService server;
    private final JobService jobs;
    private final ThreadService threads;
    private final FileService files;

    public Tm1Service(RestService rest) {
        this.rest = rest;
        this.privileges = new PrivilegeChecks(rest);
        this.processes = new ProcessService(rest);
        this.batch = new BatchService(rest);
        this.cubes = new CubeService(rest, privileges, processes);
        this.cells = new CellService(rest, cubes, batch, processes);
        this.chores = new ChoreService(rest);
        this.server = new ServerService(rest, privileges, processes);
        this.jobs = new JobService(rest);
        this.threads = new ThreadService(rest);
        this.files = new FileService(rest);
    }

    public static Tm1Service connect(Tm1Config config, RestOption... options) {
        return new Tm1Service(new RestService(config, options));
    }

    public RestService rest() {
        return rest;
    }

    public CellService cells() {
        return cells;
    }

    public ChoreService chores() {
        return chores;
    }

    public BatchService batch() {
        return batch;
    }

    public CubeService cubes() {
        return cubes;
    }

    public ProcessService processes() {
        return processes;
    }

    public ServerService server() {
        return server;
    }

    public JobService jobs() {
        return jobs;
    }

    public ThreadService threads() {
        return threads;
    }

    public FileService files() {
        return files;
    }

    public PrivilegeChecks privileges() {
        return privileges;
    }

    public String version() {
        return rest.version();
    }

    public ActiveUser whoAmI() {
        return privileges.activeUser();
    }

    /// @return the service's CSDL document from `/$metadata`
    public String metadata() {
        return rest.getText("/$metadata", RequestOption.header("Accept", "application/xml"));
    }

    public String sessionId() {
        return rest.sessionId();
    }

    public Response retrieveAsyncResponse(String asyncId) {
        return rest.retrieveAsyncResponse(asyncId);
    }

    public void cancelAsyncOperation(String asyncId) {
        rest.cancelAsyncOperation(asyncId);
    }

    public void logout() {
        rest.logout();
    }

    @Override
    public void close() {
        rest.close();
    }
}
