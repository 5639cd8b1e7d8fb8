package io.tm1client.jettyfake;

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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * A test fixture that starts a Jetty web server pretending to be a TM1 REST endpoint.
 * <p>
 * Replies are scripted per method and path with {@link #on(String, String, FakeRoute)}. Every
 * request is recorded in arrival order, so tests can assert the exact wire trace a client
 * operation produced. Requests with no matching route get a 404 with an OData-style error body.
 * <p>
 * Example usage:
 * ```java
 * try (FakeTm1Server server = new FakeTm1Server()) {
 *     server.start();
 *     server.on("GET", "/Configuration/ProductVersion/$value", FakeReply.text("11.8.02500.3"));
 *     String baseUrl = server.getApiUrl();
 *     // point a client at baseUrl
 * }
 * ```
 */
public class FakeTm1Server implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(FakeTm1Server.class);

    public static final String DEFAULT_API_ROOT = "/api/v1";

    private final String apiRoot;
    private final Map<String, FakeRoute> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private Server server;
    private int port;

    public FakeTm1Server() {
        this(DEFAULT_API_ROOT);
    }

    /// @param apiRoot the path prefix stripped from recorded paths, for example `/api/v1`
    public FakeTm1Server(String apiRoot) {
        this.apiRoot = apiRoot;
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder("tm1", new ScriptedServlet()), "/*");
        server.setHandler(context);

        try {
            server.start();
            logger.info("Fake TM1 server started on port {}", port);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /// @return `http://127.0.0.1:{port}/`
    public String getBaseUrl() {
        return "http://127.0.0.1:" + port + "/";
    }

    /// @return the base URL including the API root, for example `http://127.0.0.1:{port}/api/v1`
    public String getApiUrl() {
        return "http://127.0.0.1:" + port + apiRoot;
    }

    public int getPort() {
        return port;
    }

    /// Registers a route. A later registration for the same method and path replaces the earlier one.
    public FakeTm1Server on(String method, String path, FakeRoute route) {
        routes.put(key(method, path), route);
        return this;
    }

    public FakeTm1Server on(String method, String path, FakeReply reply) {
        return on(method, path, request -> reply);
    }

    /// @return every request received since the last [#reset()], in arrival order
    public List<RecordedRequest> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    /// @return `METHOD path` for every recorded request, in arrival order
    public List<String> trace() {
        return requests.stream().map(RecordedRequest::traceLine).collect(Collectors.toList());
    }

    /// @return recorded requests that match method and path
    public List<RecordedRequest> requests(String method, String path) {
        return requests.stream()
            .filter(r -> r.method().equals(method) && r.path().equals(path))
            .collect(Collectors.toList());
    }

    /// Forgets all routes and recorded requests.
    public void reset() {
        routes.clear();
        requests.clear();
    }

    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Fake TM1 server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
        }
    }

    private static String key(String method, String path) {
        return method.toUpperCase(Locale.ROOT) + " " + path;
    }

    private static String decode(String raw) {
        return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private RecordedRequest record(HttpServletRequest req) throws IOException {
        String path = decode(req.getRequestURI());
        if (path.startsWith(apiRoot)) {
            path = path.substring(apiRoot.length());
            if (path.isEmpty()) {
                path = "/";
            }
        }
        String query = req.getQueryString() == null ? null : decode(req.getQueryString());

        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(req.getHeaderNames())) {
            headers.put(name.toLowerCase(Locale.ROOT), Collections.list(req.getHeaders(name)));
        }
        String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        return new RecordedRequest(req.getMethod().toUpperCase(Locale.ROOT), path, query, headers, body);
    }

    private class ScriptedServlet extends HttpServlet {
        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            RecordedRequest request = record(req);
            requests.add(request);
            logger.debug("fake tm1 <- {}", request);

            FakeRoute route = routes.get(key(request.method(), request.path()));
            FakeReply reply = route != null
                ? route.respond(request)
                : FakeReply.json(404, "{\"error\":{\"code\":\"278\",\"message\":\"Resource not found: "
                    + request.path().replace("\"", "'") + "\"}}");

            resp.setStatus(reply.status());
            reply.headers().forEach(resp::addHeader);
            byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
            if (bytes.length > 0) {
                resp.setContentLength(bytes.length);
                resp.getOutputStream().write(bytes);
            }
        }
    }

    private static int findAvailablePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
