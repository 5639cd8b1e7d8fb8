package io.tm1client.rest;

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

import com.google.gson.JsonParseException;
import io.tm1client.rest.auth.AuthMode;
import io.tm1client.rest.auth.Authentication;
import io.tm1client.rest.config.Tm1Config;
import io.tm1client.rest.config.Tm1Endpoints;
import io.tm1client.rest.errors.Tm1AuthException;
import io.tm1client.rest.errors.Tm1CancelledException;
import io.tm1client.rest.errors.Tm1Exception;
import io.tm1client.rest.errors.Tm1HttpException;
import io.tm1client.rest.errors.Tm1TimeoutException;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.rest.version.Tm1Versions;
import okhttp3.Call;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.lang.reflect.Type;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// The HTTP transport for one TM1 server.
///
/// A `RestService` owns the connection pool, the session cookie jar, the default headers and
/// the authentication provider. Every request goes through the same pipeline:
///
/// 1. resolve the endpoint against the base URL
/// 2. copy the default headers
/// 3. apply credentials, failing with [Tm1AuthException]
/// 4. apply the per-request [RequestOption]s in order
/// 5. hand over to the async protocol when async mode is on for this request
/// 6. send
/// 7. turn a status of 400 or above into [Tm1HttpException], with the body drained up to
///    [Tm1HttpException#MAX_BODY_BYTES]
/// 8. otherwise return the [Response] for the caller to consume and close
///
/// The transport is safe for concurrent use. Nothing is retried unless
/// [Tm1Config#reconnectOnSessionTimeout()] or [Tm1Config#reconnectOnRemoteDisconnect()] is set,
/// and then only GET and HEAD requests are replayed, at most once.
public class RestService implements AutoCloseable {
    private final static Logger defaultLogger = LogManager.getLogger(RestService.class);

    public static final String USER_AGENT = "tm1client-java";
    public static final String CONTENT_TYPE = "application/json; odata.streaming=true; charset=utf-8";
    public static final String ACCEPT = "application/json;odata.metadata=none,text/plain";
    public static final String SESSION_COOKIE_V11 = "TM1SessionId";
    public static final String SESSION_COOKIE_V12 = "paSession";

    static final String VERSION_ENDPOINT = "/Configuration/ProductVersion/$value";
    static final String LOGOUT_ENDPOINT = "/ActiveSession/tm1.Close";

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final Set<String> REPLAYABLE_METHODS = Set.of("GET", "HEAD");

    private final Tm1Config config;
    private final Tm1Endpoints endpoints;
    private final HttpUrl baseUrl;
    private final SessionCookieJar cookieJar;
    private final OkHttpClient httpClient;
    private final Authentication authentication;
    private final Map<String, String> defaultHeaders;
    private final Logger logger;
    private final AsyncRequests async;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object versionLock = new Object();
    private volatile String version;

    /// Creates a transport. No request is sent until the first call.
    ///
    /// @throws io.tm1client.rest.errors.Tm1ValidationException when the configuration cannot form a base URL
    /// @throws UnsupportedOperationException when Windows integrated authentication is selected
    public RestService(Tm1Config config, RestOption... options) {
        this.config = config;
        this.endpoints = Tm1Endpoints.compose(config);
        this.baseUrl = HttpUrl.get(endpoints.baseUrl());

        RestSettings settings = new RestSettings();
        for (RestOption option : options) {
            option.apply(settings);
        }
        this.logger = settings.logger() != null ? settings.logger() : defaultLogger;
        this.cookieJar = new SessionCookieJar();
        this.httpClient = createHttpClient(config, cookieJar);
        this.authentication = settings.authProvider() != null
            ? Authentication.custom(AuthMode.select(config), settings.authProvider())
            : Authentication.create(config, endpoints, httpClient);
        if (authentication.mode() == AuthMode.SESSION_REUSE) {
            cookieJar.seed(baseUrl, SESSION_COOKIE_V11, config.sessionId());
        }
        this.defaultHeaders = buildDefaultHeaders(config, settings.headers());
        this.version = settings.version();
        this.async = new AsyncRequests(this, settings.pollSchedule());

        logger.debug("TM1 transport for {} ({}, auth {})", baseUrl, endpoints.shape(), authentication.mode());
    }

    private static OkHttpClient createHttpClient(Tm1Config config, SessionCookieJar cookieJar) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequestsPerHost(config.connectionPoolSize());

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(config.connectionPoolSize(), 5, TimeUnit.MINUTES))
            .dispatcher(dispatcher)
            .cookieJar(cookieJar)
            .connectTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS)
            .callTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS)
            .protocols(List.of(Protocol.HTTP_1_1))
            .retryOnConnectionFailure(false);

        if (Tm1Config.isSet(config.proxy())) {
            URI proxy = URI.create(config.proxy());
            int port = proxy.getPort() > 0 ? proxy.getPort() : 8080;
            builder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxy.getHost(), port)));
        }
        if (!config.verify()) {
            trustEverything(builder);
        }
        return builder.build();
    }

    private static void trustEverything(OkHttpClient.Builder builder) {
        X509TrustManager trustAll = new X509TrustManager() {
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            builder.sslSocketFactory(ctx.getSocketFactory(), trustAll);
            builder.hostnameVerifier((hostname, session) -> true);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("unable to create a TLS context without verification", e);
        }
    }

    private static Map<String, String> buildDefaultHeaders(Tm1Config config, Map<String, String> extra) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Connection", "keep-alive");
        headers.put("User-Agent", USER_AGENT);
        headers.put("Content-Type", CONTENT_TYPE);
        headers.put("Accept", ACCEPT);
        if (Tm1Config.isSet(config.sessionContext())) {
            headers.put("TM1-SessionContext", config.sessionContext());
        }
        if (Tm1Config.isSet(config.impersonate())) {
            headers.put("TM1-Impersonate", config.impersonate());
        }
        headers.putAll(config.additionalHeaders());
        headers.putAll(extra);
        return Collections.unmodifiableMap(headers);
    }

    /// Sends a request and returns the successful response, which the caller must close.
    ///
    /// @param body the request body, or null; POST, PUT and PATCH without a body send an empty one
    /// @throws Tm1HttpException for a status of 400 or above
    /// @throws Tm1TransportException when the server cannot be reached or the exchange breaks off
    /// @throws Tm1TimeoutException when the timeout or the cancellation deadline passes
    /// @throws Tm1CancelledException when the request is cancelled through its handle
    public Response request(String method, String endpoint, RequestBody body, RequestOption... options) {
        PreparedRequest prepared = prepare(method, endpoint, body, options);
        if (prepared.isAsync(config.asyncRequestsMode())) {
            return async.execute(prepared);
        }
        return sendWithRecovery(method, endpoint, body, options, prepared);
    }

    public Response get(String endpoint, RequestOption... options) {
        return request("GET", endpoint, null, options);
    }

    public Response post(String endpoint, String json, RequestOption... options) {
        return request("POST", endpoint, jsonBody(json), options);
    }

    public Response patch(String endpoint, String json, RequestOption... options) {
        return request("PATCH", endpoint, jsonBody(json), options);
    }

    public Response put(String endpoint, String json, RequestOption... options) {
        return request("PUT", endpoint, jsonBody(json), options);
    }

    public Response delete(String endpoint, RequestOption... options) {
        return request("DELETE", endpoint, null, options);
    }

    /// Serializes `payload` with [SHARED#gson], sends it, and decodes the response into `type`.
    /// A `String` payload is sent as-is. Returns null when the response has no body.
    public <T> T json(String method, String endpoint, Object payload, Type type, RequestOption... options) {
        try (Response response = request(method, endpoint, jsonBody(payload), options)) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (text.isBlank()) {
                return null;
            }
            return SHARED.gson.fromJson(text, type);
        } catch (IOException e) {
            throw new Tm1TransportException("unable to read response of " + method + " " + endpoint, e);
        } catch (JsonParseException e) {
            throw new Tm1TransportException("malformed JSON in response of " + method + " " + endpoint, e);
        }
    }

    /// Like [#json(String, String, Object, Type, RequestOption...)] with no result: the response
    /// body is drained and discarded.
    public void execute(String method, String endpoint, Object payload, RequestOption... options) {
        try (Response response = request(method, endpoint, jsonBody(payload), options)) {
            ResponseBody body = response.body();
            if (body != null) {
                body.source().readAll(okio.Okio.blackhole());
            }
        } catch (IOException e) {
            throw new Tm1TransportException("unable to drain response of " + method + " " + endpoint, e);
        }
    }

    /// @return the response body as text, for plain values such as `$count` and `$value`
    public String text(String method, String endpoint, Object payload, RequestOption... options) {
        try (Response response = request(method, endpoint, jsonBody(payload), options)) {
            ResponseBody body = response.body();
            return body == null ? "" : body.string();
        } catch (IOException e) {
            throw new Tm1TransportException("unable to read response of " + method + " " + endpoint, e);
        }
    }

    public String getText(String endpoint, RequestOption... options) {
        return text("GET", endpoint, null, options);
    }

    /// Starts a request through the async protocol and returns the server's async ID without
    /// waiting for completion.
    public String submitAsync(String method, String endpoint, Object payload, RequestOption... options) {
        return async.submit(prepare(method, endpoint, jsonBody(payload), options));
    }

    /// Polls an async operation once. A `202` response means it is still running; completed
    /// results are transformed as in [#request].
    public Response retrieveAsyncResponse(String asyncId, RequestOption... options) {
        return async.retrieveOnce(asyncId, options);
    }

    /// Sends `DELETE /_async('<id>')`.
    public void cancelAsyncOperation(String asyncId) {
        async.cancel(asyncId);
    }

    /// Waits for an async operation started with [#submitAsync].
    public Response awaitAsync(String asyncId, RequestOption... options) {
        PreparedRequest settings = new PreparedRequest(new Request.Builder(), baseUrl);
        for (RequestOption option : options) {
            option.apply(settings);
        }
        return async.await(asyncId, settings.cancellation(), settings.timeoutOr(config.timeout()));
    }

    /// Closes the server session with `POST /ActiveSession/tm1.Close`. A 404 (no session) is
    /// ignored; nothing is sent when the configuration asks to keep the session alive.
    public void logout() {
        if (config.keepAlive()) {
            logger.debug("keep-alive is set, leaving the TM1 session open");
            return;
        }
        try (Response ignored = request("POST", LOGOUT_ENDPOINT, null, RequestOption.synchronous())) {
            logger.debug("TM1 session closed");
        } catch (Tm1HttpException e) {
            if (!e.isNotFound()) {
                throw e;
            }
        }
    }

    /// Logs out, then releases pooled connections. A failing logout is logged and ignored.
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                logout();
            } catch (Tm1Exception e) {
                logger.warn("logout while closing the TM1 transport failed: {}", e.getMessage());
            } finally {
                httpClient.dispatcher().executorService().shutdown();
                httpClient.connectionPool().evictAll();
            }
        }
    }

    /// @return the `TM1SessionId` or `paSession` cookie for the base URL, or an empty string
    public String sessionId() {
        return cookieJar.find(baseUrl, SESSION_COOKIE_V11, SESSION_COOKIE_V12);
    }

    /// @return the server's product version, read once from `/Configuration/ProductVersion/$value`
    public String version() {
        String current = version;
        if (current == null) {
            synchronized (versionLock) {
                if (version == null) {
                    version = getText(VERSION_ENDPOINT, RequestOption.synchronous()).trim();
                    logger.debug("TM1 server version {}", version);
                }
                current = version;
            }
        }
        return current;
    }

    public boolean isVersionAtLeast(String minimum) {
        return Tm1Versions.geq(version(), minimum);
    }

    public Tm1Config config() {
        return config;
    }

    public Tm1Endpoints endpoints() {
        return endpoints;
    }

    public HttpUrl baseUrl() {
        return baseUrl;
    }

    public AuthMode authMode() {
        return authentication.mode();
    }

    public Logger logger() {
        return logger;
    }

    /// Resolves an endpoint: empty means the base URL, absolute URLs are used as-is, anything
    /// else is resolved relative to the base URL after stripping leading slashes.
    public HttpUrl resolve(String endpoint) {
        if (endpoint == null || endpoint.isEmpty()) {
            return baseUrl;
        }
        String lower = endpoint.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            HttpUrl absolute = HttpUrl.parse(endpoint);
            if (absolute == null) {
                throw new Tm1ValidationException("invalid URL: " + endpoint);
            }
            return absolute;
        }
        int start = 0;
        while (start < endpoint.length() && endpoint.charAt(start) == '/') {
            start++;
        }
        HttpUrl resolved = baseUrl.resolve("./" + endpoint.substring(start));
        if (resolved == null) {
            throw new Tm1ValidationException("unable to resolve endpoint: " + endpoint);
        }
        return resolved;
    }

    PreparedRequest prepare(String method, String endpoint, RequestBody body, RequestOption... options) {
        Request.Builder builder = new Request.Builder().method(method, bodyFor(method, body));
        defaultHeaders.forEach(builder::header);
        try {
            authentication.provider().apply(builder);
        } catch (Tm1AuthException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new Tm1AuthException("auth provider failed: " + e.getMessage(), e);
        }
        PreparedRequest prepared = new PreparedRequest(builder, resolve(endpoint));
        for (RequestOption option : options) {
            option.apply(prepared);
        }
        return prepared;
    }

    private Response sendWithRecovery(String method, String endpoint, RequestBody body,
                                      RequestOption[] options, PreparedRequest prepared) {
        boolean replayable = REPLAYABLE_METHODS.contains(method.toUpperCase(Locale.ROOT));
        Response response;
        try {
            response = send(prepared.build(), prepared);
        } catch (Tm1TransportException e) {
            if (!(replayable && config.reconnectOnRemoteDisconnect())) {
                throw e;
            }
            logger.info("connection lost on {} {}, replaying once", method, endpoint);
            PreparedRequest retry = prepare(method, endpoint, body, options);
            return checked(send(retry.build(), retry));
        }
        if (response.code() == 401 && replayable && config.reconnectOnSessionTimeout()
            && authentication.mode() != AuthMode.SESSION_REUSE) {
            response.close();
            logger.info("session rejected on {} {}, re-authenticating once", method, endpoint);
            cookieJar.clear();
            authentication.invalidateSession();
            PreparedRequest retry = prepare(method, endpoint, body, options);
            return checked(send(retry.build(), retry));
        }
        return checked(response);
    }

    /// Sends without looking at the status.
    Response send(Request request, PreparedRequest prepared) {
        CancellationHandle handle = prepared.cancellation();
        Duration timeout = prepared.timeoutOr(config.timeout());
        if (handle != null) {
            Duration remaining = handle.remaining().orElse(timeout);
            if (handle.isExpired()) {
                throw new Tm1TimeoutException(request.method() + " " + request.url() + " was not sent, deadline passed",
                    timeout);
            }
            if (remaining.compareTo(timeout) < 0) {
                timeout = remaining;
            }
        }
        // OkHttp reads a zero call timeout as no timeout at all
        if (timeout.toMillis() < 1) {
            throw new Tm1TimeoutException(request.method() + " " + request.url() + " was not sent, deadline passed",
                timeout);
        }
        Call call = httpClient.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (handle != null) {
            handle.register(call);
        }
        logger.debug("{} {}", request.method(), request.url());
        try {
            return call.execute();
        } catch (IOException e) {
            throw translate(e, request, handle, timeout);
        } finally {
            if (handle != null) {
                handle.unregister(call);
            }
        }
    }

    /// Passes a successful response through and turns a failed one into [Tm1HttpException].
    Response checked(Response response) {
        if (response.code() >= 400) {
            throw httpError(response);
        }
        return response;
    }

    /// Drains up to [Tm1HttpException#MAX_BODY_BYTES] of the body and closes the response.
    Tm1HttpException httpError(Response response) {
        Request request = response.request();
        String body;
        try (response) {
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                body = "";
            } else {
                try (InputStream in = responseBody.byteStream()) {
                    body = new String(in.readNBytes(Tm1HttpException.MAX_BODY_BYTES), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            body = "<unreadable body: " + e.getMessage() + ">";
        }
        return new Tm1HttpException(request.method(), request.url().toString(), response.code(), body);
    }

    private Tm1Exception translate(IOException e, Request request, CancellationHandle handle, Duration timeout) {
        String target = request.method() + " " + request.url();
        if (handle != null && handle.isExpired()) {
            return new Tm1TimeoutException(target + " passed its deadline", timeout, e);
        }
        if (handle != null && handle.isCancelled()) {
            return new Tm1CancelledException(target + " was cancelled", e);
        }
        if (e instanceof InterruptedIOException) {
            return new Tm1TimeoutException(target + " timed out", timeout, e);
        }
        return new Tm1TransportException(target + " failed: " + e.getMessage(), e);
    }

    private static RequestBody bodyFor(String method, RequestBody body) {
        if (body == null && BODY_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            return RequestBody.create(new byte[0], (MediaType) null);
        }
        return body;
    }

    /// Bodies carry no media type of their own, so the default `Content-Type` header, or the
    /// one set by a request option, is what the server sees.
    static RequestBody jsonBody(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof RequestBody requestBody) {
            return requestBody;
        }
        String json = payload instanceof String text ? text : SHARED.gson.toJson(payload);
        return RequestBody.create(json.getBytes(StandardCharsets.UTF_8), (MediaType) null);
    }
}
