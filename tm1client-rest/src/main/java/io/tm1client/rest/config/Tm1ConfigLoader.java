package io.tm1client.rest.config;

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

import io.tm1client.rest.errors.Tm1ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/// Loads a [Tm1Config] from a named section of a YAML file.
///
/// ```yaml
/// production:
///   address: tm1.example.com
///   port: 12354
///   ssl: true
///   user: admin
///   password: YXBwbGU=
///   decode_b64: true
///   async_requests_mode: true
/// ```
///
/// Keys are snake_case; unknown keys are rejected so that typos do not silently fall back to
/// defaults.
public class Tm1ConfigLoader {
    private final static Logger logger = LogManager.getLogger(Tm1ConfigLoader.class);

    private static final Set<String> KNOWN_KEYS = Set.of(
        "address", "port", "ssl", "base_url", "tenant", "database", "instance", "workspace_proxy_host",
        "user", "password", "decode_b64", "namespace", "cam_passport", "session_id", "access_token",
        "application_client_id", "application_client_secret", "api_key", "iam_url", "integrated_login",
        "timeout_seconds", "async_requests_mode", "cancel_at_timeout", "session_context", "impersonate",
        "reconnect_on_session_timeout", "reconnect_on_remote_disconnect", "verify", "connection_pool_size",
        "keep_alive", "proxy", "headers");

    private Tm1ConfigLoader() {
    }

    /// Reads `section` from the YAML file at `path`. A leading `~` expands to the user's home.
    public static Tm1Config load(Path path, String section) {
        Path expanded = expandTilde(path);
        String text;
        try {
            text = Files.readString(expanded);
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read TM1 config " + expanded, e);
        }
        logger.debug("loading TM1 config section '{}' from {}", section, expanded);
        return parse(text, section);
    }

    /// Parses `section` out of YAML text.
    public static Tm1Config parse(String yamlText, String section) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        Object document = yaml.loadFromString(yamlText);
        if (!(document instanceof Map<?, ?> sections)) {
            throw new Tm1ValidationException("TM1 config must be a map of named sections");
        }
        Object selected = sections.get(section);
        if (!(selected instanceof Map<?, ?> values)) {
            throw new Tm1ValidationException("TM1 config has no section named '" + section + "', known: "
                + new TreeSet<>(sections.keySet().stream().map(String::valueOf).toList()));
        }
        return fromMap(values);
    }

    static Tm1Config fromMap(Map<?, ?> values) {
        for (Object key : values.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                throw new Tm1ValidationException("unknown TM1 config key: " + key);
            }
        }
        Tm1Config.Builder b = Tm1Config.builder();
        Section s = new Section(values);
        s.string("address", b::address);
        s.integer("port", b::port);
        s.bool("ssl", b::ssl);
        s.string("base_url", b::baseUrl);
        s.string("tenant", b::tenant);
        s.string("database", b::database);
        s.string("instance", b::instance);
        s.string("workspace_proxy_host", b::workspaceProxyHost);
        s.string("user", b::user);
        s.string("password", b::password);
        s.bool("decode_b64", b::decodeBase64);
        s.string("namespace", b::namespace);
        s.string("cam_passport", b::camPassport);
        s.string("session_id", b::sessionId);
        s.string("access_token", b::accessToken);
        s.string("application_client_id", b::applicationClientId);
        s.string("application_client_secret", b::applicationClientSecret);
        s.string("api_key", b::apiKey);
        s.string("iam_url", b::iamUrl);
        s.bool("integrated_login", b::integratedLogin);
        s.integer("timeout_seconds", seconds -> b.timeout(Duration.ofSeconds(seconds)));
        s.bool("async_requests_mode", b::asyncRequestsMode);
        s.bool("cancel_at_timeout", b::cancelAtTimeout);
        s.string("session_context", b::sessionContext);
        s.string("impersonate", b::impersonate);
        s.bool("reconnect_on_session_timeout", b::reconnectOnSessionTimeout);
        s.bool("reconnect_on_remote_disconnect", b::reconnectOnRemoteDisconnect);
        s.bool("verify", b::verify);
        s.integer("connection_pool_size", b::connectionPoolSize);
        s.bool("keep_alive", b::keepAlive);
        s.string("proxy", b::proxy);
        Object headers = values.get("headers");
        if (headers != null) {
            if (!(headers instanceof Map<?, ?> headerMap)) {
                throw new Tm1ValidationException("TM1 config key 'headers' must be a map");
            }
            headerMap.forEach((k, v) -> b.header(String.valueOf(k), String.valueOf(v)));
        }
        return b.build();
    }

    static Path expandTilde(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + text.substring(1));
        }
        return path;
    }

    private record Section(Map<?, ?> values) {

        void string(String key, Consumer<String> sink) {
            Object value = values.get(key);
            if (value != null) {
                sink.accept(String.valueOf(value));
            }
        }

        void integer(String key, IntConsumer sink) {
            Object value = values.get(key);
            if (value == null) {
                return;
            }
            if (value instanceof Number number) {
                sink.accept(number.intValue());
                return;
            }
            try {
                sink.accept(Integer.parseInt(String.valueOf(value).trim()));
            } catch (NumberFormatException e) {
                throw new Tm1ValidationException("TM1 config key '" + key + "' must be an integer: " + value, e);
            }
        }

        void bool(String key, Consumer<Boolean> sink) {
            Object value = values.get(key);
            if (value == null) {
                return;
            }
            if (value instanceof Boolean flag) {
                sink.accept(flag);
                return;
            }
            String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            switch (text) {
                case "true", "yes", "1" -> sink.accept(true);
                case "false", "no", "0" -> sink.accept(false);
                default -> throw new Tm1ValidationException("TM1 config key '" + key + "' must be a boolean: " + value);
            }
        }
    }
}
