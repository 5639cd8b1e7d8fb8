package io.tm1client.rest.errors;

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

/**
 * The server answered with a status of 400 or above.
 * <p>
 * The body is the first part of the server's error payload, drained up to
 * {@link #MAX_BODY_BYTES} bytes.
 */
public class Tm1HttpException extends Tm1Exception {

    public static final int MAX_BODY_BYTES = 64 * 1024;

    private final String method;
    private final String url;
    private final int statusCode;
    private final String body;

    public Tm1HttpException(String method, String url, int statusCode, String body) {
        super(String.format("%s %s failed with status %d: %s", method, url, statusCode, body));
        this.method = method;
        this.url = url;
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    /// @return true when `error` is an HTTP failure with status 404
    public static boolean isNotFound(Throwable error) {
        return error instanceof Tm1HttpException http && http.isNotFound();
    }
}
