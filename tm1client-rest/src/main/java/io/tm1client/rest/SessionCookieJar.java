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

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/// In-memory cookie store owning the session identity of one client.
///
/// The server deposits `TM1SessionId` (v11) or `paSession` (v12) after the first authenticated
/// request; every later request that matches the cookie's domain and path sends it back.
public class SessionCookieJar implements CookieJar {

    private final List<Cookie> cookies = new ArrayList<>();

    @Override
    public synchronized void saveFromResponse(HttpUrl url, List<Cookie> received) {
        for (Cookie cookie : received) {
            cookies.removeIf(existing -> sameIdentity(existing, cookie));
            if (cookie.expiresAt() > System.currentTimeMillis()) {
                cookies.add(cookie);
            }
        }
    }

    @Override
    public synchronized List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        List<Cookie> matching = new ArrayList<>();
        for (Iterator<Cookie> it = cookies.iterator(); it.hasNext(); ) {
            Cookie cookie = it.next();
            if (cookie.expiresAt() <= now) {
                it.remove();
            } else if (cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }

    /// @return the value of the first named cookie that would be sent to `url`, or an empty string
    public synchronized String find(HttpUrl url, String... names) {
        List<Cookie> candidates = loadForRequest(url);
        for (String name : names) {
            for (Cookie cookie : candidates) {
                if (cookie.name().equals(name)) {
                    return cookie.value();
                }
            }
        }
        return "";
    }

    /// Stores a cookie for the host of `url`, used to resume an existing session.
    public synchronized void seed(HttpUrl url, String name, String value) {
        Cookie cookie = new Cookie.Builder()
            .name(name)
            .value(value)
            .hostOnlyDomain(url.host())
            .path("/")
            .build();
        cookies.removeIf(existing -> sameIdentity(existing, cookie));
        cookies.add(cookie);
    }

    public synchronized void clear() {
        cookies.clear();
    }

    private static boolean sameIdentity(Cookie a, Cookie b) {
        return a.name().equals(b.name()) && a.domain().equals(b.domain()) && a.path().equals(b.path());
    }
}
