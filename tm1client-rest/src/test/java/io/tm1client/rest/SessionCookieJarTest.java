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
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SessionCookieJarTest {

    private static final HttpUrl BASE = HttpUrl.get("https://tm1.local:12354/api/v1/");

    @Test
    public void testFindsSessionCookieByPreference() {
        SessionCookieJar jar = new SessionCookieJar();
        jar.saveFromResponse(BASE, List.of(
            Cookie.parse(BASE, "paSession=v12; Path=/"),
            Cookie.parse(BASE, "TM1SessionId=v11; Path=/api/v1")));
        assertEquals("v11", jar.find(BASE, "TM1SessionId", "paSession"));
        assertEquals("v12", jar.find(BASE, "paSession", "TM1SessionId"));
        assertEquals("", jar.find(HttpUrl.get("https://other.local/api/v1/"), "TM1SessionId"));
    }

    @Test
    public void testReplaceSeedAndClear() {
        SessionCookieJar jar = new SessionCookieJar();
        jar.seed(BASE, "TM1SessionId", "first");
        jar.saveFromResponse(BASE, List.of(Cookie.parse(BASE, "TM1SessionId=second; Path=/")));
        assertEquals(1, jar.loadForRequest(BASE).size());
        assertEquals("second", jar.find(BASE, "TM1SessionId"));

        jar.clear();
        assertTrue(jar.loadForRequest(BASE).isEmpty());
    }

    @Test
    public void testExpiredCookieIsDropped() {
        SessionCookieJar jar = new SessionCookieJar();
        jar.seed(BASE, "TM1SessionId", "live");
        jar.saveFromResponse(BASE, List.of(Cookie.parse(BASE, "TM1SessionId=gone; Path=/; Max-Age=0")));
        assertEquals("", jar.find(BASE, "TM1SessionId"));
    }
}
