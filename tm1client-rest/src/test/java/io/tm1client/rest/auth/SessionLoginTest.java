package io.tm1client.rest.auth;

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

import io.tm1client.jettyfake.FakeReply;
import io.tm1client.jettyfake.FakeTm1Server;
import io.tm1client.jettyfake.FakeTm1ServerExtension;
import io.tm1client.jettyfake.RecordedRequest;
import io.tm1client.rest.SessionCookieJar;
import io.tm1client.rest.errors.Tm1AuthException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(FakeTm1ServerExtension.class)
public class SessionLoginTest {

    @Test
    public void testServiceToServiceLogsInOnce() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/tm1/auth/v1/session",
            FakeReply.status(200).withHeader("Set-Cookie", "TM1SessionId=s2s-session; Path=/"));
        SessionCookieJar jar = new SessionCookieJar();
        OkHttpClient client = new OkHttpClient.Builder().cookieJar(jar).build();

        SessionLogin login = SessionLogin.serviceToService(client, server.getBaseUrl() + "tm1/auth/v1/session", "a", "s");
        login.ensureLoggedIn();
        login.ensureLoggedIn();

        assertEquals(1, server.requests().size());
        RecordedRequest request = server.requests().get(0);
        assertEquals("Basic YTpz", request.header("Authorization"));
        assertEquals("{\"User\":\"a\"}", request.body());
        assertEquals("s2s-session", jar.find(HttpUrl.get(server.getBaseUrl()), "TM1SessionId"));

        login.invalidate();
        login.ensureLoggedIn();
        assertEquals(2, server.requests().size());
    }

    @Test
    public void testWorkspaceProxyPostsForm() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/login", FakeReply.status(200));
        SessionLogin login = SessionLogin.workspaceProxy(new OkHttpClient(), server.getBaseUrl() + "login", "admin", "apple");
        login.asProvider().apply(new Request.Builder().url(server.getBaseUrl()));

        assertEquals("username=admin&password=apple", server.requests().get(0).body());
    }

    @Test
    public void testRejectedLogin() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/login", FakeReply.status(401));
        SessionLogin login = SessionLogin.workspaceProxy(new OkHttpClient(), server.getBaseUrl() + "login", "admin", "bad");
        assertThatThrownBy(login::ensureLoggedIn)
            .isInstanceOf(Tm1AuthException.class)
            .hasMessageContaining("401");
    }
}
