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
import io.tm1client.rest.errors.Tm1AuthException;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@ExtendWith(FakeTm1ServerExtension.class)
public class IamTokenSourceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private static IamTokenSource source(FakeTm1Server server) {
        return new IamTokenSource(new OkHttpClient(), server.getBaseUrl(), "my-key", CLOCK);
    }

    @Test
    public void testTokenIsRequestedOnceAndCached() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/identity/token", FakeReply.json("{\"access_token\":\"tok-1\",\"expires_in\":3600}"));

        IamTokenSource source = source(server);
        assertEquals("tok-1", source.accessToken());
        assertEquals("tok-1", source.accessToken());

        assertEquals(1, server.requests().size());
        RecordedRequest request = server.requests().get(0);
        assertEquals("grant_type=urn:ibm:params:oauth:grant-type:apikey&apikey=my-key",
            URLDecoder.decode(request.body(), StandardCharsets.UTF_8));
        assertEquals("application/json", request.header("Accept"));
    }

    @Test
    public void testExpiredTokenIsRefreshed() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        long expired = CLOCK.instant().getEpochSecond() + 30;
        server.on("POST", "/identity/token", FakeReply.json("{\"access_token\":\"tok\",\"expiration\":" + expired + "}"));

        IamTokenSource source = source(server);
        source.accessToken();
        source.accessToken();
        assertEquals(2, server.requests().size());
    }

    @Test
    public void testTokenWithoutExpiryIsCachedForFallbackTtl() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/identity/token", FakeReply.json("{\"access_token\":\"tok\"}"));

        IamTokenSource source = source(server);
        assertEquals("tok", source.accessToken());
        assertEquals("tok", source.accessToken());
        assertEquals(1, server.requests().size());
    }

    @Test
    public void testRejectedExchange() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/identity/token", FakeReply.json(400, "{\"errorMessage\":\"bad key\"}"));
        assertThatThrownBy(() -> source(server).accessToken())
            .isInstanceOf(Tm1AuthException.class)
            .hasMessageContaining("400")
            .hasMessageContaining("bad key");
    }

    @Test
    public void testReplyWithoutToken() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/identity/token", FakeReply.json("{\"token_type\":\"Bearer\"}"));
        assertThatThrownBy(() -> source(server).accessToken())
            .isInstanceOf(Tm1AuthException.class)
            .hasMessageContaining("access_token");
    }
}
