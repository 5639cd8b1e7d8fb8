package io.tm1client.services.batch;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.tm1client.jettyfake.FakeReply;
import io.tm1client.jettyfake.FakeTm1Server;
import io.tm1client.jettyfake.FakeTm1ServerExtension;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.services.Tm1Service;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static io.tm1client.services.FakeServerConnections.V11;
import static io.tm1client.services.FakeServerConnections.V12;
import static io.tm1client.services.FakeServerConnections.rest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(FakeTm1ServerExtension.class)
public class BatchServiceTest {

    private static final String TWO_OK = "{\"responses\":["
        + "{\"id\":\"a\",\"status\":200,\"headers\":{\"Content-Type\":\"application/json\"},\"body\":{\"Name\":\"Sales\"}},"
        + "{\"id\":\"b\",\"status\":200,\"body\":\"11.8.02500.3\"}]}";

    private static JsonArray sentUrls(FakeTm1Server server) {
        JsonObject payload = JsonParser.parseString(server.requests("POST", "/$batch").get(0).body()).getAsJsonObject();
        JsonArray urls = new JsonArray();
        for (JsonElement request : payload.getAsJsonArray("requests")) {
            urls.add(request.getAsJsonObject().get("url"));
        }
        return urls;
    }

    @Test
    public void testVersion11UrlsCarryApiPrefix() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/$batch", FakeReply.json(TWO_OK));

        List<BatchResponse> responses;
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            responses = tm1.batch().execute(List.of(
                BatchRequest.of("a", "GET", "/Cubes('Sales')", null),
                BatchRequest.of("b", "GET", "api/v1/Configuration/ProductVersion/$value", null)));
        }

        JsonArray urls = sentUrls(server);
        assertEquals("/api/v1/Cubes('Sales')", urls.get(0).getAsString());
        assertEquals("/api/v1/Configuration/ProductVersion/$value", urls.get(1).getAsString());

        assertEquals(2, responses.size());
        assertTrue(responses.get(0).isSuccessful());
        assertEquals("application/json", responses.get(0).headers().get("Content-Type"));
        assertEquals("{\"Name\":\"Sales\"}", responses.get(0).bodyText());
        assertEquals("11.8.02500.3", responses.get(1).bodyText());
    }

    @Test
    public void testVersion12UrlsAreLeftRelative() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/$batch", FakeReply.json(TWO_OK));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V12))) {
            tm1.batch().execute(List.of(
                BatchRequest.of("a", "GET", "Cubes('Sales')", null),
                BatchRequest.of("b", "GET", "//Dimensions", null)));
        }

        JsonArray urls = sentUrls(server);
        assertEquals("/Cubes('Sales')", urls.get(0).getAsString());
        assertEquals("/Dimensions", urls.get(1).getAsString());
    }

    @Test
    public void testInvalidBatchesAreRejectedLocally() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.batch().execute(List.of()))
                .isInstanceOf(Tm1ValidationException.class);
            assertThatThrownBy(() -> tm1.batch().execute(List.of(
                BatchRequest.of("x", "GET", "/Cubes", null),
                BatchRequest.of("x", "GET", "/Dimensions", null))))
                .isInstanceOf(Tm1ValidationException.class)
                .hasMessageContaining("duplicate batch request id: x");
        }
        assertThat(server.trace()).isEmpty();
    }

    @Test
    public void testReplyWithoutResponsesIsATransportError() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/$batch", FakeReply.json("{}"));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.batch().execute(List.of(BatchRequest.of("a", "GET", "/Cubes", null))))
                .isInstanceOf(Tm1TransportException.class);
        }
    }

    @Test
    public void testStatusRange() {
        assertTrue(new BatchResponse("a", 204, null, null).isSuccessful());
        assertTrue(new BatchResponse("a", 302, null, null).isSuccessful());
        assertFalse(new BatchResponse("a", 404, null, null).isSuccessful());
        assertEquals("", new BatchResponse("a", 204, null, null).bodyText());
    }
}
