package io.tm1client.services.cells;

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
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.tm1client.jettyfake.FakeReply;
import io.tm1client.jettyfake.FakeTm1Server;
import io.tm1client.jettyfake.FakeTm1ServerExtension;
import io.tm1client.jettyfake.RecordedRequest;
import io.tm1client.rest.errors.Tm1HttpException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.services.Tm1Service;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.tm1client.services.FakeServerConnections.V11;
import static io.tm1client.services.FakeServerConnections.rest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(FakeTm1ServerExtension.class)
public class CellServiceTest {

    private static final String CELLSET = "{\"ID\":\"cs1\",\"Axes\":["
        + "{\"Ordinal\":0,\"Tuples\":["
        + "{\"Ordinal\":0,\"Members\":[{\"Name\":\"2024\",\"UniqueName\":\"[Year].[Year].[2024]\",\"Ordinal\":0}]},"
        + "{\"Ordinal\":1,\"Members\":[{\"Name\":\"2025\",\"UniqueName\":\"[Year].[Year].[2025]\",\"Ordinal\":1}]}]},"
        + "{\"Ordinal\":1,\"Tuples\":["
        + "{\"Ordinal\":0,\"Members\":[{\"Name\":\"EU\",\"UniqueName\":\"[Region].[Region].[EU]\",\"Ordinal\":0}]}]}],"
        + "\"Cells\":["
        + "{\"Ordinal\":0,\"Value\":10,\"FormattedValue\":\"10.00\",\"RuleDerived\":false,\"Consolidated\":false,\"Updateable\":257},"
        + "{\"Ordinal\":1,\"Value\":null,\"FormattedValue\":\"\",\"RuleDerived\":true,\"Consolidated\":false,\"Updateable\":0}]}";

    private static final String DIMENSIONS = "{\"value\":[{\"Name\":\"Year\"},{\"Name\":\"Region\"},{\"Name\":\"Sandboxes\"}]}";

    @Test
    public void testExecuteMdxCreatesExtractsAndDeletes() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/ExecuteMDX", FakeReply.json(201, "{\"ID\":\"cs1\"}"));
        server.on("GET", "/Cellsets('cs1')", FakeReply.json(CELLSET));
        server.on("DELETE", "/Cellsets('cs1')", FakeReply.status(204));

        Map<String, Map<String, CellProperty>> cells;
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            cells = tm1.cells().executeMdx("SELECT {[Year].[2024],[Year].[2025]} ON 0 FROM [Sales]", List.of(), null);
        }

        assertEquals(List.of("POST /ExecuteMDX", "GET /Cellsets('cs1')", "DELETE /Cellsets('cs1')"), server.trace());
        assertEquals("SELECT {[Year].[2024],[Year].[2025]} ON 0 FROM [Sales]",
            JsonParser.parseString(server.requests().get(0).body()).getAsJsonObject().get("MDX").getAsString());
        assertEquals("$expand=Axes($expand=Tuples($expand=Members($select=Name,UniqueName,Ordinal;$top=100000);"
                + "$top=100000)),Cells($select=Ordinal,Value,FormattedValue,RuleDerived,Consolidated,Updateable;"
                + "$top=100000)",
            server.requests().get(1).query());

        assertThat(cells.keySet()).containsExactly(
            "[Year].[Year].[2024],[Region].[Region].[EU]",
            "[Year].[Year].[2025],[Region].[Region].[EU]");
        Map<String, CellProperty> first = cells.get("[Year].[Year].[2024],[Region].[Region].[EU]");
        assertEquals(10.0, ((CellProperty.Numeric) first.get(CellService.VALUE)).doubleValue());
        assertEquals(new CellProperty.Text("10.00"), first.get(CellService.FORMATTED_VALUE));
        assertEquals(new CellProperty.Flag(false), first.get(CellService.RULE_DERIVED));
        assertEquals(257, ((CellProperty.Numeric) first.get(CellService.UPDATEABLE)).value().intValue());

        Map<String, CellProperty> second = cells.get("[Year].[Year].[2025],[Region].[Region].[EU]");
        assertTrue(second.get(CellService.VALUE).isEmpty());
        assertThat(second).doesNotContainKey(CellService.FORMATTED_VALUE);
        assertEquals(new CellProperty.Flag(true), second.get(CellService.RULE_DERIVED));
    }

    @Test
    public void testProjectionKeepsOnlyRequestedProperties() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/ExecuteMDX", FakeReply.json(201, "{\"ID\":\"cs1\"}"));
        server.on("GET", "/Cellsets('cs1')", FakeReply.json(CELLSET));
        server.on("DELETE", "/Cellsets('cs1')", FakeReply.status(204));

        Map<String, Map<String, CellProperty>> cells;
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            cells = tm1.cells().executeMdx("SELECT", List.of(CellService.VALUE, CellService.CONSOLIDATED), null);
        }

        assertThat(server.requests("GET", "/Cellsets('cs1')").get(0).query())
            .contains("Cells($select=Ordinal,Value,FormattedValue,Consolidated;$top=100000)");
        assertThat(cells.values().iterator().next().keySet())
            .containsExactly(CellService.VALUE, CellService.ORDINAL, CellService.FORMATTED_VALUE,
                CellService.CONSOLIDATED);
    }

    @Test
    public void testCellsetIsDeletedWhenExtractionFails() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/ExecuteMDX", FakeReply.json(201, "{\"ID\":\"cs9\"}"));
        server.on("GET", "/Cellsets('cs9')", FakeReply.json(500, "{\"error\":{\"message\":\"boom\"}}"));
        server.on("DELETE", "/Cellsets('cs9')", FakeReply.status(204));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.cells().executeMdx("SELECT", List.of(), null))
                .isInstanceOf(Tm1HttpException.class)
                .satisfies(e -> assertEquals(500, ((Tm1HttpException) e).getStatusCode()));
        }

        assertEquals(List.of("POST /ExecuteMDX", "GET /Cellsets('cs9')", "DELETE /Cellsets('cs9')"), server.trace());
    }

    @Test
    public void testExecuteViewRoutesIntoSandbox() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/Cubes('Sales')/PrivateViews('Q1 Plan')/tm1.Execute", FakeReply.json(201, "{\"ID\":\"cs1\"}"));
        server.on("GET", "/Cellsets('cs1')", FakeReply.json(CELLSET));
        server.on("DELETE", "/Cellsets('cs1')", FakeReply.status(204));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThat(tm1.cells().executeView("Sales", "Q1 Plan", true, List.of(), "What If")).hasSize(2);
        }

        for (RecordedRequest request : server.requests()) {
            assertThat(request.query()).contains("!sandbox=What If");
        }
    }

    @Test
    public void testGetValueReturnsFirstNonEmptyCell() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/ExecuteMDX", FakeReply.json(201, "{\"ID\":\"cs1\"}"));
        server.on("GET", "/Cellsets('cs1')", FakeReply.json(CELLSET));
        server.on("DELETE", "/Cellsets('cs1')", FakeReply.status(204));

        Optional<CellProperty> value;
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            value = tm1.cells().getValue("Sales", List.of("2024", "EU"), List.of("Year", "Region"), null);
        }

        assertTrue(value.isPresent());
        assertEquals(10.0, ((CellProperty.Numeric) value.get()).doubleValue());
        assertEquals("SELECT [Year].[Year].[2024] ON ROWS, [Region].[Region].[EU] ON COLUMNS FROM [Sales]",
            JsonParser.parseString(server.requests().get(0).body()).getAsJsonObject().get("MDX").getAsString());
    }

    @Test
    public void testValueMdxShapes() {
        assertEquals("SELECT {} ON ROWS, [Year].[Year].[2024] ON COLUMNS FROM [Sales]",
            CellService.valueMdx("Sales", List.of("2024"), List.of("Year")));
        assertEquals("SELECT [Year].[Year].[2024]*[Region].[Region].[EU] ON ROWS, [Measure].[Measure].[Units] "
                + "ON COLUMNS FROM [Sales]",
            CellService.valueMdx("Sales", List.of("2024", "EU", "Units"), List.of("Year", "Region", "Measure")));
    }

    @Test
    public void testWriteValueLooksUpDimensionsAndSkipsSandboxDimension() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Cubes('Sales')/Dimensions", FakeReply.json(DIMENSIONS));
        server.on("POST", "/Cubes('Sales')/tm1.Update", FakeReply.status(204));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            tm1.cells().writeValue("Sales", List.of("2024", "O'Hare"), null, 42.5, "What If");
        }

        assertEquals(List.of("GET /Cubes('Sales')/Dimensions", "POST /Cubes('Sales')/tm1.Update"), server.trace());
        RecordedRequest update = server.requests().get(1);
        assertEquals("!sandbox=What If", update.query());
        JsonObject body = JsonParser.parseString(update.body()).getAsJsonObject();
        JsonArray tuple = body.getAsJsonArray("Tuple@odata.bind");
        assertEquals("Dimensions('Year')/Hierarchies('Year')/Elements('2024')", tuple.get(0).getAsString());
        assertEquals("Dimensions('Region')/Hierarchies('Region')/Elements('O''Hare')", tuple.get(1).getAsString());
        assertEquals(42.5, body.get("Value").getAsDouble());
    }

    @Test
    public void testWriteValuesValidatesEveryKeyBeforeWriting() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/Cubes('Sales')/tm1.Update", FakeReply.status(204));

        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("2024,EU", 1);
        cells.put("2025", 2);

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.cells().writeValues("Sales", cells, List.of("Year", "Region"), null))
                .isInstanceOf(Tm1ValidationException.class)
                .hasMessageContaining("coordinate 1 has 1 elements but the cube has 2 dimensions");
        }

        assertThat(server.trace()).isEmpty();
    }

    @Test
    public void testExtractCellsetDeletesOnlyWhenAsked() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Cellsets('cs1')", FakeReply.json(CELLSET));
        server.on("DELETE", "/Cellsets('cs1')", FakeReply.status(204));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            Cellset kept = tm1.cells().extractCellset("cs1", List.of(), null);
            assertEquals(2, kept.cells().size());
            assertEquals(List.of("GET /Cellsets('cs1')"), server.trace());

            tm1.cells().extractCellset("cs1", List.of(), "sb1", true);
        }

        assertEquals(List.of("GET /Cellsets('cs1')", "GET /Cellsets('cs1')", "DELETE /Cellsets('cs1')"),
            server.trace());
        assertEquals("!sandbox=sb1", server.requests().get(2).query());
    }

    @Test
    public void testWriteValuesByCoordsPairsCoordinatesWithValues() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/Cubes('Sales')/tm1.Update", FakeReply.status(204));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.cells().writeValuesByCoords("Sales",
                List.of(List.of("2024", "EU")), List.of(1, 2), List.of("Year", "Region"), null))
                .isInstanceOf(Tm1ValidationException.class)
                .hasMessageContaining("got 1 coordinates but 2 values");
            assertThat(server.trace()).isEmpty();

            tm1.cells().writeValuesByCoords("Sales", List.of(List.of("2024", "EU"), List.of("2025", "US")),
                List.of(1, 2), List.of("Year", "Region"), null);
        }

        List<RecordedRequest> updates = server.requests("POST", "/Cubes('Sales')/tm1.Update");
        assertEquals(2, updates.size());
        JsonObject second = JsonParser.parseString(updates.get(1).body()).getAsJsonObject();
        assertEquals("Dimensions('Region')/Hierarchies('Region')/Elements('US')",
            second.getAsJsonArray("Tuple@odata.bind").get(1).getAsString());
        assertEquals(2, second.get("Value").getAsInt());
    }

    @Test
    public void testWriteValuesPostsOneUpdatePerCell() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/Cubes('Sales')/tm1.Update", FakeReply.status(204));

        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("2024, EU", 1);
        cells.put("2025,EU", "note");

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            tm1.cells().writeValues("Sales", cells, List.of("Year", "Region"), null);
        }

        List<RecordedRequest> updates = server.requests("POST", "/Cubes('Sales')/tm1.Update");
        assertEquals(2, updates.size());
        JsonObject first = JsonParser.parseString(updates.get(0).body()).getAsJsonObject();
        assertEquals("Dimensions('Region')/Hierarchies('Region')/Elements('EU')",
            first.getAsJsonArray("Tuple@odata.bind").get(1).getAsString());
        assertEquals("note", JsonParser.parseString(updates.get(1).body()).getAsJsonObject().get("Value").getAsString());
    }

    @Test
    public void testBatchedWriteRaisesFirstFailedSubResponse() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("POST", "/$batch", FakeReply.json("{\"responses\":["
            + "{\"id\":\"0\",\"status\":204,\"headers\":{}},"
            + "{\"id\":\"1\",\"status\":400,\"body\":{\"error\":{\"message\":\"bad element\"}}}]}"));

        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("2024,EU", 1);
        cells.put("2025,XX", 2);

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.cells().writeValuesBatched("Sales", cells, List.of("Year", "Region"), null))
                .isInstanceOf(Tm1HttpException.class)
                .satisfies(e -> {
                    Tm1HttpException error = (Tm1HttpException) e;
                    assertEquals(400, error.getStatusCode());
                    assertThat(error.getBody()).contains("bad element");
                });
        }

        JsonObject payload = JsonParser.parseString(server.requests("POST", "/$batch").get(0).body()).getAsJsonObject();
        JsonArray requests = payload.getAsJsonArray("requests");
        assertEquals(2, requests.size());
        assertEquals("0", requests.get(0).getAsJsonObject().get("id").getAsString());
        assertEquals("/api/v1/Cubes('Sales')/tm1.Update", requests.get(0).getAsJsonObject().get("url").getAsString());
    }

    @Test
    public void testSplitKeyTrimsElements() {
        assertEquals(List.of("2024", "EU", ""), CellService.splitKey(" 2024 ,EU,"));
    }
}
