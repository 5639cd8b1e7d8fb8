package io.tm1client.services.files;

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
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.services.Tm1Service;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.tm1client.services.FakeServerConnections.V11;
import static io.tm1client.services.FakeServerConnections.V12;
import static io.tm1client.services.FakeServerConnections.rest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@ExtendWith(FakeTm1ServerExtension.class)
public class FileServiceTest {

    @Test
    public void testContentRootFollowsVersion() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertEquals(FileService.BLOBS_ROOT, tm1.files().contentRoot());
        }
        try (Tm1Service tm1 = new Tm1Service(rest(server, V12))) {
            assertEquals(FileService.FILES_ROOT, tm1.files().contentRoot());
        }
    }

    @Test
    public void testFoldersAreRefusedOnBlobs() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertThatThrownBy(() -> tm1.files().get("plan.csv", List.of("imports")))
                .isInstanceOf(Tm1ValidationException.class)
                .hasMessageContaining("imports");
        }
        assertThat(server.trace()).isEmpty();
    }

    @Test
    public void testGetAllNamesWalksNestedFolders() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Contents('Files')", FakeReply.json("{\"ID\":\"Files\",\"Name\":\"Files\",\"Contents\":["
            + "{\"ID\":\"a.csv\",\"Name\":\"a.csv\"},"
            + "{\"ID\":\"imports\",\"Name\":\"imports\",\"Contents\":["
            + "{\"ID\":\"b.csv\",\"Name\":\"b.csv\"},"
            + "{\"ID\":\"2025\",\"Name\":\"2025\",\"Contents\":[{\"ID\":\"c.csv\",\"Name\":\"c.csv\"}]}]}]}"));

        List<String> names;
        try (Tm1Service tm1 = new Tm1Service(rest(server, V12))) {
            names = tm1.files().getAllNames(2);
        }

        assertThat(names).containsExactly("a.csv", "imports", "imports/b.csv", "imports/2025", "imports/2025/c.csv");
        assertEquals("$select=ID,Name&$expand=tm1.Folder/Contents($select=ID,Name;$expand=tm1.Folder/Contents"
                + "($select=ID,Name;$expand=tm1.Folder/Contents))",
            server.requests().get(0).query());
    }

    @Test
    public void testCreateThenUploadInFolder() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        String folder = "/Contents('Files')/Contents('imports')";
        server.on("POST", folder + "/Contents", FakeReply.status(201));
        server.on("GET", folder + "/Contents('plan.csv')", FakeReply.json("{\"ID\":\"plan.csv\"}"));
        server.on("PATCH", folder + "/Contents('plan.csv')/Content", FakeReply.status(204));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V12))) {
            tm1.files().create("plan.csv", List.of("imports"), "year,value\n".getBytes(StandardCharsets.UTF_8));
        }

        assertEquals(List.of(
            "POST /Contents('Files')/Contents('imports')/Contents",
            "GET /Contents('Files')/Contents('imports')/Contents('plan.csv')",
            "PATCH /Contents('Files')/Contents('imports')/Contents('plan.csv')/Content"), server.trace());
        assertThat(server.requests().get(0).body()).contains("\"@odata.type\":\"#ibm.tm1.api.v1.Document\"");
        RecordedRequest upload = server.requests().get(2);
        assertThat(upload.header("Content-Type")).startsWith("application/octet-stream");
        assertEquals("year,value\n", upload.body());
    }

    @Test
    public void testUpdateOfMissingFileIsRejected() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertFalse(tm1.files().exists("missing.csv", List.of()));
            assertThatThrownBy(() -> tm1.files().update("missing.csv", List.of(), new byte[]{1}))
                .isInstanceOf(Tm1ValidationException.class)
                .hasMessageContaining("missing.csv");
        }
        assertThat(server.trace()).allMatch(line -> line.equals("GET /Contents('Blobs')/Contents('missing.csv')"));
    }

    @Test
    public void testGetReturnsBytes() {
        FakeTm1Server server = FakeTm1ServerExtension.getServer();
        server.on("GET", "/Contents('Blobs')/Contents('notes.txt')/Content", FakeReply.text("hello"));

        try (Tm1Service tm1 = new Tm1Service(rest(server, V11))) {
            assertEquals("hello", new String(tm1.files().get("notes.txt", List.of()), StandardCharsets.UTF_8));
        }
    }
}
