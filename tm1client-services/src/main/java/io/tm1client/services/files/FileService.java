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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.tm1client.rest.RestService;
import io.tm1client.rest.errors.Tm1HttpException;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.rest.odata.ODataUrls;
import io.tm1client.rest.version.Tm1Feature;
import okhttp3.MediaType;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Files in the server's content store.
 * <p>
 * v12 servers keep them under {@code Contents('Files')} and allow folders. Older servers keep
 * them under {@code Contents('Blobs')}, flat: a folder path is refused there.
 */
public class FileService {
    private final static Logger logger = LogManager.getLogger(FileService.class);

    public static final String FILES_ROOT = "Files";
    public static final String BLOBS_ROOT = "Blobs";
    public static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final RestService rest;

    public FileService(RestService rest) {
        this.rest = rest;
    }

    /// @return `Files` on v12 and later, `Blobs` before
    public String contentRoot() {
        return Tm1Feature.FILES_CONTENT_ROOT.isSupportedBy(rest.version()) ? FILES_ROOT : BLOBS_ROOT;
    }

    /// Lists files and folders, descending `levels` folders below the root. Nested names are
    /// joined with `/`. Blobs have no folders, so `levels` is ignored there.
    public List<String> getAllNames(int levels) {
        String root = contentRoot();
        int depth = BLOBS_ROOT.equals(root) ? 0 : Math.max(0, levels);
        StringBuilder endpoint = new StringBuilder("/Contents('" + root + "')?$select=ID,Name&$expand=tm1.Folder/Contents");
        endpoint.append("($select=ID,Name;$expand=tm1.Folder/Contents".repeat(depth));
        endpoint.append(")".repeat(depth));
        JsonObject reply = rest.json("GET", endpoint.toString(), null, JsonObject.class);
        List<String> names = new ArrayList<>();
        collect(reply, "", names);
        return names;
    }

    /// @param folders the folder path below the root, empty for the root itself
    public byte[] get(String fileName, List<String> folders) {
        String endpoint = entity(fileName, folders) + "/Content";
        try (Response response = rest.get(endpoint)) {
            ResponseBody body = response.body();
            return body == null ? new byte[0] : body.bytes();
        } catch (IOException e) {
            throw new Tm1TransportException("unable to read file " + path(fileName, folders), e);
        }
    }

    /// Creates the document entity, then uploads its content.
    public void create(String fileName, List<String> folders, byte[] content) {
        JsonObject document = new JsonObject();
        document.addProperty("@odata.type", "#ibm.tm1.api.v1.Document");
        document.addProperty("ID", fileName);
        document.addProperty("Name", fileName);
        rest.execute("POST", container(folders) + "/Contents", document);
        update(fileName, folders, content);
    }

    /// Replaces the content of an existing file.
    ///
    /// @throws Tm1ValidationException when the file does not exist
    public void update(String fileName, List<String> folders, byte[] content) {
        if (!exists(fileName, folders)) {
            throw new Tm1ValidationException("file " + path(fileName, folders) + " does not exist");
        }
        try (Response ignored = rest.request("PATCH", entity(fileName, folders) + "/Content",
            RequestBody.create(content, OCTET_STREAM))) {
            logger.debug("uploaded {} bytes to {}", content.length, path(fileName, folders));
        }
    }

    public void updateOrCreate(String fileName, List<String> folders, byte[] content) {
        if (exists(fileName, folders)) {
            update(fileName, folders, content);
        } else {
            create(fileName, folders, content);
        }
    }

    public boolean exists(String fileName, List<String> folders) {
        try {
            rest.execute("GET", entity(fileName, folders), null);
            return true;
        } catch (Tm1HttpException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    public void delete(String fileName, List<String> folders) {
        rest.execute("DELETE", entity(fileName, folders), null);
    }

    private String container(List<String> folders) {
        String root = contentRoot();
        if (BLOBS_ROOT.equals(root) && folders != null && !folders.isEmpty()) {
            throw new Tm1ValidationException("folders are not supported before TM1 v12: " + String.join("/", folders));
        }
        StringBuilder endpoint = new StringBuilder("/Contents('" + root + "')");
        if (folders != null) {
            for (String folder : folders) {
                endpoint.append(ODataUrls.format("/Contents('{}')", folder));
            }
        }
        return endpoint.toString();
    }

    private String entity(String fileName, List<String> folders) {
        return container(folders) + ODataUrls.format("/Contents('{}')", fileName);
    }

    private static String path(String fileName, List<String> folders) {
        if (folders == null || folders.isEmpty()) {
            return fileName;
        }
        return String.join("/", folders) + "/" + fileName;
    }

    private static void collect(JsonObject folder, String prefix, List<String> names) {
        if (folder == null || !folder.has("Contents")) {
            return;
        }
        for (JsonElement element : folder.getAsJsonArray("Contents")) {
            JsonObject entry = element.getAsJsonObject();
            String name = prefix + entry.get("Name").getAsString();
            names.add(name);
            collect(entry, name + "/", names);
        }
    }
}
