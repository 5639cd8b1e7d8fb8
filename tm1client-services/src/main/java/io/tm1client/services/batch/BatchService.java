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
import io.tm1client.rest.RestService;
import io.tm1client.rest.SHARED;
import io.tm1client.rest.errors.Tm1HttpException;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.rest.version.BatchUrlNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Sends several requests in one round trip through the JSON `$batch` endpoint.
///
/// Sub-request URLs are normalized for the connected server: v11 expects the `/api/v1` prefix
/// on every URL, v12 does not.
public class BatchService {
    private final static Logger logger = LogManager.getLogger(BatchService.class);

    public static final String BATCH_ENDPOINT = "/$batch";

    private final RestService rest;

    public BatchService(RestService rest) {
        this.rest = rest;
    }

    /// @return the sub-responses in the order the server sent them
    /// @throws Tm1ValidationException when the batch is empty or ids repeat
    public List<BatchResponse> execute(List<BatchRequest> requests) {
        if (requests.isEmpty()) {
            throw new Tm1ValidationException("a batch needs at least one request");
        }
        Set<String> ids = new HashSet<>();
        String version = rest.version();
        JsonArray array = new JsonArray();
        for (BatchRequest request : requests) {
            if (!ids.add(request.id())) {
                throw new Tm1ValidationException("duplicate batch request id: " + request.id());
            }
            BatchRequest normalized = request.withUrl(BatchUrlNormalizer.normalize(request.url(), version));
            array.add(SHARED.gson.toJsonTree(normalized));
        }
        JsonObject payload = new JsonObject();
        payload.add("requests", array);

        logger.debug("sending batch of {} requests", requests.size());
        JsonObject reply = rest.json("POST", BATCH_ENDPOINT, payload, JsonObject.class);
        if (reply == null || !reply.has("responses") || !reply.get("responses").isJsonArray()) {
            throw new Tm1TransportException("batch reply carries no responses");
        }
        List<BatchResponse> responses = new ArrayList<>();
        for (JsonElement element : reply.getAsJsonArray("responses")) {
            responses.add(SHARED.gson.fromJson(element, BatchResponse.class));
        }
        return responses;
    }

    /// Like [#execute(List)], but raises [Tm1HttpException] for the first sub-request, in request
    /// order, whose response failed.
    public List<BatchResponse> executeChecked(List<BatchRequest> requests) {
        List<BatchResponse> responses = execute(requests);
        Map<String, BatchResponse> byId = responses.stream()
            .collect(Collectors.toMap(BatchResponse::id, Function.identity(), (a, b) -> a));
        for (BatchRequest request : requests) {
            BatchResponse response = byId.get(request.id());
            if (response != null && !response.isSuccessful()) {
                throw new Tm1HttpException(request.method(), request.url(), response.status(), response.bodyText());
            }
        }
        return responses;
    }
}
