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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.tm1client.rest.RestService;
import io.tm1client.rest.SHARED;
import io.tm1client.rest.errors.Tm1Exception;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.errors.Tm1ValidationException;
import io.tm1client.rest.odata.ODataUrls;
import io.tm1client.rest.odata.SandboxRouting;
import io.tm1client.services.ODataReplies;
import io.tm1client.services.batch.BatchRequest;
import io.tm1client.services.batch.BatchService;
import io.tm1client.services.cubes.CubeService;
import io.tm1client.services.process.ProcessExecuteResult;
import io.tm1client.services.process.ProcessService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * Reads and writes cube cells.
 * <p>
 * Reads go through a server-side cellset: it is created from MDX or a view, expanded in a
 * single request, and deleted afterwards whether or not the expansion succeeded. The result is
 * a map from coordinate key (member unique names joined with {@code ,}) to the projected cell
 * properties, in cell ordinal order.
 * <p>
 * Writes post one {@code tm1.Update} per cell, or a single {@code $batch} with
 * {@link #writeValuesBatched}. Spreads run against a temporary cellset over the target cell,
 * which is likewise deleted afterwards.
 * <p>
 * The trace and check operations ({@link #traceCellCalculation}, {@link #traceCellFeeders},
 * {@link #checkCellFeeders}, {@link #checkRules}) are read-only diagnostics of cube rules.
 */
public class CellService {
    private final static Logger logger = LogManager.getLogger(CellService.class);

    /// Upper bound on tuples, members and cells fetched by one extraction.
    public static final int EXPAND_TOP = 100000;

    public static final String VALUE = "Value";
    public static final String ORDINAL = "Ordinal";
    public static final String FORMATTED_VALUE = "FormattedValue";
    public static final String RULE_DERIVED = "RuleDerived";
    public static final String CONSOLIDATED = "Consolidated";
    public static final String UPDATEABLE = "Updateable";

    private static final List<String> OPTIONAL_PROPERTIES = List.of(RULE_DERIVED, CONSOLIDATED, UPDATEABLE);

    /// Prefix of the temporary views created by [#clearWithMdx].
    public static final String CLEAR_VIEW_PREFIX = "}tm1client_";

    private static final String TUPLE_SELECT = "Tuple($select=Name,UniqueName,Type)";

    private final RestService rest;
    private final CubeService cubes;
    private final BatchService batch;
    private final ProcessService processes;

    public CellService(RestService rest, CubeService cubes, BatchService batch, ProcessService processes) {
        this.rest = rest;
        this.cubes = cubes;
        this.batch = batch;
        this.processes = processes;
    }

    /// Runs MDX and returns the projected cells by coordinate key.
    ///
    /// @param cellProperties the properties to project; empty projects the default set
    /// @param sandbox the sandbox to read from, or null for the base data
    public Map<String, Map<String, CellProperty>> executeMdx(String mdx, List<String> cellProperties, String sandbox) {
        String id = createCellset(mdx, sandbox);
        return project(extractAndDelete(id, cellProperties, sandbox), cellProperties);
    }

    public Map<String, Map<String, CellProperty>> executeView(String cubeName, String viewName, boolean privateView,
                                                             List<String> cellProperties, String sandbox) {
        String id = createCellsetFromView(cubeName, viewName, privateView, sandbox);
        return project(extractAndDelete(id, cellProperties, sandbox), cellProperties);
    }

    /// @return the id of the new cellset, which the caller must delete
    public String createCellset(String mdx, String sandbox) {
        JsonObject payload = new JsonObject();
        payload.addProperty("MDX", mdx);
        return cellsetId(rest.json("POST", SandboxRouting.withSandbox("/ExecuteMDX", sandbox), payload,
            JsonObject.class));
    }

    public String createCellsetFromView(String cubeName, String viewName, boolean privateView, String sandbox) {
        String endpoint = ODataUrls.format("/Cubes('{}')/" + (privateView ? "PrivateViews" : "Views")
            + "('{}')/tm1.Execute", cubeName, viewName);
        return cellsetId(rest.json("POST", SandboxRouting.withSandbox(endpoint, sandbox), null, JsonObject.class));
    }

    /// Fetches axes, tuples, members and cells of a cellset in one request. The cellset is kept.
    public Cellset extractCellset(String cellsetId, List<String> cellProperties, String sandbox) {
        return extractCellset(cellsetId, cellProperties, sandbox, false);
    }

    /// @param deleteCellset delete the cellset once extracted, even when the extraction fails
    public Cellset extractCellset(String cellsetId, List<String> cellProperties, String sandbox,
                                  boolean deleteCellset) {
        if (deleteCellset) {
            return extractAndDelete(cellsetId, cellProperties, sandbox);
        }
        Cellset cellset = rest.json("GET", SandboxRouting.withSandbox(extractEndpoint(cellsetId, cellProperties),
            sandbox), null, Cellset.class);
        if (cellset == null) {
            throw new Tm1TransportException("empty cellset " + cellsetId);
        }
        return cellset;
    }

    public void deleteCellset(String cellsetId, String sandbox) {
        rest.execute("DELETE", SandboxRouting.withSandbox(ODataUrls.format("/Cellsets('{}')", cellsetId), sandbox),
            null);
    }

    /// Reads one cell. The last element goes on columns, the others are cross-joined on rows.
    ///
    /// @param dimensions the cube's dimensions in order; null or empty looks them up
    /// @return the first cell value that is not empty
    public Optional<CellProperty> getValue(String cubeName, List<String> elements, List<String> dimensions,
                                           String sandbox) {
        if (elements.isEmpty()) {
            throw new Tm1ValidationException("elements cannot be empty");
        }
        List<String> dims = resolveDimensions(cubeName, dimensions);
        checkArity(elements, dims, 0);
        return executeMdx(valueMdx(cubeName, elements, dims), List.of(), sandbox).values().stream()
            .map(cell -> cell.get(VALUE))
            .filter(value -> value != null && !value.isEmpty())
            .findFirst();
    }

    /// Writes one cell with `tm1.Update`.
    public void writeValue(String cubeName, List<String> elements, List<String> dimensions, Object value,
                           String sandbox) {
        if (elements.isEmpty()) {
            throw new Tm1ValidationException("elements cannot be empty");
        }
        List<String> dims = resolveDimensions(cubeName, dimensions);
        checkArity(elements, dims, 0);
        rest.execute("POST", updateEndpoint(cubeName, sandbox), updateBody(elements, dims, value));
    }

    /// Writes cells one request at a time, in map order. Every key is validated before the first
    /// write; the first failing write aborts the rest.
    ///
    /// @param cells coordinate keys (element names joined with `,`) to values
    public void writeValues(String cubeName, Map<String, ?> cells, List<String> dimensions, String sandbox) {
        if (cells.isEmpty()) {
            return;
        }
        List<List<String>> coordinates = new ArrayList<>(cells.size());
        List<Object> values = new ArrayList<>(cells.size());
        cells.forEach((key, value) -> {
            coordinates.add(splitKey(key));
            values.add(value);
        });
        writeValuesByCoords(cubeName, coordinates, values, dimensions, sandbox);
    }

    /// Writes cells given as explicit element tuples, one request per cell, in list order.
    /// Every tuple is validated before the first write.
    ///
    /// @param coordinates one element list per cell, in dimension order
    /// @param values the value of each cell, matched by position
    public void writeValuesByCoords(String cubeName, List<List<String>> coordinates, List<?> values,
                                    List<String> dimensions, String sandbox) {
        if (coordinates.size() != values.size()) {
            throw new Tm1ValidationException("got " + coordinates.size() + " coordinates but " + values.size()
                + " values");
        }
        if (coordinates.isEmpty()) {
            return;
        }
        List<String> dims = resolveDimensions(cubeName, dimensions);
        List<JsonObject> bodies = new ArrayList<>(coordinates.size());
        for (int i = 0; i < coordinates.size(); i++) {
            checkArity(coordinates.get(i), dims, i);
            bodies.add(updateBody(coordinates.get(i), dims, values.get(i)));
        }
        String endpoint = updateEndpoint(cubeName, sandbox);
        for (JsonObject body : bodies) {
            rest.execute("POST", endpoint, body);
        }
        logger.debug("wrote {} cells to {}", bodies.size(), cubeName);
    }

    /// Writes all cells in one `$batch` request, one `tm1.Update` sub-request per cell.
    public void writeValuesBatched(String cubeName, Map<String, ?> cells, List<String> dimensions, String sandbox) {
        if (cells.isEmpty()) {
            return;
        }
        List<String> dims = resolveDimensions(cubeName, dimensions);
        List<JsonObject> bodies = updateBodies(cells, dims);
        String endpoint = updateEndpoint(cubeName, sandbox);
        List<BatchRequest> requests = new ArrayList<>();
        for (int i = 0; i < bodies.size(); i++) {
            requests.add(BatchRequest.of(String.valueOf(i), "POST", endpoint, bodies.get(i)));
        }
        batch.executeChecked(requests);
        logger.debug("wrote {} cells to {} in one batch", bodies.size(), cubeName);
    }

    /// Zeroes the cells an MDX query selects, through a temporary MDX view and `ViewZeroOut`.
    /// The view is deleted afterwards.
    ///
    /// @throws Tm1ValidationException when the clearing process does not complete successfully
    public void clearWithMdx(String cubeName, String mdx, String sandbox) {
        String viewName = CLEAR_VIEW_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        JsonObject view = new JsonObject();
        view.addProperty("@odata.type", "#ibm.tm1.api.v1.MDXView");
        view.addProperty("Name", viewName);
        view.addProperty("MDX", mdx);
        rest.execute("POST", ODataUrls.format("/Cubes('{}')/Views", cubeName), view);
        try {
            String prolog = sandbox == null || sandbox.isEmpty()
                ? ""
                : "ServerActiveSandbox('" + ODataUrls.quote(sandbox) + "');";
            String epilog = "ViewZeroOut('" + ODataUrls.quote(cubeName) + "','" + ODataUrls.quote(viewName) + "');";
            ProcessExecuteResult result = processes.executeTiCode(prolog, epilog);
            if (!result.isSuccess()) {
                throw new Tm1ValidationException("clearing cube " + cubeName + " did not complete successfully: status "
                    + result.statusCode());
            }
        } finally {
            try {
                rest.execute("DELETE", ODataUrls.format("/Cubes('{}')/Views('{}')", cubeName, viewName), null);
            } catch (Tm1Exception e) {
                logger.warn("unable to delete view {} on {}: {}", viewName, cubeName, e.getMessage());
            }
        }
    }

    /// Spreads `value` over the leaves of the target cell in proportion to a reference cell.
    ///
    /// @param uniqueElementNames the target cell, one unique name per dimension such as `[Year].[2024]`
    /// @param referenceUniqueElementNames the reference cell
    /// @param referenceCube the cube of the reference cell; null or empty uses `cubeName`
    public void relativeProportionalSpread(double value, String cubeName, List<String> uniqueElementNames,
                                           List<String> referenceUniqueElementNames, String referenceCube,
                                           String sandbox) {
        JsonObject payload = spreadPayload("RP" + spreadAmount(value), referenceUniqueElementNames);
        String cube = referenceCube == null || referenceCube.isEmpty() ? cubeName : referenceCube;
        payload.addProperty("ReferenceCube@odata.bind", ODataUrls.format("Cubes('{}')", cube));
        spread(cubeName, uniqueElementNames, payload, sandbox);
    }

    /// Spreads `value` equally over the leaves of the target cell.
    public void equalSpread(double value, String cubeName, List<String> uniqueElementNames, String sandbox) {
        spread(cubeName, uniqueElementNames, spreadPayload("S" + spreadAmount(value), uniqueElementNames), sandbox);
    }

    /// Zeroes the leaves of the target cell.
    public void clearSpread(String cubeName, List<String> uniqueElementNames, String sandbox) {
        spread(cubeName, uniqueElementNames, spreadPayload("C", uniqueElementNames), sandbox);
    }

    /// Traces how one cell is calculated.
    ///
    /// @param depth how many levels of components to expand; values below 1 mean 1
    public CalculationComponent traceCellCalculation(String cubeName, List<String> elements, List<String> dimensions,
                                                     String sandbox, int depth) {
        JsonObject body = tupleBody(cubeName, elements, dimensions);
        String endpoint = ODataUrls.format("/Cubes('{}')/tm1.TraceCellCalculation", cubeName)
            + traceCalculationQuery(Math.max(depth, 1));
        return rest.json("POST", SandboxRouting.withSandbox(endpoint, sandbox), body, CalculationComponent.class);
    }

    /// Traces the feeders fired from one cell.
    public FeederTrace traceCellFeeders(String cubeName, List<String> elements, List<String> dimensions,
                                        String sandbox) {
        JsonObject body = tupleBody(cubeName, elements, dimensions);
        String endpoint = ODataUrls.format("/Cubes('{}')/tm1.TraceFeeders", cubeName)
            + "?$select=Statements,FedCells&$expand=FedCells/" + TUPLE_SELECT + ",FedCells/Cube($select=Name)";
        return rest.json("POST", SandboxRouting.withSandbox(endpoint, sandbox), body, FeederTrace.class);
    }

    /// Checks whether the components of a consolidated cell are fed.
    ///
    /// @return one entry per component the server inspected
    public List<FedCell> checkCellFeeders(String cubeName, List<String> elements, List<String> dimensions,
                                          String sandbox) {
        JsonObject body = tupleBody(cubeName, elements, dimensions);
        String endpoint = ODataUrls.format("/Cubes('{}')/tm1.CheckFeeders", cubeName)
            + "?$select=Fed&$expand=" + TUPLE_SELECT + ",Cube($select=Name)";
        return ODataReplies.values(rest.json("POST", SandboxRouting.withSandbox(endpoint, sandbox), body,
            JsonObject.class), FedCell.class);
    }

    /// Checks rules for syntax errors.
    ///
    /// @param rules the rule text to check; null or empty checks the cube's current rules
    /// @return the errors found, empty when the rules are valid
    public List<RuleSyntaxError> checkRules(String cubeName, String rules) {
        JsonObject body = new JsonObject();
        if (rules != null && !rules.isEmpty()) {
            body.addProperty("Rules", rules);
        }
        return ODataReplies.values(rest.json("POST", ODataUrls.format("/Cubes('{}')/tm1.CheckRules", cubeName), body,
            JsonObject.class), RuleSyntaxError.class);
    }

    private void spread(String cubeName, List<String> uniqueElementNames, JsonObject payload, String sandbox) {
        String id = createCellset(spreadMdx(cubeName, uniqueElementNames), sandbox);
        try {
            rest.execute("POST", SandboxRouting.withSandbox(ODataUrls.format("/Cellsets('{}')/tm1.Update", id),
                sandbox), payload);
        } finally {
            try {
                deleteCellset(id, sandbox);
            } catch (Tm1Exception e) {
                logger.warn("unable to delete cellset {}: {}", id, e.getMessage());
            }
        }
    }

    static String spreadMdx(String cubeName, List<String> uniqueElementNames) {
        StringJoiner members = new StringJoiner("*");
        for (String uniqueName : uniqueElementNames) {
            members.add("{" + uniqueName + "}");
        }
        return "SELECT " + members + " ON 0 FROM [" + cubeName + "]";
    }

    private static JsonObject spreadPayload(String instruction, List<String> referenceUniqueElementNames) {
        JsonArray reference = new JsonArray();
        for (String uniqueName : referenceUniqueElementNames) {
            reference.add(uniqueNameBinding(uniqueName));
        }
        JsonObject payload = new JsonObject();
        payload.addProperty("BeginOrdinal", 0);
        payload.addProperty("Value", instruction);
        payload.add("ReferenceCell@odata.bind", reference);
        return payload;
    }

    /// `100.0` becomes `100`, `2.5` stays `2.5`.
    static String spreadAmount(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /// The element binding of `[dim].[elem]` or `[dim].[hier].[elem]`. A two-part name uses the
    /// dimension's same-named hierarchy.
    static String uniqueNameBinding(String uniqueName) {
        List<String> parts = new ArrayList<>(3);
        for (String segment : uniqueName.trim().split("]")) {
            String part = segment.replaceFirst("^[.\\[]+", "").trim();
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        if (parts.size() == 3) {
            return ODataUrls.elementBinding(parts.get(0), parts.get(1), parts.get(2));
        }
        if (parts.size() == 2) {
            return ODataUrls.elementBinding(parts.get(0), parts.get(0), parts.get(1));
        }
        throw new Tm1ValidationException("not a unique element name: " + uniqueName);
    }

    static String traceCalculationQuery(int depth) {
        StringJoiner select = new StringJoiner(",");
        StringJoiner expand = new StringJoiner(",");
        select.add("Type").add("Value").add("Statements");
        expand.add(TUPLE_SELECT);
        String path = "Components";
        for (int level = 1; level <= depth; level++) {
            select.add(path + "/Type").add(path + "/Value").add(path + "/Statements");
            expand.add(path + "/" + TUPLE_SELECT).add(path + "/Cube($select=Name)");
            path = path + "/Components";
        }
        return "?$select=" + select + "&$expand=" + expand;
    }

    private JsonObject tupleBody(String cubeName, List<String> elements, List<String> dimensions) {
        List<String> dims = resolveDimensions(cubeName, dimensions);
        checkArity(elements, dims, 0);
        JsonArray tuple = new JsonArray();
        for (int i = 0; i < elements.size(); i++) {
            tuple.add(ODataUrls.elementBinding(dims.get(i), dims.get(i), elements.get(i)));
        }
        JsonObject body = new JsonObject();
        body.add("Tuple@odata.bind", tuple);
        return body;
    }

    private Cellset extractAndDelete(String cellsetId, List<String> cellProperties, String sandbox) {
        try {
            return extractCellset(cellsetId, cellProperties, sandbox);
        } finally {
            try {
                deleteCellset(cellsetId, sandbox);
            } catch (Tm1Exception e) {
                logger.warn("unable to delete cellset {}: {}", cellsetId, e.getMessage());
            }
        }
    }

    /// Projects each cell onto the requested properties, keyed by coordinates.
    static Map<String, Map<String, CellProperty>> project(Cellset cellset, List<String> cellProperties) {
        Map<String, Map<String, CellProperty>> result = new LinkedHashMap<>();
        for (CellsetCell cell : cellset.cells()) {
            Map<String, CellProperty> properties = new LinkedHashMap<>();
            properties.put(VALUE, CellProperty.of(cell.value()));
            properties.put(ORDINAL, CellProperty.of(cell.ordinal()));
            if (cell.formattedValue() != null && !cell.formattedValue().isEmpty()) {
                properties.put(FORMATTED_VALUE, CellProperty.of(cell.formattedValue()));
            }
            if (wants(cellProperties, RULE_DERIVED)) {
                properties.put(RULE_DERIVED, CellProperty.of(cell.ruleDerived()));
            }
            if (wants(cellProperties, CONSOLIDATED)) {
                properties.put(CONSOLIDATED, CellProperty.of(cell.consolidated()));
            }
            if (wants(cellProperties, UPDATEABLE)) {
                properties.put(UPDATEABLE, CellProperty.of(cell.updateable()));
            }
            result.put(CellsetCoordinates.key(cellset, cell.ordinal()), properties);
        }
        return result;
    }

    static String extractEndpoint(String cellsetId, List<String> cellProperties) {
        StringJoiner select = new StringJoiner(",");
        select.add(ORDINAL).add(VALUE).add(FORMATTED_VALUE);
        if (cellProperties == null || cellProperties.isEmpty()) {
            OPTIONAL_PROPERTIES.forEach(select::add);
        } else {
            for (String property : cellProperties) {
                if (!property.equalsIgnoreCase(ORDINAL) && !property.equalsIgnoreCase(VALUE)
                    && !property.equalsIgnoreCase(FORMATTED_VALUE)) {
                    select.add(property);
                }
            }
        }
        return ODataUrls.format("/Cellsets('{}')", cellsetId)
            + "?$expand=Axes($expand=Tuples($expand=Members($select=Name,UniqueName,Ordinal;$top=" + EXPAND_TOP
            + ");$top=" + EXPAND_TOP + ")),Cells($select=" + select + ";$top=" + EXPAND_TOP + ")";
    }

    static String valueMdx(String cubeName, List<String> elements, List<String> dimensions) {
        List<String> members = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            String dimension = dimensions.get(i);
            members.add("[" + dimension + "].[" + dimension + "].[" + elements.get(i) + "]");
        }
        String rows = members.size() > 1 ? String.join("*", members.subList(0, members.size() - 1)) : "{}";
        String columns = members.get(members.size() - 1);
        return "SELECT " + rows + " ON ROWS, " + columns + " ON COLUMNS FROM [" + cubeName + "]";
    }

    static JsonObject updateBody(List<String> elements, List<String> dimensions, Object value) {
        JsonArray tuple = new JsonArray();
        for (int i = 0; i < elements.size(); i++) {
            String dimension = dimensions.get(i);
            tuple.add(ODataUrls.elementBinding(dimension, dimension, elements.get(i)));
        }
        JsonObject body = new JsonObject();
        body.add("Tuple@odata.bind", tuple);
        body.add("Value", SHARED.gson.toJsonTree(value));
        return body;
    }

    private List<JsonObject> updateBodies(Map<String, ?> cells, List<String> dimensions) {
        List<JsonObject> bodies = new ArrayList<>(cells.size());
        int index = 0;
        for (Map.Entry<String, ?> entry : cells.entrySet()) {
            List<String> elements = splitKey(entry.getKey());
            checkArity(elements, dimensions, index++);
            bodies.add(updateBody(elements, dimensions, entry.getValue()));
        }
        return bodies;
    }

    static List<String> splitKey(String key) {
        List<String> elements = new ArrayList<>();
        for (String part : key.split(",", -1)) {
            elements.add(part.trim());
        }
        return elements;
    }

    private List<String> resolveDimensions(String cubeName, List<String> dimensions) {
        if (dimensions != null && !dimensions.isEmpty()) {
            return dimensions;
        }
        return cubes.getDimensionNames(cubeName);
    }

    private static void checkArity(List<String> elements, List<String> dimensions, int index) {
        if (elements.size() != dimensions.size()) {
            throw new Tm1ValidationException(String.format(Locale.ROOT,
                "coordinate %d has %d elements but the cube has %d dimensions", index, elements.size(),
                dimensions.size()));
        }
    }

    private static String updateEndpoint(String cubeName, String sandbox) {
        return SandboxRouting.withSandbox(ODataUrls.format("/Cubes('{}')/tm1.Update", cubeName), sandbox);
    }

    private static boolean wants(List<String> cellProperties, String property) {
        if (cellProperties == null || cellProperties.isEmpty()) {
            return true;
        }
        for (String requested : cellProperties) {
            if (requested.equalsIgnoreCase(property)) {
                return true;
            }
        }
        return false;
    }

    private static String cellsetId(JsonObject reply) {
        JsonElement id = reply == null ? null : reply.get("ID");
        if (id == null || id.isJsonNull()) {
            throw new Tm1TransportException("server did not return a cellset id");
        }
        return id.getAsString();
    }
}
