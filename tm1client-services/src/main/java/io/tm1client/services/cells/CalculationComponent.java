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

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/// One node of a `tm1.TraceCellCalculation` reply: the cell, how it was computed and the
/// components it was computed from, as deep as the trace asked for.
///
/// @param statements the rule statements that produced the value, if any
public record CalculationComponent(
    @SerializedName("Cube") CubeRef cube,
    @SerializedName("Tuple") List<CellsetMember> tuple,
    @SerializedName("Type") JsonElement type,
    @SerializedName("Value") JsonElement value,
    @SerializedName("Statements") List<String> statements,
    @SerializedName("Components") List<CalculationComponent> components
) {

    public CalculationComponent {
        tuple = tuple == null ? List.of() : tuple;
        statements = statements == null ? List.of() : statements;
        components = components == null ? List.of() : components;
    }

    public CalculationType calculationType() {
        return CalculationType.of(type);
    }

    public CellProperty valueProperty() {
        return CellProperty.of(value);
    }
}
