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
import com.google.gson.JsonNull;
import com.google.gson.annotations.SerializedName;

/// One cell as returned by the server. Properties that were not selected keep their defaults.
///
/// @param ordinal the cell's position in row-major order over all axes
/// @param value the raw value; [JsonNull] when the server sent none
public record CellsetCell(
    @SerializedName("Ordinal") int ordinal,
    @SerializedName("Value") JsonElement value,
    @SerializedName("FormattedValue") String formattedValue,
    @SerializedName("RuleDerived") boolean ruleDerived,
    @SerializedName("Consolidated") boolean consolidated,
    @SerializedName("Updateable") int updateable
) {

    public CellsetCell {
        value = value == null ? JsonNull.INSTANCE : value;
    }
}
