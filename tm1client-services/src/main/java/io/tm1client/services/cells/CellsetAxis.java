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

import com.google.gson.annotations.SerializedName;

import java.util.List;

/// One axis of a cellset; axis 0 holds the columns.
public record CellsetAxis(
    @SerializedName("Ordinal") int ordinal,
    @SerializedName("Tuples") List<CellsetTuple> tuples
) {

    public CellsetAxis {
        tuples = tuples == null ? List.of() : List.copyOf(tuples);
    }

    /// @return the number of tuples on this axis
    public int cardinality() {
        return tuples.size();
    }
}
