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

/// A fully expanded cellset: every axis with its tuples and members, and the selected cells.
public record Cellset(
    @SerializedName("ID") String id,
    @SerializedName("Axes") List<CellsetAxis> axes,
    @SerializedName("Cells") List<CellsetCell> cells
) {

    public Cellset {
        axes = axes == null ? List.of() : List.copyOf(axes);
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    /// @return the tuple count of each axis, in axis order
    public int[] cardinalities() {
        int[] cardinalities = new int[axes.size()];
        for (int i = 0; i < cardinalities.length; i++) {
            cardinalities[i] = axes.get(i).cardinality();
        }
        return cardinalities;
    }
}
