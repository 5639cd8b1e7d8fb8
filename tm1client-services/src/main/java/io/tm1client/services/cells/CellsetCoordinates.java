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

import java.util.List;
import java.util.StringJoiner;

/// Maps a cell ordinal back onto the axes of its cellset.
///
/// The decomposition is mixed-radix with axis 0 most significant. It runs from the last axis to
/// the first: `i_j = rest % c_j; rest /= c_j`.
public final class CellsetCoordinates {

    private CellsetCoordinates() {
    }

    /// Splits an ordinal into one tuple index per axis. An axis with no tuples gets index 0 and
    /// does not divide; no axes give an empty array.
    public static int[] decompose(long ordinal, int[] cardinalities) {
        int[] indices = new int[cardinalities.length];
        long remaining = ordinal;
        for (int j = cardinalities.length - 1; j >= 0; j--) {
            int cardinality = cardinalities[j];
            if (cardinality > 0) {
                indices[j] = (int) (remaining % cardinality);
                remaining /= cardinality;
            }
        }
        return indices;
    }

    /// The inverse of [#decompose(long, int[])] for indices within bounds.
    public static long recompose(int[] indices, int[] cardinalities) {
        long ordinal = 0;
        for (int j = 0; j < cardinalities.length; j++) {
            if (cardinalities[j] > 0) {
                ordinal = ordinal * cardinalities[j] + indices[j];
            }
        }
        return ordinal;
    }

    /// The unique names of every member on every axis at the cell's position, joined with `,`.
    /// Indices outside an axis contribute nothing.
    public static String key(Cellset cellset, long ordinal) {
        List<CellsetAxis> axes = cellset.axes();
        int[] indices = decompose(ordinal, cellset.cardinalities());
        StringJoiner key = new StringJoiner(",");
        for (int j = 0; j < indices.length; j++) {
            List<CellsetTuple> tuples = axes.get(j).tuples();
            if (indices[j] >= tuples.size()) {
                continue;
            }
            for (CellsetMember member : tuples.get(indices[j]).members()) {
                key.add(member.uniqueName() != null ? member.uniqueName() : member.name());
            }
        }
        return key.toString();
    }
}
