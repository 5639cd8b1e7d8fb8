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

/// A cell reached by a feeder trace or a feeder check, and whether it is fed.
public record FedCell(
    @SerializedName("Cube") CubeRef cube,
    @SerializedName("Tuple") List<CellsetMember> tuple,
    @SerializedName("Fed") boolean fed
) {

    public FedCell {
        tuple = tuple == null ? List.of() : tuple;
    }
}
