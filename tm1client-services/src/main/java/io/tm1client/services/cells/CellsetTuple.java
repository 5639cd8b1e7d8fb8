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

/// A position on an axis. A tuple spans several members when the axis cross-joins hierarchies.
public record CellsetTuple(
    @SerializedName("Ordinal") int ordinal,
    @SerializedName("Members") List<CellsetMember> members
) {

    public CellsetTuple {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
