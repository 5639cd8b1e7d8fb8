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

/// The cellset engine: MDX and view execution, coordinate reconstruction, and cell writes.
///
/// Cellsets are created on the server, expanded in one request, then deleted. Cells come back
/// with an ordinal only; [io.tm1client.services.cells.CellsetCoordinates] turns it back into a
/// position on each axis.
package io.tm1client.services.cells;
