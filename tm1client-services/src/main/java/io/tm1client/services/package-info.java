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

/// Services built on the TM1 REST transport.
///
/// [io.tm1client.services.Tm1Service] wires them to one [io.tm1client.rest.RestService]:
/// the cellset engine, the chore orchestrator, `$batch`, and the version-gated server, job,
/// thread, file and cube services.
package io.tm1client.services;
