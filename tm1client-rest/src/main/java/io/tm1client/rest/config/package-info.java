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

/// Connection settings and base-URL composition.
///
/// [io.tm1client.rest.config.Tm1Config] holds what the caller declared,
/// [io.tm1client.rest.config.Tm1Endpoints] turns it into the base URL for one of the supported
/// deployment topologies, and [io.tm1client.rest.config.Tm1ConfigLoader] reads it from YAML.
package io.tm1client.rest.config;
