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

/// Version comparison and the capability gates built on it.
///
/// [io.tm1client.rest.version.Tm1Versions#geq(String, String)] is the only comparison the
/// client uses; [io.tm1client.rest.version.Tm1Feature] lists every gated capability with its
/// bounds, and [io.tm1client.rest.version.BatchUrlNormalizer] adapts `$batch` payloads to the
/// server's major version.
package io.tm1client.rest.version;
