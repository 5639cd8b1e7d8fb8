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

/// The TM1 REST transport.
///
/// [io.tm1client.rest.RestService] sends every request through one pipeline: URL resolution,
/// default headers, credentials, per-request [io.tm1client.rest.RequestOption]s, the optional
/// async protocol, and status checking. Failures surface as subclasses of
/// [io.tm1client.rest.errors.Tm1Exception].
package io.tm1client.rest;
