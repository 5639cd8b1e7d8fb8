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

/// Authentication for the TM1 REST API.
///
/// [io.tm1client.rest.auth.AuthMode#select] picks a mode from the declared credential fields,
/// [io.tm1client.rest.auth.Authentication#create] builds the matching
/// [io.tm1client.rest.auth.AuthProvider] variant, and the two exchanges that need a round trip
/// of their own live in [io.tm1client.rest.auth.IamTokenSource] (IBM Cloud API key) and
/// [io.tm1client.rest.auth.SessionLogin] (service-to-service and workspace proxy).
package io.tm1client.rest.auth;
