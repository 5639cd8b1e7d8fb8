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

/// Failure types raised by the TM1 client.
///
/// Every type extends [io.tm1client.rest.errors.Tm1Exception], which is unchecked. HTTP
/// failures keep the method, URL, status and a capped copy of the error body so that callers
/// can branch on 404 (absence), 401 (authentication) and 409 (conflict).
package io.tm1client.rest.errors;
