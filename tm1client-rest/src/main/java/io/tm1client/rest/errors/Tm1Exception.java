package io.tm1client.rest.errors;

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

/// Base type of every failure raised by the TM1 client.
///
/// All subtypes are unchecked; callers that want to react to a particular kind catch the
/// subtype, for example [Tm1HttpException] with [Tm1HttpException#isNotFound()].
public class Tm1Exception extends RuntimeException {

    public Tm1Exception(String message) {
        super(message);
    }

    public Tm1Exception(String message, Throwable cause) {
        super(message, cause);
    }
}
