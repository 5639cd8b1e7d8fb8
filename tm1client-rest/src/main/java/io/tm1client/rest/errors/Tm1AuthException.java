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

/// An auth provider refused to sign a request, or credential acquisition failed.
public class Tm1AuthException extends Tm1Exception {

    public Tm1AuthException(String message) {
        super(message);
    }

    public Tm1AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
