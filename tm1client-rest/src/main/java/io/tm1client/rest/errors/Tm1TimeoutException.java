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

import java.time.Duration;

/// A synchronous call exceeded its client timeout, or async polling ran past its deadline.
public class Tm1TimeoutException extends Tm1Exception {

    private final Duration timeout;

    public Tm1TimeoutException(String message, Duration timeout) {
        super(message + " (timeout " + timeout + ")");
        this.timeout = timeout;
    }

    public Tm1TimeoutException(String message, Duration timeout, Throwable cause) {
        super(message + " (timeout " + timeout + ")", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
