package io.tm1client.services.process;

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

/// The outcome of a process run that asked for a return value.
///
/// @param statusCode the server's `ProcessExecuteStatusCode`, for example `CompletedSuccessfully`,
///                   `Aborted`, `HasMinorErrors` or `QuitCalled`
/// @param errorLogFile the name of the TI error log, or null when none was written
public record ProcessExecuteResult(String statusCode, String errorLogFile) {

    public static final String COMPLETED_SUCCESSFULLY = "CompletedSuccessfully";

    public boolean isSuccess() {
        return COMPLETED_SUCCESSFULLY.equals(statusCode);
    }
}
