package io.tm1client.rest;

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
import java.util.List;

/// Back-off between polls of an async operation.
///
/// The delays ramp through `ramp` and then stay at `cap`. The default ramp is 100 ms, 300 ms,
/// 600 ms and the cap is 1 s, so a long-running operation is polled once per second.
///
/// @param ramp delays for the first polls, in order
/// @param cap delay for every poll after the ramp
public record AsyncPollSchedule(List<Duration> ramp, Duration cap) {

    public static final AsyncPollSchedule DEFAULT = new AsyncPollSchedule(
        List.of(Duration.ofMillis(100), Duration.ofMillis(300), Duration.ofMillis(600)),
        Duration.ofSeconds(1));

    public AsyncPollSchedule {
        ramp = List.copyOf(ramp);
    }

    public Duration delay(int attempt) {
        return attempt < ramp.size() ? ramp.get(attempt) : cap;
    }
}
