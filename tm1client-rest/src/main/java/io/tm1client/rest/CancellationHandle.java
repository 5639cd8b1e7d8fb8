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

import okhttp3.Call;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Lets a caller abandon an operation from another thread, optionally with a deadline.
///
/// Cancelling aborts any in-flight HTTP call registered with the handle and wakes async
/// polling, which then cancels the server-side operation when the client is configured to.
/// A handle whose deadline has passed behaves like a cancelled one, but surfaces as a timeout.
///
/// ```java
/// CancellationHandle handle = CancellationHandle.withTimeout(Duration.ofMinutes(5));
/// rest.request("POST", "/Processes('load')/tm1.ExecuteWithReturn", body, RequestOption.cancellation(handle));
/// ```
public final class CancellationHandle {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CopyOnWriteArrayList<Call> calls = new CopyOnWriteArrayList<>();
    private final Instant deadline;

    private CancellationHandle(Instant deadline) {
        this.deadline = deadline;
    }

    public static CancellationHandle create() {
        return new CancellationHandle(null);
    }

    public static CancellationHandle withTimeout(Duration timeout) {
        return new CancellationHandle(Instant.now().plus(timeout));
    }

    public void cancel() {
        cancelled.countDown();
        calls.forEach(Call::cancel);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /// @return the time left before the deadline, empty when there is no deadline
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    void register(Call call) {
        calls.add(call);
        if (isCancelled()) {
            call.cancel();
        }
    }

    void unregister(Call call) {
        calls.remove(call);
    }

    /// Sleeps for `duration` or until cancelled.
    ///
    /// @return true when the handle was cancelled
    boolean sleep(Duration duration) throws InterruptedException {
        return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
