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

import io.tm1client.rest.errors.Tm1CancelledException;
import io.tm1client.rest.errors.Tm1Exception;
import io.tm1client.rest.errors.Tm1TimeoutException;
import io.tm1client.rest.errors.Tm1TransportException;
import io.tm1client.rest.odata.AsyncIds;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/// The `Prefer: respond-async` protocol.
///
/// The first response carries `Location: .../_async('<id>')`; the operation is then polled with
/// `GET /_async('<id>')` on an [AsyncPollSchedule] until it reports something other than 202.
/// On timeout or cancellation the server-side operation is deleted when
/// [io.tm1client.rest.config.Tm1Config#cancelAtTimeout()] is set.
final class AsyncRequests {

    private static final String HTTP_PREFIX = "HTTP/";

    private final RestService rest;
    private final AsyncPollSchedule schedule;

    AsyncRequests(RestService rest, AsyncPollSchedule schedule) {
        this.rest = rest;
        this.schedule = schedule == null ? AsyncPollSchedule.DEFAULT : schedule;
    }

    Response execute(PreparedRequest prepared) {
        Started started = start(prepared);
        if (started.immediate() != null) {
            return started.immediate();
        }
        return await(started.asyncId(), prepared.cancellation(), prepared.timeoutOr(rest.config().timeout()));
    }

    String submit(PreparedRequest prepared) {
        Started started = start(prepared);
        if (started.immediate() != null) {
            started.immediate().close();
            throw new Tm1TransportException("server answered " + started.immediate().request().url()
                + " without an async operation id");
        }
        return started.asyncId();
    }

    private Started start(PreparedRequest prepared) {
        prepared.header("Prefer", "respond-async");
        Response response = rest.checked(rest.send(prepared.build(), prepared));
        String location = response.header("Location");
        Optional<String> asyncId = AsyncIds.fromLocation(location);
        boolean accepted = response.code() == 202 || (location != null && location.contains("_async("));
        if (!accepted || asyncId.isEmpty()) {
            return new Started(null, response);
        }
        response.close();
        rest.logger().debug("async operation {} started for {}", asyncId.get(), response.request().url());
        return new Started(asyncId.get(), null);
    }

    Response await(String asyncId, CancellationHandle handle, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        for (int attempt = 0; ; attempt++) {
            Duration left = remaining(deadline, handle);
            if (left.toMillis() < 1) {
                throw stop(asyncId, new Tm1TimeoutException("async operation " + asyncId
                    + " did not complete within " + timeout, timeout));
            }
            Duration delay = schedule.delay(attempt);
            if (delay.compareTo(left) > 0) {
                delay = left;
            }
            if (pause(handle, delay)) {
                throw stop(asyncId, new Tm1CancelledException("async operation " + asyncId + " was cancelled"));
            }

            rest.logger().trace("polling async operation {}, attempt {}", asyncId, attempt + 1);
            PreparedRequest poll = rest.prepare("GET", AsyncIds.endpoint(asyncId), null);
            poll.cancellation(handle);
            poll.timeout(remaining(deadline, handle));
            Response response;
            try {
                response = rest.send(poll.build(), poll);
            } catch (Tm1TimeoutException e) {
                throw stop(asyncId, new Tm1TimeoutException("async operation " + asyncId
                    + " did not complete within " + timeout, timeout, e));
            } catch (Tm1CancelledException e) {
                throw stop(asyncId, e);
            }
            if (response.code() == 202) {
                response.close();
                continue;
            }
            if (response.code() == 200 || response.code() == 201) {
                return transform(response);
            }
            throw rest.httpError(response);
        }
    }

    /// Time left before the earlier of the wait's own deadline and the handle's deadline.
    private static Duration remaining(Instant deadline, CancellationHandle handle) {
        Duration left = Duration.between(Instant.now(), deadline);
        if (handle != null) {
            Optional<Duration> handleLeft = handle.remaining();
            if (handleLeft.isPresent() && handleLeft.get().compareTo(left) < 0) {
                left = handleLeft.get();
            }
        }
        return left.isNegative() ? Duration.ZERO : left;
    }

    Response retrieveOnce(String asyncId, RequestOption... options) {
        PreparedRequest poll = rest.prepare("GET", AsyncIds.endpoint(asyncId), null, options);
        Response response = rest.send(poll.build(), poll);
        if (response.code() == 202) {
            return response;
        }
        return transform(response);
    }

    void cancel(String asyncId) {
        try (Response ignored = rest.request("DELETE", AsyncIds.endpoint(asyncId), null, RequestOption.synchronous())) {
            rest.logger().debug("async operation {} cancelled", asyncId);
        }
    }

    /// A result whose body is itself a raw HTTP response is returned untouched. Otherwise an
    /// `asyncresult` header such as `500 Internal Server Error` replaces the status before the
    /// usual check.
    private Response transform(Response response) {
        String head;
        try {
            head = response.peekBody(HTTP_PREFIX.length()).string();
        } catch (IOException e) {
            response.close();
            throw new Tm1TransportException("unable to read async result from " + response.request().url(), e);
        }
        if (head.startsWith(HTTP_PREFIX)) {
            rest.logger().info("async result from {} is a raw HTTP response, returning it unparsed",
                response.request().url());
            return response;
        }
        String asyncResult = response.header("asyncresult");
        if (asyncResult != null) {
            int status = statusOf(asyncResult);
            if (status > 0) {
                response = response.newBuilder().code(status).build();
            }
        }
        return rest.checked(response);
    }

    private static int statusOf(String asyncResult) {
        String trimmed = asyncResult.trim();
        int space = trimmed.indexOf(' ');
        String code = space < 0 ? trimmed : trimmed.substring(0, space);
        try {
            return Integer.parseInt(code);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private boolean pause(CancellationHandle handle, Duration delay) {
        try {
            if (handle != null) {
                return handle.sleep(delay);
            }
            Thread.sleep(delay.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private Tm1Exception stop(String asyncId, Tm1Exception reason) {
        if (rest.config().cancelAtTimeout()) {
            try {
                cancel(asyncId);
            } catch (Tm1Exception e) {
                reason.addSuppressed(e);
            }
        }
        return reason;
    }

    private record Started(String asyncId, Response immediate) {
    }
}
