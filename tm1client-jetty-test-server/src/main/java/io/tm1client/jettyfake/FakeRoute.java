package io.tm1client.jettyfake;

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
import java.util.concurrent.atomic.AtomicInteger;

/// Produces the reply for a matched request.
@FunctionalInterface
public interface FakeRoute {

    FakeReply respond(RecordedRequest request);

    /// Serves the given replies in order, repeating the last one once they run out.
    static FakeRoute sequence(FakeReply... replies) {
        if (replies.length == 0) {
            throw new IllegalArgumentException("a sequence needs at least one reply");
        }
        List<FakeReply> list = List.of(replies);
        AtomicInteger next = new AtomicInteger();
        return request -> list.get(Math.min(next.getAndIncrement(), list.size() - 1));
    }

    /// Holds the request for `delay` before answering through `route`, simulating a stalled server.
    static FakeRoute delayed(Duration delay, FakeRoute route) {
        return request -> {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return route.respond(request);
        };
    }
}
