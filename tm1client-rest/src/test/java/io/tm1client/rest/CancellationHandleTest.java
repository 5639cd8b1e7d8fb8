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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CancellationHandleTest {

    @Test
    public void testCancelWakesSleeper() throws InterruptedException {
        CancellationHandle handle = CancellationHandle.create();
        assertFalse(handle.isCancelled());
        assertFalse(handle.sleep(Duration.ofMillis(5)));

        Thread canceller = new Thread(() -> {
            RestServiceTest.pause(Duration.ofMillis(50));
            handle.cancel();
        });
        canceller.start();
        long start = System.nanoTime();
        assertTrue(handle.sleep(Duration.ofSeconds(10)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
        assertTrue(handle.isCancelled());
        canceller.join();
    }

    @Test
    public void testDeadline() {
        CancellationHandle open = CancellationHandle.create();
        assertFalse(open.isExpired());
        assertTrue(open.remaining().isEmpty());

        CancellationHandle expired = CancellationHandle.withTimeout(Duration.ofMillis(-1));
        assertTrue(expired.isExpired());
        assertEquals(Duration.ZERO, expired.remaining().orElseThrow());
        assertFalse(expired.isCancelled());
    }

    @Test
    public void testPollScheduleRampsToCap() {
        AsyncPollSchedule schedule = AsyncPollSchedule.DEFAULT;
        assertEquals(Duration.ofMillis(100), schedule.delay(0));
        assertEquals(Duration.ofMillis(300), schedule.delay(1));
        assertEquals(Duration.ofMillis(600), schedule.delay(2));
        assertEquals(Duration.ofSeconds(1), schedule.delay(3));
        assertEquals(Duration.ofSeconds(1), schedule.delay(50));
    }
}
