package io.tm1client.rest.odata;

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

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class AsyncIdsTest {

    @Test
    public void testIdFromLocation() {
        assertEquals(Optional.of("abc123"), AsyncIds.fromLocation("/api/v1/_async('abc123')"));
        assertEquals(Optional.of("x-1"), AsyncIds.fromLocation("https://tm1:8010/api/v1/_async('x-1')"));
    }

    @Test
    public void testMissingOrMalformedLocation() {
        assertEquals(Optional.empty(), AsyncIds.fromLocation(null));
        assertEquals(Optional.empty(), AsyncIds.fromLocation("/api/v1/_async"));
        assertEquals(Optional.empty(), AsyncIds.fromLocation("/api/v1/_async('abc"));
        assertEquals(Optional.empty(), AsyncIds.fromLocation("/api/v1/_async('')"));
    }

    @Test
    public void testEndpoint() {
        assertEquals("/_async('abc123')", AsyncIds.endpoint("abc123"));
    }
}
