package io.tm1client.rest.config;

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

import io.tm1client.rest.errors.Tm1ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class Tm1ConfigTest {

    @Test
    public void testDefaults() {
        Tm1Config config = Tm1Config.builder().address("tm1.local").build();
        assertEquals(Duration.ofSeconds(60), config.timeout());
        assertEquals("tm1client", config.sessionContext());
        assertEquals(10, config.connectionPoolSize());
        assertThat(config.verify()).isTrue();
        assertThat(config.asyncRequestsMode()).isFalse();
        assertEquals("http", config.scheme());
        assertEquals("https://iam.cloud.ibm.com", config.effectiveIamUrl());
    }

    @Test
    public void testBase64Password() {
        Tm1Config config = Tm1Config.builder().address("h").user("admin").password("YXBwbGU=").decodeBase64(true).build();
        assertEquals("apple", config.effectivePassword());
        assertEquals("YXBwbGU=", config.toBuilder().decodeBase64(false).build().effectivePassword());
        assertThrows(Tm1ValidationException.class,
            () -> config.toBuilder().password("%%%").build().effectivePassword());
    }

    @Test
    public void testRangeChecks() {
        assertThrows(Tm1ValidationException.class, () -> Tm1Config.builder().port(70000).build());
        assertThrows(Tm1ValidationException.class, () -> Tm1Config.builder().connectionPoolSize(0).build());
        assertThrows(Tm1ValidationException.class, () -> Tm1Config.builder().timeout(Duration.ZERO).build());
    }

    @Test
    public void testToStringHidesSecrets() {
        Tm1Config config = Tm1Config.builder().address("h").user("admin").password("s3cret")
            .apiKey("key-123").accessToken("token-456").build();
        assertThat(config.toString()).contains("admin").doesNotContain("s3cret", "key-123", "token-456");
    }

    @Test
    public void testHeadersAreCopied() {
        Tm1Config config = Tm1Config.builder().address("h").header("X-Trace", "1").build();
        assertEquals("1", config.additionalHeaders().get("X-Trace"));
        assertThrows(UnsupportedOperationException.class, () -> config.additionalHeaders().put("X", "2"));
    }
}
