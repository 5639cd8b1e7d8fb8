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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class Tm1EndpointsTest {

    @Test
    public void testLegacyAddressAndPort() {
        Tm1Endpoints endpoints = Tm1Endpoints.compose(Tm1Config.builder()
            .address("tm1.local").port(12354).ssl(true).build());
        assertEquals(DeploymentTopology.LEGACY, endpoints.topology());
        assertEquals("https://tm1.local:12354/api/v1/", endpoints.baseUrl());
        assertNull(endpoints.authUrl());
    }

    @Test
    public void testLegacyWithoutPort() {
        Tm1Endpoints endpoints = Tm1Endpoints.compose(Tm1Config.builder().address("tm1.local").build());
        assertEquals("http://tm1.local/api/v1/", endpoints.baseUrl());
    }

    @Test
    public void testSaasTenant() {
        Tm1Endpoints endpoints = Tm1Endpoints.compose(Tm1Config.builder()
            .address("us-east-1.planninganalytics.saas.ibm.com")
            .tenant("T1")
            .database("Planning Sample")
            .build());
        assertEquals(DeploymentTopology.SAAS, endpoints.topology());
        assertEquals("https://us-east-1.planninganalytics.saas.ibm.com/api/T1/v0/tm1/Planning%20Sample/",
            endpoints.baseUrl());
    }

    @Test
    public void testNamedInstance() {
        Tm1Endpoints endpoints = Tm1Endpoints.compose(Tm1Config.builder()
            .address("pa.local").port(8443).ssl(true).instance("tm1").database("Sales").build());
        assertEquals(DeploymentTopology.NAMED_INSTANCE, endpoints.topology());
        assertEquals("https://pa.local:8443/tm1/api/v1/Databases('Sales')/", endpoints.baseUrl());
        assertEquals("https://pa.local:8443/tm1/auth/v1/session", endpoints.authUrl());
    }

    @Test
    public void testWorkspaceProxy() {
        Tm1Endpoints endpoints = Tm1Endpoints.compose(Tm1Config.builder()
            .workspaceProxyHost("paw.local").ssl(true).database("Sales").build());
        assertEquals(DeploymentTopology.WORKSPACE_PROXY, endpoints.topology());
        assertEquals("https://paw.local/tm1/Sales/api/v1/", endpoints.baseUrl());
        assertEquals("https://paw.local/login", endpoints.authUrl());
    }

    @Test
    public void testExplicitBaseUrlWinsAndIsNormalized() {
        Tm1Endpoints endpoints = Tm1Endpoints.compose(Tm1Config.builder()
            .baseUrl("https://tm1.local:8010/api/v1//")
            .tenant("ignored")
            .address("ignored.example.com")
            .build());
        assertEquals(DeploymentTopology.EXPLICIT_BASE_URL, endpoints.topology());
        assertEquals(DeploymentTopology.LEGACY, endpoints.shape());
        assertEquals("https://tm1.local:8010/api/v1/", endpoints.baseUrl());
    }

    @Test
    public void testExplicitBaseUrlShapes() {
        assertThat(Tm1Endpoints.fromExplicit("https://tm1.local:8010"))
            .extracting(Tm1Endpoints::shape, Tm1Endpoints::baseUrl)
            .containsExactly(DeploymentTopology.LEGACY, "https://tm1.local:8010/api/v1/");

        Tm1Endpoints named = Tm1Endpoints.fromExplicit("https://pa.local/tm1/api/v1/Databases('Sales')");
        assertEquals(DeploymentTopology.NAMED_INSTANCE, named.shape());
        assertEquals("https://pa.local/tm1/auth/v1/session", named.authUrl());

        assertEquals(DeploymentTopology.SAAS,
            Tm1Endpoints.fromExplicit("https://h.planninganalytics.saas.ibm.com/api/T1/v0/tm1/db").shape());

        Tm1Endpoints proxy = Tm1Endpoints.fromExplicit("https://paw.local/tm1/Sales/api/v1");
        assertEquals(DeploymentTopology.WORKSPACE_PROXY, proxy.shape());
        assertEquals("https://paw.local/login", proxy.authUrl());
    }

    @Test
    public void testMissingFieldsAreRejected() {
        assertThrows(Tm1ValidationException.class, () -> Tm1Endpoints.compose(Tm1Config.builder().build()));
        assertThrows(Tm1ValidationException.class,
            () -> Tm1Endpoints.compose(Tm1Config.builder().address("h").tenant("T").build()));
        assertThrows(Tm1ValidationException.class,
            () -> Tm1Endpoints.compose(Tm1Config.builder().address("h").instance("tm1").build()));
        assertThrows(Tm1ValidationException.class,
            () -> Tm1Endpoints.compose(Tm1Config.builder().baseUrl("tm1/api/v1").build()));
    }
}
