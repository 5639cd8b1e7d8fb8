package io.tm1client.services.chores;

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

import com.google.gson.JsonObject;
import io.tm1client.rest.errors.Tm1ValidationException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChoreTaskTest {

    @Test
    public void testParameterValueText() {
        assertEquals("1", new ChoreTaskParameter("p", 1).valueText());
        assertEquals("1", new ChoreTaskParameter("p", 1.0).valueText());
        assertEquals("1", new ChoreTaskParameter("p", 1L).valueText());
        assertEquals("0.25", new ChoreTaskParameter("p", 0.25).valueText());
        assertEquals("1000000", new ChoreTaskParameter("p", 1.0e6).valueText());
        assertEquals("NaN", new ChoreTaskParameter("p", Double.NaN).valueText());
        assertEquals("x", new ChoreTaskParameter("p", "x").valueText());
        assertEquals("true", new ChoreTaskParameter("p", true).valueText());
    }

    @Test
    public void testProcessNameFromBinding() {
        ChoreTask task = ChoreTask.of(0, "O'Hare load", List.of());
        assertEquals("Processes('O''Hare load')", task.processBinding());
        assertEquals("O'Hare load", task.processName());
        assertEquals("x", new ChoreTask(0, new ChoreTask.ProcessRef("x"), null, null).processName());
        assertEquals("", new ChoreTask(0, null, null, null).processName());
    }

    @Test
    public void testMatchesIgnoresStepAndNumericForm() {
        ChoreTask fromServer = new ChoreTask(3, new ChoreTask.ProcessRef("load"), null,
            List.of(new ChoreTaskParameter("pYear", 2025.0)));
        ChoreTask desired = ChoreTask.of(0, "load", List.of(new ChoreTaskParameter("pYear", 2025)));
        assertTrue(desired.matches(fromServer));

        assertFalse(ChoreTask.of(0, "load", List.of(new ChoreTaskParameter("pYear", 2026))).matches(fromServer));
        assertFalse(ChoreTask.of(0, "load", List.of()).matches(fromServer));
        assertFalse(ChoreTask.of(0, "other", List.of(new ChoreTaskParameter("pYear", 2025))).matches(fromServer));
    }

    @Test
    public void testStartTimeParsing() {
        assertEquals(OffsetDateTime.of(2025, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC),
            ChoreStartTimes.parse("2025-01-01T12:00:00Z"));
        assertEquals(OffsetDateTime.of(2025, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC),
            ChoreStartTimes.parse("2025-01-01T12:00Z"));
        assertEquals(ZoneOffset.ofHours(2), ChoreStartTimes.parse("2025-01-01T12:00:00.5+02:00").getOffset());

        assertThatThrownBy(() -> ChoreStartTimes.parse("tomorrow"))
            .isInstanceOf(Tm1ValidationException.class)
            .hasMessageContaining("tomorrow");
        assertThatThrownBy(() -> ChoreStartTimes.parse(null)).isInstanceOf(Tm1ValidationException.class);
    }

    @Test
    public void testLocalStartTimeBodyKeepsOffsetFields() {
        JsonObject body = ChoreStartTimes.localStartTimeBody(OffsetDateTime.parse("2024-11-05T07:08:09-05:00"));
        assertEquals("2024-11-5", body.get("StartDate").getAsString());
        assertEquals("07:08:09", body.get("StartTime").getAsString());
    }
}
