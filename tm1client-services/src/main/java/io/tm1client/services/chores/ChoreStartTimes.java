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

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/// Parses chore start times and formats them for `tm1.SetServerLocalStartTime`.
public final class ChoreStartTimes {

    private ChoreStartTimes() {
    }

    /// Accepts RFC 3339 with or without seconds and fraction, with `Z` or a numeric offset,
    /// for example `2025-01-01T12:00:00Z` or `2025-01-01T12:00+02:00`.
    ///
    /// @throws Tm1ValidationException when the text is not such a timestamp
    public static OffsetDateTime parse(String text) {
        if (text == null) {
            throw new Tm1ValidationException("chore start time is missing");
        }
        try {
            return OffsetDateTime.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new Tm1ValidationException("unable to parse chore start time: " + text, e);
        }
    }

    /// `{"StartDate": "2025-1-1", "StartTime": "12:00:00"}` in the timestamp's own offset.
    /// The date is not zero padded; the time is.
    public static JsonObject localStartTimeBody(OffsetDateTime time) {
        JsonObject body = new JsonObject();
        body.addProperty("StartDate", String.format(Locale.ROOT, "%d-%d-%d",
            time.getYear(), time.getMonthValue(), time.getDayOfMonth()));
        body.addProperty("StartTime", String.format(Locale.ROOT, "%02d:%02d:%02d",
            time.getHour(), time.getMinute(), time.getSecond()));
        return body;
    }
}
