package io.tm1client.services.cells;

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

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;

/// A projected cell property: a number, a string, a flag, or nothing.
public sealed interface CellProperty permits CellProperty.Numeric, CellProperty.Text, CellProperty.Flag,
    CellProperty.Empty {

    /// @return the value as a plain Java object, or null for [Empty]
    Object raw();

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    static CellProperty of(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return Empty.INSTANCE;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return new Flag(primitive.getAsBoolean());
            }
            if (primitive.isNumber()) {
                return new Numeric(primitive.getAsBigDecimal());
            }
            return new Text(primitive.getAsString());
        }
        return new Text(element.toString());
    }

    static CellProperty of(long value) {
        return new Numeric(BigDecimal.valueOf(value));
    }

    static CellProperty of(boolean value) {
        return new Flag(value);
    }

    static CellProperty of(String value) {
        return value == null ? Empty.INSTANCE : new Text(value);
    }

    record Numeric(BigDecimal value) implements CellProperty {
        @Override
        public Object raw() {
            return value;
        }

        public double doubleValue() {
            return value.doubleValue();
        }
    }

    record Text(String value) implements CellProperty {
        @Override
        public Object raw() {
            return value;
        }
    }

    record Flag(boolean value) implements CellProperty {
        @Override
        public Object raw() {
            return value;
        }
    }

    record Empty() implements CellProperty {
        public static final Empty INSTANCE = new Empty();

        @Override
        public Object raw() {
            return null;
        }
    }
}
