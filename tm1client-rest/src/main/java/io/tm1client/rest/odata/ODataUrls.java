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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/// Building blocks for OData URLs and `@odata.bind` references.
public final class ODataUrls {

    private ODataUrls() {
    }

    /// Fills each `{}` placeholder in `template` with the next argument, escaped as an OData
    /// string literal and percent-encoded for a URL path.
    ///
    /// `format("/Cubes('{}')/Views('{}')", "Sales", "Q1 Plan")` gives
    /// `/Cubes('Sales')/Views('Q1%20Plan')`.
    public static String format(String template, Object... args) {
        StringBuilder sb = new StringBuilder(template.length() + 32);
        int argIndex = 0;
        int from = 0;
        int at;
        while ((at = template.indexOf("{}", from)) >= 0) {
            if (argIndex >= args.length) {
                throw new IllegalArgumentException("not enough arguments for template: " + template);
            }
            sb.append(template, from, at).append(escape(String.valueOf(args[argIndex++])));
            from = at + 2;
        }
        if (argIndex != args.length) {
            throw new IllegalArgumentException("too many arguments for template: " + template);
        }
        return sb.append(template.substring(from)).toString();
    }

    /// Doubles single quotes so the value can sit inside an OData string literal.
    public static String quote(String value) {
        return value.replace("'", "''");
    }

    /// [#quote(String)] followed by percent-encoding.
    public static String escape(String value) {
        return encode(quote(value));
    }

    /// Form encoding with `+` rewritten to `%20`, so filter expressions stay readable on the wire.
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /// Encodes query parameters in the map's iteration order.
    public static String encodeQuery(Map<String, String> parameters) {
        StringJoiner joiner = new StringJoiner("&");
        parameters.forEach((name, value) -> joiner.add(encode(name) + "=" + encode(value)));
        return joiner.toString();
    }

    /// `Dimensions('D')/Hierarchies('H')/Elements('E')`, the binding path of one element.
    public static String elementBinding(String dimension, String hierarchy, String element) {
        return "Dimensions('" + quote(dimension) + "')/Hierarchies('" + quote(hierarchy)
            + "')/Elements('" + quote(element) + "')";
    }
}
