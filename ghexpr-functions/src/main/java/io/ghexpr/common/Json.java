/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.ghexpr.common;

import io.ghexpr.expr.EvaluationResult;
import io.ghexpr.expr.Terms;
import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;
import net.minidev.json.writer.JsonReaderI;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static net.minidev.json.JSONValue.defaultReader;

public class Json {

    private Json() {
        // only static methods
    }

    /**
     * Strict RFC 4627 decode that keeps object key order. Top-level scalars
     * and {@code null} are accepted.
     *
     * @throws IllegalArgumentException if the text is blank or not valid JSON
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object parseStrict(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("invalid json: input is null or blank");
        }
        try {
            JSONParser parser = new JSONParser(JSONParser.MODE_RFC4627);
            JsonReaderI<Object> ordered = (JsonReaderI) defaultReader.DEFAULT_ORDERED;
            return parser.parse(json, ordered);
        } catch (ParseException e) {
            throw new IllegalArgumentException("invalid json: " + e.getMessage(), e);
        }
    }

    public static String toJson(Object o) {
        return toJson(o, true);
    }

    public static String toJson(Object o, boolean pretty) {
        StringBuilder sb = new StringBuilder();
        formatRecurse(o, pretty, sb, 0);
        return sb.toString();
    }

    private static void formatRecurse(Object o, boolean pretty, StringBuilder sb, int depth) {
        if (o instanceof EvaluationResult er) {
            o = er.getValue();
        }
        if (o == null) {
            sb.append("null");
        } else if (o instanceof List<?> list) {
            if (list.isEmpty()) {
                sb.append("[]");
                return;
            }
            sb.append('[');
            Iterator<?> iterator = list.iterator();
            while (iterator.hasNext()) {
                newLine(sb, pretty, depth + 1);
                formatRecurse(iterator.next(), pretty, sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(',');
                }
            }
            newLine(sb, pretty, depth);
            sb.append(']');
        } else if (o instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<?, ?> entry = iterator.next();
                newLine(sb, pretty, depth + 1);
                sb.append('"').append(escape(String.valueOf(entry.getKey()))).append('"');
                sb.append(':');
                if (pretty) {
                    sb.append(' ');
                }
                formatRecurse(entry.getValue(), pretty, sb, depth + 1);
                if (iterator.hasNext()) {
                    sb.append(',');
                }
            }
            newLine(sb, pretty, depth);
            sb.append('}');
        } else if (o instanceof Number n) {
            sb.append(Terms.formatNumber(n.doubleValue()));
        } else if (o instanceof Boolean) {
            sb.append(o);
        } else {
            sb.append('"').append(escape(o.toString())).append('"');
        }
    }

    private static void newLine(StringBuilder sb, boolean pretty, int depth) {
        if (!pretty) {
            return;
        }
        sb.append('\n');
        for (int i = 0; i < depth; i++) {
            sb.append(' ').append(' ');
        }
    }

    static String escape(String raw) {
        return JSONValue.escape(raw, JSONStyle.LT_COMPRESS);
    }

}
