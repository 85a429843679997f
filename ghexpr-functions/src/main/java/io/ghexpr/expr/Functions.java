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
package io.ghexpr.expr;

import io.ghexpr.common.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Bodies of the built-in functions. Argument counts are checked by
 * {@link FunctionRegistry} before any of these run.
 */
class Functions {

    static final Logger logger = LoggerFactory.getLogger(Functions.class);

    private Functions() {
        // only static methods
    }

    // string matching in all of these ignores case
    static EvaluationResult contains(List<EvaluationResult> args) {
        EvaluationResult search = args.get(0);
        EvaluationResult item = args.get(1);
        if (search.isPrimitive()) {
            if (!item.isPrimitive()) {
                return EvaluationResult.FALSE;
            }
            String ls = Terms.lower(search.coerceString());
            String rs = Terms.lower(item.coerceString());
            return EvaluationResult.ofBool(ls.contains(rs));
        }
        switch (search.getType()) {
            case ARRAY:
                if (!item.isPrimitive()) { // only primitives can be found in an array
                    return EvaluationResult.FALSE;
                }
                List<EvaluationResult> elements = search.coerceSlice();
                if (elements == null) {
                    return EvaluationResult.FALSE;
                }
                for (EvaluationResult element : elements) {
                    if (item.looseEquals(element)) {
                        return EvaluationResult.TRUE;
                    }
                }
                return EvaluationResult.FALSE;
            case OBJECT:
            default:
                return EvaluationResult.FALSE;
        }
    }

    static EvaluationResult startsWith(List<EvaluationResult> args) {
        EvaluationResult left = args.get(0);
        EvaluationResult right = args.get(1);
        if (!left.isPrimitive() || !right.isPrimitive()) {
            return EvaluationResult.FALSE;
        }
        String ls = Terms.lower(left.coerceString());
        String rs = Terms.lower(right.coerceString());
        return EvaluationResult.ofBool(ls.startsWith(rs));
    }

    static EvaluationResult endsWith(List<EvaluationResult> args) {
        EvaluationResult left = args.get(0);
        EvaluationResult right = args.get(1);
        if (!left.isPrimitive() || !right.isPrimitive()) {
            return EvaluationResult.FALSE;
        }
        String ls = Terms.lower(left.coerceString());
        String rs = Terms.lower(right.coerceString());
        return EvaluationResult.ofBool(ls.endsWith(rs));
    }

    static EvaluationResult join(List<EvaluationResult> args) {
        EvaluationResult first = args.get(0);
        if (first.isPrimitive()) {
            return first;
        }
        List<EvaluationResult> elements = first.coerceSlice();
        if (elements == null) {
            throw new EvaluationException("join", "join() requires an array or a primitive value, got "
                    + first.getType().getDisplayName());
        }
        String separator = args.size() > 1 ? args.get(1).coerceString() : ",";
        StringJoiner joiner = new StringJoiner(separator);
        for (EvaluationResult element : elements) {
            joiner.add(element.coerceString());
        }
        return EvaluationResult.ofString(joiner.toString());
    }

    static EvaluationResult fromJson(List<EvaluationResult> args) {
        String text = args.get(0).coerceString();
        Object decoded;
        try {
            decoded = Json.parseStrict(text);
        } catch (IllegalArgumentException e) {
            logger.debug("fromjson failed for: {}", text);
            throw new JsonParseException("fromjson", text, e);
        }
        return EvaluationResult.of(normalize(decoded, text));
    }

    // numbers of every width become Double, containers are copied
    private static Object normalize(Object o, String text) {
        if (o == null || o instanceof String || o instanceof Boolean) {
            return o;
        }
        if (o instanceof Number n) {
            double d = n.doubleValue();
            if (!Double.isFinite(d)) {
                logger.debug("fromjson number out of range: {}", n);
                throw new EvaluationException("fromjson", "number " + n + " is out of range in fromjson: `" + text + "`");
            }
            return d;
        }
        if (o instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(normalize(item, text));
            }
            return result;
        }
        if (o instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.put(String.valueOf(entry.getKey()), normalize(entry.getValue(), text));
            }
            return result;
        }
        throw new EvaluationException("fromjson", "unknown type " + o.getClass().getName() + " in fromjson");
    }

    static EvaluationResult toJson(List<EvaluationResult> args) {
        return EvaluationResult.ofString(Json.toJson(args.get(0)));
    }

    static EvaluationResult format(List<EvaluationResult> args) {
        String pattern = args.get(0).coerceString();
        StringBuilder sb = new StringBuilder(pattern.length());
        int length = pattern.length();
        int pos = 0;
        while (pos < length) {
            char c = pattern.charAt(pos);
            if (c == '{') {
                if (pos + 1 < length && pattern.charAt(pos + 1) == '{') {
                    sb.append('{');
                    pos += 2;
                    continue;
                }
                int close = pattern.indexOf('}', pos + 1);
                if (close == -1) {
                    throw invalidFormat(pattern);
                }
                int index = parseIndex(pattern.substring(pos + 1, close));
                if (index < 0) {
                    throw invalidFormat(pattern);
                }
                if (index >= args.size() - 1) {
                    throw new EvaluationException("format",
                            "The following format string references more arguments than were supplied: " + pattern);
                }
                sb.append(args.get(index + 1).coerceString());
                pos = close + 1;
            } else if (c == '}') {
                if (pos + 1 < length && pattern.charAt(pos + 1) == '}') {
                    sb.append('}');
                    pos += 2;
                    continue;
                }
                throw invalidFormat(pattern);
            } else {
                sb.append(c);
                pos++;
            }
        }
        return EvaluationResult.ofString(sb.toString());
    }

    private static int parseIndex(String text) {
        if (text.isEmpty()) {
            return -1;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static EvaluationException invalidFormat(String pattern) {
        return new EvaluationException("format", "The following format string is invalid: " + pattern);
    }

}
