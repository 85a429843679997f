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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A runtime expression value: a payload paired with its {@link ExprType}.
 * <p>
 * Payloads are {@code null}, {@link Boolean}, {@link Double}, {@link String},
 * {@link List} (array) or {@link Map} with string keys (object). Array and object
 * elements may be raw payloads or nested {@code EvaluationResult}s. Instances are
 * only created through the factory methods, which keep the type tag consistent
 * with the payload. Array and object payloads are shared, not copied, and must
 * not be mutated once wrapped.
 */
public final class EvaluationResult {

    public static final EvaluationResult NULL = new EvaluationResult(null, ExprType.NULL);
    public static final EvaluationResult TRUE = new EvaluationResult(Boolean.TRUE, ExprType.BOOL);
    public static final EvaluationResult FALSE = new EvaluationResult(Boolean.FALSE, ExprType.BOOL);

    private final Object value;
    private final ExprType type;

    private EvaluationResult(Object value, ExprType type) {
        this.value = value;
        this.type = type;
    }

    public static EvaluationResult ofBool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static EvaluationResult ofNumber(double d) {
        return new EvaluationResult(d, ExprType.NUMBER);
    }

    public static EvaluationResult ofString(String s) {
        Objects.requireNonNull(s, "string payload must not be null");
        return new EvaluationResult(s, ExprType.STRING);
    }

    public static EvaluationResult ofArray(List<?> list) {
        Objects.requireNonNull(list, "array payload must not be null");
        return new EvaluationResult(list, ExprType.ARRAY);
    }

    public static EvaluationResult ofObject(Map<String, ?> map) {
        Objects.requireNonNull(map, "object payload must not be null");
        return new EvaluationResult(map, ExprType.OBJECT);
    }

    /**
     * Wraps a raw payload, inferring its type. Numbers of any boxed type
     * become {@link Double}.
     */
    @SuppressWarnings("unchecked")
    public static EvaluationResult of(Object raw) {
        if (raw instanceof EvaluationResult er) {
            return er;
        }
        return switch (ExprType.of(raw)) {
            case NULL -> NULL;
            case BOOL -> ofBool((Boolean) raw);
            case NUMBER -> ofNumber(((Number) raw).doubleValue());
            case STRING -> ofString(raw.toString());
            case ARRAY -> ofArray((List<?>) raw);
            case OBJECT -> ofObject((Map<String, ?>) raw);
        };
    }

    public Object getValue() {
        return value;
    }

    public ExprType getType() {
        return type;
    }

    public boolean isPrimitive() {
        return type.isPrimitive();
    }

    public String coerceString() {
        return switch (type) {
            case NULL -> "";
            case BOOL -> value.toString();
            case NUMBER -> Terms.formatNumber((Double) value);
            case STRING -> (String) value;
            case ARRAY, OBJECT -> type.getDisplayName();
        };
    }

    public double coerceNumber() {
        return switch (type) {
            case NULL -> 0;
            case BOOL -> (Boolean) value ? 1 : 0;
            case NUMBER -> (Double) value;
            case STRING -> Terms.toNumber((String) value);
            case ARRAY, OBJECT -> Double.NaN;
        };
    }

    /**
     * Returns the array elements with their types inferred, or {@code null}
     * when this value is not an array.
     */
    public List<EvaluationResult> coerceSlice() {
        if (type != ExprType.ARRAY) {
            return null;
        }
        List<?> list = (List<?>) value;
        List<EvaluationResult> result = new ArrayList<>(list.size());
        for (Object o : list) {
            result.add(of(o));
        }
        return Collections.unmodifiableList(result);
    }

    @SuppressWarnings("unchecked")
    public Map<String, ?> asMap() {
        return type == ExprType.OBJECT ? (Map<String, ?>) value : null;
    }

    /**
     * Expression equality: numbers compare numerically, strings ignore case,
     * mixed primitives compare as numbers, arrays and objects by identity.
     */
    public boolean looseEquals(EvaluationResult other) {
        return Terms.eq(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult that)) {
            return false;
        }
        return type == that.type && Objects.equals(canonical(value), canonical(that.value));
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, canonical(value));
    }

    // raw and wrapped elements compare alike: unwrap values, numbers as Double
    private static Object canonical(Object o) {
        if (o instanceof EvaluationResult er) {
            o = er.value;
        }
        if (o instanceof Number n) {
            return n.doubleValue();
        }
        if (o instanceof CharSequence cs) {
            return cs.toString();
        }
        if (o instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(canonical(item));
            }
            return result;
        }
        if (o instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.put(entry.getKey(), canonical(entry.getValue()));
            }
            return result;
        }
        return o;
    }

    @Override
    public String toString() {
        String text = switch (type) {
            case STRING -> "'" + value + "'";
            case ARRAY, OBJECT -> Json.toJson(value, false);
            default -> String.valueOf(value);
        };
        return type.getDisplayName() + "(" + text + ")";
    }

}
