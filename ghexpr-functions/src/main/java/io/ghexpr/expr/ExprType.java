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

import java.util.List;
import java.util.Map;

/**
 * Closed set of runtime value shapes for workflow expressions.
 * <p>
 * Every branch over value shapes switches on this enum, so a new shape
 * fails compilation wherever it is not handled.
 */
public enum ExprType {

    NULL("Null"),
    BOOL("Bool"),
    NUMBER("Number"),
    STRING("String"),
    ARRAY("Array"),
    OBJECT("Object");

    private final String displayName;

    ExprType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isPrimitive() {
        return this != ARRAY && this != OBJECT;
    }

    /**
     * Classifies a raw payload, typically one produced by JSON decoding.
     *
     * @throws IllegalArgumentException if the payload is not one of the supported shapes
     */
    public static ExprType of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof EvaluationResult er) {
            return er.getType();
        }
        if (raw instanceof Boolean) {
            return BOOL;
        }
        if (raw instanceof Number) {
            return NUMBER;
        }
        if (raw instanceof CharSequence) {
            return STRING;
        }
        if (raw instanceof List) {
            return ARRAY;
        }
        if (raw instanceof Map) {
            return OBJECT;
        }
        throw new IllegalArgumentException("unsupported value type: " + raw.getClass().getName());
    }

}
