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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationResultTest {

    @Test
    void testOfInfersType() {
        assertSame(EvaluationResult.NULL, EvaluationResult.of(null));
        assertSame(EvaluationResult.TRUE, EvaluationResult.of(true));
        assertEquals(EvaluationResult.ofNumber(3), EvaluationResult.of(3));
        assertEquals(EvaluationResult.ofNumber(3), EvaluationResult.of(3L));
        assertEquals(3.0, EvaluationResult.of(3).getValue());
        assertEquals(ExprType.STRING, EvaluationResult.of(new StringBuilder("sb")).getType());
        assertEquals(ExprType.ARRAY, EvaluationResult.of(List.of()).getType());
        assertEquals(ExprType.OBJECT, EvaluationResult.of(Map.of()).getType());
        assertThrows(IllegalArgumentException.class, () -> EvaluationResult.of(new Object()));
    }

    @Test
    void testOfKeepsWrappedValue() {
        EvaluationResult value = EvaluationResult.ofString("x");
        assertSame(value, EvaluationResult.of(value));
    }

    @Test
    void testPrimitive() {
        assertTrue(EvaluationResult.NULL.isPrimitive());
        assertTrue(EvaluationResult.FALSE.isPrimitive());
        assertTrue(EvaluationResult.ofNumber(1).isPrimitive());
        assertTrue(EvaluationResult.ofString("").isPrimitive());
        assertFalse(EvaluationResult.ofArray(List.of()).isPrimitive());
        assertFalse(EvaluationResult.ofObject(Map.of()).isPrimitive());
    }

    @Test
    void testCoerceString() {
        assertEquals("", EvaluationResult.NULL.coerceString());
        assertEquals("true", EvaluationResult.TRUE.coerceString());
        assertEquals("false", EvaluationResult.FALSE.coerceString());
        assertEquals("42", EvaluationResult.ofNumber(42).coerceString());
        assertEquals("-0.5", EvaluationResult.ofNumber(-0.5).coerceString());
        assertEquals("Hello", EvaluationResult.ofString("Hello").coerceString());
        assertEquals("Array", EvaluationResult.ofArray(List.of(1)).coerceString());
        assertEquals("Object", EvaluationResult.ofObject(Map.of("a", 1)).coerceString());
    }

    @Test
    void testCoerceNumber() {
        assertEquals(0, EvaluationResult.NULL.coerceNumber());
        assertEquals(1, EvaluationResult.TRUE.coerceNumber());
        assertEquals(0, EvaluationResult.FALSE.coerceNumber());
        assertEquals(12.5, EvaluationResult.ofString(" 12.5 ").coerceNumber());
        assertTrue(Double.isNaN(EvaluationResult.ofString("abc").coerceNumber()));
        assertTrue(Double.isNaN(EvaluationResult.ofArray(List.of()).coerceNumber()));
        assertTrue(Double.isNaN(EvaluationResult.ofObject(Map.of()).coerceNumber()));
    }

    @Test
    void testCoerceSlice() {
        List<EvaluationResult> slice = EvaluationResult.ofArray(Arrays.asList("a", 1, null, List.of())).coerceSlice();
        assertEquals(List.of(ExprType.STRING, ExprType.NUMBER, ExprType.NULL, ExprType.ARRAY),
                slice.stream().map(EvaluationResult::getType).toList());
        assertThrows(UnsupportedOperationException.class, () -> slice.add(EvaluationResult.NULL));
        assertNull(EvaluationResult.ofString("a,b").coerceSlice());
        assertNull(EvaluationResult.ofObject(Map.of()).coerceSlice());
        assertNull(EvaluationResult.NULL.coerceSlice());
    }

    @Test
    void testAsMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", 1);
        assertSame(map, EvaluationResult.ofObject(map).asMap());
        assertNull(EvaluationResult.ofArray(List.of()).asMap());
    }

    @Test
    void testLooseEquals() {
        assertTrue(EvaluationResult.ofString("ABC").looseEquals(EvaluationResult.ofString("abc")));
        assertTrue(EvaluationResult.ofNumber(1).looseEquals(EvaluationResult.ofString("1")));
        assertTrue(EvaluationResult.ofString("0x10").looseEquals(EvaluationResult.ofNumber(16)));
        assertTrue(EvaluationResult.TRUE.looseEquals(EvaluationResult.ofNumber(1)));
        assertTrue(EvaluationResult.NULL.looseEquals(EvaluationResult.NULL));
        assertTrue(EvaluationResult.NULL.looseEquals(EvaluationResult.ofNumber(0)));
        assertTrue(EvaluationResult.NULL.looseEquals(EvaluationResult.ofString("")));
        assertFalse(EvaluationResult.ofString("abc").looseEquals(EvaluationResult.ofNumber(0)));
        assertFalse(EvaluationResult.TRUE.looseEquals(EvaluationResult.FALSE));
        EvaluationResult nan = EvaluationResult.ofNumber(Double.NaN);
        assertFalse(nan.looseEquals(nan));
    }

    @Test
    void testLooseEqualsContainers() {
        List<Object> list = List.of(1);
        EvaluationResult array = EvaluationResult.ofArray(list);
        assertTrue(array.looseEquals(EvaluationResult.ofArray(list)));
        assertFalse(array.looseEquals(EvaluationResult.ofArray(List.of(1))));
        assertFalse(array.looseEquals(EvaluationResult.ofString("Array")));
        assertFalse(EvaluationResult.ofObject(Map.of()).looseEquals(EvaluationResult.NULL));
    }

    @Test
    void testEqualsAndHashCode() {
        assertEquals(EvaluationResult.ofString("a"), EvaluationResult.ofString("a"));
        assertNotEquals(EvaluationResult.ofString("a"), EvaluationResult.ofString("A"));
        assertNotEquals(EvaluationResult.ofString("1"), EvaluationResult.ofNumber(1));
        assertEquals(EvaluationResult.ofNumber(2).hashCode(), EvaluationResult.of(2).hashCode());
    }

    @Test
    void testEqualsIgnoresElementWrapping() {
        EvaluationResult raw = EvaluationResult.ofArray(List.of(1.0, "a", List.of(2)));
        EvaluationResult wrapped = EvaluationResult.ofArray(List.of(EvaluationResult.ofNumber(1),
                EvaluationResult.ofString("a"), EvaluationResult.ofArray(List.of(EvaluationResult.ofNumber(2)))));
        assertEquals(raw, wrapped);
        assertEquals(raw.hashCode(), wrapped.hashCode());
        EvaluationResult rawMap = EvaluationResult.ofObject(Map.of("k", 3));
        assertEquals(rawMap, EvaluationResult.ofObject(Map.of("k", EvaluationResult.ofNumber(3))));
        assertNotEquals(raw, EvaluationResult.ofArray(List.of(1.0, "A", List.of(2))));
    }

    @Test
    void testToString() {
        assertEquals("String('a')", EvaluationResult.ofString("a").toString());
        assertEquals("Number(1.5)", EvaluationResult.ofNumber(1.5).toString());
        assertEquals("Null(null)", EvaluationResult.NULL.toString());
        assertEquals("Array([1,\"a\",[]])", EvaluationResult.ofArray(List.of(1, "a", List.of())).toString());
        assertEquals("Object({\"k\":true})", EvaluationResult.ofObject(Map.of("k", true)).toString());
    }

}
