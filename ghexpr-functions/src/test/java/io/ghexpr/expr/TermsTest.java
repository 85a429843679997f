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

import static org.junit.jupiter.api.Assertions.*;

class TermsTest {

    @Test
    void testFormatIntegral() {
        assertEquals("0", Terms.formatNumber(0));
        assertEquals("0", Terms.formatNumber(-0.0));
        assertEquals("1", Terms.formatNumber(1));
        assertEquals("-3", Terms.formatNumber(-3));
        assertEquals("100", Terms.formatNumber(100));
        assertEquals("123456789012345", Terms.formatNumber(123456789012345d));
    }

    @Test
    void testFormatFraction() {
        assertEquals("1.5", Terms.formatNumber(1.5));
        assertEquals("0.3", Terms.formatNumber(0.1 + 0.2));
        assertEquals("3.14159265358979", Terms.formatNumber(Math.PI));
        assertEquals("0.0001", Terms.formatNumber(0.0001));
    }

    @Test
    void testFormatExponent() {
        assertEquals("1E+15", Terms.formatNumber(1e15));
        assertEquals("1E+20", Terms.formatNumber(1e20));
        assertEquals("-2.5E+21", Terms.formatNumber(-2.5e21));
        assertEquals("9.00719925474099E+15", Terms.formatNumber(9007199254740992d));
        assertEquals("1E-05", Terms.formatNumber(0.00001));
        assertEquals("1.5E-07", Terms.formatNumber(1.5e-7));
        assertEquals("1E-100", Terms.formatNumber(1e-100));
    }

    @Test
    void testFormatSpecial() {
        assertEquals("NaN", Terms.formatNumber(Double.NaN));
        assertEquals("Infinity", Terms.formatNumber(Double.POSITIVE_INFINITY));
        assertEquals("-Infinity", Terms.formatNumber(Double.NEGATIVE_INFINITY));
    }

    @Test
    void testToNumber() {
        assertEquals(0, Terms.toNumber(""));
        assertEquals(0, Terms.toNumber("   "));
        assertEquals(42, Terms.toNumber(" 42 "));
        assertEquals(-1.5, Terms.toNumber("-1.5"));
        assertEquals(0.5, Terms.toNumber(".5"));
        assertEquals(5, Terms.toNumber("5."));
        assertEquals(1000, Terms.toNumber("1e3"));
        assertEquals(31, Terms.toNumber("0x1F"));
        assertEquals(15, Terms.toNumber("0o17"));
        assertEquals(Double.POSITIVE_INFINITY, Terms.toNumber("Infinity"));
        assertEquals(Double.NEGATIVE_INFINITY, Terms.toNumber("-Infinity"));
    }

    @Test
    void testToNumberInvalid() {
        assertTrue(Double.isNaN(Terms.toNumber("abc")));
        assertTrue(Double.isNaN(Terms.toNumber("1d")));
        assertTrue(Double.isNaN(Terms.toNumber("NaN")));
        assertTrue(Double.isNaN(Terms.toNumber("0xZZ")));
        assertTrue(Double.isNaN(Terms.toNumber("0x")));
        assertTrue(Double.isNaN(Terms.toNumber("1,000")));
    }

}
