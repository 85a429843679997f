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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Numeric and string coercion rules shared by values and built-in functions.
 */
public class Terms {

    private Terms() {
        // only static methods
    }

    static final int SIGNIFICANT_DIGITS = 15;

    private static final MathContext FORMAT_CONTEXT = new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public static double toNumber(String text) {
        text = text.trim();
        if (text.isEmpty()) {
            return 0;
        }
        switch (text) {
            case "Infinity", "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        Double radix = fromRadix(text);
        if (radix != null) {
            return radix;
        }
        if (!DECIMAL.matcher(text).matches()) {
            return Double.NaN;
        }
        return Double.parseDouble(text);
    }

    // 0x1F and 0o17 style literals
    static Double fromRadix(String text) {
        if (text.length() < 3 || text.charAt(0) != '0') {
            return null;
        }
        char second = text.charAt(1);
        int radix;
        if (second == 'x' || second == 'X') {
            radix = 16;
        } else if (second == 'o' || second == 'O') {
            radix = 8;
        } else {
            return null;
        }
        try {
            return (double) Long.parseLong(text.substring(2), radix);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * Formats a number the way workflow expressions print it: no fraction
     * for integral values, at most fifteen significant digits, and
     * exponent notation outside the plain range ({@code 1E+15}, {@code 1.5E-07}).
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0) { // includes negative zero
            return "0";
        }
        BigDecimal bd = new BigDecimal(d).round(FORMAT_CONTEXT).stripTrailingZeros();
        int exponent = bd.precision() - bd.scale() - 1;
        if (exponent > -5 && exponent < SIGNIFICANT_DIGITS) {
            return bd.toPlainString();
        }
        String mantissa = bd.movePointLeft(exponent).stripTrailingZeros().toPlainString();
        int abs = Math.abs(exponent);
        return mantissa + (exponent < 0 ? "E-" : "E+") + (abs < 10 ? "0" + abs : String.valueOf(abs));
    }

    static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    static boolean eq(EvaluationResult lhs, EvaluationResult rhs) {
        ExprType lt = lhs.getType();
        ExprType rt = rhs.getType();
        if (lt != rt) {
            if (!lt.isPrimitive() || !rt.isPrimitive()) {
                return false;
            }
            // mixed primitives compare as numbers
            return lhs.coerceNumber() == rhs.coerceNumber();
        }
        return switch (lt) {
            case NULL -> true;
            case BOOL -> lhs.getValue().equals(rhs.getValue());
            case NUMBER -> lhs.coerceNumber() == rhs.coerceNumber();
            case STRING -> ((String) lhs.getValue()).equalsIgnoreCase((String) rhs.getValue());
            case ARRAY, OBJECT -> lhs.getValue() == rhs.getValue();
        };
    }

}
