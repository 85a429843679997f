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

/**
 * Argument count rule of a function.
 * <p>
 * The integer form ({@link #argsCount()}) follows the usual convention:
 * a positive value has to be matched exactly, a negative value gives the
 * minimum number of arguments. An optional upper bound narrows variadic
 * functions such as {@code join}.
 */
public final class Arity {

    static final int UNBOUNDED = -1;

    private final int min;
    private final int max;

    private Arity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static Arity exactly(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        return new Arity(count, count);
    }

    public static Arity atLeast(int min) {
        if (min < 0) {
            throw new IllegalArgumentException("min must not be negative: " + min);
        }
        return new Arity(min, UNBOUNDED);
    }

    public static Arity between(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("invalid range: " + min + " to " + max);
        }
        return new Arity(min, max);
    }

    public static Arity fromArgsCount(int argsCount) {
        return argsCount >= 0 ? exactly(argsCount) : atLeast(-argsCount);
    }

    public int argsCount() {
        return min == max ? min : -min;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public boolean accepts(int count) {
        return count >= min && (max == UNBOUNDED || count <= max);
    }

    String describe() {
        if (min == max) {
            return min + (min == 1 ? " argument" : " arguments");
        }
        if (max == UNBOUNDED) {
            return "at least " + min + (min == 1 ? " argument" : " arguments");
        }
        return min + " to " + max + " arguments";
    }

    @Override
    public String toString() {
        return describe();
    }

}
