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

import java.util.Objects;

public final class FunctionDescriptor {

    private final String name;
    private final Arity arity;
    private final ExprFunction function;

    public FunctionDescriptor(String name, Arity arity, ExprFunction function) {
        this.name = Objects.requireNonNull(name, "name");
        this.arity = Objects.requireNonNull(arity, "arity");
        this.function = Objects.requireNonNull(function, "function");
    }

    public String getName() {
        return name;
    }

    public Arity getArity() {
        return arity;
    }

    public ExprFunction getFunction() {
        return function;
    }

    @Override
    public String toString() {
        return name + "(" + arity + ")";
    }

}
