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
 * The built-in function table. Each constant carries its name, its
 * argument count rule and its body.
 */
public enum Builtin {

    CONTAINS("contains", Arity.exactly(2), Functions::contains),
    STARTSWITH("startswith", Arity.exactly(2), Functions::startsWith),
    ENDSWITH("endswith", Arity.exactly(2), Functions::endsWith),
    JOIN("join", Arity.between(1, 2), Functions::join),
    FROMJSON("fromjson", Arity.exactly(1), Functions::fromJson),
    TOJSON("tojson", Arity.exactly(1), Functions::toJson),
    FORMAT("format", Arity.atLeast(1), Functions::format);

    private final String functionName;
    private final Arity arity;
    private final ExprFunction body;

    Builtin(String functionName, Arity arity, ExprFunction body) {
        this.functionName = functionName;
        this.arity = arity;
        this.body = body;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Arity getArity() {
        return arity;
    }

    ExprFunction getBody() {
        return body;
    }

    FunctionDescriptor toDescriptor() {
        return new FunctionDescriptor(functionName, arity, body);
    }

}
