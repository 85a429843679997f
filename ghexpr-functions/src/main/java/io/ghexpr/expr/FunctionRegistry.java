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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Name based dispatch for the built-in functions.
 * <p>
 * The table is built once when the class loads and is never modified, so a
 * single instance can be shared by any number of evaluator threads. Function
 * names are matched ignoring case ({@code fromJSON} and {@code fromjson} are
 * the same function).
 */
public class FunctionRegistry {

    static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    private static final FunctionRegistry DEFAULT = new FunctionRegistry(Builtin.values());

    private final Map<String, FunctionDescriptor> functions;

    private FunctionRegistry(Builtin[] builtins) {
        Map<String, FunctionDescriptor> map = new LinkedHashMap<>();
        for (Builtin builtin : builtins) {
            map.put(builtin.getFunctionName(), builtin.toDescriptor());
        }
        functions = Collections.unmodifiableMap(map);
        logger.debug("function registry initialized with {} functions: {}", functions.size(), functions.keySet());
    }

    public static FunctionRegistry getDefault() {
        return DEFAULT;
    }

    public Optional<FunctionDescriptor> get(String name) {
        return Optional.ofNullable(functions.get(key(name)));
    }

    public boolean contains(String name) {
        return functions.containsKey(key(name));
    }

    public Set<String> names() {
        return functions.keySet();
    }

    /**
     * Looks up the function, checks the argument count and runs it.
     *
     * @throws UnknownFunctionException if no function has this name
     * @throws ArityException if the argument count does not fit the function
     * @throws EvaluationException if the function body fails
     */
    public EvaluationResult invoke(String name, List<EvaluationResult> args) {
        Objects.requireNonNull(args, "args");
        FunctionDescriptor descriptor = functions.get(key(name));
        if (descriptor == null) {
            logger.debug("unknown function: {}", name);
            throw new UnknownFunctionException(name);
        }
        Arity arity = descriptor.getArity();
        if (!arity.accepts(args.size())) {
            logger.debug("arity mismatch for {}(): expected {}, got {}", descriptor.getName(), arity, args.size());
            throw new ArityException(descriptor.getName(), arity, args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) == null) {
                throw new IllegalArgumentException("argument " + i + " of " + descriptor.getName() + "() is not evaluated");
            }
        }
        if (logger.isTraceEnabled()) {
            logger.trace("invoke {}{}", descriptor.getName(), args);
        }
        return descriptor.getFunction().call(args);
    }

    public EvaluationResult invoke(String name, EvaluationResult... args) {
        return invoke(name, List.of(args));
    }

    private static String key(String name) {
        Objects.requireNonNull(name, "name");
        return name.toLowerCase(Locale.ROOT);
    }

}
