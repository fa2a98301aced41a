/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.atoms.analogCompiler.ir.scalar;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.ir.AnalogNode;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** A symbolic decimal number: a literal, a variable, or an arithmetic
 * combination of scalars.  Scalars parameterize waveforms and registers. */
public abstract class Scalar extends AnalogNode {
    /** Precision used for all decimal arithmetic. */
    public static final MathContext MATH = MathContext.DECIMAL128;

    /** Evaluate this scalar.
     * @param assignment  Values of the free variables.
     * @throws org.atoms.analogCompiler.compiler.errors.EvaluationError
     *         if a free variable is not assigned. */
    public abstract BigDecimal eval(Map<String, BigDecimal> assignment);

    public BigDecimal eval() {
        return this.eval(new HashMap<>());
    }

    /** Add the names of the free variables of this scalar to the set. */
    public abstract void collectVariables(Set<String> names);

    public Set<String> variables() {
        Set<String> result = new LinkedHashSet<>();
        this.collectVariables(result);
        return result;
    }

    public boolean isLiteral() {
        return this.is(Literal.class);
    }

    /** Convert a value supplied through the builder API into a scalar.
     * @param value  A Number, a variable name, or a Scalar. */
    public static Scalar cast(@Nullable Object value) {
        if (value == null)
            throw new CompilationError("Missing value where a scalar is expected");
        if (value instanceof Scalar scalar)
            return scalar;
        if (value instanceof BigDecimal decimal)
            return new Literal(decimal);
        if (value instanceof Number number)
            return new Literal(new BigDecimal(number.toString()));
        if (value instanceof String name)
            return new Variable(name);
        throw new CompilationError("Cannot convert " + value + " of type "
                + value.getClass().getSimpleName() + " to a scalar");
    }

    public static Literal literal(long value) {
        return new Literal(BigDecimal.valueOf(value));
    }

    public static Literal literal(BigDecimal value) {
        return new Literal(value);
    }

    public static Variable var(String name) {
        return new Variable(name);
    }

    public Scalar add(Scalar other) {
        return new ScalarBinary(ScalarOpcode.ADD, this, other);
    }

    public Scalar sub(Scalar other) {
        return new ScalarBinary(ScalarOpcode.SUB, this, other);
    }

    public Scalar mul(Scalar other) {
        return new ScalarBinary(ScalarOpcode.MUL, this, other);
    }

    public Scalar div(Scalar other) {
        return new ScalarBinary(ScalarOpcode.DIV, this, other);
    }

    public Scalar min(Scalar other) {
        return new ScalarBinary(ScalarOpcode.MIN, this, other);
    }

    public Scalar max(Scalar other) {
        return new ScalarBinary(ScalarOpcode.MAX, this, other);
    }

    public Scalar negate() {
        return new ScalarNegative(this);
    }
}
