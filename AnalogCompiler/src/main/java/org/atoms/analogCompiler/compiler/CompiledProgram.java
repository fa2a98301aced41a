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

package org.atoms.analogCompiler.compiler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.atoms.analogCompiler.compiler.backend.ToJsonOuterVisitor;
import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.visitors.outer.IsConstantAnalogCircuit;
import org.atoms.analogCompiler.ir.AnalogCircuit;
import org.atoms.analogCompiler.ir.routine.Parameters;
import org.atoms.util.Utilities;

import java.math.BigDecimal;
import java.util.Map;

/** The result of compiling a builder chain: the circuit and how to run it.
 * The builder the program was compiled from is kept for reference. */
public final class CompiledProgram {
    public final Builder source;
    public final AnalogCircuit circuit;
    public final Parameters parameters;

    public CompiledProgram(Builder source, AnalogCircuit circuit, Parameters parameters) {
        this.source = source;
        this.circuit = circuit;
        this.parameters = parameters;
    }

    /** If the circuit is constant in time under 'assignment', a program where every
     * waveform is replaced by a constant.  Otherwise this program. */
    public CompiledProgram foldConstants(Map<String, BigDecimal> assignment) {
        IsConstantAnalogCircuit.Result result = new IsConstantAnalogCircuit(assignment).emit(this.circuit);
        if (!result.isConstant())
            return this;
        return new CompiledProgram(this.source, result.effectiveCircuit(), this.parameters);
    }

    public ObjectNode toJson() {
        ObjectNode result = Utilities.deterministicObjectMapper().createObjectNode();
        result.set("circuit", ToJsonOuterVisitor.toJson(this.circuit));
        result.set("params", this.parameters.toJson());
        return result;
    }

    @Override
    public String toString() {
        return this.circuit + System.lineSeparator() + this.parameters;
    }
}
