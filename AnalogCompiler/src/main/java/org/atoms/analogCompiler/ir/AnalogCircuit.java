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

package org.atoms.analogCompiler.ir;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.register.Register;
import org.atoms.util.IIndentStream;

import java.util.Objects;

/** A complete lowered program: the atoms and the time program applied to them. */
public final class AnalogCircuit extends AnalogNode implements IOuterNode {
    public final Register register;
    public final Sequence sequence;

    public AnalogCircuit(Register register, Sequence sequence) {
        this.register = register;
        this.sequence = sequence;
    }

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.register.accept(visitor);
        this.sequence.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("AnalogCircuit(")
                .increase()
                .append(this.register)
                .append(",")
                .newline()
                .append(this.sequence)
                .decrease()
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalogCircuit that)) return false;
        return this.register.equals(that.register) && this.sequence.equals(that.sequence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.register, this.sequence);
    }
}
