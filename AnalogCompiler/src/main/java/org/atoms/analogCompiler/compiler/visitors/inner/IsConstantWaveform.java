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

package org.atoms.analogCompiler.compiler.visitors.inner;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.ir.IInnerNode;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Add;
import org.atoms.analogCompiler.ir.waveform.Append;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.Logger;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/** Decides whether a waveform keeps the same value for its whole duration,
 * for a given assignment of its variables.
 *
 * <p>Wrappers are constant when the waveform they wrap is.  Functions are
 * never considered constant.  The analysis also computes a constant
 * waveform with the same duration and final value; this is the
 * equivalent waveform when the verdict is true. */
public class IsConstantWaveform extends WaveformVisitor {
    /**
     * @param isConstant        True if the waveform is constant.
     * @param constantWaveform  Constant with the duration and final value of the waveform. */
    public record Result(boolean isConstant, Constant constantWaveform) {}

    final Map<String, BigDecimal> assignment;
    boolean isConstant;

    public IsConstantWaveform(Map<String, BigDecimal> assignment) {
        this.assignment = new HashMap<>(assignment);
        this.isConstant = true;
    }

    @Override
    public void startVisit(IInnerNode node) {
        super.startVisit(node);
        this.isConstant = true;
    }

    @Override
    public VisitDecision preorder(Linear node) {
        BigDecimal start = node.start.eval(this.assignment);
        BigDecimal stop = node.stop.eval(this.assignment);
        if (start.compareTo(stop) != 0)
            this.isConstant = false;
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(Poly node) {
        for (int i = 1; i < node.coeffs.size(); i++) {
            if (node.coeffs.get(i).eval(this.assignment).signum() != 0) {
                this.isConstant = false;
                break;
            }
        }
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(OpaqueFn node) {
        this.isConstant = false;
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(Append node) {
        BigDecimal value = null;
        for (Waveform waveform: node.waveforms) {
            Result result = new IsConstantWaveform(this.assignment).emit(waveform);
            BigDecimal partValue = result.constantWaveform().value.eval();
            if (value == null)
                value = partValue;
            this.isConstant = this.isConstant && result.isConstant() && partValue.compareTo(value) == 0;
            if (!this.isConstant)
                break;
        }
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Add node) {
        BigDecimal left = node.left.duration(this.assignment);
        BigDecimal right = node.right.duration(this.assignment);
        if (left.compareTo(right) != 0) {
            this.isConstant = false;
            return VisitDecision.STOP;
        }
        return VisitDecision.CONTINUE;
    }

    public Result emit(Waveform waveform) {
        this.apply(waveform);
        BigDecimal duration = waveform.duration(this.assignment);
        BigDecimal value = waveform.valueAt(duration, this.assignment);
        Constant constant = new Constant(Scalar.literal(value), Scalar.literal(duration));
        Logger.INSTANCE.belowLevel(this, 1)
                .append(waveform)
                .append(this.isConstant ? " is constant " : " is not constant ")
                .append(constant)
                .newline();
        return new Result(this.isConstant, constant);
    }
}
