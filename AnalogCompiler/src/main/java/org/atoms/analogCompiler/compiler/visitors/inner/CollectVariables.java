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

import org.atoms.analogCompiler.ir.IInnerNode;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.AlignedWaveform;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Instruction;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Record;
import org.atoms.analogCompiler.ir.waveform.Sample;
import org.atoms.analogCompiler.ir.waveform.Scale;
import org.atoms.analogCompiler.ir.waveform.Slice;
import org.atoms.analogCompiler.ir.waveform.Smooth;

import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.Set;

/** Collects the free variables of waveforms, and the names waveforms are recorded under.
 * The visitor accumulates across calls to {@link #apply}. */
public class CollectVariables extends WaveformVisitor {
    public final Set<String> variables;
    public final Set<String> recorded;

    public CollectVariables() {
        this.variables = new LinkedHashSet<>();
        this.recorded = new LinkedHashSet<>();
    }

    void add(@Nullable Scalar scalar) {
        if (scalar != null)
            scalar.collectVariables(this.variables);
    }

    @Override
    public void postorder(Instruction node) {
        this.add(node.duration);
    }

    @Override
    public void postorder(Constant node) {
        this.add(node.value);
        super.postorder(node);
    }

    @Override
    public void postorder(Linear node) {
        this.add(node.start);
        this.add(node.stop);
        super.postorder(node);
    }

    @Override
    public void postorder(Poly node) {
        for (Scalar coefficient: node.coeffs)
            this.add(coefficient);
        super.postorder(node);
    }

    @Override
    public void postorder(OpaqueFn node) {
        this.variables.addAll(node.parameters);
        super.postorder(node);
    }

    @Override
    public void postorder(AlignedWaveform node) {
        this.add(node.value);
    }

    @Override
    public void postorder(Record node) {
        this.recorded.add(node.name);
    }

    @Override
    public void postorder(Sample node) {
        this.add(node.dt);
    }

    @Override
    public void postorder(Scale node) {
        this.add(node.factor);
    }

    @Override
    public void postorder(Slice node) {
        this.add(node.start);
        this.add(node.stop);
    }

    @Override
    public void postorder(Smooth node) {
        this.add(node.radius);
    }

    /** Free variables of a single node tree. */
    public static Set<String> of(IInnerNode node) {
        CollectVariables collect = new CollectVariables();
        collect.apply(node);
        return collect.variables;
    }
}
