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

package org.atoms.analogCompiler.compiler.visitors.outer;

import org.atoms.analogCompiler.compiler.visitors.inner.CollectVariables;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.analogCompiler.ir.control.RunTimeVector;
import org.atoms.analogCompiler.ir.control.ScaledLocations;
import org.atoms.analogCompiler.ir.register.AtomArrangement;
import org.atoms.analogCompiler.ir.register.LocationInfo;
import org.atoms.analogCompiler.ir.register.ParallelRegister;
import org.atoms.analogCompiler.ir.scalar.Scalar;

import java.util.LinkedHashSet;
import java.util.Set;

/** Finds the names a circuit needs bound before it can run. */
public class ScanVariables extends AnalogCircuitVisitor {
    /**
     * @param scalarVariables  Free scalar variables, in waveforms, weights and the register.
     * @param vectorVariables  Names of per-site weight vectors.
     * @param recorded         Names assigned by recording waveform values. */
    public record Result(Set<String> scalarVariables, Set<String> vectorVariables, Set<String> recorded) {}

    final Set<String> scalars;
    final Set<String> vectors;
    final CollectVariables waveformVariables;

    ScanVariables(CollectVariables waveformVariables) {
        super(waveformVariables);
        this.waveformVariables = waveformVariables;
        this.scalars = new LinkedHashSet<>();
        this.vectors = new LinkedHashSet<>();
    }

    public ScanVariables() {
        this(new CollectVariables());
    }

    @Override
    public void postorder(ScaledLocations node) {
        for (Scalar weight: node.weights.values())
            weight.collectVariables(this.scalars);
    }

    @Override
    public void postorder(RunTimeVector node) {
        this.vectors.add(node.name);
    }

    @Override
    public void postorder(AtomArrangement node) {
        for (LocationInfo location: node.enumerate()) {
            location.x().collectVariables(this.scalars);
            location.y().collectVariables(this.scalars);
        }
    }

    @Override
    public void postorder(ParallelRegister node) {
        node.clusterSpacing.collectVariables(this.scalars);
    }

    public Result scan(IOuterNode node) {
        this.apply(node);
        Set<String> scalars = new LinkedHashSet<>(this.scalars);
        scalars.addAll(this.waveformVariables.variables);
        return new Result(scalars, new LinkedHashSet<>(this.vectors),
                new LinkedHashSet<>(this.waveformVariables.recorded));
    }
}
