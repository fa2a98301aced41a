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

package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.ir.AnalogNode;
import org.atoms.analogCompiler.ir.IInnerNode;
import org.atoms.analogCompiler.ir.scalar.Scalar;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** A symbolic scalar function of time, represented as an expression tree.
 * A waveform is defined on [0, duration]; outside this interval its value is 0. */
public abstract class Waveform extends AnalogNode implements IInnerNode {
    /** Duration of the waveform under the given assignment of the free variables. */
    public abstract BigDecimal duration(Map<String, BigDecimal> assignment);

    public BigDecimal duration() {
        return this.duration(new HashMap<>());
    }

    /** Value at a given time under the given assignment of the free variables. */
    public BigDecimal valueAt(BigDecimal time, Map<String, BigDecimal> assignment) {
        BigDecimal duration = this.duration(assignment);
        if (time.signum() < 0 || time.compareTo(duration) > 0)
            return BigDecimal.ZERO;
        return this.evalAt(time, duration, assignment);
    }

    public BigDecimal valueAt(BigDecimal time) {
        return this.valueAt(time, new HashMap<>());
    }

    /** Value at a time known to be in [0, duration]. */
    protected abstract BigDecimal evalAt(
            BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment);

    /** Sequential composition: 'other' starts when this waveform ends.
     * Nested appends are flattened. */
    public Append append(Waveform other) {
        List<Waveform> parts = new ArrayList<>();
        Append.flattenInto(this, parts);
        Append.flattenInto(other, parts);
        return new Append(parts);
    }

    public Add add(Waveform other) {
        return new Add(this, other);
    }

    public Negative negate() {
        return new Negative(this);
    }

    public Scale scale(Scalar factor) {
        return new Scale(this, factor);
    }

    public Slice slice(@Nullable Scalar start, @Nullable Scalar stop) {
        return new Slice(this, start, stop);
    }

    public Record record(String name) {
        return new Record(this, name);
    }

    public Sample sample(Scalar dt, Interpolation interpolation) {
        return new Sample(this, interpolation, dt);
    }

    public Smooth smooth(Scalar radius, SmoothingKernel kernel) {
        return new Smooth(this, radius, kernel);
    }

    public AlignedWaveform align(Alignment alignment, Scalar value) {
        return new AlignedWaveform(this, alignment, value);
    }

    public AlignedWaveform align(Alignment alignment, ValueAlignment value) {
        return new AlignedWaveform(this, alignment, value);
    }
}
