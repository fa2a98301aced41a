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

import org.atoms.analogCompiler.compiler.errors.InternalCompilerError;
import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.IsConstantWaveform;
import org.atoms.analogCompiler.ir.AnalogCircuit;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.analogCompiler.ir.control.Field;
import org.atoms.analogCompiler.ir.control.FieldName;
import org.atoms.analogCompiler.ir.control.LevelCoupling;
import org.atoms.analogCompiler.ir.control.Pulse;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.control.SpatialModulation;
import org.atoms.analogCompiler.ir.register.Register;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.Logger;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Decides whether a whole circuit is constant in time: every waveform is
 * constant, and all waveforms have the same duration.
 *
 * <p>The circuit is rebuilt with every waveform replaced by its constant
 * representative, whatever the verdict.  Registers are kept unchanged. */
public class IsConstantAnalogCircuit extends AnalogCircuitVisitor {
    /**
     * @param isConstant        True if the circuit is constant.
     * @param effectiveCircuit  The circuit with folded waveforms. */
    public record Result(boolean isConstant, AnalogCircuit effectiveCircuit) {}

    final Map<String, BigDecimal> assignment;
    boolean isConstant;
    /** Common duration of the waveforms seen so far. */
    @Nullable
    BigDecimal duration;
    /** Maps each original node to its rebuilt version. */
    final Map<Object, Object> translation;

    public IsConstantAnalogCircuit(Map<String, BigDecimal> assignment) {
        this.assignment = new HashMap<>(assignment);
        this.isConstant = true;
        this.duration = null;
        this.translation = new IdentityHashMap<>();
    }

    public IsConstantAnalogCircuit() {
        this(new HashMap<>());
    }

    @Override
    public void startVisit(IOuterNode node) {
        super.startVisit(node);
        this.isConstant = true;
        this.duration = null;
        this.translation.clear();
    }

    <T> T get(Object node, Class<T> clazz) {
        Object result = this.translation.get(node);
        if (result == null)
            throw new InternalCompilerError("No translation for " + node);
        return clazz.cast(result);
    }

    @Override
    public void visitWaveform(Waveform waveform) {
        IsConstantWaveform.Result result = new IsConstantWaveform(this.assignment).emit(waveform);
        this.isConstant = this.isConstant && result.isConstant();
        BigDecimal duration = result.constantWaveform().duration(this.assignment);
        if (this.duration == null)
            this.duration = duration;
        else if (this.duration.compareTo(duration) != 0)
            this.isConstant = false;
        this.translation.put(waveform, result.constantWaveform());
    }

    @Override
    public VisitDecision preorder(Register node) {
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SpatialModulation node) {
        return VisitDecision.STOP;
    }

    @Override
    public void postorder(Field node) {
        Field result = new Field();
        for (Map.Entry<SpatialModulation, Waveform> e: node.drives.entrySet())
            result = result.add(new Field(e.getKey(), this.get(e.getValue(), Waveform.class)));
        this.translation.put(node, result);
    }

    @Override
    public void postorder(Pulse node) {
        Map<FieldName, Field> fields = new LinkedHashMap<>();
        for (Map.Entry<FieldName, Field> e: node.fields.entrySet())
            fields.put(e.getKey(), this.get(e.getValue(), Field.class));
        this.translation.put(node, new Pulse(fields));
    }

    @Override
    public void postorder(Sequence node) {
        Map<LevelCoupling, Pulse> pulses = new LinkedHashMap<>();
        for (Map.Entry<LevelCoupling, Pulse> e: node.pulses.entrySet())
            pulses.put(e.getKey(), this.get(e.getValue(), Pulse.class));
        this.translation.put(node, new Sequence(pulses));
    }

    @Override
    public void postorder(AnalogCircuit node) {
        Sequence sequence = this.get(node.sequence, Sequence.class);
        this.translation.put(node, new AnalogCircuit(node.register, sequence));
    }

    public Result emit(AnalogCircuit circuit) {
        this.apply(circuit);
        AnalogCircuit result = this.get(circuit, AnalogCircuit.class);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Circuit is ")
                .append(this.isConstant ? "constant" : "not constant")
                .append(", duration ")
                .append(Objects.toString(this.duration))
                .newline();
        return new Result(this.isConstant, result);
    }
}
