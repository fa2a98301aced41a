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
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.analogCompiler.ir.AnalogCircuit;
import org.atoms.analogCompiler.ir.control.Field;
import org.atoms.analogCompiler.ir.control.Pulse;
import org.atoms.analogCompiler.ir.control.RunTimeVector;
import org.atoms.analogCompiler.ir.control.ScaledLocations;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.control.SpatialModulation;
import org.atoms.analogCompiler.ir.control.UniformModulation;
import org.atoms.analogCompiler.ir.register.AtomArrangement;
import org.atoms.analogCompiler.ir.register.ParallelRegister;
import org.atoms.analogCompiler.ir.register.Register;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.ICastable;
import org.atoms.util.IHasId;
import org.atoms.util.IWritesLogs;
import org.atoms.util.Logger;
import org.atoms.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an analog circuit: register, sequence, pulses, fields
 * and spatial modulations.  Waveforms found in fields are handed to an optional
 * {@link WaveformVisitor}. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class AnalogCircuitVisitor implements IWritesLogs, IHasId, ICastable {
    final long id;
    static long crtId = 0;
    /** Node currently being visited, and its ancestors. */
    protected final List<IOuterNode> context;
    /** Visitor applied to every waveform, if any. */
    @Nullable
    protected final WaveformVisitor waveformVisitor;

    public AnalogCircuitVisitor(@Nullable WaveformVisitor waveformVisitor) {
        this.id = crtId++;
        this.context = new ArrayList<>();
        this.waveformVisitor = waveformVisitor;
    }

    public AnalogCircuitVisitor() {
        this(null);
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IOuterNode node) {
        this.context.add(node);
    }

    public void pop(IOuterNode node) {
        IOuterNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    public IOuterNode getCurrent() {
        return Utilities.last(this.context);
    }

    /** The node enclosing the one currently visited; null at the root. */
    @Nullable
    public IOuterNode getParent() {
        if (this.context.size() < 2)
            return null;
        return this.context.get(this.context.size() - 2);
    }

    /** Called for each waveform driving a spatial modulation.
     * The default delegates to the waveform visitor. */
    public void visitWaveform(Waveform waveform) {
        if (this.waveformVisitor != null)
            this.waveformVisitor.apply(waveform);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IOuterNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    public VisitDecision preorder(IOuterNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(AnalogCircuit node) {
        return this.preorder((IOuterNode) node);
    }

    public VisitDecision preorder(Sequence node) {
        return this.preorder((IOuterNode) node);
    }

    public VisitDecision preorder(Pulse node) {
        return this.preorder((IOuterNode) node);
    }

    public VisitDecision preorder(Field node) {
        return this.preorder((IOuterNode) node);
    }

    public VisitDecision preorder(SpatialModulation node) {
        return this.preorder((IOuterNode) node);
    }

    public VisitDecision preorder(UniformModulation node) {
        return this.preorder((SpatialModulation) node);
    }

    public VisitDecision preorder(ScaledLocations node) {
        return this.preorder((SpatialModulation) node);
    }

    public VisitDecision preorder(RunTimeVector node) {
        return this.preorder((SpatialModulation) node);
    }

    public VisitDecision preorder(Register node) {
        return this.preorder((IOuterNode) node);
    }

    public VisitDecision preorder(AtomArrangement node) {
        return this.preorder((Register) node);
    }

    public VisitDecision preorder(ParallelRegister node) {
        return this.preorder((Register) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IOuterNode ignored) {}

    public void postorder(AnalogCircuit node) {
        this.postorder((IOuterNode) node);
    }

    public void postorder(Sequence node) {
        this.postorder((IOuterNode) node);
    }

    public void postorder(Pulse node) {
        this.postorder((IOuterNode) node);
    }

    public void postorder(Field node) {
        this.postorder((IOuterNode) node);
    }

    public void postorder(SpatialModulation node) {
        this.postorder((IOuterNode) node);
    }

    public void postorder(UniformModulation node) {
        this.postorder((SpatialModulation) node);
    }

    public void postorder(ScaledLocations node) {
        this.postorder((SpatialModulation) node);
    }

    public void postorder(RunTimeVector node) {
        this.postorder((SpatialModulation) node);
    }

    public void postorder(Register node) {
        this.postorder((IOuterNode) node);
    }

    public void postorder(AtomArrangement node) {
        this.postorder((Register) node);
    }

    public void postorder(ParallelRegister node) {
        this.postorder((Register) node);
    }

    public IOuterNode apply(IOuterNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "_" + this.id;
    }
}
