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

import org.atoms.analogCompiler.compiler.errors.InternalCompilerError;
import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.ir.IInnerNode;
import org.atoms.analogCompiler.ir.waveform.Add;
import org.atoms.analogCompiler.ir.waveform.AlignedWaveform;
import org.atoms.analogCompiler.ir.waveform.Append;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Instruction;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.Negative;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Record;
import org.atoms.analogCompiler.ir.waveform.Sample;
import org.atoms.analogCompiler.ir.waveform.Scale;
import org.atoms.analogCompiler.ir.waveform.Slice;
import org.atoms.analogCompiler.ir.waveform.Smooth;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.analogCompiler.ir.waveform.WaveformWrapper;
import org.atoms.util.IHasId;
import org.atoms.util.IWritesLogs;
import org.atoms.util.Logger;
import org.atoms.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of a waveform tree. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class WaveformVisitor implements IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    /** Path from the root to the node currently visited. */
    protected final List<IInnerNode> context;

    public WaveformVisitor() {
        this.id = crtId++;
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IInnerNode node) {
        this.context.add(node);
    }

    public void pop(IInnerNode node) {
        IInnerNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public IInnerNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IInnerNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should not visit the children of the current node.
    public VisitDecision preorder(IInnerNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(Waveform node) {
        return this.preorder((IInnerNode) node);
    }

    public VisitDecision preorder(Instruction node) {
        return this.preorder((Waveform) node);
    }

    public VisitDecision preorder(WaveformWrapper node) {
        return this.preorder((Waveform) node);
    }

    public VisitDecision preorder(Constant node) {
        return this.preorder((Instruction) node);
    }

    public VisitDecision preorder(Linear node) {
        return this.preorder((Instruction) node);
    }

    public VisitDecision preorder(Poly node) {
        return this.preorder((Instruction) node);
    }

    public VisitDecision preorder(OpaqueFn node) {
        return this.preorder((Instruction) node);
    }

    public VisitDecision preorder(Append node) {
        return this.preorder((Waveform) node);
    }

    public VisitDecision preorder(Add node) {
        return this.preorder((Waveform) node);
    }

    public VisitDecision preorder(AlignedWaveform node) {
        return this.preorder((WaveformWrapper) node);
    }

    public VisitDecision preorder(Negative node) {
        return this.preorder((WaveformWrapper) node);
    }

    public VisitDecision preorder(Record node) {
        return this.preorder((WaveformWrapper) node);
    }

    public VisitDecision preorder(Sample node) {
        return this.preorder((WaveformWrapper) node);
    }

    public VisitDecision preorder(Scale node) {
        return this.preorder((WaveformWrapper) node);
    }

    public VisitDecision preorder(Slice node) {
        return this.preorder((WaveformWrapper) node);
    }

    public VisitDecision preorder(Smooth node) {
        return this.preorder((WaveformWrapper) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IInnerNode ignored) {}

    public void postorder(Waveform node) {
        this.postorder((IInnerNode) node);
    }

    public void postorder(Instruction node) {
        this.postorder((Waveform) node);
    }

    public void postorder(WaveformWrapper node) {
        this.postorder((Waveform) node);
    }

    public void postorder(Constant node) {
        this.postorder((Instruction) node);
    }

    public void postorder(Linear node) {
        this.postorder((Instruction) node);
    }

    public void postorder(Poly node) {
        this.postorder((Instruction) node);
    }

    public void postorder(OpaqueFn node) {
        this.postorder((Instruction) node);
    }

    public void postorder(Append node) {
        this.postorder((Waveform) node);
    }

    public void postorder(Add node) {
        this.postorder((Waveform) node);
    }

    public void postorder(AlignedWaveform node) {
        this.postorder((WaveformWrapper) node);
    }

    public void postorder(Negative node) {
        this.postorder((WaveformWrapper) node);
    }

    public void postorder(Record node) {
        this.postorder((WaveformWrapper) node);
    }

    public void postorder(Sample node) {
        this.postorder((WaveformWrapper) node);
    }

    public void postorder(Scale node) {
        this.postorder((WaveformWrapper) node);
    }

    public void postorder(Slice node) {
        this.postorder((WaveformWrapper) node);
    }

    public void postorder(Smooth node) {
        this.postorder((WaveformWrapper) node);
    }

    public IInnerNode apply(IInnerNode node) {
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
