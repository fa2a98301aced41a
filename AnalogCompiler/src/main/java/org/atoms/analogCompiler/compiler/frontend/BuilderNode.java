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

package org.atoms.analogCompiler.compiler.frontend;

import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.frontend.builder.BuilderNodeKind;

import javax.annotation.Nullable;
import java.util.List;

/** A position in a linearized builder chain. */
public final class BuilderNode {
    final List<Builder> nodes;
    final int index;

    BuilderNode(List<Builder> nodes, int index) {
        this.nodes = nodes;
        this.index = index;
    }

    public Builder builder() {
        return this.nodes.get(this.index);
    }

    public BuilderNodeKind kind() {
        return this.builder().kind;
    }

    /** The node after this one in call order, or null at the end of the chain. */
    @Nullable
    public BuilderNode next() {
        if (this.index + 1 >= this.nodes.size())
            return null;
        return new BuilderNode(this.nodes, this.index + 1);
    }

    @Override
    public String toString() {
        return this.index + ":" + this.builder();
    }
}
