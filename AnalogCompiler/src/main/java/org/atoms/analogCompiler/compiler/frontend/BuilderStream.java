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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/** A cursor over a builder chain, in the order the calls were made.
 * Copies share the chain but move independently. */
public final class BuilderStream {
    final List<Builder> nodes;
    int cursor;

    BuilderStream(List<Builder> nodes, int cursor) {
        this.nodes = nodes;
        this.cursor = cursor;
    }

    /** Linearize the chain ending at 'builder'. */
    public static BuilderStream create(Builder builder) {
        List<Builder> nodes = new ArrayList<>();
        for (Builder current = builder; current != null; current = current.parent)
            nodes.add(current);
        Collections.reverse(nodes);
        return new BuilderStream(Collections.unmodifiableList(nodes), 0);
    }

    public BuilderStream copy() {
        return new BuilderStream(this.nodes, this.cursor);
    }

    public int size() {
        return this.nodes.size();
    }

    /** The node at the cursor, or null if the stream is exhausted. */
    @Nullable
    public BuilderNode current() {
        if (this.cursor >= this.nodes.size())
            return null;
        return new BuilderNode(this.nodes, this.cursor);
    }

    /** Return the node at the cursor and move past it. */
    @Nullable
    public BuilderNode read() {
        BuilderNode result = this.current();
        if (result != null)
            this.cursor++;
        return result;
    }

    /** Skip to the first node whose kind is in 'kinds' and move past it.
     * @return The node found, or null if the stream is exhausted. */
    @Nullable
    public BuilderNode readNext(Set<BuilderNodeKind> kinds) {
        BuilderNode node = this.read();
        while (node != null && !kinds.contains(node.kind()))
            node = this.read();
        return node;
    }
}
