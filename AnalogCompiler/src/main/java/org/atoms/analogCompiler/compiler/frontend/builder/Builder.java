package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.util.ICastable;

import javax.annotation.Nullable;

/** A node of a builder chain.  Every fluent call creates a new node which
 * refers to the node it was called on; the chain is never modified. */
public abstract class Builder implements ICastable {
    /** Node this call was made on; null only for the register at the root. */
    @Nullable
    public final Builder parent;
    public final BuilderNodeKind kind;

    protected Builder(@Nullable Builder parent, BuilderNodeKind kind) {
        this.parent = parent;
        this.kind = kind;
    }

    public Builder node() {
        return this;
    }

    @Override
    public String toString() {
        return this.kind.name();
    }
}
