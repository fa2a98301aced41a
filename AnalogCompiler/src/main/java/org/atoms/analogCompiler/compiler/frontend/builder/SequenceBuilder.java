package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.control.Sequence;

/** A complete sequence supplied directly. */
public final class SequenceBuilder extends Builder implements IPragmaTarget {
    public final Sequence sequence;

    SequenceBuilder(Builder parent, Sequence sequence) {
        super(parent, BuilderNodeKind.SEQUENCE);
        this.sequence = sequence;
    }
}
