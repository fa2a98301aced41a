package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.control.FieldName;

/** Groups the two fields of the Rabi frequency. */
public final class RabiBuilder extends Builder {
    RabiBuilder(Builder parent) {
        super(parent, BuilderNodeKind.RABI);
    }

    public FieldBuilder amplitude() {
        return new FieldBuilder(this, FieldName.RABI_AMPLITUDE);
    }

    public FieldBuilder phase() {
        return new FieldBuilder(this, FieldName.RABI_PHASE);
    }
}
