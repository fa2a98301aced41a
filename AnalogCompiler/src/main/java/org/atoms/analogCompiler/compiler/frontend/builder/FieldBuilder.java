package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.control.FieldName;

public final class FieldBuilder extends Builder implements ISpatialTarget {
    public final FieldName name;

    FieldBuilder(Builder parent, FieldName name) {
        super(parent, kind(name));
        this.name = name;
    }

    static BuilderNodeKind kind(FieldName name) {
        return switch (name) {
            case DETUNING -> BuilderNodeKind.DETUNING;
            case RABI_AMPLITUDE -> BuilderNodeKind.RABI_AMPLITUDE;
            case RABI_PHASE -> BuilderNodeKind.RABI_PHASE;
        };
    }
}
