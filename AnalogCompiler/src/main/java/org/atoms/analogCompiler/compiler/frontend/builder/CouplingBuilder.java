package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.control.LevelCoupling;

public final class CouplingBuilder extends Builder implements IFieldTarget {
    public final LevelCoupling coupling;

    CouplingBuilder(Builder parent, LevelCoupling coupling) {
        super(parent, coupling == LevelCoupling.RYDBERG ? BuilderNodeKind.RYDBERG : BuilderNodeKind.HYPERFINE);
        this.coupling = coupling;
    }
}
