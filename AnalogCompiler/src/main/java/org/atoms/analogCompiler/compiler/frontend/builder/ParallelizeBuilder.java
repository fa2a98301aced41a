package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;

public final class ParallelizeBuilder extends PragmaBuilder {
    public final Scalar clusterSpacing;

    ParallelizeBuilder(Builder parent, Scalar clusterSpacing) {
        super(parent, BuilderNodeKind.PARALLELIZE);
        this.clusterSpacing = clusterSpacing;
    }
}
