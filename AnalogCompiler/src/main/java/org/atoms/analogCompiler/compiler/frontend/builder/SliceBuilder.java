package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;

import javax.annotation.Nullable;

public final class SliceBuilder extends WaveformBuilder {
    @Nullable
    public final Scalar start;
    @Nullable
    public final Scalar stop;

    SliceBuilder(Builder parent, @Nullable Scalar start, @Nullable Scalar stop) {
        super(parent, BuilderNodeKind.SLICE);
        this.start = start;
        this.stop = stop;
    }
}
