package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Interpolation;

import javax.annotation.Nullable;

public final class SampleBuilder extends WaveformBuilder {
    /** The sampled function. */
    public final FnBuilder function;
    public final Scalar dt;
    /** Null when the default for the field should be used. */
    @Nullable
    public final Interpolation interpolation;

    SampleBuilder(FnBuilder function, Scalar dt, @Nullable Interpolation interpolation) {
        super(function, BuilderNodeKind.SAMPLE);
        this.function = function;
        this.dt = dt;
        this.interpolation = interpolation;
    }
}
