package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Waveform;

import javax.annotation.Nullable;

/** A waveform computed by a function.  It can be used as is, or sampled. */
public final class FnBuilder extends PrimitiveBuilder {
    FnBuilder(Builder parent, Waveform waveform) {
        super(parent, BuilderNodeKind.FN, waveform);
    }

    /** Sample every 'dt'; the interpolation depends on the field driven. */
    public SampleBuilder sample(Object dt) {
        return new SampleBuilder(this, Scalar.cast(dt), null);
    }

    public SampleBuilder sample(Object dt, @Nullable Interpolation interpolation) {
        return new SampleBuilder(this, Scalar.cast(dt), interpolation);
    }
}
