package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;

import javax.annotation.Nullable;

/** A node of a waveform expression.  A new drive, field or coupling
 * can be started from here; the ones not named stay as they were. */
public abstract class WaveformBuilder extends Builder
        implements ICouplingTarget, IFieldTarget, ISpatialTarget, IWaveformTarget, IPragmaTarget {
    protected WaveformBuilder(Builder parent, BuilderNodeKind kind) {
        super(parent, kind);
    }

    /** Keep the part of the waveform between 'start' and 'stop'.
     * @param start  Null for the beginning of the waveform.
     * @param stop   Null for the end of the waveform. */
    public SliceBuilder slice(@Nullable Object start, @Nullable Object stop) {
        return new SliceBuilder(this,
                start == null ? null : Scalar.cast(start),
                stop == null ? null : Scalar.cast(stop));
    }

    /** Store the final value of the waveform in the variable 'name'. */
    public RecordBuilder record(String name) {
        return new RecordBuilder(this, name);
    }
}
