package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.waveform.Waveform;

/** A waveform shape, already lowered. */
public class PrimitiveBuilder extends WaveformBuilder {
    public final Waveform waveform;

    PrimitiveBuilder(Builder parent, BuilderNodeKind kind, Waveform waveform) {
        super(parent, kind);
        this.waveform = waveform;
    }
}
