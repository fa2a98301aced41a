package org.atoms.analogCompiler.compiler.frontend.builder;

/** Selects the sites driven by the waveform that follows. */
public abstract class SpatialBuilder extends Builder implements IWaveformTarget {
    protected SpatialBuilder(Builder parent, BuilderNodeKind kind) {
        super(parent, kind);
    }
}
