package org.atoms.analogCompiler.compiler.frontend.builder;

public final class RecordBuilder extends WaveformBuilder {
    public final String name;

    RecordBuilder(Builder parent, String name) {
        super(parent, BuilderNodeKind.RECORD);
        this.name = name;
    }
}
