package org.atoms.analogCompiler.compiler.frontend.builder;

public final class UniformBuilder extends SpatialBuilder {
    UniformBuilder(Builder parent) {
        super(parent, BuilderNodeKind.UNIFORM);
    }
}
