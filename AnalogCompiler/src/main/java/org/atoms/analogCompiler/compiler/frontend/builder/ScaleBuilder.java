package org.atoms.analogCompiler.compiler.frontend.builder;

public final class ScaleBuilder extends SpatialBuilder {
    /** Name of the per-site weight vector. */
    public final String name;

    ScaleBuilder(Builder parent, String name) {
        super(parent, BuilderNodeKind.SCALE);
        this.name = name;
    }
}
