package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;

/** One addressed site.  Consecutive locations address a set of sites. */
public final class LocationBuilder extends SpatialBuilder {
    public final int index;
    public final Scalar weight;

    LocationBuilder(Builder parent, int index, Scalar weight) {
        super(parent, BuilderNodeKind.LOCATION);
        this.index = index;
        this.weight = weight;
    }

    public LocationBuilder location(int index) {
        return new LocationBuilder(this, index, Scalar.literal(1));
    }

    public LocationBuilder location(int index, Object scale) {
        return new LocationBuilder(this, index, Scalar.cast(scale));
    }
}
