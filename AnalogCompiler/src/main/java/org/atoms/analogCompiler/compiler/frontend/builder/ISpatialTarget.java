package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.scalar.Scalar;

/** A builder node after which the addressed sites can be selected. */
public interface ISpatialTarget {
    Builder node();

    /** Address all sites with the same weight. */
    default UniformBuilder uniform() {
        return new UniformBuilder(this.node());
    }

    /** Address one site with weight 1. */
    default LocationBuilder location(int index) {
        return new LocationBuilder(this.node(), index, Scalar.literal(1));
    }

    /** Address one site with the given weight.
     * @param scale  A number, a variable name, or a Scalar. */
    default LocationBuilder location(int index, Object scale) {
        return new LocationBuilder(this.node(), index, Scalar.cast(scale));
    }

    /** Address all sites, with weights supplied at run time under 'name'. */
    default ScaleBuilder scale(String name) {
        return new ScaleBuilder(this.node(), name);
    }
}
