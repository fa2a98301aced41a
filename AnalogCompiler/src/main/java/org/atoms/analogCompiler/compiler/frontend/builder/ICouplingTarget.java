package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.control.LevelCoupling;

/** A builder node after which a level coupling can be selected. */
public interface ICouplingTarget {
    Builder node();

    default CouplingBuilder rydberg() {
        return new CouplingBuilder(this.node(), LevelCoupling.RYDBERG);
    }

    default CouplingBuilder hyperfine() {
        return new CouplingBuilder(this.node(), LevelCoupling.HYPERFINE);
    }
}
