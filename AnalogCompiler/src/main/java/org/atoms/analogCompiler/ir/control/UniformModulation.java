package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.util.IIndentStream;

/** All sites, with weight 1. */
public final class UniformModulation extends SpatialModulation {
    public static final UniformModulation INSTANCE = new UniformModulation();

    private UniformModulation() {}

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Uniform");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UniformModulation;
    }

    @Override
    public int hashCode() {
        return UniformModulation.class.hashCode();
    }
}
