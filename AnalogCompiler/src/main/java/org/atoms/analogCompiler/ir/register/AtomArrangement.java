package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;

import java.util.List;

/** A concrete set of sites.  Site indexes are positions in {@link #enumerate()}. */
public abstract class AtomArrangement extends Register {
    public abstract List<LocationInfo> enumerate();

    public int size() {
        return this.enumerate().size();
    }

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }
}
