package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.util.IIndentStream;

/** Per-site weights supplied under a name when the program is run. */
public final class RunTimeVector extends SpatialModulation {
    public final String name;

    public RunTimeVector(String name) {
        this.name = name;
    }

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
        return builder.append("RunTimeVector(")
                .append(this.name)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunTimeVector that)) return false;
        return this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return this.name.hashCode();
    }
}
