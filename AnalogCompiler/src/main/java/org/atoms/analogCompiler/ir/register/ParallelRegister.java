package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.util.Objects;

/** An arrangement replicated across the device, copies 'clusterSpacing' apart. */
public final class ParallelRegister extends Register {
    public final AtomArrangement arrangement;
    public final Scalar clusterSpacing;

    public ParallelRegister(AtomArrangement arrangement, Scalar clusterSpacing) {
        this.arrangement = arrangement;
        this.clusterSpacing = clusterSpacing;
    }

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.arrangement.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("ParallelRegister(")
                .append(this.arrangement)
                .append(", ")
                .append(this.clusterSpacing)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParallelRegister that)) return false;
        return this.arrangement.equals(that.arrangement) &&
                this.clusterSpacing.equals(that.clusterSpacing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.arrangement, this.clusterSpacing);
    }
}
