package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Explicit sites, each with its own (possibly symbolic) weight.
 * Sites are kept sorted by index. */
public final class ScaledLocations extends SpatialModulation {
    public final Map<Integer, Scalar> weights;

    public ScaledLocations(Map<Integer, Scalar> weights) {
        this.weights = Collections.unmodifiableMap(new TreeMap<>(weights));
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
        builder.append("ScaledLocations({");
        boolean first = true;
        for (Map.Entry<Integer, Scalar> e: this.weights.entrySet()) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(e.getKey())
                    .append(": ")
                    .append(e.getValue());
        }
        return builder.append("})");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScaledLocations that)) return false;
        return this.weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return this.weights.hashCode();
    }
}
