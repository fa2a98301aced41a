package org.atoms.analogCompiler.ir.scalar;

import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/** A decimal constant.  The value is normalized, so 1 and 1.0 are the same literal. */
public final class Literal extends Scalar {
    public final BigDecimal value;

    public Literal(BigDecimal value) {
        this.value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    @Override
    public BigDecimal eval(Map<String, BigDecimal> assignment) {
        return this.value;
    }

    @Override
    public void collectVariables(Set<String> names) {}

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value.toPlainString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal literal)) return false;
        return this.value.equals(literal.value);
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }
}
