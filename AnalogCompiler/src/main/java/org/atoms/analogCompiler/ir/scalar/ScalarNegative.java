package org.atoms.analogCompiler.ir.scalar;

import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

public final class ScalarNegative extends Scalar {
    public final Scalar source;

    public ScalarNegative(Scalar source) {
        this.source = source;
    }

    @Override
    public BigDecimal eval(Map<String, BigDecimal> assignment) {
        return this.source.eval(assignment).negate();
    }

    @Override
    public void collectVariables(Set<String> names) {
        this.source.collectVariables(names);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("-").append(this.source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarNegative that)) return false;
        return this.source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return 31 * this.source.hashCode() + 7;
    }
}
