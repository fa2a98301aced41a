package org.atoms.analogCompiler.ir.scalar;

import org.atoms.analogCompiler.compiler.errors.EvaluationError;
import org.atoms.util.IIndentStream;
import org.atoms.util.Utilities;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/** A named free variable. */
public final class Variable extends Scalar {
    public final String name;

    public Variable(String name) {
        Utilities.enforce(!name.isEmpty(), "Empty variable name");
        this.name = name;
    }

    @Override
    public BigDecimal eval(Map<String, BigDecimal> assignment) {
        BigDecimal value = assignment.get(this.name);
        if (value == null)
            throw new EvaluationError("Variable " + Utilities.singleQuote(this.name) + " is not assigned");
        return value;
    }

    @Override
    public void collectVariables(Set<String> names) {
        names.add(this.name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable variable)) return false;
        return this.name.equals(variable.name);
    }

    @Override
    public int hashCode() {
        return this.name.hashCode();
    }
}
