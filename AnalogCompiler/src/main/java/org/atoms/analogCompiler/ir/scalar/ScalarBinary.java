package org.atoms.analogCompiler.ir.scalar;

import org.atoms.analogCompiler.compiler.errors.EvaluationError;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Binary arithmetic on scalars. */
public final class ScalarBinary extends Scalar {
    public final ScalarOpcode opcode;
    public final Scalar left;
    public final Scalar right;

    public ScalarBinary(ScalarOpcode opcode, Scalar left, Scalar right) {
        this.opcode = opcode;
        this.left = left;
        this.right = right;
    }

    @Override
    public BigDecimal eval(Map<String, BigDecimal> assignment) {
        BigDecimal l = this.left.eval(assignment);
        BigDecimal r = this.right.eval(assignment);
        switch (this.opcode) {
            case ADD:
                return l.add(r, MATH);
            case SUB:
                return l.subtract(r, MATH);
            case MUL:
                return l.multiply(r, MATH);
            case DIV:
                if (r.signum() == 0)
                    throw new EvaluationError("Division by zero in " + this);
                return l.divide(r, MATH);
            case MIN:
                return l.min(r);
            case MAX:
                return l.max(r);
            default:
                throw new EvaluationError("Unexpected opcode " + this.opcode);
        }
    }

    @Override
    public void collectVariables(Set<String> names) {
        this.left.collectVariables(names);
        this.right.collectVariables(names);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.opcode.isFunction())
            return builder.append(this.opcode.toString())
                    .append("(")
                    .append(this.left)
                    .append(", ")
                    .append(this.right)
                    .append(")");
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.opcode.toString())
                .append(" ")
                .append(this.right)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarBinary that)) return false;
        return this.opcode == that.opcode &&
                this.left.equals(that.left) &&
                this.right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.opcode, this.left, this.right);
    }
}
