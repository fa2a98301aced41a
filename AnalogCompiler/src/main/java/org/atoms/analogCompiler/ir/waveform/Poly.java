package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Polynomial in time; coefficient i multiplies t^i. */
public final class Poly extends Instruction {
    public final List<Scalar> coeffs;

    public Poly(List<Scalar> coeffs, Scalar duration) {
        super(duration);
        this.coeffs = List.copyOf(coeffs);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        BigDecimal result = BigDecimal.ZERO;
        BigDecimal power = BigDecimal.ONE;
        for (Scalar coeff: this.coeffs) {
            result = result.add(coeff.eval(assignment).multiply(power, Scalar.MATH), Scalar.MATH);
            power = power.multiply(time, Scalar.MATH);
        }
        return result;
    }

    @Override
    public void accept(WaveformVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Poly([")
                .joinI(", ", this.coeffs)
                .append("], ")
                .append(this.duration)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Poly that)) return false;
        return this.coeffs.equals(that.coeffs) && this.duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.coeffs, this.duration);
    }
}
