package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

public final class Constant extends Instruction {
    public final Scalar value;

    public Constant(Scalar value, Scalar duration) {
        super(duration);
        this.value = value;
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        return this.value.eval(assignment);
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
        return builder.append("Constant(")
                .append(this.value)
                .append(", ")
                .append(this.duration)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant that)) return false;
        return this.value.equals(that.value) && this.duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.value, this.duration);
    }
}
