package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** A ramp from 'start' to 'stop' over 'duration'. */
public final class Linear extends Instruction {
    public final Scalar start;
    public final Scalar stop;

    public Linear(Scalar start, Scalar stop, Scalar duration) {
        super(duration);
        this.start = start;
        this.stop = stop;
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        BigDecimal start = this.start.eval(assignment);
        if (duration.signum() == 0)
            return start;
        BigDecimal stop = this.stop.eval(assignment);
        BigDecimal slope = stop.subtract(start, Scalar.MATH).divide(duration, Scalar.MATH);
        return start.add(slope.multiply(time, Scalar.MATH), Scalar.MATH);
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
        return builder.append("Linear(")
                .append(this.start)
                .append(", ")
                .append(this.stop)
                .append(", ")
                .append(this.duration)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Linear that)) return false;
        return this.start.equals(that.start) &&
                this.stop.equals(that.stop) &&
                this.duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.start, this.stop, this.duration);
    }
}
