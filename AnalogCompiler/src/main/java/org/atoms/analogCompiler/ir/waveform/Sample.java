package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.errors.EvaluationError;
import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A waveform discretized every 'dt' and reconstructed by interpolation. */
public final class Sample extends WaveformWrapper {
    public final Interpolation interpolation;
    public final Scalar dt;

    public Sample(Waveform waveform, Interpolation interpolation, Scalar dt) {
        super(waveform);
        this.interpolation = interpolation;
        this.dt = dt;
    }

    BigDecimal step(Map<String, BigDecimal> assignment) {
        BigDecimal dt = this.dt.eval(assignment);
        if (dt.signum() <= 0)
            throw new EvaluationError("Sampling step must be positive, got " + dt.toPlainString());
        return dt;
    }

    /** The sample clocks: 0, dt, 2*dt, ... while before the duration,
     * followed by the duration itself. */
    public List<BigDecimal> sampleTimes(Map<String, BigDecimal> assignment) {
        BigDecimal duration = this.waveform.duration(assignment);
        BigDecimal dt = this.step(assignment);
        List<BigDecimal> result = new ArrayList<>();
        BigDecimal clock = BigDecimal.ZERO;
        while (clock.compareTo(duration) < 0) {
            result.add(clock);
            clock = clock.add(dt, Scalar.MATH);
        }
        result.add(duration);
        return result;
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        return this.waveform.duration(assignment);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        BigDecimal dt = this.step(assignment);
        // The clocks around 'time' are k*dt and the next clock, capped at the duration
        BigDecimal index = time.divideToIntegralValue(dt, Scalar.MATH);
        BigDecimal previousTime = index.multiply(dt, Scalar.MATH);
        BigDecimal previous = this.waveform.valueAt(previousTime, assignment);
        if (previousTime.compareTo(time) == 0)
            return previous;
        BigDecimal nextTime = previousTime.add(dt, Scalar.MATH).min(duration);
        if (nextTime.compareTo(time) == 0)
            return this.waveform.valueAt(nextTime, assignment);
        if (this.interpolation == Interpolation.CONSTANT)
            return previous;
        BigDecimal next = this.waveform.valueAt(nextTime, assignment);
        BigDecimal slope = next.subtract(previous, Scalar.MATH)
                .divide(nextTime.subtract(previousTime, Scalar.MATH), Scalar.MATH);
        return previous.add(slope.multiply(time.subtract(previousTime, Scalar.MATH), Scalar.MATH), Scalar.MATH);
    }

    @Override
    public void accept(WaveformVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.waveform.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Sample(")
                .append(this.waveform)
                .append(", ")
                .append(this.interpolation.name())
                .append(", ")
                .append(this.dt)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sample that)) return false;
        return this.interpolation == that.interpolation &&
                this.dt.equals(that.dt) &&
                this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.interpolation, this.dt, this.waveform);
    }
}
