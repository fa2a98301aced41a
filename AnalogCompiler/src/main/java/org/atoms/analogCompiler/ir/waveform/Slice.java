package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.errors.EvaluationError;
import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** The part of a waveform between 'start' and 'stop', shifted to begin at 0.
 * A missing start means 0; a missing stop means the end of the waveform. */
public final class Slice extends WaveformWrapper {
    @Nullable
    public final Scalar start;
    @Nullable
    public final Scalar stop;

    public Slice(Waveform waveform, @Nullable Scalar start, @Nullable Scalar stop) {
        super(waveform);
        this.start = start;
        this.stop = stop;
    }

    BigDecimal startTime(Map<String, BigDecimal> assignment) {
        return this.start == null ? BigDecimal.ZERO : this.start.eval(assignment);
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        BigDecimal start = this.startTime(assignment);
        BigDecimal stop = this.stop == null ? this.waveform.duration(assignment) : this.stop.eval(assignment);
        BigDecimal result = stop.subtract(start, Scalar.MATH);
        if (result.signum() < 0)
            throw new EvaluationError("Slice " + this + " ends before it starts");
        return result;
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        return this.waveform.valueAt(time.add(this.startTime(assignment), Scalar.MATH), assignment);
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
        builder.append(this.waveform).append("[");
        if (this.start != null)
            builder.append(this.start);
        builder.append(":");
        if (this.stop != null)
            builder.append(this.stop);
        return builder.append("]");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slice that)) return false;
        return Objects.equals(this.start, that.start) &&
                Objects.equals(this.stop, that.stop) &&
                this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.start, this.stop, this.waveform);
    }
}
