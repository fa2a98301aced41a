package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** A waveform convolved with a smoothing kernel of the given radius.
 * The convolution is computed numerically on a fixed grid. */
public final class Smooth extends WaveformWrapper {
    static final int GRID_POINTS = 101;

    public final Scalar radius;
    public final SmoothingKernel kernel;

    public Smooth(Waveform waveform, Scalar radius, SmoothingKernel kernel) {
        super(waveform);
        this.radius = radius;
        this.kernel = kernel;
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        return this.waveform.duration(assignment);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        double radius = this.radius.eval(assignment).doubleValue();
        if (radius <= 0)
            return this.waveform.valueAt(time, assignment);
        double t = time.doubleValue();
        double half = radius * this.kernel.support();
        double low = Math.max(0, t - half);
        double high = Math.min(duration.doubleValue(), t + half);
        double weights = 0;
        double sum = 0;
        for (int i = 0; i < GRID_POINTS; i++) {
            double s = low + (high - low) * i / (GRID_POINTS - 1);
            double weight = this.kernel.weight((s - t) / radius);
            if (weight == 0)
                continue;
            weights += weight;
            sum += weight * this.waveform.valueAt(BigDecimal.valueOf(s), assignment).doubleValue();
        }
        if (weights == 0)
            return this.waveform.valueAt(time, assignment);
        return BigDecimal.valueOf(sum / weights);
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
        return builder.append("Smooth(")
                .append(this.waveform)
                .append(", ")
                .append(this.radius)
                .append(", ")
                .append(this.kernel.name())
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Smooth that)) return false;
        return this.kernel == that.kernel &&
                this.radius.equals(that.radius) &&
                this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kernel, this.radius, this.waveform);
    }
}
