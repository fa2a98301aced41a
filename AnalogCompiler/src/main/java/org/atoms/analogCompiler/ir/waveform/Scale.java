package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** A waveform multiplied by a scalar factor. */
public final class Scale extends WaveformWrapper {
    public final Scalar factor;

    public Scale(Waveform waveform, Scalar factor) {
        super(waveform);
        this.factor = factor;
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        return this.waveform.duration(assignment);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        return this.factor.eval(assignment)
                .multiply(this.waveform.valueAt(time, assignment), Scalar.MATH);
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
        return builder.append(this.factor)
                .append(" * ")
                .append(this.waveform);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scale that)) return false;
        return this.factor.equals(that.factor) && this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.factor, this.waveform);
    }
}
