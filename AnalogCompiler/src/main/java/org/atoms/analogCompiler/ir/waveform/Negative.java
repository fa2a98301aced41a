package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;

public final class Negative extends WaveformWrapper {
    public Negative(Waveform waveform) {
        super(waveform);
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        return this.waveform.duration(assignment);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        return this.waveform.valueAt(time, assignment).negate();
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
        return builder.append("-").append(this.waveform);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Negative that)) return false;
        return this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return 17 * this.waveform.hashCode() + 1;
    }
}
