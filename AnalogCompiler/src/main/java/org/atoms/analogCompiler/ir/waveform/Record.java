package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** Makes the final value of a waveform available under a name.
 * The values of the waveform itself are unchanged. */
public final class Record extends WaveformWrapper {
    public final String name;

    public Record(Waveform waveform, String name) {
        super(waveform);
        this.name = name;
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        return this.waveform.duration(assignment);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        return this.waveform.valueAt(time, assignment);
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
        return builder.append("Record(")
                .append(this.waveform)
                .append(", ")
                .append(this.name)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record that)) return false;
        return this.name.equals(that.name) && this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.waveform);
    }
}
