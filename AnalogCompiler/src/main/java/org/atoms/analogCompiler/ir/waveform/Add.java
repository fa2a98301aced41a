package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** Pointwise sum of two waveforms.  If the durations differ the result
 * lasts as long as the longer operand, the shorter one contributing 0
 * after it ends. */
public final class Add extends Waveform {
    public final Waveform left;
    public final Waveform right;

    public Add(Waveform left, Waveform right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        return this.left.duration(assignment).max(this.right.duration(assignment));
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        return this.left.valueAt(time, assignment)
                .add(this.right.valueAt(time, assignment), Scalar.MATH);
    }

    @Override
    public void accept(WaveformVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" + ")
                .append(this.right)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Add that)) return false;
        return this.left.equals(that.left) && this.right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.left, this.right);
    }
}
