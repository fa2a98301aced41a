package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;
import org.atoms.util.Utilities;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Waveforms played one after the other. */
public final class Append extends Waveform {
    public final List<Waveform> waveforms;

    public Append(List<Waveform> waveforms) {
        Utilities.enforce(!waveforms.isEmpty(), "Empty append");
        this.waveforms = List.copyOf(waveforms);
    }

    static void flattenInto(Waveform waveform, List<Waveform> parts) {
        if (waveform instanceof Append append)
            parts.addAll(append.waveforms);
        else
            parts.add(waveform);
    }

    @Override
    public BigDecimal duration(Map<String, BigDecimal> assignment) {
        BigDecimal result = BigDecimal.ZERO;
        for (Waveform waveform: this.waveforms)
            result = result.add(waveform.duration(assignment), Scalar.MATH);
        return result;
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        BigDecimal offset = BigDecimal.ZERO;
        for (Waveform waveform: this.waveforms) {
            BigDecimal end = offset.add(waveform.duration(assignment), Scalar.MATH);
            // A boundary belongs to the segment which ends there
            if (time.compareTo(end) <= 0)
                return waveform.valueAt(time.subtract(offset, Scalar.MATH), assignment);
            offset = end;
        }
        return BigDecimal.ZERO;
    }

    @Override
    public void accept(WaveformVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Waveform waveform: this.waveforms)
            waveform.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Append([")
                .joinI(", ", this.waveforms)
                .append("])");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Append that)) return false;
        return this.waveforms.equals(that.waveforms);
    }

    @Override
    public int hashCode() {
        return this.waveforms.hashCode();
    }
}
