package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;
import org.atoms.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/** A waveform annotated with how it should be padded when aligned with
 * longer waveforms.  The padding value is either a scalar or the value at
 * one of the ends.  Exactly one of 'value' and 'valueAlignment' is set. */
public final class AlignedWaveform extends WaveformWrapper {
    public final Alignment alignment;
    @Nullable
    public final Scalar value;
    @Nullable
    public final ValueAlignment valueAlignment;

    AlignedWaveform(Waveform waveform, Alignment alignment,
                    @Nullable Scalar value, @Nullable ValueAlignment valueAlignment) {
        super(waveform);
        Utilities.enforce((value == null) != (valueAlignment == null),
                "Aligned waveform needs exactly one padding value");
        this.alignment = alignment;
        this.value = value;
        this.valueAlignment = valueAlignment;
    }

    public AlignedWaveform(Waveform waveform, Alignment alignment, Scalar value) {
        this(waveform, alignment, value, null);
    }

    public AlignedWaveform(Waveform waveform, Alignment alignment, ValueAlignment valueAlignment) {
        this(waveform, alignment, null, valueAlignment);
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
        builder.append("Aligned(")
                .append(this.waveform)
                .append(", ")
                .append(this.alignment.name())
                .append(", ");
        if (this.value != null)
            builder.append(this.value);
        else
            builder.append(Objects.requireNonNull(this.valueAlignment).name());
        return builder.append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlignedWaveform that)) return false;
        return this.alignment == that.alignment &&
                Objects.equals(this.value, that.value) &&
                this.valueAlignment == that.valueAlignment &&
                this.waveform.equals(that.waveform);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.alignment, this.value, this.valueAlignment, this.waveform);
    }
}
