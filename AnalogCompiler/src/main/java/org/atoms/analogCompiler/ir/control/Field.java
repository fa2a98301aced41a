package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.AnalogNode;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.IIndentStream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The drives of one physical quantity: a waveform for each spatial modulation. */
public final class Field extends AnalogNode implements IOuterNode {
    public final Map<SpatialModulation, Waveform> drives;

    public Field(Map<SpatialModulation, Waveform> drives) {
        this.drives = Collections.unmodifiableMap(new LinkedHashMap<>(drives));
    }

    public Field() {
        this(new LinkedHashMap<>());
    }

    public Field(SpatialModulation modulation, Waveform waveform) {
        this(Map.of(modulation, waveform));
    }

    /** Merge the drives of two fields.  Drives on the same spatial
     * modulation are summed. */
    public Field add(Field other) {
        Map<SpatialModulation, Waveform> result = new LinkedHashMap<>(this.drives);
        for (Map.Entry<SpatialModulation, Waveform> e: other.drives.entrySet())
            result.merge(e.getKey(), e.getValue(), Waveform::add);
        return new Field(result);
    }

    public boolean isEmpty() {
        return this.drives.isEmpty();
    }

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Map.Entry<SpatialModulation, Waveform> e: this.drives.entrySet()) {
            e.getKey().accept(visitor);
            visitor.visitWaveform(e.getValue());
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("Field({").increase();
        for (Map.Entry<SpatialModulation, Waveform> e: this.drives.entrySet()) {
            builder.append(e.getKey())
                    .append(": ")
                    .append(e.getValue())
                    .newline();
        }
        return builder.decrease().append("})");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Field that)) return false;
        return this.drives.equals(that.drives);
    }

    @Override
    public int hashCode() {
        return this.drives.hashCode();
    }
}
