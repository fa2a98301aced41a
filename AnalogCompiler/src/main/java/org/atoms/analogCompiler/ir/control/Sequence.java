package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.AnalogNode;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The complete time program: a pulse for each level coupling. */
public final class Sequence extends AnalogNode implements IOuterNode {
    public final Map<LevelCoupling, Pulse> pulses;

    public Sequence(Map<LevelCoupling, Pulse> pulses) {
        this.pulses = Collections.unmodifiableMap(new LinkedHashMap<>(pulses));
    }

    public Sequence() {
        this(new LinkedHashMap<>());
    }

    @Nullable
    public Pulse getPulse(LevelCoupling coupling) {
        return this.pulses.get(coupling);
    }

    /** A sequence identical to this one, except that 'coupling' maps to 'pulse'. */
    public Sequence with(LevelCoupling coupling, Pulse pulse) {
        Map<LevelCoupling, Pulse> result = new LinkedHashMap<>(this.pulses);
        result.put(coupling, pulse);
        return new Sequence(result);
    }

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Pulse pulse: this.pulses.values())
            pulse.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("Sequence({").increase();
        for (Map.Entry<LevelCoupling, Pulse> e: this.pulses.entrySet()) {
            builder.append(e.getKey().toString())
                    .append(": ")
                    .append(e.getValue())
                    .newline();
        }
        return builder.decrease().append("})");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequence that)) return false;
        return this.pulses.equals(that.pulses);
    }

    @Override
    public int hashCode() {
        return this.pulses.hashCode();
    }
}
