package org.atoms.analogCompiler.ir.waveform;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.scalar.Variable;
import org.atoms.util.IIndentStream;
import org.atoms.util.Linq;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A waveform computed by an externally supplied function.
 * The function receives the values of the named parameters. */
public final class OpaqueFn extends Instruction {
    public final String name;
    public final WaveformFunction function;
    public final List<String> parameters;

    public OpaqueFn(String name, WaveformFunction function, List<String> parameters, Scalar duration) {
        super(duration);
        this.name = name;
        this.function = function;
        this.parameters = List.copyOf(parameters);
    }

    @Override
    protected BigDecimal evalAt(BigDecimal time, BigDecimal duration, Map<String, BigDecimal> assignment) {
        List<BigDecimal> arguments = Linq.map(this.parameters, p -> new Variable(p).eval(assignment));
        return this.function.apply(time, arguments);
    }

    @Override
    public void accept(WaveformVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("OpaqueFn(")
                .append(this.name)
                .append("(")
                .joinS(", ", this.parameters)
                .append("), ")
                .append(this.duration)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OpaqueFn that)) return false;
        return this.name.equals(that.name) &&
                this.function.equals(that.function) &&
                this.parameters.equals(that.parameters) &&
                this.duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.parameters, this.duration);
    }
}
