package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Append;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.analogCompiler.ir.waveform.WaveformFunction;
import org.atoms.util.Linq;

import java.util.ArrayList;
import java.util.List;

/** A builder node after which waveform primitives can be added.
 * Arguments can be numbers, variable names, or Scalars.
 * Consecutive primitives are played one after the other. */
public interface IWaveformTarget {
    Builder node();

    default PrimitiveBuilder linear(Object start, Object stop, Object duration) {
        Waveform waveform = new Linear(Scalar.cast(start), Scalar.cast(stop), Scalar.cast(duration));
        return new PrimitiveBuilder(this.node(), BuilderNodeKind.LINEAR, waveform);
    }

    default PrimitiveBuilder constant(Object value, Object duration) {
        Waveform waveform = new Constant(Scalar.cast(value), Scalar.cast(duration));
        return new PrimitiveBuilder(this.node(), BuilderNodeKind.CONSTANT, waveform);
    }

    default PrimitiveBuilder poly(List<?> coefficients, Object duration) {
        Waveform waveform = new Poly(Linq.map(coefficients, Scalar::cast), Scalar.cast(duration));
        return new PrimitiveBuilder(this.node(), BuilderNodeKind.POLY, waveform);
    }

    /** Linear ramps through 'values'; there is one duration less than there are values. */
    default PrimitiveBuilder piecewiseLinear(List<?> durations, List<?> values) {
        if (durations.isEmpty() || durations.size() + 1 != values.size())
            throw new CompilationError("piecewiseLinear needs n durations and n+1 values, got " +
                    durations.size() + " durations and " + values.size() + " values", this.node());
        List<Waveform> parts = new ArrayList<>();
        for (int i = 0; i < durations.size(); i++)
            parts.add(new Linear(Scalar.cast(values.get(i)), Scalar.cast(values.get(i + 1)),
                    Scalar.cast(durations.get(i))));
        return new PrimitiveBuilder(this.node(), BuilderNodeKind.PIECEWISE_LINEAR, new Append(parts));
    }

    /** Steps holding each value for the corresponding duration. */
    default PrimitiveBuilder piecewiseConstant(List<?> durations, List<?> values) {
        if (durations.isEmpty() || durations.size() != values.size())
            throw new CompilationError("piecewiseConstant needs as many durations as values, got " +
                    durations.size() + " durations and " + values.size() + " values", this.node());
        List<Waveform> parts = new ArrayList<>();
        for (int i = 0; i < durations.size(); i++)
            parts.add(new Constant(Scalar.cast(values.get(i)), Scalar.cast(durations.get(i))));
        return new PrimitiveBuilder(this.node(), BuilderNodeKind.PIECEWISE_CONSTANT, new Append(parts));
    }

    /** A waveform computed by 'function'.
     * @param parameters  Names of the variables whose values are passed to the function. */
    default FnBuilder fn(String name, WaveformFunction function, List<String> parameters, Object duration) {
        Waveform waveform = new OpaqueFn(name, function, parameters, Scalar.cast(duration));
        return new FnBuilder(this.node(), waveform);
    }
}
