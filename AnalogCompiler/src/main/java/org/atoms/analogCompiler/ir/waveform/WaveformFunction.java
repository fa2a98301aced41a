package org.atoms.analogCompiler.ir.waveform;

import java.math.BigDecimal;
import java.util.List;

/** A user-supplied function of time, opaque to the analyses. */
@FunctionalInterface
public interface WaveformFunction {
    /** @param time       Time at which the function is evaluated.
     *  @param arguments  Values of the function parameters, in declaration order. */
    BigDecimal apply(BigDecimal time, List<BigDecimal> arguments);
}
