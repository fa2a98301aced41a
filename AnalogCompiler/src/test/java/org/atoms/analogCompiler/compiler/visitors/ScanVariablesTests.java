package org.atoms.analogCompiler.compiler.visitors;

import org.atoms.analogCompiler.compiler.frontend.Parser;
import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.frontend.builder.RegisterBuilder;
import org.atoms.analogCompiler.compiler.visitors.inner.CollectVariables;
import org.atoms.analogCompiler.compiler.visitors.outer.ScanVariables;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Set;

/** Unit tests for the analyses collecting free variables */
public class ScanVariablesTests {
    @Test
    public void testWaveformVariables() {
        Waveform waveform = new Linear(Scalar.var("a"), Scalar.literal(1), Scalar.var("t"))
                .append(new Constant(Scalar.var("c"), Scalar.var("t")))
                .sample(Scalar.var("dt"), Interpolation.LINEAR)
                .record("r");
        Assert.assertEquals(List.of("a", "t", "c", "dt"), List.copyOf(CollectVariables.of(waveform)));

        CollectVariables visitor = new CollectVariables();
        visitor.apply(waveform);
        Assert.assertEquals(Set.of("r"), visitor.recorded);
    }

    @Test
    public void testCircuitVariables() {
        Builder builder = RegisterBuilder.chain(2, "d")
                .rydberg().detuning()
                .uniform().linear("a", "b", "t").record("r")
                .scale("mask").constant("c", 1)
                .rabi().amplitude().location(0, "w").fn("f", (time, arguments) -> time, List.of("p"), "t")
                .parallelize("s");
        ScanVariables.Result result = new ScanVariables().scan(new Parser().parse(builder).circuit);
        Assert.assertEquals(Set.of("d", "s", "a", "b", "t", "c", "w", "p"), result.scalarVariables());
        Assert.assertEquals(Set.of("mask"), result.vectorVariables());
        Assert.assertEquals(Set.of("r"), result.recorded());
    }

    @Test
    public void testNoVariables() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().constant(1, 1);
        ScanVariables.Result result = new ScanVariables().scan(new Parser().parseCircuit(builder));
        Assert.assertTrue(result.scalarVariables().isEmpty());
        Assert.assertTrue(result.vectorVariables().isEmpty());
        Assert.assertTrue(result.recorded().isEmpty());
    }
}
