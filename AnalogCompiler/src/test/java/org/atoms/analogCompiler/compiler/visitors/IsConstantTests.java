package org.atoms.analogCompiler.compiler.visitors;

import org.atoms.analogCompiler.compiler.visitors.inner.IsConstantWaveform;
import org.atoms.analogCompiler.compiler.visitors.outer.IsConstantAnalogCircuit;
import org.atoms.analogCompiler.ir.AnalogCircuit;
import org.atoms.analogCompiler.ir.control.Field;
import org.atoms.analogCompiler.ir.control.FieldName;
import org.atoms.analogCompiler.ir.control.LevelCoupling;
import org.atoms.analogCompiler.ir.control.Pulse;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.control.UniformModulation;
import org.atoms.analogCompiler.ir.register.Chain;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Unit tests for constant folding of waveforms and circuits */
public class IsConstantTests {
    static Linear linear(long start, long stop, long duration) {
        return new Linear(Scalar.literal(start), Scalar.literal(stop), Scalar.literal(duration));
    }

    static Constant constant(long value, long duration) {
        return new Constant(Scalar.literal(value), Scalar.literal(duration));
    }

    static IsConstantWaveform.Result check(Waveform waveform) {
        return new IsConstantWaveform(Map.of()).emit(waveform);
    }

    static void assertConstant(Waveform waveform, Constant expected) {
        IsConstantWaveform.Result result = check(waveform);
        Assert.assertTrue(waveform.toString(), result.isConstant());
        Assert.assertEquals(expected, result.constantWaveform());
    }

    static void assertNotConstant(Waveform waveform) {
        Assert.assertFalse(waveform.toString(), check(waveform).isConstant());
    }

    @Test
    public void testFlatLinear() {
        assertConstant(linear(1, 1, 2), constant(1, 2));
        assertNotConstant(linear(0, 1, 1));
    }

    @Test
    public void testLinearWithVariables() {
        Waveform ramp = new Linear(Scalar.var("a"), Scalar.var("b"), Scalar.literal(1));
        IsConstantWaveform.Result flat = new IsConstantWaveform(
                Map.of("a", BigDecimal.TEN, "b", BigDecimal.TEN)).emit(ramp);
        Assert.assertTrue(flat.isConstant());
        Assert.assertEquals(new Constant(Scalar.literal(10), Scalar.literal(1)), flat.constantWaveform());
        IsConstantWaveform.Result slope = new IsConstantWaveform(
                Map.of("a", BigDecimal.ONE, "b", BigDecimal.TEN)).emit(ramp);
        Assert.assertFalse(slope.isConstant());
        // the representative holds the final value
        Assert.assertEquals(new Constant(Scalar.literal(10), Scalar.literal(1)), slope.constantWaveform());
    }

    @Test
    public void testPoly() {
        assertConstant(new Poly(List.of(Scalar.literal(3), Scalar.literal(0), Scalar.literal(0)), Scalar.literal(2)),
                constant(3, 2));
        assertNotConstant(new Poly(List.of(Scalar.literal(3), Scalar.literal(1)), Scalar.literal(2)));
    }

    @Test
    public void testOpaqueFunction() {
        assertNotConstant(new OpaqueFn("f", (time, arguments) -> BigDecimal.ONE, List.of(), Scalar.literal(1)));
    }

    @Test
    public void testAddDurationMismatch() {
        Waveform add = constant(1, 1).add(constant(1, 2));
        assertNotConstant(add);
        // the shorter operand contributes nothing at the end
        Assert.assertEquals(constant(1, 2), check(add).constantWaveform());
        assertConstant(constant(1, 2).add(linear(2, 2, 2)), constant(3, 2));
        assertNotConstant(constant(1, 2).add(linear(0, 2, 2)));
    }

    @Test
    public void testAppend() {
        assertConstant(constant(1, 1).append(linear(1, 1, 2)), constant(1, 3));
        assertNotConstant(constant(1, 1).append(constant(2, 1)));
        assertNotConstant(constant(1, 1).append(linear(1, 2, 1)));
    }

    @Test
    public void testWrappers() {
        assertConstant(constant(2, 1).negate(), constant(-2, 1));
        assertConstant(constant(2, 1).scale(Scalar.literal(3)), constant(6, 1));
        assertConstant(constant(2, 1).record("r"), constant(2, 1));
        assertConstant(constant(2, 4).slice(Scalar.literal(1), Scalar.literal(3)), constant(2, 2));
        assertNotConstant(linear(0, 1, 1).scale(Scalar.literal(2)));
        assertConstant(constant(5, 2).sample(Scalar.literal(1), Interpolation.LINEAR), constant(5, 2));
    }

    @Test
    public void testVisitorIsReusable() {
        IsConstantWaveform visitor = new IsConstantWaveform(Map.of());
        Assert.assertFalse(visitor.emit(linear(0, 1, 1)).isConstant());
        Assert.assertTrue(visitor.emit(constant(1, 1)).isConstant());
    }

    static AnalogCircuit circuit(Waveform detuning, Waveform amplitude) {
        Pulse pulse = new Pulse()
                .with(FieldName.DETUNING, new Field(UniformModulation.INSTANCE, detuning))
                .with(FieldName.RABI_AMPLITUDE, new Field(UniformModulation.INSTANCE, amplitude));
        return new AnalogCircuit(new Chain(2, Scalar.literal(5)), new Sequence().with(LevelCoupling.RYDBERG, pulse));
    }

    @Test
    public void testConstantCircuit() {
        AnalogCircuit circuit = circuit(constant(1, 2), linear(3, 3, 2));
        IsConstantAnalogCircuit.Result result = new IsConstantAnalogCircuit().emit(circuit);
        Assert.assertTrue(result.isConstant());
        Assert.assertEquals(circuit(constant(1, 2), constant(3, 2)), result.effectiveCircuit());
        Assert.assertSame(circuit.register, result.effectiveCircuit().register);
    }

    @Test
    public void testDurationsMustAgree() {
        AnalogCircuit circuit = circuit(constant(1, 2), constant(3, 3));
        Assert.assertFalse(new IsConstantAnalogCircuit().emit(circuit).isConstant());
    }

    @Test
    public void testNonConstantCircuit() {
        AnalogCircuit circuit = circuit(constant(1, 2), linear(0, 3, 2));
        IsConstantAnalogCircuit.Result result = new IsConstantAnalogCircuit().emit(circuit);
        Assert.assertFalse(result.isConstant());
        Assert.assertEquals(circuit(constant(1, 2), constant(3, 2)), result.effectiveCircuit());
    }

    @Test
    public void testCircuitWithAssignment() {
        AnalogCircuit circuit = circuit(new Constant(Scalar.var("d"), Scalar.var("t")),
                new Linear(Scalar.var("a"), Scalar.var("a"), Scalar.var("t")));
        Map<String, BigDecimal> assignment = Map.of(
                "d", BigDecimal.ONE, "a", new BigDecimal(2), "t", new BigDecimal(4));
        IsConstantAnalogCircuit.Result result = new IsConstantAnalogCircuit(assignment).emit(circuit);
        Assert.assertTrue(result.isConstant());
        Assert.assertEquals(circuit(constant(1, 4), constant(2, 4)), result.effectiveCircuit());
    }
}
