package org.atoms.analogCompiler.ir;

import org.atoms.analogCompiler.compiler.errors.EvaluationError;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Alignment;
import org.atoms.analogCompiler.ir.waveform.Append;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Sample;
import org.atoms.analogCompiler.ir.waveform.SmoothingKernel;
import org.atoms.analogCompiler.ir.waveform.ValueAlignment;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Unit tests for waveform evaluation */
public class WaveformTests {
    static Scalar lit(String value) {
        return Scalar.cast(new BigDecimal(value));
    }

    static Constant constant(long value, long duration) {
        return new Constant(Scalar.literal(value), Scalar.literal(duration));
    }

    static void assertValue(String expected, Waveform waveform, String time) {
        BigDecimal actual = waveform.valueAt(new BigDecimal(time));
        Assert.assertEquals(waveform + " at " + time + " is " + actual,
                0, new BigDecimal(expected).compareTo(actual));
    }

    @Test
    public void testLinear() {
        Waveform linear = new Linear(Scalar.literal(0), Scalar.literal(2), Scalar.literal(1));
        assertValue("0", linear, "0");
        assertValue("1", linear, "0.5");
        assertValue("2", linear, "1");
        // outside of [0, duration] every waveform is 0
        assertValue("0", linear, "1.5");
        assertValue("0", linear, "-1");
    }

    @Test
    public void testPoly() {
        Waveform poly = new Poly(List.of(Scalar.literal(1), Scalar.literal(0), Scalar.literal(2)), Scalar.literal(3));
        assertValue("1", poly, "0");
        assertValue("9", poly, "2");
    }

    @Test
    public void testAppendBoundary() {
        Waveform append = constant(1, 1).append(constant(2, 1));
        Assert.assertEquals(0, new BigDecimal(2).compareTo(append.duration()));
        assertValue("1", append, "0");
        assertValue("1", append, "1");
        assertValue("2", append, "1.5");
        assertValue("2", append, "2");
    }

    @Test
    public void testAppendFlattens() {
        Append append = constant(1, 1).append(constant(2, 1)).append(constant(3, 1));
        Assert.assertEquals(3, append.waveforms.size());
        Append nested = constant(0, 1).append(append);
        Assert.assertEquals(4, nested.waveforms.size());
    }

    @Test
    public void testAddPadding() {
        Waveform add = constant(1, 1).add(constant(2, 2));
        Assert.assertEquals(0, new BigDecimal(2).compareTo(add.duration()));
        assertValue("3", add, "0.5");
        assertValue("2", add, "1.5");
    }

    @Test
    public void testWrappers() {
        Waveform linear = new Linear(Scalar.literal(0), Scalar.literal(4), Scalar.literal(4));
        assertValue("-1", linear.negate(), "1");
        assertValue("3", linear.scale(Scalar.literal(3)), "1");
        assertValue("2", linear.record("r"), "2");
    }

    @Test
    public void testSlice() {
        Waveform linear = new Linear(Scalar.literal(0), Scalar.literal(4), Scalar.literal(4));
        Waveform slice = linear.slice(Scalar.literal(1), Scalar.literal(3));
        Assert.assertEquals(0, new BigDecimal(2).compareTo(slice.duration()));
        assertValue("1", slice, "0");
        assertValue("3", slice, "2");

        Waveform tail = linear.slice(Scalar.literal(3), null);
        Assert.assertEquals(0, BigDecimal.ONE.compareTo(tail.duration()));
        Waveform head = linear.slice(null, Scalar.literal(1));
        assertValue("1", head, "1");

        Waveform reversed = linear.slice(Scalar.literal(3), Scalar.literal(1));
        Assert.assertThrows(EvaluationError.class, reversed::duration);
    }

    @Test
    public void testSampleTimes() {
        Waveform linear = new Linear(Scalar.literal(0), Scalar.literal(1), Scalar.literal(1));
        Sample sample = linear.sample(lit("0.4"), Interpolation.LINEAR);
        List<BigDecimal> times = sample.sampleTimes(Map.of());
        Assert.assertEquals(4, times.size());
        Assert.assertEquals(0, new BigDecimal("0.8").compareTo(times.get(2)));
        Assert.assertEquals(0, BigDecimal.ONE.compareTo(times.get(3)));

        Sample bad = linear.sample(Scalar.literal(0), Interpolation.LINEAR);
        Assert.assertThrows(EvaluationError.class, () -> bad.sampleTimes(Map.of()));
    }

    @Test
    public void testSampleInterpolation() {
        // t^2 on [0, 1]
        Waveform square = new Poly(List.of(Scalar.literal(0), Scalar.literal(0), Scalar.literal(1)), Scalar.literal(1));
        Waveform linear = square.sample(lit("0.5"), Interpolation.LINEAR);
        assertValue("0.125", linear, "0.25");
        assertValue("0.25", linear, "0.5");
        assertValue("0.625", linear, "0.75");

        Waveform constant = square.sample(lit("0.5"), Interpolation.CONSTANT);
        assertValue("0", constant, "0.25");
        assertValue("0.25", constant, "0.75");
        assertValue("1", constant, "1");
    }

    @Test
    public void testSampleLastInterval() {
        // the last interval is shorter than dt
        Waveform linear = new Linear(Scalar.literal(0), Scalar.literal(1), Scalar.literal(1));
        assertValue("0.9", linear.sample(lit("0.4"), Interpolation.LINEAR), "0.9");
        assertValue("0.8", linear.sample(lit("0.4"), Interpolation.CONSTANT), "0.9");
        assertValue("1", linear.sample(lit("0.4"), Interpolation.CONSTANT), "1");
    }

    @Test
    public void testSampleManyClocks() {
        Waveform ramp = new Linear(Scalar.literal(0), Scalar.literal(1000000), Scalar.literal(1000000));
        Waveform sample = ramp.sample(lit("0.001"), Interpolation.LINEAR);
        assertValue("500000.0005", sample, "500000.0005");
        assertValue("999999.999", sample.sample(lit("0.001"), Interpolation.CONSTANT), "999999.9995");
        Sample bad = ramp.sample(Scalar.literal(0), Interpolation.LINEAR);
        Assert.assertThrows(EvaluationError.class, () -> bad.valueAt(BigDecimal.ONE));
    }

    @Test
    public void testSmooth() {
        Waveform flat = constant(2, 4).smooth(lit("0.5"), SmoothingKernel.UNIFORM);
        Assert.assertEquals(2.0, flat.valueAt(new BigDecimal(2)).doubleValue(), 1e-9);
        // a symmetric kernel preserves a ramp away from its ends
        Waveform ramp = new Linear(Scalar.literal(0), Scalar.literal(4), Scalar.literal(4))
                .smooth(lit("0.5"), SmoothingKernel.TRIANGLE);
        Assert.assertEquals(1.0, ramp.valueAt(BigDecimal.ONE).doubleValue(), 1e-9);
        Assert.assertEquals(0, new BigDecimal(4).compareTo(ramp.duration()));
        Waveform unsmoothed = constant(3, 1).smooth(Scalar.literal(0), SmoothingKernel.GAUSSIAN);
        assertValue("3", unsmoothed, "0.5");
    }

    @Test
    public void testAligned() {
        Waveform ramp = new Linear(Scalar.literal(0), Scalar.literal(4), Scalar.literal(4));
        Waveform left = ramp.align(Alignment.LEFT, ValueAlignment.RIGHT);
        assertValue("3", left, "3");
        Waveform right = ramp.align(Alignment.RIGHT, Scalar.literal(0));
        Assert.assertEquals(0, new BigDecimal(4).compareTo(right.duration()));
    }

    @Test
    public void testVariables() {
        Waveform linear = new Linear(Scalar.var("a"), Scalar.var("b"), Scalar.var("t"));
        Map<String, BigDecimal> assignment = Map.of(
                "a", BigDecimal.ONE, "b", new BigDecimal(3), "t", new BigDecimal(2));
        Assert.assertEquals(0, new BigDecimal(2).compareTo(linear.duration(assignment)));
        Assert.assertEquals(0, new BigDecimal(2).compareTo(linear.valueAt(BigDecimal.ONE, assignment)));
        Assert.assertThrows(EvaluationError.class, linear::duration);
    }

    @Test
    public void testOpaqueFunction() {
        Waveform fn = new OpaqueFn("shift", (time, arguments) -> time.add(arguments.get(0)),
                List.of("offset"), Scalar.literal(2));
        Assert.assertEquals(0, new BigDecimal(5).compareTo(
                fn.valueAt(BigDecimal.ONE, Map.of("offset", new BigDecimal(4)))));
    }

    @Test
    public void testEquality() {
        Waveform left = new Linear(Scalar.cast(0), Scalar.cast(1.0), Scalar.literal(1));
        Waveform right = new Linear(Scalar.literal(0), Scalar.literal(1), Scalar.cast("1"));
        Assert.assertNotEquals(left, right);
        Assert.assertEquals(left, new Linear(Scalar.literal(0), Scalar.literal(1), Scalar.literal(1)));
        Assert.assertEquals(constant(1, 1).add(constant(2, 1)), constant(1, 1).add(constant(2, 1)));
    }
}
