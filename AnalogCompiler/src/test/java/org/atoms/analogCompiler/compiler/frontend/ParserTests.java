package org.atoms.analogCompiler.compiler.frontend;

import org.atoms.analogCompiler.compiler.CompiledProgram;
import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.frontend.builder.RegisterBuilder;
import org.atoms.analogCompiler.ir.AnalogCircuit;
import org.atoms.analogCompiler.ir.control.Field;
import org.atoms.analogCompiler.ir.control.FieldName;
import org.atoms.analogCompiler.ir.control.LevelCoupling;
import org.atoms.analogCompiler.ir.control.Pulse;
import org.atoms.analogCompiler.ir.control.RunTimeVector;
import org.atoms.analogCompiler.ir.control.ScaledLocations;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.control.UniformModulation;
import org.atoms.analogCompiler.ir.register.Chain;
import org.atoms.analogCompiler.ir.register.LocationInfo;
import org.atoms.analogCompiler.ir.register.ListOfLocations;
import org.atoms.analogCompiler.ir.register.ParallelRegister;
import org.atoms.analogCompiler.ir.register.Register;
import org.atoms.analogCompiler.ir.routine.ParamValue;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Append;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Sample;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.analogCompiler.ir.waveform.WaveformFunction;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

/** Unit tests for lowering builder chains to IR */
public class ParserTests {
    static final WaveformFunction IDENTITY = (time, arguments) -> time;

    static Linear linear(long start, long stop, long duration) {
        return new Linear(Scalar.literal(start), Scalar.literal(stop), Scalar.literal(duration));
    }

    static Constant constant(long value, long duration) {
        return new Constant(Scalar.literal(value), Scalar.literal(duration));
    }

    static Sequence sequence(LevelCoupling coupling, FieldName name, Field field) {
        return new Sequence().with(coupling, new Pulse().with(name, field));
    }

    static Field uniform(Waveform waveform) {
        return new Field(UniformModulation.INSTANCE, waveform);
    }

    static Sequence parseSequence(Builder builder) {
        return new Parser().parseSequence(builder);
    }

    static void assertError(String expectedMessage, Builder builder) {
        CompilationError error = Assert.assertThrows(CompilationError.class, () -> new Parser().parse(builder));
        Assert.assertTrue(error.getMessage(), error.getMessage().contains(expectedMessage));
    }

    @Test
    public void testRegister() {
        Builder builder = RegisterBuilder.start()
                .addPosition(0, 0)
                .addPosition(0, 5)
                .rydberg().detuning().uniform().constant(1, 1);
        Register register = new Parser().parseRegister(builder);
        ListOfLocations expected = new ListOfLocations(List.of(
                LocationInfo.filled(Scalar.literal(0), Scalar.literal(0)),
                LocationInfo.filled(Scalar.literal(0), Scalar.literal(5))));
        Assert.assertEquals(expected, register);
    }

    @Test
    public void testEmptySequence() {
        Assert.assertEquals(new Sequence(), parseSequence(RegisterBuilder.chain(2, 5)));
    }

    @Test
    public void testRepeatedDriveIsSummed() {
        Builder builder = RegisterBuilder.start()
                .addPosition(0, 0)
                .rydberg().detuning()
                .uniform().linear(0, 1, 1)
                .uniform().linear(0, 1, 1);
        Sequence expected = sequence(LevelCoupling.RYDBERG, FieldName.DETUNING,
                uniform(linear(0, 1, 1).add(linear(0, 1, 1))));
        Assert.assertEquals(expected, parseSequence(builder));
    }

    @Test
    public void testConsecutivePrimitivesAreAppended() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning()
                .uniform().linear(0, 1, 1).linear(1, 0, 1);
        Waveform expected = new Append(List.of(linear(0, 1, 1), linear(1, 0, 1)));
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING, uniform(expected)),
                parseSequence(builder));
    }

    @Test
    public void testPiecewiseIsFlattened() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning()
                .uniform()
                .piecewiseLinear(List.of(1, 2), List.of(0, 1, 1))
                .constant(1, 1);
        Waveform expected = new Append(List.of(linear(0, 1, 1), linear(1, 1, 2), constant(1, 1)));
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING, uniform(expected)),
                parseSequence(builder));
    }

    @Test
    public void testDistinctModulationsAreSeparateDrives() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning()
                .uniform().linear(0, 1, 1)
                .location(0).constant(1, 1);
        Field field = uniform(linear(0, 1, 1))
                .add(new Field(new ScaledLocations(Map.of(0, Scalar.literal(1))), constant(1, 1)));
        Sequence actual = parseSequence(builder);
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING, field), actual);
        Assert.assertEquals(2, actual.getPulse(LevelCoupling.RYDBERG).getField(FieldName.DETUNING).drives.size());
    }

    @Test
    public void testLocations() {
        Builder builder = RegisterBuilder.chain(3, 5)
                .rydberg().detuning()
                .location(0, "w").location(2, 0.5).constant(1, 1)
                .location(1).location(1, 2).constant(2, 1);
        ScaledLocations first = new ScaledLocations(Map.of(0, Scalar.var("w"), 2, Scalar.cast(0.5)));
        ScaledLocations second = new ScaledLocations(Map.of(1, Scalar.literal(1).add(Scalar.literal(2))));
        Field field = new Field(first, constant(1, 1)).add(new Field(second, constant(2, 1)));
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING, field), parseSequence(builder));
    }

    @Test
    public void testStickyCouplingAndField() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().constant(1, 1)
                .rabi().amplitude().uniform().constant(2, 1)
                .scale("mask").constant(3, 1)
                .hyperfine().rabi().phase().uniform().constant(4, 1)
                .detuning().uniform().constant(5, 1);
        Pulse rydberg = new Pulse()
                .with(FieldName.DETUNING, uniform(constant(1, 1)))
                .with(FieldName.RABI_AMPLITUDE, uniform(constant(2, 1))
                        .add(new Field(new RunTimeVector("mask"), constant(3, 1))));
        Pulse hyperfine = new Pulse()
                .with(FieldName.RABI_PHASE, uniform(constant(4, 1)))
                .with(FieldName.DETUNING, uniform(constant(5, 1)));
        Sequence expected = new Sequence()
                .with(LevelCoupling.RYDBERG, rydberg)
                .with(LevelCoupling.HYPERFINE, hyperfine);
        Assert.assertEquals(expected, parseSequence(builder));
    }

    @Test
    public void testSampleInterpolationDependsOnField() {
        Builder phase = RegisterBuilder.chain(2, 5)
                .rydberg().rabi().phase().uniform()
                .fn("f", IDENTITY, List.of(), 1).sample(0.5);
        OpaqueFn fn = new OpaqueFn("f", IDENTITY, List.of(), Scalar.literal(1));
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.RABI_PHASE,
                        uniform(new Sample(fn, Interpolation.CONSTANT, Scalar.cast(0.5)))),
                parseSequence(phase));

        Builder detuning = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform()
                .fn("f", IDENTITY, List.of(), 1).sample(0.5);
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING,
                        uniform(new Sample(fn, Interpolation.LINEAR, Scalar.cast(0.5)))),
                parseSequence(detuning));

        Builder explicit = RegisterBuilder.chain(2, 5)
                .rydberg().rabi().phase().uniform()
                .fn("f", IDENTITY, List.of(), 1).sample(0.5, Interpolation.LINEAR);
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.RABI_PHASE,
                        uniform(new Sample(fn, Interpolation.LINEAR, Scalar.cast(0.5)))),
                parseSequence(explicit));
    }

    @Test
    public void testFunctionWithoutSample() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform()
                .fn("f", IDENTITY, List.of("a"), "t")
                .constant(1, 1);
        Waveform expected = new OpaqueFn("f", IDENTITY, List.of("a"), Scalar.var("t")).append(constant(1, 1));
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING, uniform(expected)),
                parseSequence(builder));
    }

    @Test
    public void testSliceAndRecord() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform()
                .linear(0, 1, 2).slice(0.5, null).record("v");
        Waveform expected = linear(0, 1, 2).slice(Scalar.cast(0.5), null).record("v");
        Assert.assertEquals(sequence(LevelCoupling.RYDBERG, FieldName.DETUNING, uniform(expected)),
                parseSequence(builder));
    }

    @Test
    public void testPragmas() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().constant("c", "t")
                .assign(Map.of("c", 1))
                .batchAssign(Map.of("t", List.of(1, 2, 3)))
                .args("x");
        CompiledProgram program = new Parser().parse(builder);
        Assert.assertEquals(Map.of("c", ParamValue.cast(1)), program.parameters.staticParams);
        Assert.assertEquals(3, program.parameters.batchSize());
        Assert.assertEquals(Map.of("t", ParamValue.cast(2)), program.parameters.batchParams.get(1));
        Assert.assertEquals(List.of("x"), program.parameters.argsList);
        Assert.assertEquals(new Chain(2, Scalar.literal(5)), program.circuit.register);
    }

    @Test
    public void testListAssign() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().constant("c", 1)
                .listAssign(List.of(Map.of("c", 1), Map.of("c", 2)));
        CompiledProgram program = new Parser().parse(builder);
        Assert.assertEquals(2, program.parameters.batchSize());
        Assert.assertEquals(Map.of("c", ParamValue.cast(2)), program.parameters.batchParams.get(1));
        Assert.assertTrue(program.parameters.staticParams.isEmpty());
        Assert.assertTrue(program.parameters.argsList.isEmpty());
    }

    @Test
    public void testMalformedBatches() {
        Assert.assertThrows(CompilationError.class, () -> RegisterBuilder.chain(2, 5)
                .batchAssign(Map.of("a", List.of(1, 2), "b", List.of(1))));
        Assert.assertThrows(CompilationError.class, () -> RegisterBuilder.chain(2, 5)
                .listAssign(List.of(Map.of("a", 1), Map.of("b", 1))));
        Assert.assertThrows(CompilationError.class, () -> RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform()
                .piecewiseLinear(List.of(1, 1), List.of(0, 1)));
    }

    @Test
    public void testParallelize() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().constant(1, 1)
                .parallelize(20);
        Register expected = new ParallelRegister(new Chain(2, Scalar.literal(5)), Scalar.literal(20));
        Assert.assertEquals(expected, new Parser().parseRegister(builder));
        Assert.assertEquals(expected, new Parser().parse(builder).circuit.register);
        // directives are not part of the circuit
        Assert.assertEquals(new Chain(2, Scalar.literal(5)), new Parser().parseCircuit(builder).register);

        Builder twice = RegisterBuilder.chain(2, 5).parallelize(20).parallelize(30);
        assertError("already parallelized", twice);
    }

    @Test
    public void testDuplicateArguments() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().constant("a", "b")
                .args("a", "b", "a");
        assertError("Cannot have duplicate names [a]", builder);
    }

    @Test
    public void testVectorArgument() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().scale("mask").constant(1, 1)
                .args("mask");
        assertError("Cannot have RunTimeVectors [mask] as arguments", builder);
    }

    @Test
    public void testPrecomputedSequence() {
        Sequence sequence = sequence(LevelCoupling.HYPERFINE, FieldName.DETUNING, uniform(constant(1, 1)));
        Builder builder = RegisterBuilder.chain(3, 5)
                .apply(sequence)
                .assign(Map.of("x", 1));
        CompiledProgram program = new Parser().parse(builder);
        Assert.assertEquals(sequence, program.circuit.sequence);
        Assert.assertEquals(Map.of("x", ParamValue.cast(1)), program.parameters.staticParams);
    }

    @Test
    public void testVectorArgumentInPrecomputedSequence() {
        Sequence sequence = sequence(LevelCoupling.RYDBERG, FieldName.RABI_AMPLITUDE,
                new Field(new RunTimeVector("mask"), constant(1, 1)));
        Builder builder = RegisterBuilder.chain(2, 5)
                .apply(sequence)
                .args("mask");
        assertError("Cannot have RunTimeVectors [mask] as arguments", builder);
        CompiledProgram program = new Parser().parse(RegisterBuilder.chain(2, 5)
                .apply(sequence)
                .args("t"));
        Assert.assertEquals(List.of("t"), program.parameters.argsList);
    }

    @Test
    public void testParsingIsRepeatable() {
        Builder builder = RegisterBuilder.square(2, "d")
                .rydberg().detuning().uniform().linear(0, "x", 1)
                .rabi().amplitude().location(1, 2).constant(1, 1)
                .batchAssign(Map.of("x", List.of(1, 2)));
        Parser parser = new Parser();
        CompiledProgram first = parser.parse(builder);
        CompiledProgram second = parser.parse(builder);
        AnalogCircuit circuit = first.circuit;
        Assert.assertEquals(circuit, second.circuit);
        Assert.assertEquals(first.parameters, second.parameters);
        Assert.assertSame(builder, first.source);
    }
}
