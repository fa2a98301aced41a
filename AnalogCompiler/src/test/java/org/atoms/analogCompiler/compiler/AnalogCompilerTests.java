package org.atoms.analogCompiler.compiler;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.compiler.frontend.Parser;
import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.frontend.builder.PrimitiveBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.RegisterBuilder;
import org.atoms.analogCompiler.ir.control.FieldName;
import org.atoms.analogCompiler.ir.control.LevelCoupling;
import org.atoms.analogCompiler.ir.control.UniformModulation;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.Logger;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Tests for the compiler driver and its options */
public class AnalogCompilerTests {
    static PrimitiveBuilder ramp() {
        return RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().linear("a", "a", "t");
    }

    static Waveform detuning(CompiledProgram program) {
        return program.circuit.sequence
                .getPulse(LevelCoupling.RYDBERG)
                .getField(FieldName.DETUNING)
                .drives.get(UniformModulation.INSTANCE);
    }

    static AnalogCompiler folding() {
        CompilerOptions options = new CompilerOptions();
        options.foldConstants = true;
        return new AnalogCompiler(options);
    }

    @Test
    public void testOptions() {
        CompilerOptions options = CompilerOptions.fromArgs(
                "-TParser=1", "-TIsConstantWaveform=2", "--foldConstants", "--noThrow", "--quiet");
        Assert.assertEquals(Map.of("Parser", "1", "IsConstantWaveform", "2"), options.loggingLevel);
        Assert.assertTrue(options.foldConstants);
        Assert.assertFalse(options.throwOnError());
        Assert.assertTrue(options.quiet);

        CompilerOptions defaults = CompilerOptions.getDefault();
        Assert.assertFalse(defaults.foldConstants);
        Assert.assertTrue(defaults.throwOnError());
        Assert.assertTrue(defaults.loggingLevel.isEmpty());

        Assert.assertThrows(CompilationError.class, () -> CompilerOptions.fromArgs("--noSuchOption"));
    }

    @Test
    public void testBadLoggingOptions() {
        CompilerOptions options = new CompilerOptions();
        options.loggingLevel.put("Parser", "high");
        AnalogCompiler compiler = new AnalogCompiler(options);
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertTrue(compiler.messages.getMessage(0).message.contains("-T option"));

        options = new CompilerOptions();
        options.loggingLevel.put("NoSuchVisitor", "1");
        compiler = new AnalogCompiler(options);
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertTrue(compiler.messages.getMessage(0).message.contains("NoSuchVisitor"));
    }

    @Test
    public void testCompile() {
        AnalogCompiler compiler = new AnalogCompiler(CompilerOptions.getDefault());
        CompiledProgram program = Objects.requireNonNull(compiler.compile(ramp().assign(Map.of("a", 3, "t", 2))));
        Assert.assertEquals(new Linear(Scalar.var("a"), Scalar.var("a"), Scalar.var("t")), detuning(program));
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void testFoldConstants() {
        CompiledProgram program = Objects.requireNonNull(
                folding().compile(ramp().assign(Map.of("a", 3, "t", 2))));
        Assert.assertEquals(new Constant(Scalar.literal(3), Scalar.literal(2)), detuning(program));
        Assert.assertEquals(2, program.parameters.staticParams.size());
    }

    @Test
    public void testNoFoldingWhenValuesAreMissing() {
        Waveform ramp = new Linear(Scalar.var("a"), Scalar.var("a"), Scalar.var("t"));
        // unbound variable
        CompiledProgram unbound = Objects.requireNonNull(folding().compile(ramp().assign(Map.of("a", 3))));
        Assert.assertEquals(ramp, detuning(unbound));
        // bound at run time
        CompiledProgram args = Objects.requireNonNull(
                folding().compile(ramp().assign(Map.of("a", 3)).args("t")));
        Assert.assertEquals(ramp, detuning(args));
        // one value per batch entry
        CompiledProgram batch = Objects.requireNonNull(
                folding().compile(ramp().assign(Map.of("a", 3)).batchAssign(Map.of("t", List.of(1, 2)))));
        Assert.assertEquals(ramp, detuning(batch));
    }

    @Test
    public void testNoFoldingOfVaryingPrograms() {
        Builder builder = RegisterBuilder.chain(2, 5)
                .rydberg().detuning().uniform().linear(0, 1, 1);
        CompiledProgram program = Objects.requireNonNull(folding().compile(builder));
        Assert.assertEquals(new Linear(Scalar.literal(0), Scalar.literal(1), Scalar.literal(1)), detuning(program));
    }

    @Test
    public void testErrorsAreThrown() {
        AnalogCompiler compiler = new AnalogCompiler(CompilerOptions.getDefault());
        Builder builder = ramp().args("a", "a");
        Assert.assertThrows(CompilationError.class, () -> compiler.compile(builder));
        Assert.assertEquals(1, compiler.messages.errorCount());
    }

    @Test
    public void testErrorsAreReported() {
        CompilerOptions options = new CompilerOptions();
        options.noThrow = true;
        AnalogCompiler compiler = new AnalogCompiler(options);
        Assert.assertNull(compiler.compile(ramp().args("a", "a")));
        Assert.assertTrue(compiler.hasErrors());

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        compiler.showMessages(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String output = bytes.toString(StandardCharsets.UTF_8);
        Assert.assertTrue(output, output.startsWith("error: Compilation error: Cannot have duplicate names [a]"));
        Assert.assertEquals(1, compiler.messages.exitCode);
    }

    @Test
    public void testLogging() {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        int previous = Logger.INSTANCE.setLoggingLevel(Parser.class, 1);
        try {
            new Parser().parse(ramp());
        } finally {
            Logger.INSTANCE.setLoggingLevel(Parser.class, previous);
            Logger.INSTANCE.setDebugStream(save);
        }
        String log = builder.toString();
        Assert.assertTrue(log, log.contains("Drive rydberg.detuning Uniform: Linear(a, a, t)"));
        Assert.assertFalse(log, log.contains("Register"));
    }
}
