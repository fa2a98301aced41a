package org.atoms.analogCompiler.compiler.backend;

import com.fasterxml.jackson.databind.JsonNode;
import org.atoms.analogCompiler.compiler.CompiledProgram;
import org.atoms.analogCompiler.compiler.frontend.Parser;
import org.atoms.analogCompiler.compiler.frontend.builder.RegisterBuilder;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Alignment;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.SmoothingKernel;
import org.atoms.analogCompiler.ir.waveform.ValueAlignment;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Unit tests for the JSON encoding of programs */
public class ToJsonTests {
    static void assertNumber(String expected, JsonNode node) {
        Assert.assertTrue(node.toString(), node.isNumber());
        Assert.assertEquals(0, new BigDecimal(expected).compareTo(node.decimalValue()));
    }

    @Test
    public void testScalars() {
        ToJsonInnerVisitor visitor = new ToJsonInnerVisitor();
        assertNumber("2.5", visitor.scalar(Scalar.cast(2.5)));
        Assert.assertEquals("x", visitor.scalar(Scalar.var("x")).asText());
        JsonNode sum = visitor.scalar(Scalar.var("x").add(Scalar.literal(1)));
        Assert.assertEquals("x", sum.get("add").get(0).asText());
        assertNumber("1", sum.get("add").get(1));
        JsonNode negative = visitor.scalar(Scalar.var("y").negate());
        Assert.assertEquals("y", negative.get("negative").asText());
    }

    @Test
    public void testWaveform() {
        Waveform waveform = new Linear(Scalar.literal(0), Scalar.literal(1), Scalar.var("t"))
                .append(new Constant(Scalar.literal(1), Scalar.literal(2)))
                .sample(Scalar.cast(0.5), Interpolation.CONSTANT);
        JsonNode json = ToJsonInnerVisitor.toJson(waveform);
        JsonNode sample = json.get("sample");
        Assert.assertNotNull(sample);
        Assert.assertEquals("constant", sample.get("interpolation").asText());
        assertNumber("0.5", sample.get("dt"));
        JsonNode parts = sample.get("waveform").get("append");
        Assert.assertEquals(2, parts.size());
        Assert.assertEquals("t", parts.get(0).get("linear").get("duration").asText());
        assertNumber("2", parts.get(1).get("constant").get("duration"));
    }

    @Test
    public void testSlice() {
        Waveform waveform = new Constant(Scalar.literal(1), Scalar.literal(4))
                .slice(null, Scalar.literal(2))
                .record("v");
        JsonNode record = ToJsonInnerVisitor.toJson(waveform).get("record");
        Assert.assertEquals("v", record.get("name").asText());
        JsonNode slice = record.get("waveform").get("slice");
        Assert.assertFalse(slice.has("start"));
        assertNumber("2", slice.get("stop"));
    }

    @Test
    public void testWrappers() {
        Waveform waveform = new Constant(Scalar.literal(1), Scalar.literal(4))
                .smooth(Scalar.cast(0.1), SmoothingKernel.GAUSSIAN)
                .align(Alignment.LEFT, ValueAlignment.RIGHT)
                .scale(Scalar.var("k"))
                .negate();
        JsonNode scale = ToJsonInnerVisitor.toJson(waveform).get("negative").get("waveform").get("scale");
        Assert.assertEquals("k", scale.get("factor").asText());
        JsonNode aligned = scale.get("waveform").get("aligned");
        Assert.assertEquals("left", aligned.get("alignment").asText());
        Assert.assertEquals("right", aligned.get("value_alignment").asText());
        Assert.assertFalse(aligned.has("value"));
        JsonNode smooth = aligned.get("waveform").get("smooth");
        Assert.assertEquals("gaussian", smooth.get("kernel").asText());
        assertNumber("0.1", smooth.get("radius"));
    }

    @Test
    public void testProgram() {
        CompiledProgram program = new Parser().parse(RegisterBuilder.chain(3, 5)
                .rydberg().detuning().uniform().constant(1, 2)
                .location(1, 0.5).linear(0, 1, 2)
                .scale("mask").constant(2, 2)
                .assign(Map.of("mask", List.of(1, 0, 1)))
                .parallelize(20));
        JsonNode json = program.toJson();

        JsonNode circuit = json.get("circuit").get("analog_circuit");
        JsonNode register = circuit.get("register").get("parallel_register");
        assertNumber("20", register.get("cluster_spacing"));
        Assert.assertEquals(3, register.get("register").get("chain").get("size").intValue());

        JsonNode field = circuit.get("sequence").get("sequence").get("pulses")
                .get("rydberg").get("pulse").get("fields")
                .get("detuning").get("field");
        JsonNode drives = field.get("drives");
        Assert.assertEquals(3, drives.size());
        Assert.assertTrue(drives.get(0).get("modulation").has("uniform_modulation"));
        assertNumber("0.5", drives.get(1).get("modulation").get("scaled_locations").get("1"));
        Assert.assertEquals("mask",
                drives.get(2).get("modulation").get("run_time_vector").get("name").asText());
        Assert.assertTrue(drives.get(2).get("waveform").has("constant"));

        JsonNode params = json.get("params");
        Assert.assertEquals(3, params.get("static_params").get("mask").size());
        Assert.assertEquals(1, params.get("batch_params").size());
        Assert.assertEquals(0, params.get("args").size());
    }

    @Test
    public void testListOfLocations() {
        JsonNode json = ToJsonOuterVisitor.toJson(new Parser().parseRegister(
                RegisterBuilder.start().addPosition(0, 0).addPosition("x", 5)));
        JsonNode locations = json.get("list_of_locations").get("locations");
        Assert.assertEquals(2, locations.size());
        Assert.assertEquals("x", locations.get(1).get("x").asText());
        Assert.assertTrue(locations.get(1).get("filled").asBoolean());
    }
}
