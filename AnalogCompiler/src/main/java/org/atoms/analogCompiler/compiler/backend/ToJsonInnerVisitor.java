package org.atoms.analogCompiler.compiler.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.atoms.analogCompiler.compiler.errors.InternalCompilerError;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.ir.IInnerNode;
import org.atoms.analogCompiler.ir.scalar.Literal;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.scalar.ScalarBinary;
import org.atoms.analogCompiler.ir.scalar.ScalarNegative;
import org.atoms.analogCompiler.ir.scalar.Variable;
import org.atoms.analogCompiler.ir.waveform.Add;
import org.atoms.analogCompiler.ir.waveform.AlignedWaveform;
import org.atoms.analogCompiler.ir.waveform.Append;
import org.atoms.analogCompiler.ir.waveform.Constant;
import org.atoms.analogCompiler.ir.waveform.Linear;
import org.atoms.analogCompiler.ir.waveform.Negative;
import org.atoms.analogCompiler.ir.waveform.OpaqueFn;
import org.atoms.analogCompiler.ir.waveform.Poly;
import org.atoms.analogCompiler.ir.waveform.Record;
import org.atoms.analogCompiler.ir.waveform.Sample;
import org.atoms.analogCompiler.ir.waveform.Scale;
import org.atoms.analogCompiler.ir.waveform.Slice;
import org.atoms.analogCompiler.ir.waveform.Smooth;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.Utilities;

import javax.annotation.Nullable;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/** Encodes waveforms as JSON trees.  Each node becomes an object with a single
 * property, named after the kind of the node, holding the node's fields. */
public class ToJsonInnerVisitor extends WaveformVisitor {
    final ObjectMapper mapper;
    final Map<IInnerNode, JsonNode> translation;

    public ToJsonInnerVisitor(ObjectMapper mapper) {
        this.mapper = mapper;
        this.translation = new IdentityHashMap<>();
    }

    public ToJsonInnerVisitor() {
        this(Utilities.deterministicObjectMapper());
    }

    public static JsonNode toJson(Waveform waveform) {
        ToJsonInnerVisitor visitor = new ToJsonInnerVisitor();
        visitor.apply(waveform);
        return visitor.get(waveform);
    }

    public JsonNode get(IInnerNode node) {
        JsonNode result = this.translation.get(node);
        if (result == null)
            throw new InternalCompilerError("Waveform was not encoded", node);
        return result;
    }

    /** Literals are numbers, variables are strings, and operations are objects. */
    public JsonNode scalar(Scalar scalar) {
        if (scalar instanceof Literal literal)
            return this.mapper.getNodeFactory().numberNode(literal.value);
        if (scalar instanceof Variable variable)
            return this.mapper.getNodeFactory().textNode(variable.name);
        ObjectNode result = this.mapper.createObjectNode();
        if (scalar instanceof ScalarNegative negative) {
            result.set("negative", this.scalar(negative.source));
        } else {
            ScalarBinary binary = scalar.to(ScalarBinary.class);
            ArrayNode operands = result.putArray(binary.opcode.name().toLowerCase());
            operands.add(this.scalar(binary.left));
            operands.add(this.scalar(binary.right));
        }
        return result;
    }

    ObjectNode node(IInnerNode node, String kind) {
        ObjectNode result = this.mapper.createObjectNode();
        ObjectNode body = result.putObject(kind);
        this.translation.put(node, result);
        return body;
    }

    void setScalar(ObjectNode body, String property, @Nullable Scalar scalar) {
        if (scalar != null)
            body.set(property, this.scalar(scalar));
    }

    @Override
    public void postorder(Constant node) {
        ObjectNode body = this.node(node, "constant");
        this.setScalar(body, "value", node.value);
        this.setScalar(body, "duration", node.duration);
    }

    @Override
    public void postorder(Linear node) {
        ObjectNode body = this.node(node, "linear");
        this.setScalar(body, "start", node.start);
        this.setScalar(body, "stop", node.stop);
        this.setScalar(body, "duration", node.duration);
    }

    @Override
    public void postorder(Poly node) {
        ObjectNode body = this.node(node, "poly");
        ArrayNode coefficients = body.putArray("coeffs");
        for (Scalar coefficient: node.coeffs)
            coefficients.add(this.scalar(coefficient));
        this.setScalar(body, "duration", node.duration);
    }

    @Override
    public void postorder(OpaqueFn node) {
        ObjectNode body = this.node(node, "opaque_fn");
        body.put("name", node.name);
        ArrayNode parameters = body.putArray("parameters");
        for (String parameter: node.parameters)
            parameters.add(parameter);
        this.setScalar(body, "duration", node.duration);
    }

    @Override
    public void postorder(Append node) {
        ObjectNode result = this.mapper.createObjectNode();
        ArrayNode waveforms = result.putArray("append");
        for (Waveform waveform: node.waveforms)
            waveforms.add(this.get(waveform));
        this.translation.put(node, result);
    }

    @Override
    public void postorder(Add node) {
        ObjectNode body = this.node(node, "add");
        body.set("left", this.get(node.left));
        body.set("right", this.get(node.right));
    }

    @Override
    public void postorder(AlignedWaveform node) {
        ObjectNode body = this.node(node, "aligned");
        body.set("waveform", this.get(node.waveform));
        body.put("alignment", node.alignment.name().toLowerCase());
        if (node.value != null)
            this.setScalar(body, "value", node.value);
        else
            body.put("value_alignment", Objects.requireNonNull(node.valueAlignment).name().toLowerCase());
    }

    @Override
    public void postorder(Negative node) {
        ObjectNode body = this.node(node, "negative");
        body.set("waveform", this.get(node.waveform));
    }

    @Override
    public void postorder(Record node) {
        ObjectNode body = this.node(node, "record");
        body.set("waveform", this.get(node.waveform));
        body.put("name", node.name);
    }

    @Override
    public void postorder(Sample node) {
        ObjectNode body = this.node(node, "sample");
        body.set("waveform", this.get(node.waveform));
        body.put("interpolation", node.interpolation.name().toLowerCase());
        this.setScalar(body, "dt", node.dt);
    }

    @Override
    public void postorder(Scale node) {
        ObjectNode body = this.node(node, "scale");
        body.set("waveform", this.get(node.waveform));
        this.setScalar(body, "factor", node.factor);
    }

    @Override
    public void postorder(Slice node) {
        ObjectNode body = this.node(node, "slice");
        body.set("waveform", this.get(node.waveform));
        this.setScalar(body, "start", node.start);
        this.setScalar(body, "stop", node.stop);
    }

    @Override
    public void postorder(Smooth node) {
        ObjectNode body = this.node(node, "smooth");
        body.set("waveform", this.get(node.waveform));
        this.setScalar(body, "radius", node.radius);
        body.put("kernel", node.kernel.name().toLowerCase());
    }
}
