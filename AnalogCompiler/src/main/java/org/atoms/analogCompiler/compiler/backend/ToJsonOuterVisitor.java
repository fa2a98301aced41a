package org.atoms.analogCompiler.compiler.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.atoms.analogCompiler.compiler.errors.InternalCompilerError;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.AnalogCircuit;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.analogCompiler.ir.control.Field;
import org.atoms.analogCompiler.ir.control.FieldName;
import org.atoms.analogCompiler.ir.control.LevelCoupling;
import org.atoms.analogCompiler.ir.control.Pulse;
import org.atoms.analogCompiler.ir.control.RunTimeVector;
import org.atoms.analogCompiler.ir.control.ScaledLocations;
import org.atoms.analogCompiler.ir.control.Sequence;
import org.atoms.analogCompiler.ir.control.SpatialModulation;
import org.atoms.analogCompiler.ir.control.UniformModulation;
import org.atoms.analogCompiler.ir.register.AtomArrangement;
import org.atoms.analogCompiler.ir.register.Chain;
import org.atoms.analogCompiler.ir.register.LocationInfo;
import org.atoms.analogCompiler.ir.register.ParallelRegister;
import org.atoms.analogCompiler.ir.register.Square;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Waveform;

import java.util.IdentityHashMap;
import java.util.Map;

/** Encodes circuits as JSON trees, in the same shape as {@link ToJsonInnerVisitor}. */
public class ToJsonOuterVisitor extends AnalogCircuitVisitor {
    final ObjectMapper mapper;
    final ToJsonInnerVisitor innerVisitor;
    final Map<IOuterNode, JsonNode> translation;

    public ToJsonOuterVisitor(ToJsonInnerVisitor innerVisitor) {
        super(innerVisitor);
        this.innerVisitor = innerVisitor;
        this.mapper = innerVisitor.mapper;
        this.translation = new IdentityHashMap<>();
    }

    public static JsonNode toJson(IOuterNode node) {
        ToJsonOuterVisitor visitor = new ToJsonOuterVisitor(new ToJsonInnerVisitor());
        visitor.apply(node);
        return visitor.get(node);
    }

    public JsonNode get(IOuterNode node) {
        JsonNode result = this.translation.get(node);
        if (result == null)
            throw new InternalCompilerError("Node was not encoded", node);
        return result;
    }

    ObjectNode node(IOuterNode node, String kind) {
        ObjectNode result = this.mapper.createObjectNode();
        ObjectNode body = result.putObject(kind);
        this.translation.put(node, result);
        return body;
    }

    JsonNode scalar(Scalar scalar) {
        return this.innerVisitor.scalar(scalar);
    }

    @Override
    public void postorder(UniformModulation node) {
        this.node(node, "uniform_modulation");
    }

    @Override
    public void postorder(ScaledLocations node) {
        ObjectNode body = this.node(node, "scaled_locations");
        for (Map.Entry<Integer, Scalar> e: node.weights.entrySet())
            body.set(Integer.toString(e.getKey()), this.scalar(e.getValue()));
    }

    @Override
    public void postorder(RunTimeVector node) {
        ObjectNode body = this.node(node, "run_time_vector");
        body.put("name", node.name);
    }

    @Override
    public void postorder(Field node) {
        ObjectNode body = this.node(node, "field");
        ArrayNode drives = body.putArray("drives");
        for (Map.Entry<SpatialModulation, Waveform> e: node.drives.entrySet()) {
            ObjectNode drive = drives.addObject();
            drive.set("modulation", this.get(e.getKey()));
            drive.set("waveform", this.innerVisitor.get(e.getValue()));
        }
    }

    @Override
    public void postorder(Pulse node) {
        ObjectNode body = this.node(node, "pulse");
        ObjectNode fields = body.putObject("fields");
        for (Map.Entry<FieldName, Field> e: node.fields.entrySet())
            fields.set(e.getKey().label, this.get(e.getValue()));
    }

    @Override
    public void postorder(Sequence node) {
        ObjectNode body = this.node(node, "sequence");
        ObjectNode pulses = body.putObject("pulses");
        for (Map.Entry<LevelCoupling, Pulse> e: node.pulses.entrySet())
            pulses.set(e.getKey().label, this.get(e.getValue()));
    }

    @Override
    public void postorder(AtomArrangement node) {
        if (node instanceof Chain chain) {
            ObjectNode body = this.node(node, "chain");
            body.put("size", chain.size);
            body.set("spacing", this.scalar(chain.spacing));
        } else if (node instanceof Square square) {
            ObjectNode body = this.node(node, "square");
            body.put("size", square.size);
            body.set("spacing", this.scalar(square.spacing));
        } else {
            ObjectNode body = this.node(node, "list_of_locations");
            ArrayNode locations = body.putArray("locations");
            for (LocationInfo location: node.enumerate()) {
                ObjectNode site = locations.addObject();
                site.set("x", this.scalar(location.x()));
                site.set("y", this.scalar(location.y()));
                site.put("filled", location.filled());
            }
        }
    }

    @Override
    public void postorder(ParallelRegister node) {
        ObjectNode body = this.node(node, "parallel_register");
        body.set("register", this.get(node.arrangement));
        body.set("cluster_spacing", this.scalar(node.clusterSpacing));
    }

    @Override
    public void postorder(AnalogCircuit node) {
        ObjectNode body = this.node(node, "analog_circuit");
        body.set("register", this.get(node.register));
        body.set("sequence", this.get(node.sequence));
    }
}
