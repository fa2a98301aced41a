package org.atoms.analogCompiler.ir.routine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.util.Utilities;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Execution parameters of a compiled program.
 * The batch defines one program variant per entry; all variants share the IR. */
public final class Parameters {
    /** Values bound at compile time. */
    public final Map<String, ParamValue> staticParams;
    /** Per-variant overrides; never empty. */
    public final List<Map<String, ParamValue>> batchParams;
    /** Names bound when the program is run, in call order. */
    public final List<String> argsList;

    public Parameters(Map<String, ParamValue> staticParams,
                      List<Map<String, ParamValue>> batchParams,
                      List<String> argsList) {
        this.staticParams = Collections.unmodifiableMap(new LinkedHashMap<>(staticParams));
        List<Map<String, ParamValue>> batch = new ArrayList<>();
        for (Map<String, ParamValue> entry: batchParams)
            batch.add(Collections.unmodifiableMap(new LinkedHashMap<>(entry)));
        if (batch.isEmpty())
            batch.add(Map.of());
        this.batchParams = Collections.unmodifiableList(batch);
        this.argsList = List.copyOf(argsList);
    }

    public Parameters() {
        this(Map.of(), List.of(), List.of());
    }

    public int batchSize() {
        return this.batchParams.size();
    }

    /** Combine the run-time arguments with the static and batch parameters.
     * Batch entries override static values, and arguments override both.
     * @param args  One value for each name in {@link #argsList}.
     * @return      One complete assignment per batch entry. */
    public List<Map<String, ParamValue>> batchAssignments(Object... args) {
        if (args.length != this.argsList.size())
            throw new CompilationError("Expected " + this.argsList.size() + " arguments " +
                    this.argsList + ", got " + args.length);
        Map<String, ParamValue> arguments = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++)
            arguments.put(this.argsList.get(i), ParamValue.cast(args[i]));

        List<Map<String, ParamValue>> result = new ArrayList<>();
        for (Map<String, ParamValue> batch: this.batchParams) {
            Map<String, ParamValue> assignment = new LinkedHashMap<>(this.staticParams);
            assignment.putAll(batch);
            assignment.putAll(arguments);
            result.add(assignment);
        }
        return result;
    }

    /** The scalar part of an assignment, in the form waveforms are evaluated with. */
    public static Map<String, BigDecimal> scalarAssignment(Map<String, ParamValue> assignment) {
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        for (Map.Entry<String, ParamValue> e: assignment.entrySet()) {
            if (!e.getValue().isVector())
                result.put(e.getKey(), e.getValue().getScalar());
        }
        return result;
    }

    static ObjectNode toJson(ObjectMapper mapper, Map<String, ParamValue> values) {
        ObjectNode result = mapper.createObjectNode();
        for (Map.Entry<String, ParamValue> e: values.entrySet()) {
            ParamValue value = e.getValue();
            if (value.isVector()) {
                ArrayNode array = result.putArray(e.getKey());
                for (BigDecimal d: value.getVector())
                    array.add(d);
            } else {
                result.put(e.getKey(), value.getScalar());
            }
        }
        return result;
    }

    public ObjectNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ObjectNode result = mapper.createObjectNode();
        result.set("static_params", toJson(mapper, this.staticParams));
        ArrayNode batch = result.putArray("batch_params");
        for (Map<String, ParamValue> entry: this.batchParams)
            batch.add(toJson(mapper, entry));
        ArrayNode args = result.putArray("args");
        for (String arg: this.argsList)
            args.add(arg);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameters that)) return false;
        return this.staticParams.equals(that.staticParams) &&
                this.batchParams.equals(that.batchParams) &&
                this.argsList.equals(that.argsList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.staticParams, this.batchParams, this.argsList);
    }

    @Override
    public String toString() {
        return "Parameters{static=" + this.staticParams +
                ", batch=" + this.batchParams +
                ", args=" + this.argsList + "}";
    }
}
