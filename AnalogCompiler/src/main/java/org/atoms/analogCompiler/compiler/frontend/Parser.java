/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.atoms.analogCompiler.compiler.frontend;

import org.atoms.analogCompiler.compiler.CompiledProgram;
import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.compiler.frontend.builder.ArgsBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.AssignBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.BatchAssignBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.frontend.builder.BuilderNodeKind;
import org.atoms.analogCompiler.compiler.frontend.builder.CouplingBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.FieldBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.LocationBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.ParallelizeBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.PrimitiveBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.RecordBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.RegisterBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.SampleBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.ScaleBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.SequenceBuilder;
import org.atoms.analogCompiler.compiler.frontend.builder.SliceBuilder;
import org.atoms.analogCompiler.compiler.visitors.outer.ScanVariables;
import org.atoms.analogCompiler.ir.AnalogCircuit;
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
import org.atoms.analogCompiler.ir.register.ParallelRegister;
import org.atoms.analogCompiler.ir.register.Register;
import org.atoms.analogCompiler.ir.routine.ParamValue;
import org.atoms.analogCompiler.ir.routine.Parameters;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.waveform.Interpolation;
import org.atoms.analogCompiler.ir.waveform.Waveform;
import org.atoms.util.IWritesLogs;
import org.atoms.util.Logger;
import org.atoms.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/** Lowers a builder chain into IR.
 *
 * <p>The chain is read in three passes over the same linearized stream:
 * the register (always the first node), the sequence, and the pragmas.
 * The sequence pass looks for spatial modulations; the field and level
 * coupling of each drive are found by walking back from the spatial node.
 * When they are not given, the ones of the previous drive are used.
 *
 * <p>A parser carries no state between calls. */
public class Parser implements IWritesLogs {
    static final Set<BuilderNodeKind> SPATIAL = EnumSet.of(
            BuilderNodeKind.LOCATION, BuilderNodeKind.UNIFORM, BuilderNodeKind.SCALE);
    static final Set<BuilderNodeKind> PRAGMAS = EnumSet.of(
            BuilderNodeKind.ASSIGN, BuilderNodeKind.BATCH_ASSIGN, BuilderNodeKind.LIST_ASSIGN,
            BuilderNodeKind.ARGS, BuilderNodeKind.PARALLELIZE);

    /** Everything accumulated while parsing one chain. */
    static final class State {
        final BuilderStream stream;
        @Nullable
        Register register = null;
        Sequence sequence = new Sequence();
        @Nullable
        LevelCoupling coupling = null;
        @Nullable
        FieldName field = null;
        /** Names of the per-site weight vectors used by the sequence. */
        final Set<String> vectorNames = new LinkedHashSet<>();
        Map<String, ParamValue> staticParams = new LinkedHashMap<>();
        List<Map<String, ParamValue>> batchParams = new ArrayList<>();
        List<String> args = new ArrayList<>();

        State(Builder builder) {
            this.stream = BuilderStream.create(builder);
        }
    }

    /** The spatial nodes of a drive, and the coupling and field selected before them.
     * Coupling and field are null when not given. */
    record Address(@Nullable LevelCoupling coupling, @Nullable FieldName field, List<BuilderNode> spatial) {
        static final Address NONE = new Address(null, null, List.of());

        BuilderNode last() {
            return Utilities.last(this.spatial);
        }
    }

    /** A waveform, and the first node following it. */
    record WaveformAndRest(@Nullable Waveform waveform, @Nullable BuilderNode rest) {}

    public Parser() {}

    void readRegister(State state) {
        BuilderNode node = state.stream.read();
        Utilities.enforce(node != null, "Empty builder chain");
        if (node.kind() != BuilderNodeKind.REGISTER)
            throw new CompilationError("Builder chain must start with a register", node.builder());
        state.register = node.builder().to(RegisterBuilder.class).register;
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Register ")
                .append(state.register)
                .newline();
    }

    Address readAddress(BuilderStream stream) {
        BuilderNode spatial = stream.readNext(SPATIAL);
        if (spatial == null)
            return Address.NONE;
        List<BuilderNode> nodes = new ArrayList<>();
        nodes.add(spatial);
        if (spatial.kind() == BuilderNodeKind.LOCATION) {
            BuilderNode current = stream.current();
            while (current != null && current.kind() == BuilderNodeKind.LOCATION) {
                nodes.add(Objects.requireNonNull(stream.read()));
                current = stream.current();
            }
        }

        Builder scope = Objects.requireNonNull(spatial.builder().parent);
        @Nullable Builder couplingNode;
        switch (scope.kind) {
            case DETUNING -> couplingNode = scope.parent;
            case RABI_AMPLITUDE, RABI_PHASE -> {
                // skip the node grouping the Rabi fields
                Builder rabi = Objects.requireNonNull(scope.parent);
                couplingNode = rabi.parent;
            }
            default -> {
                return new Address(null, null, nodes);
            }
        }
        FieldName field = scope.to(FieldBuilder.class).name;
        LevelCoupling coupling = null;
        if (couplingNode != null && couplingNode.is(CouplingBuilder.class))
            coupling = couplingNode.to(CouplingBuilder.class).coupling;
        return new Address(coupling, field, nodes);
    }

    SpatialModulation readSpatialModulation(State state, List<BuilderNode> nodes) {
        Builder head = nodes.get(0).builder();
        switch (head.kind) {
            case UNIFORM:
                return UniformModulation.INSTANCE;
            case SCALE: {
                String name = head.to(ScaleBuilder.class).name;
                state.vectorNames.add(name);
                return new RunTimeVector(name);
            }
            case LOCATION: {
                Map<Integer, Scalar> weights = new TreeMap<>();
                for (BuilderNode node: nodes) {
                    LocationBuilder location = node.builder().to(LocationBuilder.class);
                    weights.merge(location.index, location.weight, Scalar::add);
                }
                return new ScaledLocations(weights);
            }
            default:
                throw new CompilationError("Not a spatial modulation: " + head, head);
        }
    }

    Waveform require(@Nullable Waveform waveform, Builder node) {
        if (waveform == null)
            throw new CompilationError(node + " must follow a waveform", node);
        return waveform;
    }

    static Waveform appendTo(@Nullable Waveform waveform, Waveform next) {
        if (waveform == null)
            return next;
        return waveform.append(next);
    }

    /** Fold the nodes starting at 'head' into a single waveform.
     * Stops at the first node which is not part of a waveform expression. */
    WaveformAndRest readWaveform(State state, @Nullable BuilderNode head) {
        Waveform waveform = null;
        BuilderNode current = head;
        fold:
        while (current != null) {
            Builder node = current.builder();
            switch (node.kind) {
                case LINEAR, CONSTANT, POLY, PIECEWISE_LINEAR, PIECEWISE_CONSTANT ->
                        waveform = appendTo(waveform, node.to(PrimitiveBuilder.class).waveform);
                case FN -> {
                    BuilderNode next = current.next();
                    // a function followed by a sample is lowered by the sample
                    if (next == null || next.kind() != BuilderNodeKind.SAMPLE)
                        waveform = appendTo(waveform, node.to(PrimitiveBuilder.class).waveform);
                }
                case SAMPLE -> {
                    SampleBuilder sample = node.to(SampleBuilder.class);
                    Interpolation interpolation = sample.interpolation;
                    if (interpolation == null)
                        interpolation = state.field == FieldName.RABI_PHASE ?
                                Interpolation.CONSTANT : Interpolation.LINEAR;
                    waveform = appendTo(waveform, sample.function.waveform.sample(sample.dt, interpolation));
                }
                case SLICE -> {
                    SliceBuilder slice = node.to(SliceBuilder.class);
                    waveform = this.require(waveform, node).slice(slice.start, slice.stop);
                }
                case RECORD -> waveform = this.require(waveform, node).record(node.to(RecordBuilder.class).name);
                case REGISTER, SEQUENCE, RYDBERG, HYPERFINE, DETUNING, RABI, RABI_AMPLITUDE, RABI_PHASE,
                        LOCATION, UNIFORM, SCALE, ASSIGN, BATCH_ASSIGN, LIST_ASSIGN, ARGS, PARALLELIZE -> {
                    break fold;
                }
            }
            current = current.next();
        }
        return new WaveformAndRest(waveform, current);
    }

    Field readDrive(State state, Address address) {
        SpatialModulation modulation = this.readSpatialModulation(state, address.spatial());
        WaveformAndRest result = this.readWaveform(state, address.last().next());
        if (result.waveform() == null)
            throw new CompilationError("No waveform given for " + modulation, address.last().builder());
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Drive ")
                .append(String.valueOf(state.coupling))
                .append(".")
                .append(String.valueOf(state.field))
                .append(" ")
                .append(modulation)
                .append(": ")
                .append(result.waveform())
                .newline();
        return new Field(modulation, result.waveform());
    }

    void readSequence(State state) {
        BuilderNode current = state.stream.current();
        if (current != null && current.kind() == BuilderNodeKind.SEQUENCE) {
            state.sequence = current.builder().to(SequenceBuilder.class).sequence;
            state.vectorNames.addAll(new ScanVariables().scan(state.sequence).vectorVariables());
            state.stream.read();
            return;
        }

        BuilderStream stream = state.stream.copy();
        while (stream.current() != null) {
            Address address = this.readAddress(stream);
            if (address.coupling() != null)
                state.coupling = address.coupling();
            if (address.field() != null)
                state.field = address.field();
            if (address.spatial().isEmpty())
                break;
            if (state.coupling == null)
                throw new CompilationError("No level coupling selected for drive", address.last().builder());
            if (state.field == null)
                throw new CompilationError("No field selected for drive", address.last().builder());

            Pulse pulse = state.sequence.getPulse(state.coupling);
            if (pulse == null)
                pulse = new Pulse();
            Field field = pulse.getField(state.field);
            if (field == null)
                field = new Field();
            Field drive = this.readDrive(state, address);
            state.sequence = state.sequence.with(state.coupling, pulse.with(state.field, field.add(drive)));
        }
    }

    void checkArgs(State state, List<String> names, Builder node) {
        List<String> duplicates = Utilities.duplicates(names);
        if (!duplicates.isEmpty())
            throw new CompilationError("Cannot have duplicate names " + duplicates, node);
        Set<String> vectors = new LinkedHashSet<>(names);
        vectors.retainAll(state.vectorNames);
        if (!vectors.isEmpty())
            throw new CompilationError("Cannot have RunTimeVectors " + vectors + " as arguments", node);
    }

    void readPragmas(State state) {
        BuilderStream stream = state.stream.copy();
        BuilderNode current = stream.readNext(PRAGMAS);
        while (current != null) {
            Builder node = current.builder();
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Pragma ")
                    .append(node.toString())
                    .newline();
            switch (node.kind) {
                case ASSIGN -> state.staticParams = new LinkedHashMap<>(node.to(AssignBuilder.class).values);
                case BATCH_ASSIGN, LIST_ASSIGN -> state.batchParams = new ArrayList<>(node.to(BatchAssignBuilder.class).batch);
                case ARGS -> {
                    List<String> names = node.to(ArgsBuilder.class).names;
                    this.checkArgs(state, names, node);
                    state.args = new ArrayList<>(names);
                }
                case PARALLELIZE -> {
                    Register register = Objects.requireNonNull(state.register);
                    if (!register.is(AtomArrangement.class))
                        throw new CompilationError("Register " + register + " is already parallelized", node);
                    state.register = new ParallelRegister(register.to(AtomArrangement.class),
                            node.to(ParallelizeBuilder.class).clusterSpacing);
                }
                case REGISTER, SEQUENCE, RYDBERG, HYPERFINE, DETUNING, RABI, RABI_AMPLITUDE, RABI_PHASE,
                        LOCATION, UNIFORM, SCALE, LINEAR, CONSTANT, POLY, PIECEWISE_LINEAR, PIECEWISE_CONSTANT,
                        FN, SLICE, RECORD, SAMPLE -> {
                    return;
                }
            }
            current = current.next();
        }
    }

    /** The register, including the effect of a parallelize directive. */
    public Register parseRegister(Builder builder) {
        State state = new State(builder);
        this.readRegister(state);
        this.readPragmas(state);
        return Objects.requireNonNull(state.register);
    }

    public Sequence parseSequence(Builder builder) {
        State state = new State(builder);
        this.readRegister(state);
        this.readSequence(state);
        return state.sequence;
    }

    /** Register and sequence; directives are ignored. */
    public AnalogCircuit parseCircuit(Builder builder) {
        State state = new State(builder);
        this.readRegister(state);
        this.readSequence(state);
        return new AnalogCircuit(Objects.requireNonNull(state.register), state.sequence);
    }

    public CompiledProgram parse(Builder builder) {
        State state = new State(builder);
        this.readRegister(state);
        this.readSequence(state);
        this.readPragmas(state);
        Parameters parameters = new Parameters(state.staticParams, state.batchParams, state.args);
        AnalogCircuit circuit = new AnalogCircuit(Objects.requireNonNull(state.register), state.sequence);
        return new CompiledProgram(builder, circuit, parameters);
    }
}
