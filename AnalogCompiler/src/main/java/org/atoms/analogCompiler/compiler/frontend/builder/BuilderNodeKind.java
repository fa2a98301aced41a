package org.atoms.analogCompiler.compiler.frontend.builder;

/** The kind of each node of a builder chain. */
public enum BuilderNodeKind {
    REGISTER,
    SEQUENCE,
    // level couplings
    RYDBERG,
    HYPERFINE,
    // fields
    DETUNING,
    RABI,
    RABI_AMPLITUDE,
    RABI_PHASE,
    // spatial modulations
    LOCATION,
    UNIFORM,
    SCALE,
    // waveform primitives
    LINEAR,
    CONSTANT,
    POLY,
    PIECEWISE_LINEAR,
    PIECEWISE_CONSTANT,
    FN,
    // waveform transforms
    SLICE,
    RECORD,
    SAMPLE,
    // pragmas
    ASSIGN,
    BATCH_ASSIGN,
    LIST_ASSIGN,
    ARGS,
    PARALLELIZE
}
