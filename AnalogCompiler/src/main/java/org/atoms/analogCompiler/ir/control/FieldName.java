package org.atoms.analogCompiler.ir.control;

/** The physical quantity driven by a field. */
public enum FieldName {
    DETUNING("detuning"),
    RABI_AMPLITUDE("rabi_frequency_amplitude"),
    RABI_PHASE("rabi_frequency_phase");

    public final String label;

    FieldName(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return this.label;
    }
}
