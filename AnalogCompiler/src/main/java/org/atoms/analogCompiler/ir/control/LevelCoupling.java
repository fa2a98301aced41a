package org.atoms.analogCompiler.ir.control;

/** The atomic transition addressed by a pulse. */
public enum LevelCoupling {
    RYDBERG("rydberg"),
    HYPERFINE("hyperfine");

    public final String label;

    LevelCoupling(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return this.label;
    }
}
