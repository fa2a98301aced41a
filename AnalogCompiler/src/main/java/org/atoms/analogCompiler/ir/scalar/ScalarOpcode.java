package org.atoms.analogCompiler.ir.scalar;

public enum ScalarOpcode {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MIN("min"),
    MAX("max");

    private final String text;

    ScalarOpcode(String text) {
        this.text = text;
    }

    public boolean isFunction() {
        return this == MIN || this == MAX;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
