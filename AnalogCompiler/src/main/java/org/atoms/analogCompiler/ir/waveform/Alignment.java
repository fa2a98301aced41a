package org.atoms.analogCompiler.ir.waveform;

/** Which end of a waveform is kept when it is aligned with others. */
public enum Alignment {
    LEFT,
    RIGHT
}
