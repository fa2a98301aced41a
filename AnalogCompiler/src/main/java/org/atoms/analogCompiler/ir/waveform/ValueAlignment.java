package org.atoms.analogCompiler.ir.waveform;

/** Padding value of an aligned waveform taken from one of its ends. */
public enum ValueAlignment {
    LEFT,
    RIGHT
}
