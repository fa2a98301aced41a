package org.atoms.analogCompiler.ir.waveform;

/** How a sampled waveform is reconstructed between samples. */
public enum Interpolation {
    LINEAR,
    CONSTANT
}
