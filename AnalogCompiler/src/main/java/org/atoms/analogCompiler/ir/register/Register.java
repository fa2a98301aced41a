package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.ir.AnalogNode;
import org.atoms.analogCompiler.ir.IOuterNode;

/** The atoms a program runs on: an arrangement, or an arrangement tiled across the device. */
public abstract class Register extends AnalogNode implements IOuterNode {}
