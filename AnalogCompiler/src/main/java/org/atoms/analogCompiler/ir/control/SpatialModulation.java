package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.ir.AnalogNode;
import org.atoms.analogCompiler.ir.IOuterNode;

/** Describes which sites of the register a drive applies to, and with what weight.
 * Spatial modulations are the keys of a {@link Field}. */
public abstract class SpatialModulation extends AnalogNode implements IOuterNode {}
