package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.control.FieldName;

/** A builder node after which a field can be selected. */
public interface IFieldTarget {
    Builder node();

    default FieldBuilder detuning() {
        return new FieldBuilder(this.node(), FieldName.DETUNING);
    }

    default RabiBuilder rabi() {
        return new RabiBuilder(this.node());
    }
}
