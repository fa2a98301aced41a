package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.routine.ParamValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class AssignBuilder extends PragmaBuilder {
    public final Map<String, ParamValue> values;

    AssignBuilder(Builder parent, Map<String, ParamValue> values) {
        super(parent, BuilderNodeKind.ASSIGN);
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
