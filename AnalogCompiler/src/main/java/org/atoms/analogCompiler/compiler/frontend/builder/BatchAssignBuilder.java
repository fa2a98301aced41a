package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.ir.routine.ParamValue;

import java.util.List;
import java.util.Map;

/** Result of both batchAssign and listAssign: one assignment per program variant. */
public final class BatchAssignBuilder extends PragmaBuilder {
    public final List<Map<String, ParamValue>> batch;

    BatchAssignBuilder(Builder parent, BuilderNodeKind kind, List<Map<String, ParamValue>> batch) {
        super(parent, kind);
        this.batch = List.copyOf(batch);
    }
}
