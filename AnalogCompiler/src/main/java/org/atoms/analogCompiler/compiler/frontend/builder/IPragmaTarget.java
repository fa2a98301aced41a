package org.atoms.analogCompiler.compiler.frontend.builder;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.ir.routine.ParamValue;
import org.atoms.analogCompiler.ir.scalar.Scalar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A builder node after which execution directives can be given. */
public interface IPragmaTarget {
    Builder node();

    /** Bind variables at compile time.
     * @param values  Numbers, or lists of numbers for per-site weights. */
    default AssignBuilder assign(Map<String, ?> values) {
        Map<String, ParamValue> result = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e: values.entrySet())
            result.put(e.getKey(), ParamValue.cast(e.getValue()));
        return new AssignBuilder(this.node(), result);
    }

    /** Run one program variant for each position in the lists.
     * All lists must have the same length. */
    default BatchAssignBuilder batchAssign(Map<String, ? extends List<?>> values) {
        int size = -1;
        for (Map.Entry<String, ? extends List<?>> e: values.entrySet()) {
            if (size < 0)
                size = e.getValue().size();
            else if (size != e.getValue().size())
                throw new CompilationError("Batch assignment lists must have the same length; '" +
                        e.getKey() + "' has " + e.getValue().size() + " values instead of " + size,
                        this.node());
        }
        List<Map<String, ParamValue>> batch = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Map<String, ParamValue> entry = new LinkedHashMap<>();
            for (Map.Entry<String, ? extends List<?>> e: values.entrySet())
                entry.put(e.getKey(), ParamValue.cast(e.getValue().get(i)));
            batch.add(entry);
        }
        return new BatchAssignBuilder(this.node(), BuilderNodeKind.BATCH_ASSIGN, batch);
    }

    /** Run one program variant for each map.  All maps must bind the same names. */
    default BatchAssignBuilder listAssign(List<? extends Map<String, ?>> values) {
        List<Map<String, ParamValue>> batch = new ArrayList<>();
        for (Map<String, ?> map: values) {
            if (!batch.isEmpty() && !batch.get(0).keySet().equals(map.keySet()))
                throw new CompilationError("All batch entries must assign the same names; got " +
                        batch.get(0).keySet() + " and " + map.keySet(), this.node());
            Map<String, ParamValue> entry = new LinkedHashMap<>();
            for (Map.Entry<String, ?> e: map.entrySet())
                entry.put(e.getKey(), ParamValue.cast(e.getValue()));
            batch.add(entry);
        }
        return new BatchAssignBuilder(this.node(), BuilderNodeKind.LIST_ASSIGN, batch);
    }

    /** Variables bound when the program is run, in the order the values are given. */
    default ArgsBuilder args(String... names) {
        return new ArgsBuilder(this.node(), List.of(names));
    }

    /** Replicate the register across the device, copies 'clusterSpacing' apart. */
    default ParallelizeBuilder parallelize(Object clusterSpacing) {
        return new ParallelizeBuilder(this.node(), Scalar.cast(clusterSpacing));
    }
}
