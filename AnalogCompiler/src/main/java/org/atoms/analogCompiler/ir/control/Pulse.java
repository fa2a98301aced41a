package org.atoms.analogCompiler.ir.control;

import org.atoms.analogCompiler.compiler.visitors.VisitDecision;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.ir.AnalogNode;
import org.atoms.analogCompiler.ir.IOuterNode;
import org.atoms.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The fields applied on one level coupling. */
public final class Pulse extends AnalogNode implements IOuterNode {
    public final Map<FieldName, Field> fields;

    public Pulse(Map<FieldName, Field> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Pulse() {
        this(new LinkedHashMap<>());
    }

    @Nullable
    public Field getField(FieldName name) {
        return this.fields.get(name);
    }

    /** A pulse identical to this one, except that 'name' maps to 'field'. */
    public Pulse with(FieldName name, Field field) {
        Map<FieldName, Field> result = new LinkedHashMap<>(this.fields);
        result.put(name, field);
        return new Pulse(result);
    }

    @Override
    public void accept(AnalogCircuitVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Field field: this.fields.values())
            field.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("Pulse({").increase();
        for (Map.Entry<FieldName, Field> e: this.fields.entrySet()) {
            builder.append(e.getKey().toString())
                    .append(": ")
                    .append(e.getValue())
                    .newline();
        }
        return builder.decrease().append("})");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pulse that)) return false;
        return this.fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return this.fields.hashCode();
    }
}
