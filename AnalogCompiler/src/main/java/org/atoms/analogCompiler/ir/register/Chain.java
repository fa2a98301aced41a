package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;
import org.atoms.util.Utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 'size' sites on the x axis, 'spacing' apart. */
public final class Chain extends AtomArrangement {
    public final int size;
    public final Scalar spacing;

    public Chain(int size, Scalar spacing) {
        Utilities.enforce(size > 0, "Chain must have at least one site");
        this.size = size;
        this.spacing = spacing;
    }

    @Override
    public List<LocationInfo> enumerate() {
        List<LocationInfo> result = new ArrayList<>();
        for (int i = 0; i < this.size; i++)
            result.add(LocationInfo.filled(Scalar.literal(i).mul(this.spacing), Scalar.literal(0)));
        return result;
    }

    @Override
    public int size() {
        return this.size;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Chain(")
                .append(this.size)
                .append(", ")
                .append(this.spacing)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chain that)) return false;
        return this.size == that.size && this.spacing.equals(that.spacing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.size, this.spacing);
    }
}
