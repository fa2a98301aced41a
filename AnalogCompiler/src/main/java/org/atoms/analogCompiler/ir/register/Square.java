package org.atoms.analogCompiler.ir.register;

import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.util.IIndentStream;
import org.atoms.util.Utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A 'size' x 'size' grid of sites, 'spacing' apart, enumerated column by column. */
public final class Square extends AtomArrangement {
    public final int size;
    public final Scalar spacing;

    public Square(int size, Scalar spacing) {
        Utilities.enforce(size > 0, "Square must have at least one site");
        this.size = size;
        this.spacing = spacing;
    }

    @Override
    public List<LocationInfo> enumerate() {
        List<LocationInfo> result = new ArrayList<>();
        for (int i = 0; i < this.size; i++)
            for (int j = 0; j < this.size; j++)
                result.add(LocationInfo.filled(
                        Scalar.literal(i).mul(this.spacing),
                        Scalar.literal(j).mul(this.spacing)));
        return result;
    }

    @Override
    public int size() {
        return this.size * this.size;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Square(")
                .append(this.size)
                .append(", ")
                .append(this.spacing)
                .append(")");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Square that)) return false;
        return this.size == that.size && this.spacing.equals(that.spacing);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.size, this.spacing);
    }
}
