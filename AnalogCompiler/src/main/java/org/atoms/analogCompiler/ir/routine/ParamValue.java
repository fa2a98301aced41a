package org.atoms.analogCompiler.ir.routine;

import org.atoms.analogCompiler.compiler.errors.CompilationError;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** The value bound to a parameter: a decimal, or a vector of decimals with one
 * entry per site for per-site weights. */
public final class ParamValue {
    @Nullable
    public final BigDecimal scalar;
    @Nullable
    public final List<BigDecimal> vector;

    private ParamValue(@Nullable BigDecimal scalar, @Nullable List<BigDecimal> vector) {
        this.scalar = scalar;
        this.vector = vector;
    }

    public static ParamValue of(BigDecimal value) {
        return new ParamValue(normalize(value), null);
    }

    public static ParamValue of(List<BigDecimal> values) {
        List<BigDecimal> result = new ArrayList<>();
        for (BigDecimal value: values)
            result.add(normalize(value));
        return new ParamValue(null, List.copyOf(result));
    }

    /** 1 and 1.0 denote the same value. */
    static BigDecimal normalize(BigDecimal value) {
        if (value.signum() == 0)
            return BigDecimal.ZERO;
        return value.stripTrailingZeros();
    }

    /** Convert a value supplied through the builder API.
     * @param value  A Number, or a List of Numbers. */
    public static ParamValue cast(Object value) {
        if (value instanceof ParamValue param)
            return param;
        if (value instanceof Number number)
            return of(toDecimal(number));
        if (value instanceof List<?> list) {
            List<BigDecimal> result = new ArrayList<>();
            for (Object o: list) {
                if (!(o instanceof Number number))
                    throw new CompilationError("Expected a list of numbers, got " + value);
                result.add(toDecimal(number));
            }
            return of(result);
        }
        throw new CompilationError("Cannot assign " + value + ": expected a number or a list of numbers");
    }

    static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal)
            return decimal;
        return new BigDecimal(number.toString());
    }

    public boolean isVector() {
        return this.vector != null;
    }

    public BigDecimal getScalar() {
        return Objects.requireNonNull(this.scalar);
    }

    public List<BigDecimal> getVector() {
        return Objects.requireNonNull(this.vector);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParamValue that)) return false;
        return Objects.equals(this.scalar, that.scalar) && Objects.equals(this.vector, that.vector);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.scalar, this.vector);
    }

    @Override
    public String toString() {
        if (this.scalar != null)
            return this.scalar.toPlainString();
        return Objects.requireNonNull(this.vector).toString();
    }
}
