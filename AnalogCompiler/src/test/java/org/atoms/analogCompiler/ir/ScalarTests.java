package org.atoms.analogCompiler.ir;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.compiler.errors.EvaluationError;
import org.atoms.analogCompiler.ir.scalar.Literal;
import org.atoms.analogCompiler.ir.scalar.Scalar;
import org.atoms.analogCompiler.ir.scalar.Variable;
import org.junit.Assert;
import org.junit.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Unit tests for symbolic scalars */
public class ScalarTests {
    static void assertValue(String expected, BigDecimal actual) {
        Assert.assertEquals(0, new BigDecimal(expected).compareTo(actual));
    }

    @Test
    public void testLiteralNormalization() {
        Assert.assertEquals(Scalar.literal(1), Scalar.cast(1.0));
        Assert.assertEquals(Scalar.literal(0), Scalar.cast(new BigDecimal("0.000")));
        Assert.assertEquals(Scalar.literal(1).hashCode(), Scalar.cast(new BigDecimal("1.00")).hashCode());
        Assert.assertEquals("2.5", Scalar.cast(2.50).toString());
    }

    @Test
    public void testCast() {
        Assert.assertTrue(Scalar.cast(3) instanceof Literal);
        Assert.assertTrue(Scalar.cast("x") instanceof Variable);
        Scalar scalar = Scalar.var("y");
        Assert.assertSame(scalar, Scalar.cast(scalar));
        Assert.assertThrows(CompilationError.class, () -> Scalar.cast(null));
        Assert.assertThrows(CompilationError.class, () -> Scalar.cast(List.of(1)));
    }

    @Test
    public void testArithmetic() {
        Scalar expression = Scalar.var("a").add(Scalar.literal(2)).mul(Scalar.var("b"));
        assertValue("9", expression.eval(Map.of("a", BigDecimal.ONE, "b", new BigDecimal(3))));
        assertValue("-4", Scalar.literal(4).negate().eval());
        assertValue("0.5", Scalar.literal(1).div(Scalar.literal(2)).eval());
        assertValue("2", Scalar.literal(5).sub(Scalar.literal(3)).eval());
        assertValue("3", Scalar.literal(3).max(Scalar.literal(-1)).eval());
        assertValue("-1", Scalar.literal(3).min(Scalar.literal(-1)).eval());
    }

    @Test
    public void testVariables() {
        Scalar expression = Scalar.var("a").add(Scalar.literal(2)).mul(Scalar.var("b").sub(Scalar.var("a")));
        Assert.assertEquals(List.of("a", "b"), List.copyOf(expression.variables()));
        Assert.assertTrue(Scalar.literal(3).variables().isEmpty());
        Assert.assertFalse(expression.isLiteral());
        Assert.assertTrue(Scalar.literal(3).isLiteral());
    }

    @Test
    public void testEvaluationErrors() {
        Assert.assertThrows(EvaluationError.class, () -> Scalar.var("missing").eval());
        Assert.assertThrows(EvaluationError.class,
                () -> Scalar.literal(1).div(Scalar.literal(0)).eval());
    }
}
