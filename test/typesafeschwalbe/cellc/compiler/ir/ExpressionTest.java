package typesafeschwalbe.cellc.compiler.ir;

import org.junit.Assert;
import org.junit.Test;

import typesafeschwalbe.cellc.compiler.Source;

/** Tests {@link Expression} */
public class ExpressionTest {

    @Test
    public void testEqualityIgnoresSource() {
        Expression a = Expression.binary(
            Expression.Operator.ADD,
            Expression.reference("x"), Expression.number(2.0)
        );
        Expression b = Expression.binary(
            Expression.Operator.ADD,
            Expression.reference("x"), Expression.number(2.0)
        ).at(new Source("m.cell", 0, 5));
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertTrue(b.source.isPresent());
        Assert.assertFalse(a.source.isPresent());
    }

    @Test
    public void testToString() {
        Expression e = Expression.call(
            "exp",
            Expression.unary(
                Expression.Operator.NEGATE, Expression.reference("V")
            )
        );
        Assert.assertEquals("exp(negate(V))", e.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnaryRejectsBinaryOperator() {
        Expression.unary(Expression.Operator.ADD, Expression.number(1.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBinaryRejectsUnaryOperator() {
        Expression.binary(
            Expression.Operator.NOT,
            Expression.number(1.0), Expression.number(2.0)
        );
    }

}
