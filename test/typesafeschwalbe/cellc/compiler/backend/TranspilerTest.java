package typesafeschwalbe.cellc.compiler.backend;

import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Expression;
import typesafeschwalbe.cellc.compiler.ir.Model;

/** Tests {@link Transpiler} with the C operator table */
public class TranspilerTest {

    private Model model;
    private Transpiler transpiler;

    private static Expression ref(String name) {
        return Expression.reference(name);
    }

    private static Expression num(double value) {
        return Expression.number(value);
    }

    private static Expression bin(
        Expression.Operator op, Expression left, Expression right
    ) {
        return Expression.binary(op, left, right);
    }

    @Before
    public void setUp() throws ErrorException {
        this.model = Model.builder("m")
            .time("t")
            .externalParameter("a")
            .externalParameter("b")
            .externalParameter("c")
            .externalParameter("I_Na,fast")
            .build();
        this.transpiler = new Transpiler(
            this.model, new IdentifierTable(this.model, Set.of()),
            OperatorTable.C, "c-test"
        );
    }

    private String transpile(Expression expression) throws ErrorException {
        return this.transpiler.transpile(expression);
    }

    @Test
    public void testNumberFormat() {
        Assert.assertEquals("1.0", Transpiler.formatNumber(1.0));
        Assert.assertEquals("-85.0", Transpiler.formatNumber(-85.0));
        Assert.assertEquals("0.001", Transpiler.formatNumber(1e-3));
        Assert.assertEquals(
            "100000000000000000000.0", Transpiler.formatNumber(1e20)
        );
        Assert.assertEquals("0.0", Transpiler.formatNumber(0.0));
        Assert.assertEquals("-0.0", Transpiler.formatNumber(-0.0));
        Assert.assertEquals("(0.0 / 0.0)", Transpiler.formatNumber(Double.NaN));
        Assert.assertEquals(
            "(1.0 / 0.0)", Transpiler.formatNumber(Double.POSITIVE_INFINITY)
        );
        Assert.assertEquals(
            "(-1.0 / 0.0)", Transpiler.formatNumber(Double.NEGATIVE_INFINITY)
        );
    }

    @Test
    public void testParenthesesFollowPrecedence() throws ErrorException {
        Expression.Operator add = Expression.Operator.ADD;
        Expression.Operator sub = Expression.Operator.SUBTRACT;
        Expression.Operator mul = Expression.Operator.MULTIPLY;
        Expression.Operator div = Expression.Operator.DIVIDE;
        Assert.assertEquals(
            "a * (b + c)",
            this.transpile(bin(mul, ref("a"), bin(add, ref("b"), ref("c"))))
        );
        Assert.assertEquals(
            "a * b + c",
            this.transpile(bin(add, bin(mul, ref("a"), ref("b")), ref("c")))
        );
        Assert.assertEquals(
            "a - b - c",
            this.transpile(bin(sub, bin(sub, ref("a"), ref("b")), ref("c")))
        );
        Assert.assertEquals(
            "a - (b - c)",
            this.transpile(bin(sub, ref("a"), bin(sub, ref("b"), ref("c"))))
        );
        Assert.assertEquals(
            "a / (b * c)",
            this.transpile(bin(div, ref("a"), bin(mul, ref("b"), ref("c"))))
        );
        Assert.assertEquals(
            "-(a + b)",
            this.transpile(Expression.unary(
                Expression.Operator.NEGATE, bin(add, ref("a"), ref("b"))
            ))
        );
        Assert.assertEquals(
            "-(-1.0)",
            this.transpile(Expression.unary(
                Expression.Operator.NEGATE, num(-1.0)
            ))
        );
        Assert.assertEquals(
            "-1.0 * a", this.transpile(bin(mul, num(-1.0), ref("a")))
        );
        Assert.assertEquals(
            "a - -1.0", this.transpile(bin(sub, ref("a"), num(-1.0)))
        );
    }

    @Test
    public void testFunctionsAndConditional() throws ErrorException {
        Assert.assertEquals(
            "pow(a + b, 2.0)",
            this.transpile(bin(
                Expression.Operator.POWER,
                bin(Expression.Operator.ADD, ref("a"), ref("b")), num(2.0)
            ))
        );
        Assert.assertEquals(
            "fmod(a, b)",
            this.transpile(bin(Expression.Operator.REMAINDER, ref("a"), ref("b")))
        );
        Assert.assertEquals(
            "fabs(exp(-a))",
            this.transpile(Expression.call(
                "abs",
                Expression.call(
                    "exp", Expression.unary(Expression.Operator.NEGATE, ref("a"))
                )
            ))
        );
        Assert.assertEquals(
            "a < b ? 1.0 : c",
            this.transpile(Expression.call(
                "if",
                bin(Expression.Operator.LESS_THAN, ref("a"), ref("b")),
                num(1.0), ref("c")
            ))
        );
        Assert.assertEquals(
            "a && (b || c)",
            this.transpile(bin(
                Expression.Operator.AND, ref("a"),
                bin(Expression.Operator.OR, ref("b"), ref("c"))
            ))
        );
    }

    @Test
    public void testReferencesAreRewritten() throws ErrorException {
        Assert.assertEquals("I_Na_fast * t", this.transpile(bin(
            Expression.Operator.MULTIPLY, ref("I_Na,fast"), ref("t")
        )));
    }

    @Test
    public void testUnboundReference() {
        try {
            this.transpile(bin(Expression.Operator.ADD, ref("a"), ref("zzz")));
            Assert.fail("expected an unbound reference");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.UNBOUND_REFERENCE, e.error.kind());
            Assert.assertEquals(List.of("zzz"), e.error.subjects());
        }
    }

    @Test
    public void testUnsupportedOperator() {
        try {
            this.transpile(Expression.call("erf", ref("a")));
            Assert.fail("expected an unsupported operator");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.UNSUPPORTED_OPERATOR, e.error.kind());
            Assert.assertEquals(List.of("erf", "c-test"), e.error.subjects());
        }
        try {
            this.transpile(Expression.call("exp", ref("a"), ref("b")));
            Assert.fail("expected an arity mismatch");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.UNSUPPORTED_OPERATOR, e.error.kind());
            Assert.assertEquals(List.of("exp", "c-test"), e.error.subjects());
        }
    }

    @Test
    public void testRestrictedTable() throws ErrorException {
        OperatorTable restricted = OperatorTable.builder()
            .infix(Expression.Operator.ADD, "+", 4)
            .build();
        Transpiler limited = new Transpiler(
            this.model, new IdentifierTable(this.model, Set.of()),
            restricted, "tiny"
        );
        Assert.assertEquals(
            "a + 1.0",
            limited.transpile(bin(Expression.Operator.ADD, ref("a"), num(1.0)))
        );
        try {
            limited.transpile(bin(Expression.Operator.POWER, ref("a"), num(2.0)));
            Assert.fail("expected an unsupported operator");
        } catch(ErrorException e) {
            Assert.assertEquals(List.of("power", "tiny"), e.error.subjects());
        }
    }

}
