package typesafeschwalbe.cellc.compiler.ir;

import java.util.List;
import java.util.Optional;

import org.junit.Assert;
import org.junit.Test;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;

/** Tests {@link Model} construction and queries */
public class ModelTest {

    private static Expression ref(String name) {
        return Expression.reference(name);
    }

    private static Model.Builder toy() throws ErrorException {
        return Model.builder("toy")
            .time("t")
            .parameter("C", Expression.number(1.0))
            .externalParameter("g")
            .intermediate("I", Expression.binary(
                Expression.Operator.MULTIPLY, ref("g"), ref("V")
            ))
            .state("V", -85.0, Expression.binary(
                Expression.Operator.DIVIDE,
                Expression.unary(Expression.Operator.NEGATE, ref("I")),
                ref("C")
            ));
    }

    private static Error.Kind buildFailure(Model.Builder builder) {
        try {
            builder.build();
        } catch(ErrorException e) {
            return e.error.kind();
        }
        Assert.fail("expected the model to be rejected");
        return null;
    }

    @Test
    public void testQueries() throws ErrorException {
        Model model = toy().label("V", "membrane_potential").build();
        Assert.assertEquals("toy", model.name());
        Assert.assertEquals(5, model.variables().size());
        Assert.assertEquals("t", model.time().name());
        Assert.assertEquals(List.of(model.variable("V").get()), model.states());
        Assert.assertEquals(0, model.stateIndex(model.variable("V").get()));
        Assert.assertEquals(
            List.of(model.variable("g").get()), model.externalParameters()
        );
        Assert.assertEquals(
            List.of(model.variable("V").get()),
            model.variablesLabelled("membrane_potential")
        );
        Assert.assertTrue(model.variablesLabelled("cellular_current").isEmpty());
        Assert.assertFalse(model.variable("missing").isPresent());
        Assert.assertTrue(model.variable("C").get().isComputed());
        Assert.assertTrue(model.variable("I").get().isComputed());
        Assert.assertFalse(model.variable("g").get().isComputed());
        Assert.assertTrue(model.variable("g").get().isExternalParameter());
        Assert.assertEquals(4, model.variable("V").get().index());
    }

    @Test
    public void testReferencesInFirstUseOrder() throws ErrorException {
        Model model = toy().build();
        Expression expr = Expression.binary(
            Expression.Operator.ADD,
            Expression.call("exp", ref("V")),
            Expression.binary(Expression.Operator.MULTIPLY, ref("g"), ref("V"))
        );
        Assert.assertEquals(
            List.of(model.variable("V").get(), model.variable("g").get()),
            List.copyOf(model.references(expr))
        );
    }

    @Test
    public void testUnboundReference() throws ErrorException {
        Model model = toy().build();
        try {
            model.references(ref("nowhere"));
            Assert.fail("expected an unbound reference");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.UNBOUND_REFERENCE, e.error.kind());
            Assert.assertEquals(List.of("nowhere"), e.error.subjects());
        }
    }

    @Test
    public void testDuplicateName() throws ErrorException {
        Model.Builder builder = toy();
        try {
            builder.externalParameter("V");
            Assert.fail("expected a duplicate to be rejected");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.INVALID_MODEL, e.error.kind());
        }
    }

    @Test
    public void testTimeRole() throws ErrorException {
        Assert.assertEquals(
            Error.Kind.MISSING_ROLE,
            buildFailure(Model.builder("no time")
                .externalParameter("g"))
        );
        Assert.assertEquals(
            Error.Kind.AMBIGUOUS_ROLE,
            buildFailure(toy().time("t2"))
        );
        Assert.assertEquals(
            Error.Kind.INVALID_MODEL,
            buildFailure(Model.builder("defined time").add(
                "t", Variable.Role.TIME, Optional.empty(),
                Optional.of(Expression.number(0.0)), Optional.empty()
            ))
        );
    }

    @Test
    public void testStateAndIntermediateRequirements() throws ErrorException {
        Assert.assertEquals(
            Error.Kind.INVALID_MODEL,
            buildFailure(Model.builder("m").time("t").add(
                "V", Variable.Role.STATE, Optional.empty(),
                Optional.of(Expression.number(0.0)), Optional.empty()
            ))
        );
        Assert.assertEquals(
            Error.Kind.INVALID_MODEL,
            buildFailure(Model.builder("m").time("t").add(
                "V", Variable.Role.STATE, Optional.of(1.0),
                Optional.empty(), Optional.empty()
            ))
        );
        Assert.assertEquals(
            Error.Kind.INVALID_MODEL,
            buildFailure(Model.builder("m").time("t").add(
                "x", Variable.Role.INTERMEDIATE, Optional.empty(),
                Optional.empty(), Optional.empty()
            ))
        );
        Assert.assertEquals(
            Error.Kind.INVALID_MODEL,
            buildFailure(Model.builder("m").time("t").add(
                "p", Variable.Role.PARAMETER, Optional.of(1.0),
                Optional.empty(), Optional.empty()
            ))
        );
    }

    @Test
    public void testLabelCarriedTwice() throws ErrorException {
        Model.Builder builder = toy()
            .label("I", "cellular_current")
            .label("V", "cellular_current");
        try {
            builder.build();
            Assert.fail("expected the label to be ambiguous");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.AMBIGUOUS_ROLE, e.error.kind());
            Assert.assertEquals(List.of("I", "V"), e.error.subjects());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLabelUnknownVariable() throws ErrorException {
        toy().label("nobody", "membrane_potential");
    }

}
