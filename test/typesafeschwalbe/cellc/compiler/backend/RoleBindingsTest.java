package typesafeschwalbe.cellc.compiler.backend;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.TargetRegistry;
import typesafeschwalbe.cellc.compiler.ir.Expression;
import typesafeschwalbe.cellc.compiler.ir.Model;

/** Tests {@link RoleBindings} against the chaste role table */
public class RoleBindingsTest {

    private static Model.Builder cell() throws ErrorException {
        return Model.builder("cell")
            .time("t")
            .intermediate("I", Expression.reference("V"))
            .state("V", -80.0, Expression.reference("I"));
    }

    @Test
    public void testBinds() throws ErrorException {
        Model model = cell()
            .label("V", ChasteCodeGen.MEMBRANE_POTENTIAL)
            .label("I", ChasteCodeGen.CELLULAR_CURRENT)
            .build();
        RoleBindings bindings = RoleBindings.bind(
            model, TargetRegistry.chaste()
        );
        Assert.assertEquals(
            "V", bindings.get(ChasteCodeGen.MEMBRANE_POTENTIAL).name()
        );
        Assert.assertEquals("I", bindings.output().name());
    }

    @Test
    public void testMissingRole() throws ErrorException {
        Model model = cell()
            .label("I", ChasteCodeGen.CELLULAR_CURRENT)
            .build();
        try {
            RoleBindings.bind(model, TargetRegistry.chaste());
            Assert.fail("expected a missing role");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.MISSING_ROLE, e.error.kind());
            Assert.assertEquals(
                List.of(ChasteCodeGen.MEMBRANE_POTENTIAL), e.error.subjects()
            );
        }
    }

    @Test
    public void testWrongRole() throws ErrorException {
        // the membrane potential has to be a state
        Model model = cell()
            .label("I", ChasteCodeGen.MEMBRANE_POTENTIAL)
            .label("V", ChasteCodeGen.CELLULAR_CURRENT)
            .build();
        try {
            RoleBindings.bind(model, TargetRegistry.chaste());
            Assert.fail("expected a missing role");
        } catch(ErrorException e) {
            Assert.assertEquals(Error.Kind.MISSING_ROLE, e.error.kind());
            Assert.assertEquals(
                List.of(ChasteCodeGen.MEMBRANE_POTENTIAL, "I"),
                e.error.subjects()
            );
        }
    }

    @Test
    public void testAnsiCNeedsOnlyTheCurrent() throws ErrorException {
        Model model = cell()
            .label("I", AnsiCCodeGen.CELLULAR_CURRENT)
            .build();
        Assert.assertEquals(
            "I", RoleBindings.bind(model, TargetRegistry.ansiC()).output().name()
        );
    }

}
