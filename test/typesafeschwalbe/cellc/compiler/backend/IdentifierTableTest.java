package typesafeschwalbe.cellc.compiler.backend;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Model;

/** Tests {@link IdentifierTable} */
public class IdentifierTableTest {

    @Test
    public void testSanitize() {
        Assert.assertEquals("I_Na_fast", IdentifierTable.sanitize("I_Na,fast"));
        Assert.assertEquals("V", IdentifierTable.sanitize("V"));
        Assert.assertEquals("v_2x", IdentifierTable.sanitize("2x"));
        Assert.assertEquals("v_", IdentifierTable.sanitize(""));
        Assert.assertEquals("g_K1_", IdentifierTable.sanitize("g K1."));
    }

    @Test
    public void testCollisionsGetSuffixes() throws ErrorException {
        Model model = Model.builder("m")
            .time("t")
            .externalParameter("I_Na,fast")
            .externalParameter("I_Na fast")
            .externalParameter("I_Na_fast")
            .build();
        IdentifierTable table = new IdentifierTable(model, Set.of());
        Assert.assertEquals(
            "I_Na_fast", table.get(model.variable("I_Na,fast").get())
        );
        Assert.assertEquals(
            "I_Na_fast_2", table.get(model.variable("I_Na fast").get())
        );
        Assert.assertEquals(
            "I_Na_fast_3", table.get(model.variable("I_Na_fast").get())
        );
    }

    @Test
    public void testReservedWordsAreAvoided() throws ErrorException {
        Model model = Model.builder("m")
            .time("time")
            .externalParameter("double")
            .externalParameter("rY")
            .build();
        IdentifierTable table = new IdentifierTable(
            model, ChasteCodeGen.RESERVED_WORDS
        );
        Assert.assertEquals("time", table.get(model.time()));
        Assert.assertEquals(
            "double_2", table.get(model.variable("double").get())
        );
        Assert.assertEquals("rY_2", table.get(model.variable("rY").get()));
    }

    @Test
    public void testStableAcrossTables() throws ErrorException {
        Model model = Model.builder("m")
            .time("t")
            .externalParameter("a.b")
            .externalParameter("a_b")
            .build();
        IdentifierTable first = new IdentifierTable(model, Set.of());
        IdentifierTable second = new IdentifierTable(model, Set.of());
        // rewriting in a different order must not change the assignment
        Assert.assertEquals(
            second.rewrite(model.variable("a_b").get()),
            first.get(model.variable("a_b").get())
        );
        Assert.assertEquals("a_b_2", first.get(model.variable("a_b").get()));
    }

    @Test
    public void testMathMacrosAreAvoided() throws ErrorException {
        Model model = Model.builder("m")
            .time("t")
            .externalParameter("M_PI")
            .externalParameter("INFINITY")
            .build();
        IdentifierTable table = new IdentifierTable(
            model, AnsiCCodeGen.RESERVED_WORDS
        );
        Assert.assertEquals("M_PI_2", table.get(model.variable("M_PI").get()));
        Assert.assertEquals(
            "INFINITY_2", table.get(model.variable("INFINITY").get())
        );
    }

    @Test
    public void testSuffixesRunOut() throws ErrorException {
        Model model = Model.builder("m")
            .time("t")
            .externalParameter("x")
            .build();
        Set<String> reserved = new HashSet<>();
        reserved.add("x");
        for(int suffix = 2; suffix <= 9999; suffix += 1) {
            reserved.add("x_" + suffix);
        }
        try {
            new IdentifierTable(model, reserved);
            Assert.fail("expected the suffixes to run out");
        } catch(ErrorException e) {
            Assert.assertEquals(
                Error.Kind.IDENTIFIER_COLLISION, e.error.kind()
            );
            Assert.assertEquals(List.of("x"), e.error.subjects());
        }
    }

}
