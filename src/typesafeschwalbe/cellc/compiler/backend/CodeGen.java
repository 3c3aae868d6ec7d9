package typesafeschwalbe.cellc.compiler.backend;

import java.util.Map;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ordering.EvaluationOrder;

public interface CodeGen {

    @FunctionalInterface
    public static interface Constructor {
        CodeGen create(RenderContext context);
    }

    Map<String, String> generate(
        EvaluationOrder order, RoleBindings bindings
    ) throws ErrorException;

}
