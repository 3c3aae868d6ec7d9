package typesafeschwalbe.cellc.compiler.backend;

import java.util.HashSet;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Target;
import typesafeschwalbe.cellc.compiler.ir.Model;

public class RenderContext {

    public final Target target;
    public final Model model;
    public final String className;
    public final String modelName;
    public final IdentifierTable identifiers;
    public final Transpiler transpiler;
    private final StringBuilder code;

    public RenderContext(
        Target target, Model model, String className, String modelName
    ) throws ErrorException {
        this.target = target;
        this.model = model;
        this.className = className;
        this.modelName = modelName;
        Set<String> reserved = new HashSet<>(target.reservedWords());
        reserved.add(className);
        // macros the skeletons define from the class name
        String guard = ChasteCodeGen.guardOf(className);
        reserved.add(guard + "_HPP_");
        reserved.add(guard + "_STATE_COUNT");
        reserved.add(guard + "_PARAMETER_COUNT");
        this.identifiers = new IdentifierTable(model, reserved);
        this.transpiler = new Transpiler(
            model, this.identifiers, target.operators(), target.targetName()
        );
        this.code = new StringBuilder();
    }

    public StringBuilder code() {
        return this.code;
    }

    public String takeCode() {
        String taken = this.code.toString();
        this.code.setLength(0);
        return taken;
    }

}
