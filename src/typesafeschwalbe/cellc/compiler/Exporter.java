package typesafeschwalbe.cellc.compiler;

import java.util.List;
import java.util.Map;

import typesafeschwalbe.cellc.compiler.backend.CodeGen;
import typesafeschwalbe.cellc.compiler.backend.RenderContext;
import typesafeschwalbe.cellc.compiler.backend.RoleBindings;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ordering.DependencyResolver;
import typesafeschwalbe.cellc.compiler.ordering.EvaluationOrder;
import typesafeschwalbe.cellc.compiler.template.TemplateRenderer;

public class Exporter {

    public static record Output(String fileName, String code) {}

    public static boolean isValidClassName(String className) {
        if(className.isEmpty()) { return false; }
        char first = className.charAt(0);
        if('0' <= first && first <= '9') { return false; }
        for(int charI = 0; charI < className.length(); charI += 1) {
            char c = className.charAt(charI);
            boolean legal = ('0' <= c && c <= '9')
                || ('A' <= c && c <= 'Z')
                || ('a' <= c && c <= 'z')
                || c == '_';
            if(!legal) { return false; }
        }
        return true;
    }

    public static Result<Output> export(
        Model model, Target target, String className
    ) {
        return Exporter.export(model, target, className, model.name());
    }

    public static Result<Output> export(
        Model model, Target target, String className, String modelName
    ) {
        try {
            return Result.ofValue(
                Exporter.exportOrThrow(model, target, className, modelName)
            );
        } catch(ErrorException e) {
            return Result.ofError(e.error.withModel(model.name()));
        }
    }

    public static Output exportOrThrow(
        Model model, Target target, String className, String modelName
    ) throws ErrorException {
        if(!Exporter.isValidClassName(className)
                || target.reservedWords().contains(className)) {
            throw new ErrorException(new Error(
                Error.Kind.INVALID_ARGUMENT,
                "'" + className + "' is not a valid class name for the target '"
                    + target.targetName() + "'",
                List.of(className)
            ));
        }
        RoleBindings bindings = RoleBindings.bind(model, target);
        EvaluationOrder order = new DependencyResolver(model).resolve();
        RenderContext context = new RenderContext(
            target, model, className, modelName
        );
        CodeGen codeGen = target.codeGen().create(context);
        Map<String, String> slots = codeGen.generate(order, bindings);
        String code = TemplateRenderer.render(target.skeleton(), slots);
        return new Output(className + target.fileExtension(), code);
    }

}
