package typesafeschwalbe.cellc.compiler.backend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Variable;
import typesafeschwalbe.cellc.compiler.ordering.EvaluationOrder;

public class AnsiCCodeGen implements CodeGen, Emitter.Syntax {

    public static final String CELLULAR_CURRENT = "cellular_current";

    public static final Set<String> RESERVED_WORDS = OperatorTable.withMathMacros(Set.of(
        // C99
        "auto", "break", "case", "char", "const", "continue", "default",
        "do", "double", "else", "enum", "extern", "float", "for", "goto",
        "if", "inline", "int", "long", "register", "restrict", "return",
        "short", "signed", "sizeof", "static", "struct", "switch",
        "typedef", "union", "unsigned", "void", "volatile", "while",
        "_Bool", "_Complex", "_Imaginary", "NULL",
        // <math.h>
        "exp", "log", "log10", "sqrt", "pow", "fmod", "fabs", "floor",
        "ceil", "sin", "cos", "tan", "asin", "acos", "atan", "sinh", "cosh",
        "tanh",
        // names used by the skeleton
        "state", "parameters", "derivatives"
    ));

    private static final String INDENT = "    ";

    private final RenderContext context;

    public AnsiCCodeGen(RenderContext context) {
        this.context = context;
    }

    @Override
    public Map<String, String> generate(
        EvaluationOrder order, RoleBindings bindings
    ) throws ErrorException {
        Emitter.Blocks blocks = new Emitter(this.context, this)
            .emit(order, bindings);
        Map<String, String> slots = new HashMap<>();
        slots.put("class_name", this.context.className);
        slots.put("class_guard", ChasteCodeGen.guardOf(this.context.className));
        slots.put(
            "model_name",
            ChasteCodeGen.singleLine(this.context.modelName)
                .replace("*/", "* /")
        );
        slots.put(
            "time", this.context.identifiers.get(this.context.model.time())
        );
        List<Variable> states = this.context.model.states();
        slots.put("state_count", String.valueOf(states.size()));
        slots.put(
            "parameter_count",
            String.valueOf(this.context.model.externalParameters().size())
        );
        StringBuilder initial = new StringBuilder();
        for(int stateI = 0; stateI < states.size(); stateI += 1) {
            initial.append(INDENT);
            initial.append("state[");
            initial.append(stateI);
            initial.append("] = ");
            initial.append(Transpiler.formatNumber(
                states.get(stateI).initialValue().get()
            ));
            initial.append(";\n");
        }
        slots.put("initial_state_block", initial.toString());
        slots.put("derivative_block", blocks.derivatives());
        slots.put("output_block", blocks.output());
        return slots;
    }

    @Override
    public void emitTimeLoad(
        Emitter.Block block, String time, StringBuilder out
    ) {
        // both functions take the time as an argument
    }

    @Override
    public void emitStateLoad(
        Emitter.Block block, String name, int stateIndex, StringBuilder out
    ) {
        out.append(INDENT);
        out.append("const double ");
        out.append(name);
        out.append(" = state[");
        out.append(stateIndex);
        out.append("];\n");
    }

    @Override
    public void emitParameterLoad(
        String name, int parameterIndex, StringBuilder out
    ) {
        out.append(INDENT);
        out.append("const double ");
        out.append(name);
        out.append(" = parameters[");
        out.append(parameterIndex);
        out.append("];\n");
    }

    @Override
    public void emitLocal(String name, String value, StringBuilder out) {
        out.append(INDENT);
        out.append("const double ");
        out.append(name);
        out.append(" = ");
        out.append(value);
        out.append(";\n");
    }

    @Override
    public void emitDerivative(int stateIndex, String value, StringBuilder out) {
        out.append(INDENT);
        out.append("derivatives[");
        out.append(stateIndex);
        out.append("] = ");
        out.append(value);
        out.append(";\n");
    }

    @Override
    public void emitOutput(String value, StringBuilder out) {
        out.append(INDENT);
        out.append("return ");
        out.append(value);
        out.append(";\n");
    }

}
