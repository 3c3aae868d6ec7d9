package typesafeschwalbe.cellc.compiler.backend;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.ir.Variable;
import typesafeschwalbe.cellc.compiler.ordering.EvaluationOrder;

public class ChasteCodeGen implements CodeGen, Emitter.Syntax {

    public static final String MEMBRANE_POTENTIAL = "membrane_potential";
    public static final String CELLULAR_CURRENT = "cellular_current";

    public static final Set<String> RESERVED_WORDS = OperatorTable.withMathMacros(Set.of(
        // C++
        "alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand",
        "bitor", "bool", "break", "case", "catch", "char", "char16_t",
        "char32_t", "class", "compl", "const", "constexpr", "const_cast",
        "continue", "decltype", "default", "delete", "do", "double",
        "dynamic_cast", "else", "enum", "explicit", "export", "extern",
        "false", "float", "for", "friend", "goto", "if", "inline", "int",
        "long", "mutable", "namespace", "new", "noexcept", "not", "not_eq",
        "nullptr", "operator", "or", "or_eq", "private", "protected",
        "public", "register", "reinterpret_cast", "return", "short",
        "signed", "sizeof", "static", "static_assert", "static_cast",
        "struct", "switch", "template", "this", "thread_local", "throw",
        "true", "try", "typedef", "typeid", "typename", "union", "unsigned",
        "using", "virtual", "void", "volatile", "wchar_t", "while", "xor",
        "xor_eq", "NULL", "std", "boost",
        // <cmath>
        "exp", "log", "log10", "sqrt", "pow", "fmod", "fabs", "floor",
        "ceil", "sin", "cos", "tan", "asin", "acos", "atan", "sinh", "cosh",
        "tanh",
        // names used by the skeleton
        "rY", "rDY", "pStateVariables", "pSolver", "pIntracellularStimulus",
        "mStateVariables", "mParameters", "mpSystemInfo", "archive",
        "version", "AbstractCardiacCell", "OdeSystemInformation",
        "PdeSimulationTime"
    ));

    private static final String INDENT = "        ";

    private final RenderContext context;

    public ChasteCodeGen(RenderContext context) {
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
        slots.put("model_name", ChasteCodeGen.singleLine(this.context.modelName));
        StringBuilder literal = new StringBuilder();
        Emitter.emitStringLiteral(this.context.modelName, literal);
        slots.put("model_name_literal", literal.toString());
        slots.put(
            "time", this.context.identifiers.get(this.context.model.time())
        );
        slots.put(
            "state_count", String.valueOf(this.context.model.states().size())
        );
        Variable voltage = bindings.get(MEMBRANE_POTENTIAL);
        slots.put(
            "voltage_index",
            String.valueOf(this.context.model.stateIndex(voltage))
        );
        slots.put("derivative_block", blocks.derivatives());
        slots.put("output_block", blocks.output());
        slots.put("system_info_block", this.systemInfo());
        return slots;
    }

    static String guardOf(String className) {
        StringBuilder guard = new StringBuilder();
        for(int charI = 0; charI < className.length(); charI += 1) {
            char c = className.charAt(charI);
            boolean keep = ('0' <= c && c <= '9')
                || ('A' <= c && c <= 'Z')
                || ('a' <= c && c <= 'z');
            guard.append(keep? Character.toUpperCase(c) : '_');
        }
        return guard.toString();
    }

    static String singleLine(String text) {
        return text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }

    private String systemInfo() {
        StringBuilder out = new StringBuilder();
        for(Variable state: this.context.model.states()) {
            out.append("    this->mVariableNames.push_back(");
            Emitter.emitStringLiteral(state.name(), out);
            out.append(");\n");
            out.append("    this->mVariableUnits.push_back(\"dimensionless\");\n");
            out.append("    this->mInitialConditions.push_back(");
            out.append(Transpiler.formatNumber(state.initialValue().get()));
            out.append(");\n");
        }
        List<Variable> externals = this.context.model.externalParameters();
        for(Variable parameter: externals) {
            out.append("    this->mParameterNames.push_back(");
            Emitter.emitStringLiteral(parameter.name(), out);
            out.append(");\n");
            out.append("    this->mParameterUnits.push_back(\"dimensionless\");\n");
        }
        return out.toString();
    }

    @Override
    public void emitTimeLoad(
        Emitter.Block block, String time, StringBuilder out
    ) {
        // the derivative method receives the time as its argument
        if(block != Emitter.Block.OUTPUT) { return; }
        out.append(INDENT);
        out.append("const double ");
        out.append(time);
        out.append(" = PdeSimulationTime::GetTime();\n");
    }

    @Override
    public void emitStateLoad(
        Emitter.Block block, String name, int stateIndex, StringBuilder out
    ) {
        out.append(INDENT);
        out.append("const double ");
        out.append(name);
        out.append(" = rY[");
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
        out.append(" = this->mParameters[");
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
        out.append("rDY[");
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
