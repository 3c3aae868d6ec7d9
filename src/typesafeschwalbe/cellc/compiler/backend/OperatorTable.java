package typesafeschwalbe.cellc.compiler.backend;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.cellc.compiler.ir.Expression;

// a lower precedence number binds tighter
public class OperatorTable {

    public static record Form(
        Type type,
        String symbol,
        int precedence,
        int arity
    ) {
        public enum Type {
            PREFIX,      // symbol operand
            INFIX,       // left symbol right
            CALL,        // symbol(arguments...)
            CONDITIONAL  // condition ? then : else
        }
    }

    public static final int ATOM_PRECEDENCE = 0;

    public static class Builder {

        private final Map<String, Form> forms = new HashMap<>();

        private Builder() {}

        public Builder prefix(Expression.Operator op, String symbol, int prec) {
            this.forms.put(op.tag, new Form(Form.Type.PREFIX, symbol, prec, 1));
            return this;
        }

        public Builder infix(Expression.Operator op, String symbol, int prec) {
            this.forms.put(op.tag, new Form(Form.Type.INFIX, symbol, prec, 2));
            return this;
        }

        public Builder call(Expression.Operator op, String function) {
            this.forms.put(op.tag, new Form(
                Form.Type.CALL, function, ATOM_PRECEDENCE, op.arity
            ));
            return this;
        }

        public Builder function(String tag, String function, int arity) {
            this.forms.put(tag, new Form(
                Form.Type.CALL, function, ATOM_PRECEDENCE, arity
            ));
            return this;
        }

        public Builder conditional(String tag, int prec) {
            this.forms.put(tag, new Form(Form.Type.CONDITIONAL, "?", prec, 3));
            return this;
        }

        public OperatorTable build() {
            return new OperatorTable(Map.copyOf(this.forms));
        }

    }

    public static Builder builder() {
        return new Builder();
    }

    // macros from <math.h> and <cmath> that a local would silently expand
    public static final Set<String> C_MATH_MACROS = Set.of(
        "NAN", "INFINITY", "HUGE_VAL", "HUGE_VALF", "HUGE_VALL",
        "FP_NAN", "FP_INFINITE", "FP_ZERO", "FP_SUBNORMAL", "FP_NORMAL",
        "FP_FAST_FMA", "FP_FAST_FMAF", "FP_FAST_FMAL", "FP_ILOGB0",
        "FP_ILOGBNAN", "MATH_ERRNO", "MATH_ERREXCEPT", "math_errhandling",
        "M_E", "M_LOG2E", "M_LOG10E", "M_LN2", "M_LN10", "M_PI", "M_PI_2",
        "M_PI_4", "M_1_PI", "M_2_PI", "M_2_SQRTPI", "M_SQRT2", "M_SQRT1_2",
        "isnan", "isinf", "isfinite", "isnormal", "signbit", "fpclassify"
    );

    public static Set<String> withMathMacros(Set<String> words) {
        Set<String> all = new HashSet<>(words);
        all.addAll(OperatorTable.C_MATH_MACROS);
        return Set.copyOf(all);
    }

    public static final OperatorTable C = OperatorTable.builder()
        .prefix(Expression.Operator.NEGATE, "-", 2)
        .prefix(Expression.Operator.PLUS, "+", 2)
        .prefix(Expression.Operator.NOT, "!", 2)
        .infix(Expression.Operator.MULTIPLY, "*", 3)
        .infix(Expression.Operator.DIVIDE, "/", 3)
        .call(Expression.Operator.REMAINDER, "fmod")
        .call(Expression.Operator.POWER, "pow")
        .infix(Expression.Operator.ADD, "+", 4)
        .infix(Expression.Operator.SUBTRACT, "-", 4)
        .infix(Expression.Operator.LESS_THAN, "<", 6)
        .infix(Expression.Operator.GREATER_THAN, ">", 6)
        .infix(Expression.Operator.LESS_THAN_EQUAL, "<=", 6)
        .infix(Expression.Operator.GREATER_THAN_EQUAL, ">=", 6)
        .infix(Expression.Operator.EQUALS, "==", 7)
        .infix(Expression.Operator.NOT_EQUALS, "!=", 7)
        .infix(Expression.Operator.AND, "&&", 11)
        .infix(Expression.Operator.OR, "||", 12)
        .conditional("if", 13)
        .function("exp", "exp", 1)
        .function("log", "log", 1)
        .function("log10", "log10", 1)
        .function("sqrt", "sqrt", 1)
        .function("sin", "sin", 1)
        .function("cos", "cos", 1)
        .function("tan", "tan", 1)
        .function("asin", "asin", 1)
        .function("acos", "acos", 1)
        .function("atan", "atan", 1)
        .function("sinh", "sinh", 1)
        .function("cosh", "cosh", 1)
        .function("tanh", "tanh", 1)
        .function("abs", "fabs", 1)
        .function("floor", "floor", 1)
        .function("ceil", "ceil", 1)
        .build();

    private final Map<String, Form> forms;

    private OperatorTable(Map<String, Form> forms) {
        this.forms = forms;
    }

    public Optional<Form> get(String tag) {
        return Optional.ofNullable(this.forms.get(tag));
    }

}
