package typesafeschwalbe.cellc.compiler.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import typesafeschwalbe.cellc.compiler.Source;

public class Expression {

    public static record Number(
        double value
    ) {}

    public static record Reference(
        String variableName
    ) {}

    public static record UnaryOperation(
        Operator operator,
        Expression operand
    ) {}

    public static record BinaryOperation(
        Operator operator,
        Expression left,
        Expression right
    ) {}

    public static record Call(
        String function,
        List<Expression> arguments
    ) {}

    public enum Type {
        NUMBER,           // Number
        REFERENCE,        // Reference
        UNARY_OPERATION,  // UnaryOperation
        BINARY_OPERATION, // BinaryOperation
        CALL              // Call
    }

    public enum Operator {
        NEGATE("negate", 1),
        PLUS("plus", 1),
        NOT("not", 1),
        ADD("add", 2),
        SUBTRACT("subtract", 2),
        MULTIPLY("multiply", 2),
        DIVIDE("divide", 2),
        REMAINDER("remainder", 2),
        POWER("power", 2),
        LESS_THAN("less_than", 2),
        GREATER_THAN("greater_than", 2),
        LESS_THAN_EQUAL("less_than_equal", 2),
        GREATER_THAN_EQUAL("greater_than_equal", 2),
        EQUALS("equals", 2),
        NOT_EQUALS("not_equals", 2),
        AND("and", 2),
        OR("or", 2);

        public final String tag;
        public final int arity;

        private Operator(String tag, int arity) {
            this.tag = tag;
            this.arity = arity;
        }
    }

    public final Type type;
    private final Object value;
    public final Optional<Source> source;

    private Expression(Type type, Object value, Optional<Source> source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    public static Expression number(double value) {
        return new Expression(
            Type.NUMBER, new Number(value), Optional.empty()
        );
    }

    public static Expression reference(String variableName) {
        return new Expression(
            Type.REFERENCE, new Reference(variableName), Optional.empty()
        );
    }

    public static Expression unary(Operator operator, Expression operand) {
        if(operator.arity != 1) {
            throw new IllegalArgumentException(
                "'" + operator.tag + "' is not a unary operator!"
            );
        }
        return new Expression(
            Type.UNARY_OPERATION, new UnaryOperation(operator, operand),
            Optional.empty()
        );
    }

    public static Expression binary(
        Operator operator, Expression left, Expression right
    ) {
        if(operator.arity != 2) {
            throw new IllegalArgumentException(
                "'" + operator.tag + "' is not a binary operator!"
            );
        }
        return new Expression(
            Type.BINARY_OPERATION, new BinaryOperation(operator, left, right),
            Optional.empty()
        );
    }

    public static Expression call(String function, Expression... arguments) {
        return Expression.call(function, List.of(arguments));
    }

    public static Expression call(String function, List<Expression> arguments) {
        return new Expression(
            Type.CALL, new Call(function, List.copyOf(arguments)),
            Optional.empty()
        );
    }

    public Expression at(Source source) {
        return new Expression(this.type, this.value, Optional.of(source));
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Expression)) { return false; }
        Expression other = (Expression) otherRaw;
        return this.type == other.type && this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value);
    }

    @Override
    public String toString() {
        switch(this.type) {
            case NUMBER:
                return String.valueOf(this.<Number>getValue().value());
            case REFERENCE:
                return this.<Reference>getValue().variableName();
            case UNARY_OPERATION: {
                UnaryOperation data = this.getValue();
                return data.operator().tag + "(" + data.operand() + ")";
            }
            case BINARY_OPERATION: {
                BinaryOperation data = this.getValue();
                return data.operator().tag
                    + "(" + data.left() + ", " + data.right() + ")";
            }
            case CALL: {
                Call data = this.getValue();
                StringBuilder out = new StringBuilder(data.function());
                out.append("(");
                for(int argI = 0; argI < data.arguments().size(); argI += 1) {
                    if(argI > 0) { out.append(", "); }
                    out.append(data.arguments().get(argI));
                }
                out.append(")");
                return out.toString();
            }
            default:
                throw new RuntimeException("unhandled expression type!");
        }
    }

}
