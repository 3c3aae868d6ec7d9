package typesafeschwalbe.cellc.compiler.backend;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Source;
import typesafeschwalbe.cellc.compiler.ir.Expression;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ir.Variable;

public class Transpiler {

    @FunctionalInterface
    public static interface Rewriter {
        String rewrite(Variable variable) throws ErrorException;
    }

    public static Error unsupportedOperatorError(
        String tag, int arity, String targetName, Optional<Source> usage
    ) {
        String message = "The operator '" + tag + "' with " + arity
            + " operand" + (arity == 1? "" : "s")
            + " is not supported by the target '" + targetName + "'";
        if(usage.isPresent()) {
            return new Error(
                Error.Kind.UNSUPPORTED_OPERATOR, message,
                List.of(tag, targetName),
                Error.Marking.error(usage.get(), "used here")
            );
        }
        return new Error(
            Error.Kind.UNSUPPORTED_OPERATOR, message, List.of(tag, targetName)
        );
    }

    public static String formatNumber(double value) {
        if(Double.isNaN(value)) {
            return "(0.0 / 0.0)";
        } else if(value == Double.POSITIVE_INFINITY) {
            return "(1.0 / 0.0)";
        } else if(value == Double.NEGATIVE_INFINITY) {
            return "(-1.0 / 0.0)";
        }
        if(value == 0.0) {
            return 1.0 / value < 0? "-0.0" : "0.0";
        }
        String text = BigDecimal.valueOf(value).toPlainString();
        if(text.indexOf('.') < 0) {
            text += ".0";
        }
        return text;
    }

    private final Model model;
    private final Rewriter rewriter;
    private final OperatorTable operators;
    private final String targetName;

    public Transpiler(
        Model model, Rewriter rewriter, OperatorTable operators,
        String targetName
    ) {
        this.model = model;
        this.rewriter = rewriter;
        this.operators = operators;
        this.targetName = targetName;
    }

    public String transpile(Expression expression) throws ErrorException {
        StringBuilder out = new StringBuilder();
        this.emit(expression, out);
        return out.toString();
    }

    private int emit(Expression expression, StringBuilder out)
            throws ErrorException {
        switch(expression.type) {
            case NUMBER: {
                double value = expression.<Expression.Number>getValue().value();
                String text = Transpiler.formatNumber(value);
                out.append(text);
                if(text.startsWith("-")) {
                    return this.operators.get(Expression.Operator.NEGATE.tag)
                        .map(OperatorTable.Form::precedence)
                        .orElse(OperatorTable.ATOM_PRECEDENCE + 1);
                }
                return OperatorTable.ATOM_PRECEDENCE;
            }
            case REFERENCE: {
                String name = expression.<Expression.Reference>getValue()
                    .variableName();
                Optional<Variable> variable = this.model.variable(name);
                if(variable.isEmpty()) {
                    throw new ErrorException(
                        Model.unboundReferenceError(name, expression.source)
                    );
                }
                out.append(this.rewriter.rewrite(variable.get()));
                return OperatorTable.ATOM_PRECEDENCE;
            }
            case UNARY_OPERATION: {
                Expression.UnaryOperation data = expression.getValue();
                OperatorTable.Form form = this.lookUp(
                    data.operator().tag, 1, expression.source
                );
                return this.emitForm(form, List.of(data.operand()), out);
            }
            case BINARY_OPERATION: {
                Expression.BinaryOperation data = expression.getValue();
                OperatorTable.Form form = this.lookUp(
                    data.operator().tag, 2, expression.source
                );
                return this.emitForm(
                    form, List.of(data.left(), data.right()), out
                );
            }
            case CALL: {
                Expression.Call data = expression.getValue();
                OperatorTable.Form form = this.lookUp(
                    data.function(), data.arguments().size(), expression.source
                );
                return this.emitForm(form, data.arguments(), out);
            }
            default:
                throw new RuntimeException("unhandled expression type!");
        }
    }

    private OperatorTable.Form lookUp(
        String tag, int arity, Optional<Source> usage
    ) throws ErrorException {
        Optional<OperatorTable.Form> form = this.operators.get(tag);
        boolean fits = form.isPresent() && form.get().arity() == arity
            && (form.get().type() != OperatorTable.Form.Type.PREFIX
                || arity == 1)
            && (form.get().type() != OperatorTable.Form.Type.INFIX
                || arity == 2);
        if(!fits) {
            throw new ErrorException(Transpiler.unsupportedOperatorError(
                tag, arity, this.targetName, usage
            ));
        }
        return form.get();
    }

    private int emitForm(
        OperatorTable.Form form, List<Expression> operands, StringBuilder out
    ) throws ErrorException {
        int precedence = form.precedence();
        switch(form.type()) {
            case PREFIX: {
                out.append(form.symbol());
                this.emitOperand(operands.get(0), precedence, true, out);
            } break;
            case INFIX: {
                this.emitOperand(operands.get(0), precedence, false, out);
                out.append(" ");
                out.append(form.symbol());
                out.append(" ");
                this.emitOperand(operands.get(1), precedence, true, out);
            } break;
            case CALL: {
                out.append(form.symbol());
                out.append("(");
                for(int argI = 0; argI < operands.size(); argI += 1) {
                    if(argI > 0) { out.append(", "); }
                    this.emit(operands.get(argI), out);
                }
                out.append(")");
            } break;
            case CONDITIONAL: {
                this.emitOperand(operands.get(0), precedence, true, out);
                out.append(" ? ");
                this.emitOperand(operands.get(1), precedence, true, out);
                out.append(" : ");
                this.emitOperand(operands.get(2), precedence, true, out);
            } break;
            default:
                throw new RuntimeException("unhandled operator form!");
        }
        return precedence;
    }

    private void emitOperand(
        Expression operand, int parentPrecedence, boolean wrapEqual,
        StringBuilder out
    ) throws ErrorException {
        StringBuilder inner = new StringBuilder();
        int precedence = this.emit(operand, inner);
        boolean wrap = precedence > parentPrecedence
            || (wrapEqual && precedence == parentPrecedence
                && precedence != OperatorTable.ATOM_PRECEDENCE);
        if(wrap) {
            out.append("(");
            out.append(inner);
            out.append(")");
        } else {
            out.append(inner);
        }
    }

}
