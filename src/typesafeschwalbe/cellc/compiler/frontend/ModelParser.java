package typesafeschwalbe.cellc.compiler.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Source;
import typesafeschwalbe.cellc.compiler.ir.Expression;
import typesafeschwalbe.cellc.compiler.ir.Model;
import typesafeschwalbe.cellc.compiler.ir.Variable;

public class ModelParser extends Parser {

    public static Model parse(String fileName, String fileContent)
            throws ErrorException {
        String defaultName = fileName;
        int separator = Math.max(
            defaultName.lastIndexOf('/'), defaultName.lastIndexOf('\\')
        );
        defaultName = defaultName.substring(separator + 1);
        int extension = defaultName.lastIndexOf('.');
        if(extension > 0) {
            defaultName = defaultName.substring(0, extension);
        }
        return new ModelParser(new Lexer(fileName, fileContent), defaultName)
            .parseModel();
    }

    private static record Name(String content, Source source) {}

    private final String defaultName;

    public ModelParser(Lexer lexer, String defaultName) throws ErrorException {
        super(lexer);
        this.defaultName = defaultName;
    }

    public Model parseModel() throws ErrorException {
        String name = this.defaultName;
        if(this.current.type == Token.Type.KEYWORD_MODEL) {
            this.next();
            name = this.parseName().content;
            this.expect(Token.Type.SEMICOLON);
            this.next();
        }
        Model.Builder builder = Model.builder(name);
        while(this.current.type != Token.Type.FILE_END) {
            this.parseStatement(builder);
        }
        return builder.build();
    }

    private Name parseName() throws ErrorException {
        this.expect(Token.Type.IDENTIFIER, Token.Type.STRING);
        Name name = new Name(this.current.content, this.current.source);
        this.next();
        return name;
    }

    private void parseStatement(Model.Builder builder) throws ErrorException {
        Token start = this.current;
        switch(start.type) {
            case KEYWORD_TIME: {
                this.next();
                Name name = this.parseName();
                builder.add(
                    name.content, Variable.Role.TIME,
                    Optional.empty(), Optional.empty(),
                    Optional.of(name.source)
                );
                this.expect(Token.Type.SEMICOLON);
                this.next();
                return;
            }
            case KEYWORD_PARAMETER: {
                this.next();
                Name name = this.parseName();
                Optional<Expression> value = Optional.empty();
                if(this.current.type == Token.Type.EQUALS) {
                    this.next();
                    value = Optional.of(this.parseExpression());
                }
                builder.add(
                    name.content, Variable.Role.PARAMETER,
                    Optional.empty(), value, Optional.of(name.source)
                );
                this.parseStatementEnd(builder, name);
                return;
            }
            case KEYWORD_VARIABLE: {
                this.next();
                Name name = this.parseName();
                this.expect(Token.Type.EQUALS);
                this.next();
                Expression value = this.parseExpression();
                builder.add(
                    name.content, Variable.Role.INTERMEDIATE,
                    Optional.empty(), Optional.of(value),
                    Optional.of(name.source)
                );
                this.parseStatementEnd(builder, name);
                return;
            }
            case KEYWORD_STATE: {
                this.next();
                Name name = this.parseName();
                this.expect(Token.Type.EQUALS);
                this.next();
                double initialValue = this.parseSignedNumber();
                this.expect(Token.Type.COLON);
                this.next();
                Expression derivative = this.parseExpression();
                builder.add(
                    name.content, Variable.Role.STATE,
                    Optional.of(initialValue), Optional.of(derivative),
                    Optional.of(name.source)
                );
                this.parseStatementEnd(builder, name);
                return;
            }
            default: {
                this.throwUnexpected(
                    Token.Type.KEYWORD_TIME.description + ", "
                        + Token.Type.KEYWORD_PARAMETER.description + ", "
                        + Token.Type.KEYWORD_VARIABLE.description + " or "
                        + Token.Type.KEYWORD_STATE.description
                );
            }
        }
    }

    private void parseStatementEnd(Model.Builder builder, Name declared)
            throws ErrorException {
        if(this.current.type == Token.Type.KEYWORD_LABEL) {
            this.next();
            this.expect(Token.Type.IDENTIFIER);
            builder.label(declared.content, this.current.content);
            this.next();
        }
        this.expect(Token.Type.SEMICOLON);
        this.next();
    }

    private double parseSignedNumber() throws ErrorException {
        boolean negative = false;
        if(this.current.type == Token.Type.MINUS
                || this.current.type == Token.Type.PLUS) {
            negative = this.current.type == Token.Type.MINUS;
            this.next();
        }
        this.expect(Token.Type.NUMBER);
        double value = Double.parseDouble(this.current.content);
        this.next();
        return negative? -value : value;
    }

    public Expression parseExpression() throws ErrorException {
        return this.parseExpression(Token.Type.LOWEST_PRECEDENCE);
    }

    private static Expression.Operator infixOperator(Token.Type type) {
        switch(type) {
            case CARET: return Expression.Operator.POWER;
            case ASTERISK: return Expression.Operator.MULTIPLY;
            case SLASH: return Expression.Operator.DIVIDE;
            case PERCENT: return Expression.Operator.REMAINDER;
            case PLUS: return Expression.Operator.ADD;
            case MINUS: return Expression.Operator.SUBTRACT;
            case LESS_THAN: return Expression.Operator.LESS_THAN;
            case GREATER_THAN: return Expression.Operator.GREATER_THAN;
            case LESS_THAN_EQUAL: return Expression.Operator.LESS_THAN_EQUAL;
            case GREATER_THAN_EQUAL:
                return Expression.Operator.GREATER_THAN_EQUAL;
            case DOUBLE_EQUALS: return Expression.Operator.EQUALS;
            case NOT_EQUALS: return Expression.Operator.NOT_EQUALS;
            case DOUBLE_AMPERSAND: return Expression.Operator.AND;
            case DOUBLE_PIPE: return Expression.Operator.OR;
            default:
                throw new RuntimeException("unhandled infix token type!");
        }
    }

    private Expression parseExpression(int precedence) throws ErrorException {
        Optional<Expression> previous = Optional.empty();
        while(true) {
            if(previous.isPresent()) {
                Token.Type infix = this.current.type;
                if(!infix.isInfix() || infix.infixPrecedence >= precedence) {
                    return previous.get();
                }
                Expression left = previous.get();
                this.next();
                // '^' is right associative
                int rightPrecedence = infix == Token.Type.CARET
                    ? infix.infixPrecedence + 1
                    : infix.infixPrecedence;
                Expression right = this.parseExpression(rightPrecedence);
                previous = Optional.of(Expression.binary(
                    ModelParser.infixOperator(infix), left, right
                ).at(new Source(left.source.get(), right.source.get())));
                continue;
            }
            Token start = this.current;
            switch(start.type) {
                case NUMBER: {
                    this.next();
                    previous = Optional.of(
                        Expression.number(Double.parseDouble(start.content))
                            .at(start.source)
                    );
                    continue;
                }
                case IDENTIFIER:
                case STRING: {
                    this.next();
                    if(start.type == Token.Type.IDENTIFIER
                            && this.current.type == Token.Type.PAREN_OPEN) {
                        previous = Optional.of(this.parseCall(start));
                        continue;
                    }
                    previous = Optional.of(
                        Expression.reference(start.content).at(start.source)
                    );
                    continue;
                }
                case MINUS:
                case PLUS:
                case EXCLAMATION_MARK: {
                    this.next();
                    Expression operand = this.parseExpression(
                        Token.Type.PREFIX_PRECEDENCE
                    );
                    Expression.Operator operator;
                    switch(start.type) {
                        case MINUS: operator = Expression.Operator.NEGATE; break;
                        case PLUS: operator = Expression.Operator.PLUS; break;
                        default: operator = Expression.Operator.NOT;
                    }
                    previous = Optional.of(
                        Expression.unary(operator, operand)
                            .at(new Source(start.source, operand.source.get()))
                    );
                    continue;
                }
                case PAREN_OPEN: {
                    this.next();
                    Expression inner = this.parseExpression();
                    this.expect(Token.Type.PAREN_CLOSE);
                    Token end = this.current;
                    this.next();
                    previous = Optional.of(
                        inner.at(new Source(start.source, end.source))
                    );
                    continue;
                }
                default: {
                    this.throwUnexpected("the start of an expression");
                }
            }
        }
    }

    private Expression parseCall(Token function) throws ErrorException {
        this.expect(Token.Type.PAREN_OPEN);
        this.next();
        List<Expression> arguments = new ArrayList<>();
        while(this.current.type != Token.Type.PAREN_CLOSE) {
            arguments.add(this.parseExpression());
            this.expect(Token.Type.COMMA, Token.Type.PAREN_CLOSE);
            if(this.current.type == Token.Type.COMMA) {
                this.next();
            }
        }
        Token end = this.current;
        this.next();
        return Expression.call(function.content, arguments)
            .at(new Source(function.source, end.source));
    }

}
