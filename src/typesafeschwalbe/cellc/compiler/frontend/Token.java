package typesafeschwalbe.cellc.compiler.frontend;

import typesafeschwalbe.cellc.compiler.Source;

public class Token {

    public enum Type {
        WHITESPACE("a whitespace"),
        COMMENT("a line comment"),
        FILE_END("the end of the file"),

        IDENTIFIER("an identifier"),
        NUMBER("a number"),
        STRING("a quoted name"),
        EQUALS("'='"),
        COLON("':'"),
        COMMA("','"),
        SEMICOLON("';'"),
        EXCLAMATION_MARK("'!'"),
        CARET("'^'", 1),
        ASTERISK("'*'", 3),
        SLASH("'/'", 3),
        PERCENT("'%'", 3),
        PLUS("'+'", 4),
        MINUS("'-'", 4),
        LESS_THAN("'<'", 5),
        GREATER_THAN("'>'", 5),
        LESS_THAN_EQUAL("'<='", 5),
        GREATER_THAN_EQUAL("'>='", 5),
        DOUBLE_EQUALS("'=='", 6),
        NOT_EQUALS("'!='", 6),
        DOUBLE_AMPERSAND("'&&'", 7),
        DOUBLE_PIPE("'||'", 8),
        PAREN_OPEN("'('"),
        PAREN_CLOSE("')'"),
        KEYWORD_MODEL("'model'"),
        KEYWORD_TIME("'time'"),
        KEYWORD_STATE("'state'"),
        KEYWORD_VARIABLE("'var'"),
        KEYWORD_PARAMETER("'param'"),
        KEYWORD_LABEL("'label'");

        public static final int PREFIX_PRECEDENCE = 2;
        public static final int LOWEST_PRECEDENCE = 999;

        public final String description;
        public final int infixPrecedence;

        private Type(String description, int infixPrecedence) {
            this.description = description;
            this.infixPrecedence = infixPrecedence;
        }
        private Type(String description) {
            this.description = description;
            this.infixPrecedence = 0;
        }

        public boolean isInfix() {
            return this.infixPrecedence > 0;
        }
    }

    public final Type type;
    public final String content;
    public final Source source;

    Token(Type type, String content, Source source) {
        this.type = type;
        this.content = content;
        this.source = source;
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("[");
        output.append(this.type);
        output.append(" - '");
        output.append(this.content);
        output.append("']");
        return output.toString();
    }

}
