package typesafeschwalbe.cellc.compiler.frontend;

import java.util.function.Function;

import typesafeschwalbe.cellc.compiler.Error;
import typesafeschwalbe.cellc.compiler.ErrorException;
import typesafeschwalbe.cellc.compiler.Source;

public class Lexer {

    public static Error syntaxError(
        String message, Source location, String note
    ) {
        return new Error(
            Error.Kind.SYNTAX, message, Error.Marking.error(location, note)
        );
    }

    private final String fileName;
    private final String fileContent;

    private int currentPos = 0;

    public Lexer(String fileName, String fileContent) {
        this.fileName = fileName;
        this.fileContent = fileContent;
    }

    public static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    public static boolean isAlphanumeral(char c) {
        return ('0' <= c && c <= '9')
            || ('A' <= c && c <= 'Z')
            || ('a' <= c && c <= 'z')
            || c == '_';
    }

    public static boolean isWhitespace(char c) {
        return c == 9   // horizontal tab
            || c == 10  // line feed
            || c == 13  // carriage feed
            || c == 32; // space
    }

    private char current() {
        if(this.atEnd()) { return '\0'; }
        return this.fileContent.charAt(this.currentPos);
    }

    private char peek() {
        if(this.currentPos + 1 >= this.fileContent.length()) { return '\0'; }
        return this.fileContent.charAt(this.currentPos + 1);
    }

    private void next() {
        this.currentPos += 1;
    }

    public boolean atEnd() {
        return this.currentPos >= this.fileContent.length();
    }

    private int find(Function<Character, Boolean> f) {
        int pos = this.currentPos;
        while(true) {
            if(pos >= this.fileContent.length()) { break; }
            if(f.apply(this.fileContent.charAt(pos))) { break; }
            pos += 1;
        }
        return pos;
    }

    private Token makeToken(String content, Token.Type type) {
        return new Token(
            type,
            content,
            new Source(
                this.fileName, this.currentPos - content.length(),
                this.currentPos
            )
        );
    }

    private Token makeToken(int startPos, Token.Type type) {
        return this.makeToken(
            this.fileContent.substring(startPos, this.currentPos), type
        );
    }

    private void skipDigits() {
        while(Lexer.isDigit(this.current())) {
            this.next();
        }
    }

    private Token lexNumber() throws ErrorException {
        int startPos = this.currentPos;
        this.skipDigits();
        if(this.current() == '.') {
            this.next();
            this.skipDigits();
        }
        if(this.current() == 'e' || this.current() == 'E') {
            this.next();
            if(this.current() == '+' || this.current() == '-') {
                this.next();
            }
            if(!Lexer.isDigit(this.current())) {
                throw new ErrorException(Lexer.syntaxError(
                    "Incomplete number exponent",
                    new Source(this.fileName, startPos, this.currentPos),
                    "expected the digits of the exponent after this"
                ));
            }
            this.skipDigits();
        }
        return this.makeToken(startPos, Token.Type.NUMBER);
    }

    private Token lexString() throws ErrorException {
        int startPos = this.currentPos;
        this.next();
        StringBuilder content = new StringBuilder();
        boolean escaped = false;
        while(escaped || this.current() != '"') {
            if(this.atEnd() || this.current() == '\n') {
                throw new ErrorException(Lexer.syntaxError(
                    "Unclosed quoted name",
                    new Source(this.fileName, startPos, startPos + 1),
                    "starts here"
                ));
            }
            if(escaped) {
                char a = this.current();
                switch(a) {
                    case 't': a = 9; break;  // horizontal tab
                    case 'n': a = 10; break; // line feed
                    case 'r': a = 13; break; // carriage feed
                }
                content.append(a);
                escaped = false;
            } else {
                escaped = this.current() == '\\';
                if(!escaped) { content.append(this.current()); }
            }
            this.next();
        }
        this.next();
        return new Token(
            Token.Type.STRING,
            content.toString(),
            new Source(this.fileName, startPos, this.currentPos)
        );
    }

    public Token nextToken() throws ErrorException {
        if(this.atEnd()) {
            int end = this.fileContent.length();
            return new Token(
                Token.Type.FILE_END, "",
                new Source(this.fileName, Math.max(0, end - 1), end)
            );
        }
        if(Lexer.isWhitespace(this.current())) {
            int endIdx = this.find(c -> !Lexer.isWhitespace(c));
            String content = this.fileContent.substring(
                this.currentPos, endIdx
            );
            this.currentPos = endIdx;
            return this.makeToken(content, Token.Type.WHITESPACE);
        }
        if(Lexer.isDigit(this.current())
                || (this.current() == '.' && Lexer.isDigit(this.peek()))) {
            return this.lexNumber();
        }
        if(this.current() == '"') {
            return this.lexString();
        }
        if(Lexer.isAlphanumeral(this.current())) {
            int endIdx = this.find(c -> !Lexer.isAlphanumeral(c));
            String content = this.fileContent.substring(
                this.currentPos, endIdx
            );
            Token.Type t;
            switch(content) {
                case "model": t = Token.Type.KEYWORD_MODEL; break;
                case "time": t = Token.Type.KEYWORD_TIME; break;
                case "state": t = Token.Type.KEYWORD_STATE; break;
                case "var": t = Token.Type.KEYWORD_VARIABLE; break;
                case "param": t = Token.Type.KEYWORD_PARAMETER; break;
                case "label": t = Token.Type.KEYWORD_LABEL; break;
                default: t = Token.Type.IDENTIFIER;
            }
            this.currentPos = endIdx;
            return this.makeToken(content, t);
        }
        int startPos = this.currentPos;
        switch(this.current()) {
            case '=':
                this.next();
                if(this.current() == '=') {
                    this.next();
                    return this.makeToken("==", Token.Type.DOUBLE_EQUALS);
                }
                return this.makeToken("=", Token.Type.EQUALS);
            case '+':
                this.next();
                return this.makeToken("+", Token.Type.PLUS);
            case '-':
                this.next();
                return this.makeToken("-", Token.Type.MINUS);
            case '*':
                this.next();
                return this.makeToken("*", Token.Type.ASTERISK);
            case '^':
                this.next();
                return this.makeToken("^", Token.Type.CARET);
            case '/':
                this.next();
                if(this.current() == '/') {
                    while(!this.atEnd() && this.current() != '\n') {
                        this.next();
                    }
                    return this.makeToken(startPos, Token.Type.COMMENT);
                }
                return this.makeToken("/", Token.Type.SLASH);
            case '%':
                this.next();
                return this.makeToken("%", Token.Type.PERCENT);
            case '<':
                this.next();
                if(this.current() == '=') {
                    this.next();
                    return this.makeToken("<=", Token.Type.LESS_THAN_EQUAL);
                }
                return this.makeToken("<", Token.Type.LESS_THAN);
            case '>':
                this.next();
                if(this.current() == '=') {
                    this.next();
                    return this.makeToken(">=", Token.Type.GREATER_THAN_EQUAL);
                }
                return this.makeToken(">", Token.Type.GREATER_THAN);
            case '!':
                this.next();
                if(this.current() == '=') {
                    this.next();
                    return this.makeToken("!=", Token.Type.NOT_EQUALS);
                }
                return this.makeToken("!", Token.Type.EXCLAMATION_MARK);
            case '&':
                if(this.peek() == '&') {
                    this.next();
                    this.next();
                    return this.makeToken("&&", Token.Type.DOUBLE_AMPERSAND);
                }
                break;
            case '|':
                if(this.peek() == '|') {
                    this.next();
                    this.next();
                    return this.makeToken("||", Token.Type.DOUBLE_PIPE);
                }
                break;
            case ':':
                this.next();
                return this.makeToken(":", Token.Type.COLON);
            case ';':
                this.next();
                return this.makeToken(";", Token.Type.SEMICOLON);
            case ',':
                this.next();
                return this.makeToken(",", Token.Type.COMMA);
            case '(':
                this.next();
                return this.makeToken("(", Token.Type.PAREN_OPEN);
            case ')':
                this.next();
                return this.makeToken(")", Token.Type.PAREN_CLOSE);
        }
        throw new ErrorException(Lexer.syntaxError(
            "Invalid character",
            new Source(this.fileName, this.currentPos, this.currentPos + 1),
            "'" + this.current() + "' is not a valid character"
        ));
    }

}
