package typesafeschwalbe.cellc.compiler.frontend;

import java.util.List;

import typesafeschwalbe.cellc.compiler.ErrorException;

public abstract class Parser {

    private final Lexer lexer;
    protected Token current;

    public Parser(Lexer lexer) throws ErrorException {
        this.lexer = lexer;
        this.next();
    }

    protected void throwUnexpected(String expected) throws ErrorException {
        throw new ErrorException(Lexer.syntaxError(
            "Unexpected syntax",
            this.current.source,
            "expected " + expected + ", but " + (
                this.current.type == Token.Type.FILE_END
                    ? "reached the end of the file"
                    : "got '" + this.current.content + "' instead"
            )
        ));
    }

    private static final List<Token.Type> filtered = List.of(
        Token.Type.WHITESPACE, Token.Type.COMMENT
    );

    protected void next() throws ErrorException {
        while(true) {
            this.current = lexer.nextToken();
            if(Parser.filtered.contains(this.current.type)) {
                continue;
            }
            break;
        }
    }

    protected void expect(Token.Type... allowedTypes) throws ErrorException {
        if(!List.of(allowedTypes).contains(this.current.type)) {
            StringBuilder expected = new StringBuilder();
            for(int expIdx = 0; expIdx < allowedTypes.length; expIdx += 1) {
                if(expIdx > 0) { expected.append(
                    expIdx < allowedTypes.length - 1? ", " : " or "
                ); }
                expected.append(allowedTypes[expIdx].description);
            }
            this.throwUnexpected(expected.toString());
        }
    }

}
