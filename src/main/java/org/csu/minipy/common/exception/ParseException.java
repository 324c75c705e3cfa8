package org.csu.minipy.common.exception;

import org.csu.minipy.compiler.lexer.Token;

/**
 * @description: 语法分析阶段的异常
 */
public class ParseException extends CompilerException {

    public ParseException(String message, int line, int column) {
        super(Kind.SYNTAX, message, line, column);
    }

    public ParseException(Token token, String expected) {
        super(Kind.SYNTAX,
                String.format("Expected %s, but found '%s' (%s)", expected, describe(token), token.type()),
                token.line(),
                token.column());
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case NEWLINE -> "\\n";
            case INDENT -> "<indent>";
            case DEDENT -> "<dedent>";
            case EOF -> "<end of input>";
            default -> token.lexeme();
        };
    }
}
