package org.csu.minipy.compiler.parser.ast;

import org.csu.minipy.compiler.lexer.Token;

/**
 * AST 节点在源码中的位置，用于错误诊断
 */
public record SourcePosition(int line, int column) {

    public static SourcePosition of(Token token) {
        return new SourcePosition(token.line(), token.column());
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
