package org.csu.minipy.common.exception;

/**
 * @description: 词法分析阶段的异常 (非法字符、未闭合字符串、畸形数字、缩进不一致)
 */
public class LexicalException extends CompilerException {

    public LexicalException(String message, int line, int column) {
        super(Kind.LEXICAL, message, line, column);
    }
}
