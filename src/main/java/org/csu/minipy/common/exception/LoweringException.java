package org.csu.minipy.common.exception;

import org.csu.minipy.compiler.parser.ast.SourcePosition;

/**
 * @description: IR 生成阶段的异常
 *
 * 对于 Parser 产生的合法 AST 不应出现，作为防御性的边界。
 */
public class LoweringException extends CompilerException {

    public LoweringException(String message, SourcePosition position) {
        super(Kind.LOWERING, message,
                position == null ? 0 : position.line(),
                position == null ? 0 : position.column());
    }
}
