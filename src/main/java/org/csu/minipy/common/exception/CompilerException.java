package org.csu.minipy.common.exception;

import lombok.Getter;

/**
 * @description: 前端流水线所有错误的公共基类
 *
 * 携带错误种类以及出错的源码位置 (行号/列号为 0 表示位置未知)。
 */
@Getter
public abstract class CompilerException extends RuntimeException {

    public enum Kind {
        LEXICAL("Lexical"),
        SYNTAX("Syntax"),
        LOWERING("Lowering");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;
    private final int line;
    private final int column;
    private final String detail;

    protected CompilerException(Kind kind, String detail, int line, int column) {
        super(format(kind, detail, line, column));
        this.kind = kind;
        this.detail = detail;
        this.line = line;
        this.column = column;
    }

    private static String format(Kind kind, String detail, int line, int column) {
        if (line <= 0) {
            return String.format("%s Error: %s", kind.label(), detail);
        }
        return String.format("%s Error at line %d, column %d: %s", kind.label(), line, column, detail);
    }
}
