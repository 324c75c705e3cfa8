package org.csu.minipy.engine;

import org.csu.minipy.common.exception.CompilerException;

/**
 * 一次失败的分析所携带的错误信息 (纯数据，可直接序列化)。
 */
public record PipelineError(
        CompilerException.Kind kind,  // 出错阶段
        String message,               // 完整的错误描述 "<Kind> Error at line L, column C: ..."
        int line,                     // 0 表示位置未知
        int column
) {
    public static PipelineError from(CompilerException e) {
        return new PipelineError(e.getKind(), e.getMessage(), e.getLine(), e.getColumn());
    }
}
