package org.csu.minipy.engine;

import org.csu.minipy.compiler.ir.IrProgram;
import org.csu.minipy.compiler.parser.ast.ModuleNode;

/**
 * 封装一次分析的全部结果：成功时为 AST + IR，失败时只有错误信息。
 */
public record AnalysisResult(
        ModuleNode ast,
        IrProgram ir,
        PipelineError error
) {
    // 静态工厂方法，用于成功返回
    public static AnalysisResult success(ModuleNode ast, IrProgram ir) {
        return new AnalysisResult(ast, ir, null);
    }

    // 静态工厂方法，用于失败返回，失败时不保留任何部分输出
    public static AnalysisResult failure(PipelineError error) {
        return new AnalysisResult(null, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
