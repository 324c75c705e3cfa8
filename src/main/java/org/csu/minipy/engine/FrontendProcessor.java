package org.csu.minipy.engine;

import org.csu.minipy.common.exception.CompilerException;
import org.csu.minipy.compiler.ir.IrGenerator;
import org.csu.minipy.compiler.ir.IrProgram;
import org.csu.minipy.compiler.lexer.Lexer;
import org.csu.minipy.compiler.lexer.Token;
import org.csu.minipy.compiler.parser.Parser;
import org.csu.minipy.compiler.parser.ast.ModuleNode;

import java.util.List;

/**
 * @description: 前端流水线的统一入口
 * 源码 -> Token 流 -> AST -> IR。
 *
 * 每次调用都会创建新的 Lexer / Parser / IrGenerator，本类只持有不可变配置，可以被多个线程共享。
 */
public class FrontendProcessor {

    private final int tabWidth;

    public FrontendProcessor() {
        this(Lexer.DEFAULT_TAB_WIDTH);
    }

    public FrontendProcessor(int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
        }
        this.tabWidth = tabWidth;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    /**
     * 对一段源码执行完整的前端分析。
     * 词法/语法/降级错误会被转换为 {@link PipelineError}，不会向外抛出。
     *
     * @param source 源码文本
     * @return 分析结果
     */
    public AnalysisResult analyze(String source) {
        try {
            // 1. 词法分析
            List<Token> tokens = new Lexer(source, tabWidth).tokenize();
            // 2. 语法分析
            ModuleNode ast = new Parser(tokens).parse();
            // 3. 生成三地址码
            IrProgram ir = new IrGenerator().generate(ast);
            return AnalysisResult.success(ast, ir);
        } catch (CompilerException e) {
            return AnalysisResult.failure(PipelineError.from(e));
        }
    }
}
