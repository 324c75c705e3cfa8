package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示一个字面量 (数字、字符串、True/False/None)
 *
 * @param type 字面量种类
 * @param text 字面量文本；字符串为解码后的内容 (不含引号)
 */
public record ConstantNode(LiteralType type, String text, SourcePosition position) implements ExpressionNode {

    @Override
    public String kind() {
        return "Constant";
    }

    @Override
    public String detail() {
        return type.render(text);
    }

    @Override
    public List<AstChild> children() {
        return List.of();
    }
}
