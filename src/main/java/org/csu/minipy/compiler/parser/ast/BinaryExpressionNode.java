package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., age > 20)
 */
public record BinaryExpressionNode(
        String operator,
        ExpressionNode left,
        ExpressionNode right,
        SourcePosition position
) implements ExpressionNode {

    @Override
    public String kind() {
        return "BinOp";
    }

    @Override
    public String detail() {
        return operator;
    }

    @Override
    public List<AstChild> children() {
        return List.of(new AstChild("left", left), new AstChild("right", right));
    }
}
