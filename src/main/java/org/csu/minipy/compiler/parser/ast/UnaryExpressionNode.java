package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示一元运算 (取负 "-" 或逻辑非 "not")
 */
public record UnaryExpressionNode(
        String operator,
        ExpressionNode operand,
        SourcePosition position
) implements ExpressionNode {

    @Override
    public String kind() {
        return "UnaryOp";
    }

    @Override
    public String detail() {
        return operator;
    }

    @Override
    public List<AstChild> children() {
        return List.of(new AstChild("operand", operand));
    }
}
