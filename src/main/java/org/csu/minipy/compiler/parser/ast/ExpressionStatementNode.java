package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表达式语句，例如单独一行的 print("hi")
 */
public record ExpressionStatementNode(ExpressionNode expression, SourcePosition position) implements StatementNode {

    @Override
    public String kind() {
        return "ExprStmt";
    }

    @Override
    public List<AstChild> children() {
        return List.of(new AstChild("expression", expression));
    }
}
