package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示 while 循环
 */
public record WhileNode(
        ExpressionNode test,
        List<StatementNode> body,
        SourcePosition position
) implements StatementNode {

    public WhileNode {
        body = List.copyOf(body);
    }

    @Override
    public String kind() {
        return "While";
    }

    @Override
    public List<AstChild> children() {
        return AstChildren.append(List.of(new AstChild("test", test)), "body", body);
    }
}
