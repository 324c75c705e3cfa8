package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示属性访问 (e.g., self.name)
 */
public record AttributeNode(ExpressionNode receiver, String name, SourcePosition position) implements ExpressionNode {

    @Override
    public String kind() {
        return "AttributeRef";
    }

    @Override
    public String detail() {
        return name;
    }

    @Override
    public List<AstChild> children() {
        return List.of(new AstChild("receiver", receiver));
    }
}
