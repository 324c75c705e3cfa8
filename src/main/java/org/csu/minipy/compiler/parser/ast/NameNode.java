package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示一个标识符引用
 */
public record NameNode(String identifier, SourcePosition position) implements ExpressionNode {

    @Override
    public String kind() {
        return "Name";
    }

    @Override
    public String detail() {
        return identifier;
    }

    @Override
    public List<AstChild> children() {
        return List.of();
    }
}
