package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示 continue 语句，只能出现在 while 循环体内
 */
public record ContinueNode(SourcePosition position) implements StatementNode {

    @Override
    public String kind() {
        return "Continue";
    }

    @Override
    public List<AstChild> children() {
        return List.of();
    }
}
