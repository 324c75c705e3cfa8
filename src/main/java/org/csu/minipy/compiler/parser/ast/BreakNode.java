package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示 break 语句，只能出现在 while 循环体内
 */
public record BreakNode(SourcePosition position) implements StatementNode {

    @Override
    public String kind() {
        return "Break";
    }

    @Override
    public List<AstChild> children() {
        return List.of();
    }
}
