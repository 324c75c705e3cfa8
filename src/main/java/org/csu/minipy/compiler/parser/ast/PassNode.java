package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示 pass 语句
 */
public record PassNode(SourcePosition position) implements StatementNode {

    @Override
    public String kind() {
        return "Pass";
    }

    @Override
    public List<AstChild> children() {
        return List.of();
    }
}
