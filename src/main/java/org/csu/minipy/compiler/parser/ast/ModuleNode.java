package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * @description: AST 的根节点，表示一个完整的源文件
 *
 * @param body 按源码顺序排列的顶层语句
 */
public record ModuleNode(List<StatementNode> body, SourcePosition position) implements AstNode {

    public ModuleNode {
        body = List.copyOf(body);
    }

    @Override
    public String kind() {
        return "Module";
    }

    @Override
    public List<AstChild> children() {
        return AstChildren.of("body", body);
    }
}
