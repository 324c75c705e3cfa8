package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示 return 语句
 *
 * @param value 返回值表达式，裸 return 时为 null
 */
public record ReturnNode(ExpressionNode value, SourcePosition position) implements StatementNode {

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String kind() {
        return "Return";
    }

    @Override
    public List<AstChild> children() {
        return value == null ? List.of() : List.of(new AstChild("value", value));
    }
}
