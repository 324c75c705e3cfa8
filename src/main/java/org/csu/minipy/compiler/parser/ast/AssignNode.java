package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示赋值语句 (e.g., x = 1, self.name = name)
 *
 * @param target 赋值目标，只能是 {@link NameNode} 或 {@link AttributeNode}
 * @param value  右侧表达式
 */
public record AssignNode(
        ExpressionNode target,
        ExpressionNode value,
        SourcePosition position
) implements StatementNode {

    @Override
    public String kind() {
        return "Assign";
    }

    @Override
    public List<AstChild> children() {
        return List.of(new AstChild("target", target), new AstChild("value", value));
    }
}
