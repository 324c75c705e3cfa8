package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示 if 语句
 * elif 分支被表示为 elseBody 中嵌套的一个 IfNode
 *
 * @param elseBody 没有 else 分支时为空列表
 */
public record IfNode(
        ExpressionNode test,
        List<StatementNode> thenBody,
        List<StatementNode> elseBody,
        SourcePosition position
) implements StatementNode {

    public IfNode {
        thenBody = List.copyOf(thenBody);
        elseBody = List.copyOf(elseBody);
    }

    public boolean hasElse() {
        return !elseBody.isEmpty();
    }

    @Override
    public String kind() {
        return "If";
    }

    @Override
    public List<AstChild> children() {
        List<AstChild> children = List.of(new AstChild("test", test));
        children = AstChildren.append(children, "then", thenBody);
        return AstChildren.append(children, "else", elseBody);
    }
}
