package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示方法调用 receiver.name(args)
 * 与"对属性表达式的普通调用"区分开，IR 生成时需要知道调用目标是绑定方法。
 */
public record MethodCallNode(
        ExpressionNode receiver,
        String methodName,
        List<ExpressionNode> arguments,
        SourcePosition position
) implements ExpressionNode {

    public MethodCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String kind() {
        return "MethodCall";
    }

    @Override
    public String detail() {
        return methodName;
    }

    @Override
    public List<AstChild> children() {
        return AstChildren.append(List.of(new AstChild("receiver", receiver)), "arg", arguments);
    }
}
