package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示一个函数定义 (类中的方法也使用该节点)
 *
 * @param name       函数名
 * @param parameters 形参名列表，方法的接收者 (self) 只是普通的第一个参数
 * @param body       函数体语句
 */
public record FunctionDefNode(
        String name,
        List<String> parameters,
        List<StatementNode> body,
        SourcePosition position
) implements StatementNode {

    public FunctionDefNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public String kind() {
        return "FunctionDef";
    }

    @Override
    public String detail() {
        return name + "(" + String.join(", ", parameters) + ")";
    }

    @Override
    public List<AstChild> children() {
        return AstChildren.of("body", body);
    }
}
