package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示对一个名字的调用 name(args)
 *
 * @param callee          被调用的名字
 * @param arguments       实参表达式
 * @param constructorCall 被调用的名字是之前已声明的类名时为 true，即对象实例化
 */
public record CallNode(
        String callee,
        List<ExpressionNode> arguments,
        boolean constructorCall,
        SourcePosition position
) implements ExpressionNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String kind() {
        return constructorCall ? "New" : "Call";
    }

    @Override
    public String detail() {
        return callee;
    }

    @Override
    public List<AstChild> children() {
        return AstChildren.of("arg", arguments);
    }
}
