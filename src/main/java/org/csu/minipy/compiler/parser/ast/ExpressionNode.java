package org.csu.minipy.compiler.parser.ast;

/**
 * AST 节点: 表达式
 */
public sealed interface ExpressionNode extends AstNode
        permits BinaryExpressionNode, UnaryExpressionNode, CallNode, MethodCallNode,
        AttributeNode, NameNode, ConstantNode {
}
