package org.csu.minipy.compiler.parser.ast;

/**
 * AST 节点: 语句
 */
public sealed interface StatementNode extends AstNode
        permits FunctionDefNode, ClassDefNode, AssignNode, IfNode, WhileNode,
        ReturnNode, PassNode, BreakNode, ContinueNode, ExpressionStatementNode {
}
